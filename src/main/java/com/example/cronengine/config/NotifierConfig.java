package com.example.cronengine.config;

import com.example.cronengine.notify.LogNotifier;
import com.example.cronengine.notify.MailNotifier;
import com.example.cronengine.notify.Notifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Arrays;

/**
 * {@code cronengine.notify.mail.enabled=true} 时发邮件（需配置 {@code spring.mail.*}），
 * 否则只写日志。
 */
@Configuration
public class NotifierConfig {

    @Bean
    @ConditionalOnProperty(name = "cronengine.notify.mail.enabled", havingValue = "true")
    public Notifier mailNotifier(JavaMailSender mailSender,
                                 @Value("${cronengine.notify.mail.from:}") String from,
                                 @Value("${cronengine.notify.admin-recipients:}") String[] adminRecipients,
                                 ObjectMapper mapper) {
        return new MailNotifier(mailSender, from, Arrays.asList(adminRecipients), mapper);
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    public Notifier logNotifier(@Value("${cronengine.notify.admin-recipients:}") String[] adminRecipients,
                                ObjectMapper mapper) {
        return new LogNotifier(Arrays.asList(adminRecipients), mapper);
    }
}
