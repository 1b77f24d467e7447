package com.example.cronengine.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Collection;
import java.util.List;

@Slf4j
public class MailNotifier extends AbstractNotifier {

    private final JavaMailSender mailSender;
    private final String from;

    public MailNotifier(JavaMailSender mailSender, String from, Collection<String> adminRecipients, ObjectMapper mapper) {
        super(adminRecipients, mapper);
        this.mailSender = mailSender;
        this.from = from;
    }

    @Override
    protected void deliver(List<String> to, String subject, String body) {
        SimpleMailMessage msg = new SimpleMailMessage();
        if (from != null && !from.trim().isEmpty()) {
            msg.setFrom(from);
        }
        msg.setTo(to.toArray(new String[0]));
        msg.setSubject(subject);
        msg.setText(body);
        mailSender.send(msg);
        log.debug("Mail sent to {} subject={}", to, subject);
    }
}
