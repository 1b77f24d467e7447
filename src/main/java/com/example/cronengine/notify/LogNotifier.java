package com.example.cronengine.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * 通知写到应用日志，未开启邮件时使用。
 */
@Slf4j
public class LogNotifier extends AbstractNotifier {

    public LogNotifier(Collection<String> adminRecipients, ObjectMapper mapper) {
        super(adminRecipients, mapper);
    }

    @Override
    protected void deliver(List<String> to, String subject, String body) {
        log.info("[notify] to={} subject={}\n{}", to, subject, body);
    }
}
