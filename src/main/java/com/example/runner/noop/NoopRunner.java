package com.example.runner.noop;

import com.example.cronengine.service.TaskRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 什么都不做，返回 {@code {"ok": true}}。用来验证调度和通知是否正常。
 */
@Slf4j
@Component("noop")
@RequiredArgsConstructor
public class NoopRunner implements TaskRunner {

    private final ObjectMapper mapper;

    @Override
    public JsonNode run(JsonNode config) {
        log.debug("NoopRunner config: {}", config);
        ObjectNode result = mapper.createObjectNode();
        result.put("ok", true);
        return result;
    }
}
