package com.example.runner.cleanup;

import com.example.cronengine.service.TaskRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 删除 {@code root} 下早于 {@code maxAgeDays} 天的普通文件。
 * <p>
 * 配置：{@code root}（默认 {@code cronengine.tasks.cleanup.default-root}）、{@code maxAgeDays}（30）、
 * {@code includes} / {@code excludes}（相对 root 的 glob 列表）、{@code dryRun}（false）。
 * 删不掉的文件记日志后跳过。
 */
@Slf4j
@Component("cleanupOldFiles")
@RequiredArgsConstructor
public class CleanupOldFilesRunner implements TaskRunner {

    static final int DEFAULT_MAX_AGE_DAYS = 30;

    private final ObjectMapper mapper;

    @Value("${cronengine.tasks.cleanup.default-root:uploads}")
    private String defaultRoot;

    @Override
    public JsonNode run(JsonNode config) throws IOException {
        Path root = resolveRoot(config);
        int maxAgeDays = readMaxAgeDays(config);
        boolean dryRun = config != null && config.path("dryRun").asBoolean(false);
        PathFilter filter = PathFilter.fromConfig(root, config);
        FileTime cutoff = FileTime.from(Instant.now().minus(Duration.ofDays(maxAgeDays)));

        log.info("cleanupOldFiles.start root={} maxAgeDays={} dryRun={}", root, maxAgeDays, dryRun);

        int deleted = 0;
        int failed = 0;
        if (Files.isDirectory(root)) {
            List<Path> candidates;
            try (Stream<Path> s = Files.walk(root)) {
                candidates = s.filter(Files::isRegularFile)
                        .filter(filter::accept)
                        .collect(Collectors.toList());
            }
            for (Path p : candidates) {
                try {
                    if (Files.getLastModifiedTime(p).compareTo(cutoff) >= 0) continue;
                    if (!dryRun) Files.deleteIfExists(p);
                    deleted++;
                } catch (IOException ex) {
                    failed++;
                    log.warn("cleanupOldFiles: cannot delete {} : {}", p, ex.toString());
                }
            }
        } else {
            log.info("cleanupOldFiles: root {} does not exist, nothing to do", root);
        }

        log.info("cleanupOldFiles.done root={} deleted={} failed={}", root, deleted, failed);

        ObjectNode result = mapper.createObjectNode();
        result.put("message", "File cleanup completed");
        result.put("deletedFiles", deleted);
        result.put("failedFiles", failed);
        result.put("maxAgeDays", maxAgeDays);
        result.put("dryRun", dryRun);
        return result;
    }

    /**
     * 缺省或 0 时取 {@link #DEFAULT_MAX_AGE_DAYS}；非整数、负数直接报错，不能退化成"删除全部"。
     */
    static int readMaxAgeDays(JsonNode config) {
        JsonNode n = config == null ? null : config.get("maxAgeDays");
        if (n == null || n.isNull()) return DEFAULT_MAX_AGE_DAYS;

        int days;
        if (n.isIntegralNumber() && n.canConvertToInt()) {
            days = n.intValue();
        } else if (n.isTextual() && n.asText().trim().matches("-?\\d{1,9}")) {
            days = Integer.parseInt(n.asText().trim());
        } else {
            throw new IllegalArgumentException("config.maxAgeDays must be a whole number of days, got: " + n);
        }
        if (days < 0) {
            throw new IllegalArgumentException("config.maxAgeDays must not be negative: " + days);
        }
        if (days == 0) {
            log.warn("cleanupOldFiles: maxAgeDays=0, falling back to {} days", DEFAULT_MAX_AGE_DAYS);
            return DEFAULT_MAX_AGE_DAYS;
        }
        return days;
    }

    private Path resolveRoot(JsonNode config) {
        if (config != null && config.hasNonNull("root")) {
            return Paths.get(config.get("root").asText()).toAbsolutePath().normalize();
        }
        if (defaultRoot == null || defaultRoot.trim().isEmpty()) {
            throw new IllegalArgumentException("config.root required");
        }
        return Paths.get(defaultRoot).toAbsolutePath().normalize();
    }
}
