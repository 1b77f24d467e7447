package com.example.runner.cleanup;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按相对 root 的路径用 glob 过滤文件。
 * 模式可以带 {@code glob:} 或 {@code regex:} 前缀，不带时按 glob 处理。
 * exclude 优先于 include；没有 include 时 root 下所有文件都算。
 * root 之外的路径一律不接受。
 */
public class PathFilter {
    private final Path root;
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;

    public PathFilter(Path root, List<String> includes, List<String> excludes) {
        this.root = root.toAbsolutePath().normalize();
        FileSystem fs = root.getFileSystem();
        this.includes = compile(fs, includes);
        this.excludes = compile(fs, excludes);
    }

    /** 从任务配置读取 {@code includes} / {@code excludes} 字符串数组 */
    public static PathFilter fromConfig(Path root, JsonNode config) {
        return new PathFilter(root, strings(config, "includes"), strings(config, "excludes"));
    }

    public boolean accept(Path p) {
        Path abs = p.toAbsolutePath().normalize();
        if (!abs.startsWith(root) || abs.equals(root)) return false;
        Path rel = root.relativize(abs);
        if (excludes.stream().anyMatch(m -> m.matches(rel))) return false;
        return includes.isEmpty() || includes.stream().anyMatch(m -> m.matches(rel));
    }

    private static List<PathMatcher> compile(FileSystem fs, List<String> patterns) {
        List<PathMatcher> out = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.trim().isEmpty()) continue;
            String p = pattern.trim();
            out.add(fs.getPathMatcher(p.startsWith("glob:") || p.startsWith("regex:") ? p : "glob:" + p));
        }
        return out;
    }

    private static List<String> strings(JsonNode config, String key) {
        if (config == null || !config.path(key).isArray()) return Collections.emptyList();
        List<String> list = new ArrayList<>();
        for (JsonNode n : config.get(key)) {
            if (n != null && n.isTextual()) list.add(n.asText());
        }
        return list;
    }
}
