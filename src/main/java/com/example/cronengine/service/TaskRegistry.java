package com.example.cronengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 任务标识 -> {@link TaskRunner}。
 * <p>
 * 来源按顺序：
 * <ol>
 *   <li>所有 {@code TaskRunner} bean，以 bean 名为标识</li>
 *   <li>classpath 上的 {@code task-aliases.properties}，格式 {@code alias=已有标识}</li>
 * </ol>
 * 标识冲突时保留先注册的；{@code cronengine.registry.strict=true} 时直接抛异常。
 */
@Slf4j
@Component
public class TaskRegistry {

    static final String ALIAS_FILE = "task-aliases.properties";

    private final Map<String, TaskRunner> runners = new ConcurrentHashMap<>();
    private final boolean strictRegistration;

    @Autowired
    public TaskRegistry(Optional<Map<String, TaskRunner>> beans,
                        @Value("${cronengine.registry.strict:false}") boolean strictRegistration) {
        this.strictRegistration = strictRegistration;
        beans.orElseGet(Collections::emptyMap).forEach(this::register);
        loadAliases(new ClassPathResource(ALIAS_FILE));
        log.info("TaskRegistry initialized. Registered keys: {}", availableTasks());
    }

    public TaskRegistry(Map<String, TaskRunner> runners) {
        this(Optional.of(runners), false);
    }

    /**
     * 把任务标识绑定到 runner。同一标识重复绑定同一实例时忽略；
     * 绑定到别的实例时保留先到的，strict 模式下直接失败。
     */
    public void register(String taskIdentifier, TaskRunner runner) {
        String key = Optional.ofNullable(taskIdentifier).map(String::trim).orElse("");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Task identifier is blank");
        }
        if (runner == null) {
            throw new IllegalArgumentException("No runner given for task '" + key + "'");
        }

        TaskRunner bound = runners.putIfAbsent(key, runner);
        if (bound == null) {
            log.debug("Task {} bound to {}", key, runner.getClass().getName());
            return;
        }
        if (bound == runner) {
            return;
        }
        if (strictRegistration) {
            throw new IllegalStateException("Task '" + key + "' is already bound to "
                    + bound.getClass().getName() + ", cannot rebind it to " + runner.getClass().getName());
        }
        log.warn("Task {} already bound to {}, ignoring {}", key, bound.getClass().getName(),
                runner.getClass().getName());
    }

    /** 别名 {@code alias} 指向 {@code target} 已绑定的 runner；target 不存在时忽略。 */
    public void registerAlias(String alias, String target) {
        TaskRunner r = runners.get(target);
        if (r == null) {
            log.warn("Task alias '{}' points to unknown task '{}', ignored", alias, target);
            return;
        }
        register(alias, r);
    }

    void loadAliases(Resource resource) {
        if (!resource.exists()) {
            log.debug("No {} found on classpath", ALIAS_FILE);
            return;
        }
        Properties props = new Properties();
        try (InputStream in = resource.getInputStream()) {
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load {}", ALIAS_FILE, ex);
            return;
        }
        for (String alias : props.stringPropertyNames()) {
            String target = props.getProperty(alias);
            if (target != null && !target.trim().isEmpty()) {
                registerAlias(alias.trim(), target.trim());
            }
        }
        log.info("Loaded {} ({} entries)", ALIAS_FILE, props.size());
    }

    public Optional<TaskRunner> resolve(String taskIdentifier) {
        return taskIdentifier == null ? Optional.empty() : Optional.ofNullable(runners.get(taskIdentifier));
    }

    public boolean contains(String taskIdentifier) {
        return taskIdentifier != null && runners.containsKey(taskIdentifier);
    }

    public Set<String> availableTasks() {
        return Collections.unmodifiableSet(new TreeSet<>(runners.keySet()));
    }
}
