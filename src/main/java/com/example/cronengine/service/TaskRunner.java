package com.example.cronengine.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 作业 task 标识背后的业务逻辑。
 * <p>
 * 实现为 Spring bean，bean 名即作业引用的 task 标识。
 * {@code config} 是作业保存的配置对象（未配置时为空对象）。
 * 返回值作为最近一次执行结果保存，可以为 {@code null}。
 * <p>
 * 超时后 runner 不会被停掉：引擎只是不再等待，除非开启
 * {@code cronengine.execution.interrupt-on-timeout} 才会中断。长循环需要自己检查
 * {@link Thread#isInterrupted()}。
 */
public interface TaskRunner {
    JsonNode run(JsonNode config) throws Exception;
}
