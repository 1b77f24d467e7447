package com.example.cronengine.exception;

/**
 * 包装 handler 抛出的异常，message 沿用 handler 自己的
 */
public class TaskHandlerException extends CronEngineException {

    public TaskHandlerException(Throwable cause) {
        super(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage(), cause);
    }
}
