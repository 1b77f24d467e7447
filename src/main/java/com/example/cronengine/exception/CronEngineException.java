package com.example.cronengine.exception;

/**
 * 引擎抛出或上报的所有异常的基类
 */
public class CronEngineException extends RuntimeException {

    public CronEngineException(String message) {
        super(message);
    }

    public CronEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
