package com.example.cronengine.exception;

/**
 * 定义变更被拒：重名，或作业正在运行
 */
public class JobConflictException extends CronEngineException {

    public JobConflictException(String message) {
        super(message);
    }
}
