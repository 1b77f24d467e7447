package com.example.cronengine.domain;

public enum ExecutionStatus {
    SUCCESS,    // handler 正常返回
    FAILURE,    // handler 抛异常，或 task 标识找不到
    TIMEOUT,    // 超时仍未返回（计入失败）
    CANCELLED;  // 等待线程被中断，如停机时（计入失败）

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
