package com.example.cronengine.domain;

public enum RunTrigger {
    SCHEDULED,  // 定时触发
    MANUAL      // 手动"立即执行"
}
