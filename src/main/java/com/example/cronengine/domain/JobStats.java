package com.example.cronengine.domain;

import lombok.Value;

import java.util.Map;

/** 全部作业定义的汇总计数 */
@Value
public class JobStats {
    long total;
    long active;
    long running;
    long lastSucceeded;
    long lastFailed;
    Map<JobType, Long> byType;
}
