package com.example.cronengine.notify;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.JobOutcome;

import java.util.Map;

/**
 * 对外通知。投递失败由实现自己记日志，不往外抛。
 */
public interface Notifier {

    /** 把作业执行结果发给作业自己配置的收件人 */
    void notifyJobOutcome(CronJob job, JobOutcome outcome);

    /** 系统告警，发给配置的管理员 */
    void notifySystemAlert(String kind, String message, Map<String, ?> details);
}
