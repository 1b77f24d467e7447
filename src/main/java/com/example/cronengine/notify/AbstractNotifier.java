package com.example.cronengine.notify;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.ExecutionStatus;
import com.example.cronengine.domain.JobOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.*;

/**
 * 负责拼标题和正文，子类只管投递。
 */
@Slf4j
public abstract class AbstractNotifier implements Notifier {

    private final List<String> adminRecipients;
    private final ObjectMapper mapper;

    protected AbstractNotifier(Collection<String> adminRecipients, ObjectMapper mapper) {
        List<String> list = new ArrayList<>();
        if (adminRecipients != null) {
            for (String s : adminRecipients) {
                if (s != null && !s.trim().isEmpty()) list.add(s.trim());
            }
        }
        this.adminRecipients = Collections.unmodifiableList(list);
        this.mapper = mapper;
    }

    protected abstract void deliver(List<String> to, String subject, String body) throws Exception;

    @Override
    public void notifyJobOutcome(CronJob job, JobOutcome outcome) {
        List<String> to = job.getNotificationRecipients();
        if (!outcome.isExecuted() || to == null || to.isEmpty()) {
            return;
        }
        try {
            deliver(new ArrayList<>(to), jobSubject(job, outcome.getStatus()), jobBody(job, outcome));
            log.info("Cron job notification sent for {} ({})", job.getName(), outcome.getStatus());
        } catch (Exception ex) {
            log.error("Failed to send cron job notification for {}", job.getName(), ex);
        }
    }

    @Override
    public void notifySystemAlert(String kind, String message, Map<String, ?> details) {
        if (adminRecipients.isEmpty()) {
            log.info("No admin recipients configured for system alerts, dropping alert '{}': {}", kind, message);
            return;
        }
        try {
            deliver(adminRecipients, "System Alert: " + kind, alertBody(kind, message, details));
            log.info("System alert sent: {}", kind);
        } catch (Exception ex) {
            log.error("Failed to send system alert '{}'", kind, ex);
        }
    }

    public List<String> getAdminRecipients() {
        return adminRecipients;
    }

    static String jobSubject(CronJob job, ExecutionStatus status) {
        return "Cron Job " + verb(status) + ": " + job.getName();
    }

    String jobBody(CronJob job, JobOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("Cron Job Execution ").append(verb(outcome.getStatus())).append("\n\n");
        sb.append("Job Details:\n");
        sb.append("  Name: ").append(job.getName()).append('\n');
        sb.append("  Type: ").append(job.getType()).append('\n');
        sb.append("  Schedule: ").append(job.getSchedule()).append('\n');
        sb.append("  Execution Time: ").append(outcome.getStartedAt()).append('\n');
        sb.append("  Duration: ").append(outcome.getDurationMs()).append("ms\n");
        sb.append("  Status: ").append(outcome.getStatus()).append('\n');

        if (outcome.isSuccess() && outcome.getResult() != null) {
            sb.append("\nExecution Result:\n").append(pretty(outcome.getResult())).append('\n');
        }
        if (!outcome.isSuccess() && outcome.getError() != null) {
            sb.append("\nError Details:\n").append(outcome.errorMessage()).append('\n');
            Throwable cause = outcome.getError().getCause();
            if (cause != null) {
                StringWriter sw = new StringWriter();
                cause.printStackTrace(new PrintWriter(sw));
                sb.append("\nStack Trace:\n").append(sw);
            }
        }
        sb.append("\n--\nThis is an automated notification from the cron engine.\n");
        return sb.toString();
    }

    String alertBody(String kind, String message, Map<String, ?> details) {
        StringBuilder sb = new StringBuilder();
        sb.append("System Alert: ").append(kind).append("\n\n");
        sb.append("Alert Message:\n").append(message).append("\n\n");
        sb.append("Timestamp:\n").append(Instant.now()).append('\n');
        if (details != null && !details.isEmpty()) {
            sb.append("\nAdditional Details:\n").append(pretty(details)).append('\n');
        }
        sb.append("\n--\nThis is an automated system alert from the cron engine.\n");
        return sb.toString();
    }

    private String pretty(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String verb(ExecutionStatus status) {
        if (status == ExecutionStatus.SUCCESS) return "Completed";
        if (status == ExecutionStatus.TIMEOUT) return "Timed Out";
        return "Failed";
    }
}
