package com.example.cronengine.support;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.JobOutcome;
import com.example.cronengine.notify.Notifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingNotifier implements Notifier {

    public final List<JobOutcome> outcomes = new CopyOnWriteArrayList<>();
    public final List<String> alerts = new CopyOnWriteArrayList<>();

    @Override
    public void notifyJobOutcome(CronJob job, JobOutcome outcome) {
        outcomes.add(outcome);
    }

    @Override
    public void notifySystemAlert(String kind, String message, Map<String, ?> details) {
        alerts.add(kind);
    }

    public List<String> alertsOf(String kind) {
        return alerts.stream().filter(kind::equals).collect(Collectors.toList());
    }
}
