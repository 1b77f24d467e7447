package com.example.cronengine.notify;

import com.example.cronengine.domain.*;
import com.example.cronengine.exception.ExecutionTimeoutException;
import com.example.cronengine.exception.JobInactiveException;
import com.example.cronengine.exception.TaskHandlerException;
import com.example.cronengine.support.Jobs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MailNotifierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JavaMailSender mailSender = mock(JavaMailSender.class);

    private MailNotifier notifier;
    private CronJob job;

    @BeforeEach
    void setUp() {
        notifier = new MailNotifier(mailSender, "cron@example.com",
                Arrays.asList("admin@example.com", " ", "root@example.com"), mapper);
        job = Jobs.job("nightly-cleanup", "cleanupOldFiles", "0 2 * * *");
        job.setId(7L);
        job.setNotificationRecipients(Arrays.asList("ops@example.com", "dev@example.com"));
    }

    private SimpleMailMessage sent() {
        ArgumentCaptor<SimpleMailMessage> msg = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(msg.capture());
        return msg.getValue();
    }

    @Test
    void failureMailGoesToJobRecipients() {
        JobOutcome outcome = JobOutcome.failed(7L, RunTrigger.SCHEDULED, ExecutionStatus.FAILURE,
                Instant.now(), 12L, new TaskHandlerException(new IllegalStateException("disk full")));

        notifier.notifyJobOutcome(job, outcome);

        SimpleMailMessage msg = sent();
        assertThat(msg.getSubject()).isEqualTo("Cron Job Failed: nightly-cleanup");
        assertThat(msg.getTo()).containsExactly("ops@example.com", "dev@example.com");
        assertThat(msg.getFrom()).isEqualTo("cron@example.com");
        assertThat(msg.getText()).contains("Error Details", "disk full", "Stack Trace", "0 2 * * *");
    }

    @Test
    void timeoutHasItsOwnSubject() {
        JobOutcome outcome = JobOutcome.failed(7L, RunTrigger.SCHEDULED, ExecutionStatus.TIMEOUT,
                Instant.now(), 100L, new ExecutionTimeoutException(100L));

        notifier.notifyJobOutcome(job, outcome);

        assertThat(sent().getSubject()).isEqualTo("Cron Job Timed Out: nightly-cleanup");
    }

    @Test
    void successMailCarriesResult() {
        JobOutcome outcome = JobOutcome.success(7L, RunTrigger.MANUAL, Instant.now(), 3L,
                mapper.createObjectNode().put("deletedFiles", 4));

        notifier.notifyJobOutcome(job, outcome);

        SimpleMailMessage msg = sent();
        assertThat(msg.getSubject()).isEqualTo("Cron Job Completed: nightly-cleanup");
        assertThat(msg.getText()).contains("Execution Result", "deletedFiles").doesNotContain("Error Details");
    }

    @Test
    void rejectedOutcomeIsNotMailed() {
        notifier.notifyJobOutcome(job, JobOutcome.rejected(7L, RunTrigger.MANUAL, new JobInactiveException(7L)));

        verifyNoInteractions(mailSender);
    }

    @Test
    void jobWithoutRecipientsIsNotMailed() {
        job.setNotificationRecipients(Collections.emptyList());

        notifier.notifyJobOutcome(job, JobOutcome.success(7L, RunTrigger.MANUAL, Instant.now(), 1L, null));

        verifyNoInteractions(mailSender);
    }

    @Test
    void systemAlertGoesToAdmins() {
        notifier.notifySystemAlert("Job Scheduling Failed", "Failed to schedule job: nightly-cleanup",
                Collections.singletonMap("schedule", "99 * * * *"));

        SimpleMailMessage msg = sent();
        assertThat(msg.getSubject()).isEqualTo("System Alert: Job Scheduling Failed");
        assertThat(msg.getTo()).containsExactly("admin@example.com", "root@example.com");
        assertThat(msg.getText()).contains("Failed to schedule job: nightly-cleanup", "Additional Details", "99 * * * *");
    }

    @Test
    void systemAlertWithoutAdminsIsDropped() {
        MailNotifier noAdmins = new MailNotifier(mailSender, "", Collections.emptyList(), mapper);

        noAdmins.notifySystemAlert("Job Store Failure", "db down", null);

        verifyNoInteractions(mailSender);
        assertThat(noAdmins.getAdminRecipients()).isEmpty();
    }

    @Test
    void deliveryErrorsAreNotPropagated() {
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));

        notifier.notifySystemAlert("Unknown Task", "Job x refers to unknown task y", null);
        notifier.notifyJobOutcome(job, JobOutcome.failed(7L, RunTrigger.SCHEDULED, ExecutionStatus.FAILURE,
                Instant.now(), 1L, new IllegalStateException("boom")));

        verify(mailSender, times(2)).send(any(SimpleMailMessage.class));
    }

    @Test
    void subjectFollowsStatus() {
        assertThat(AbstractNotifier.jobSubject(job, ExecutionStatus.SUCCESS)).isEqualTo("Cron Job Completed: nightly-cleanup");
        assertThat(AbstractNotifier.jobSubject(job, ExecutionStatus.CANCELLED)).isEqualTo("Cron Job Failed: nightly-cleanup");
    }
}
