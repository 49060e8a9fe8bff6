package com.fastalert.core.dispatch;

import com.fastalert.config.RetryPolicy;
import com.fastalert.model.Alert;
import com.fastalert.model.BatchReport;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.enums.JobOutcome;
import com.fastalert.model.enums.NotificationReason;
import com.fastalert.model.enums.Severity;
import com.fastalert.support.AlertWheelFixture;
import com.fastalert.support.RecordingChannelAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFanoutTest {

    private AlertWheelFixture f;

    @AfterEach
    void tearDown() {
        f.close();
    }

    private static Alert alert(List<String> channels) {
        return Alert.builder().id("a-1").kind("k").title("disk full").severity(Severity.HIGH)
                .assignedTeam("sre").channels(channels).build();
    }

    @Test
    void oneJobPerChannelWithChannelRetryBudget() {
        f = AlertWheelFixture.create(x -> {
            RetryPolicy sms = new RetryPolicy();
            sms.setMaxAttempts(5);
            x.props.getRetry().setPerChannel(Map.of("sms", sms));
        });

        List<NotificationJob> jobs = f.fanout.buildJobs(alert(List.of("rec", "sms")), NotificationReason.ESCALATED);

        assertThat(jobs).extracting(NotificationJob::getChannel).containsExactly("rec", "sms");
        assertThat(jobs).extracting(NotificationJob::getMaxAttempts).containsExactly(3, 5);
        assertThat(jobs).allSatisfy(j -> {
            assertThat(j.getAlertId()).isEqualTo("a-1");
            assertThat(j.getAttempt()).isEqualTo(1);
            assertThat(j.getReason()).isEqualTo(NotificationReason.ESCALATED);
            assertThat(j.getPayload().getSubject()).isEqualTo("[HIGH] disk full (escalated)");
        });
        assertThat(jobs.get(0).getJobId()).isNotEqualTo(jobs.get(1).getJobId());
    }

    @Test
    void notifyReportsPerChannelOutcome() {
        f = AlertWheelFixture.create(new RecordingChannelAdapter("rec"));

        BatchReport report = f.fanout.notify(alert(List.of("rec", "missing")), NotificationReason.CREATED).join();

        assertThat(report.count(JobOutcome.SENT)).isEqualTo(1);
        assertThat(report.count(JobOutcome.SKIPPED)).isEqualTo(1);
    }

    @Test
    void noChannelsNoJobs() {
        f = AlertWheelFixture.create();

        assertThat(f.fanout.notify(alert(null), NotificationReason.CREATED).join().getTotal()).isZero();
    }
}
