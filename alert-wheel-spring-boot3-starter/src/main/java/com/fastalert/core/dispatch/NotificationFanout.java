package com.fastalert.core.dispatch;

import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.spi.PayloadRenderer;
import com.fastalert.model.Alert;
import com.fastalert.model.BatchReport;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.NotificationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * 按告警当前渠道集合生成通知任务并异步派发
 * 派发失败只记日志和审计, 不影响生命周期
 */
public class NotificationFanout {

    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final PayloadRenderer renderer;

    private final BatchDispatcher dispatcher;

    private final BackoffRegistry backoff;

    public NotificationFanout(PayloadRenderer renderer, BatchDispatcher dispatcher, BackoffRegistry backoff) {
        this.renderer = renderer;
        this.dispatcher = dispatcher;
        this.backoff = backoff;
    }

    public CompletableFuture<BatchReport> notify(Alert alert, NotificationReason reason) {
        List<NotificationJob> jobs;
        try {
            jobs = buildJobs(alert, reason);
        } catch (RuntimeException e) {
            log.error("[Notify] render failed, alert={} reason={}", alert.getId(), reason, e);
            return CompletableFuture.completedFuture(BatchReport.empty());
        }
        if (jobs.isEmpty()) {
            return CompletableFuture.completedFuture(BatchReport.empty());
        }
        return dispatcher.dispatchAsync(jobs).whenComplete((report, ex) -> {
            if (ex != null) {
                log.error("[Notify] dispatch error, alert={} reason={}", alert.getId(), reason, ex);
            } else {
                log.info("[Notify] alert={} reason={} status={} sent={} failed={} skipped={}",
                        alert.getId(), reason, report.overallStatus(),
                        report.getSent(), report.getFailed(), report.getSkipped());
            }
        });
    }

    List<NotificationJob> buildJobs(Alert alert, NotificationReason reason) {
        List<String> channels = alert.getChannels() == null ? List.of() : alert.getChannels();
        List<NotificationJob> jobs = new ArrayList<>(channels.size());
        for (String channel : channels) {
            RenderedPayload payload = renderer.render(alert, channel, reason);
            jobs.add(NotificationJob.builder()
                    .jobId(UUID.randomUUID().toString())
                    .alertId(alert.getId())
                    .channel(channel)
                    .payload(payload)
                    .attempt(1)
                    .maxAttempts(backoff.policyFor(channel).getMaxAttempts())
                    .reason(reason)
                    .severity(alert.getSeverity())
                    .build());
        }
        return jobs;
    }
}
