package com.fastalert.core.channel;

import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志渠道, 默认启用
 */
public class LoggingChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(LoggingChannelAdapter.class);

    @Override
    public String channel() {
        return "log";
    }

    @Override
    public DeliveryResult send(NotificationJob job) {
        RenderedPayload p = job.getPayload();
        String subject = p == null ? null : p.getSubject();
        String to = p == null ? null : p.getRecipient();
        switch (job.getSeverity() == null ? Severity.LOW : job.getSeverity()) {
            case CRITICAL, HIGH -> log.error("[Notify-{}] alert={}, to={}, subject={}, body={}",
                    job.getReason(), job.getAlertId(), to, subject, truncate(p == null ? null : p.getBody()));
            case MEDIUM -> log.warn("[Notify-{}] alert={}, to={}, subject={}",
                    job.getReason(), job.getAlertId(), to, subject);
            default -> log.info("[Notify-{}] alert={}, to={}, subject={}",
                    job.getReason(), job.getAlertId(), to, subject);
        }
        return DeliveryResult.sent("log-" + job.getJobId());
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
