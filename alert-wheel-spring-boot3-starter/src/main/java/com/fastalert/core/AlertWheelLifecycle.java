package com.fastalert.core;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertWheelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class AlertWheelLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(AlertWheelLifecycle.class);

    private final AlertPipeline pipeline;

    private final AlertWheelProperties props;

    private final AlertGuardProperties guardProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public AlertWheelLifecycle(AlertPipeline pipeline, AlertWheelProperties props,
                               AlertGuardProperties guardProps) {
        this.pipeline = pipeline;
        this.props = props;
        this.guardProps = guardProps;
    }

    @Override
    public void start() {
        running.compareAndSet(false, props.isEnabled());
        if (!running.get()) {
            log.info("[Alert-Wheel] start skipped, alert.enabled=false");
            return;
        }
        try {
            AlertGuardProperties.CbConfig cb = guardProps.getCircuitBreaker();
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ AlertWheel starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ wheel.tick          : {} ms", props.getWheel().getTickDuration().toMillis());
            log.info("│ wheel.size          : {}", props.getWheel().getTicksPerWheel());
            log.info("│ dispatch.batchSize  : {}", props.getDispatch().getBatchSize());
            log.info("│ dispatch.concurrency: {}", props.getDispatch().getConcurrency());
            log.info("│ dispatch.sendTimeout: {} ms", props.getDispatch().getSendTimeout().toMillis());
            log.info("│ retry.maxAttempts   : {}", props.getRetry().getMaxAttempts());
            log.info("│ retry.strategy      : {}", props.getRetry().getStrategy());
            log.info("│ escalation.enabled  : {}", props.getEscalation().isEnabled());
            if (props.getEscalation().isEnabled()) {
                log.info("│ escalation.delays   : {}", props.getEscalation().getDelays());
            }
            log.info("│ guard.threshold     : {}", cb.getFailureThreshold());
            log.info("│ guard.coolDown      : {} ms", cb.getCoolDown().toMillis());
            log.info("│ retention.enabled   : {}", props.getRetention().isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Alert-Wheel] failed to render startup banner: {}", t.toString());
        }
        int recovered = pipeline.start();
        log.info("[Alert-Wheel] started, recovered {} pending escalation(s)", recovered);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Alert-Wheel] stop skipped: already stopped");
            return;
        }
        log.info("[Alert-Wheel] stopping...");
        try {
            pipeline.gracefulShutdown(props.getShutdown().getAwait().toSeconds());
        } finally {
            log.info("[Alert-Wheel] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
