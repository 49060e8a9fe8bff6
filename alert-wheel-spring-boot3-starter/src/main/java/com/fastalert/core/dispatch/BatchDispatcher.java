package com.fastalert.core.dispatch;

import com.fastalert.config.AlertWheelProperties;
import com.fastalert.core.WheelTask;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.guard.ChannelHealthTracker;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.ErrorCode;
import com.fastalert.exception.guard.ChannelUnavailableException;
import com.fastalert.exception.guard.DeliveryFailedException;
import com.fastalert.model.BatchReport;
import com.fastalert.model.DeliveryAuditRecord;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.JobResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.enums.JobOutcome;
import com.fastalert.store.DeliveryAuditStore;
import io.netty.util.HashedWheelTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 批量派发
 * 按 batchSize 分批、批间串行; 批内由固定大小的 worker 池并发, 并发上限即池大小
 * 每次发送前申请熔断许可, 发送在独立线程池执行并受单次超时约束
 * 失败经 FailureDecider 判定, 需要重试的按回退间隔挂到时间轮, 到期后重新进入 worker 池
 */
public class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    public static final String DISPATCHER_STOPPED = "DISPATCHER_STOPPED";

    private final Map<String, ChannelAdapter> adapters = new ConcurrentHashMap<>();

    private final ChannelHealthTracker guard;

    private final BackoffRegistry backoff;

    private final FailureDecider failureDecider;

    private final DeliveryAuditStore auditStore;

    private final AlertMetrics metrics;

    private final HashedWheelTimer timer;

    /** worker 线程池, 大小 = concurrency */
    private final ExecutorService workerExecutor;

    /** 渠道调用线程池, 超时后 cancel(true) */
    private final ExecutorService sendExecutor;

    private final AlertWheelProperties props;

    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(true);

    public BatchDispatcher(Collection<ChannelAdapter> adapters,
                           ChannelHealthTracker guard,
                           BackoffRegistry backoff,
                           FailureDecider failureDecider,
                           DeliveryAuditStore auditStore,
                           AlertMetrics metrics,
                           HashedWheelTimer timer,
                           ExecutorService workerExecutor,
                           ExecutorService sendExecutor,
                           AlertWheelProperties props,
                           Clock clock) {
        if (adapters != null) {
            adapters.forEach(this::register);
        }
        this.guard = guard;
        this.backoff = backoff;
        this.failureDecider = failureDecider;
        this.auditStore = auditStore;
        this.metrics = metrics;
        this.timer = timer;
        this.workerExecutor = workerExecutor;
        this.sendExecutor = sendExecutor;
        this.props = props;
        this.clock = clock;
    }

    /**
     * 注册或覆盖渠道
     */
    public BatchDispatcher register(ChannelAdapter adapter) {
        adapters.put(adapter.channel(), adapter);
        return this;
    }

    public Map<String, ChannelAdapter> adapters() {
        return Map.copyOf(adapters);
    }

    /**
     * 同步派发, 阻塞到所有任务到达终态
     */
    public BatchReport dispatch(List<NotificationJob> jobs) {
        return dispatchAsync(jobs).join();
    }

    /**
     * 异步派发, 报告中结果顺序与入参顺序一致
     */
    public CompletableFuture<BatchReport> dispatchAsync(List<NotificationJob> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return CompletableFuture.completedFuture(BatchReport.empty());
        }
        int batchSize = Math.max(1, props.getDispatch().getBatchSize());
        CompletableFuture<List<JobResult>> chain = CompletableFuture.completedFuture(new ArrayList<>(jobs.size()));
        for (int i = 0; i < jobs.size(); i += batchSize) {
            List<NotificationJob> slice = List.copyOf(jobs.subList(i, Math.min(i + batchSize, jobs.size())));
            chain = chain.thenCompose(acc -> runBatch(slice).thenApply(r -> {
                acc.addAll(r);
                return acc;
            }));
        }
        return chain.thenApply(BatchReport::new);
    }

    private CompletableFuture<List<JobResult>> runBatch(List<NotificationJob> slice) {
        List<CompletableFuture<JobResult>> futures = new ArrayList<>(slice.size());
        for (NotificationJob job : slice) {
            CompletableFuture<JobResult> promise = new CompletableFuture<>();
            submitAttempt(normalize(job), promise);
            futures.add(promise);
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).toList());
    }

    private NotificationJob normalize(NotificationJob job) {
        NotificationJob.NotificationJobBuilder b = job.toBuilder();
        if (job.getAttempt() < 1) {
            b.attempt(1);
        }
        if (job.getMaxAttempts() < 1) {
            b.maxAttempts(backoff.policyFor(job.getChannel()).getMaxAttempts());
        }
        return b.build();
    }

    private void submitAttempt(NotificationJob job, CompletableFuture<JobResult> promise) {
        if (!running.get()) {
            complete(job, promise, JobOutcome.DELIVERY_FAILED, job.getAttempt() - 1, null,
                    DISPATCHER_STOPPED, "dispatcher stopped");
            return;
        }
        try {
            workerExecutor.execute(() -> attempt(job, promise));
        } catch (RejectedExecutionException e) {
            complete(job, promise, JobOutcome.DELIVERY_FAILED, job.getAttempt() - 1, null,
                    DISPATCHER_STOPPED, "dispatcher stopped");
        }
    }

    /**
     * 单次尝试, worker 线程上执行
     */
    private void attempt(NotificationJob job, CompletableFuture<JobResult> promise) {
        String channel = job.getChannel();
        try {
            ChannelAdapter adapter = adapters.get(channel);
            if (adapter == null || !adapter.isConfigured()) {
                log.warn("[Dispatch] channel={} not configured, job={} skipped", channel, job.getJobId());
                complete(job, promise, JobOutcome.SKIPPED, job.getAttempt() - 1, null,
                        ErrorCode.CHANNEL_NOT_CONFIGURED.name(), "channel not configured: " + channel);
                return;
            }

            // 熔断许可
            try {
                guard.acquire(channel);
            } catch (ChannelUnavailableException open) {
                handleFailure(job, open, promise, false);
                return;
            }

            // 执行 with 超时
            long startNanos = System.nanoTime();
            Future<DeliveryResult> f;
            try {
                f = sendExecutor.submit(() -> adapter.send(job));
            } catch (RejectedExecutionException rejected) {
                // 未真正调用渠道, 归还许可
                guard.release(channel);
                log.warn("[Dispatch] send pool rejected job={} channel={}", job.getJobId(), channel);
                complete(job, promise, JobOutcome.DELIVERY_FAILED, job.getAttempt() - 1, null,
                        DISPATCHER_STOPPED, "send pool rejected");
                return;
            }
            DeliveryResult ret;
            try {
                ret = f.get(props.sendTimeoutMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                f.cancel(true);
                // 外层等待超时, 手动记一次熔断失败
                guard.onFailure(channel, System.nanoTime() - startNanos, te);
                handleFailure(job, te, promise, true);
                return;
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                guard.onFailure(channel, System.nanoTime() - startNanos, cause);
                handleFailure(job, cause, promise, true);
                return;
            } catch (InterruptedException ie) {
                f.cancel(true);
                guard.onFailure(channel, System.nanoTime() - startNanos, ie);
                Thread.currentThread().interrupt();
                complete(job, promise, JobOutcome.DELIVERY_FAILED, job.getAttempt(), null,
                        DISPATCHER_STOPPED, "interrupted");
                return;
            }
            long elapsed = System.nanoTime() - startNanos;
            metrics.recordSendNanos(elapsed);

            if (ret != null && ret.isSent()) {
                guard.onSuccess(channel, elapsed);
                complete(job, promise, JobOutcome.SENT, job.getAttempt(), ret.getProviderRef(), null, null);
            } else {
                DeliveryFailedException ex = ret == null
                        ? new DeliveryFailedException(channel, "adapter returned no result", true)
                        : new DeliveryFailedException(channel, ret.getError(), ret.isRetryable());
                guard.onFailure(channel, elapsed, ex);
                handleFailure(job, ex, promise, true);
            }
        } catch (Throwable ex) {
            // 兜底, 保证 promise 必定完成
            log.error("[Dispatch] job={} unexpected error", job.getJobId(), ex);
            complete(job, promise, JobOutcome.DELIVERY_FAILED, job.getAttempt(), null,
                    ErrorCode.DELIVERY_FAILED.name(), String.valueOf(ex.getMessage()));
        }
    }

    /**
     * 失败处理: 决策 -> 挂时间轮重试 或 终态
     * @param invoked 本次是否实际调用了渠道
     */
    private void handleFailure(NotificationJob job, Throwable ex, CompletableFuture<JobResult> promise,
                               boolean invoked) {
        FailureDecider.Decision decision = failureDecider.decide(ex, job);
        int attempts = invoked ? job.getAttempt() : job.getAttempt() - 1;
        String err = truncate(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());

        if (decision.getOutcome() == FailureDecider.Outcome.RETRY && job.hasAttemptsLeft() && running.get()) {
            Duration base = backoff.delay(job.getChannel(), job.getAttempt());
            long delayMs = Math.max(0, Math.round(base.toMillis() * decision.getBackoffFactor()));
            NotificationJob next = job.nextAttempt();
            log.warn("[Dispatch] job={} channel={} attempt {}/{} failed ({}), retry in {} ms: {}",
                    job.getJobId(), job.getChannel(), job.getAttempt(), job.getMaxAttempts(),
                    decision.getCode(), delayMs, err);
            WheelTask task = new WheelTask(WheelTask.Kind.DELIVERY_RETRY, job.getJobId(),
                    () -> submitAttempt(next, promise),
                    () -> complete(job, promise, JobOutcome.DELIVERY_FAILED, attempts, null,
                            DISPATCHER_STOPPED, "dispatcher stopped before retry"));
            try {
                timer.newTimeout(task, delayMs, TimeUnit.MILLISECONDS);
            } catch (IllegalStateException | RejectedExecutionException stopped) {
                task.abort();
            }
            return;
        }

        JobOutcome outcome = decision.getCategory() == FailureDecider.Category.OPEN_CIRCUIT
                ? JobOutcome.CHANNEL_UNAVAILABLE : JobOutcome.DELIVERY_FAILED;
        if (outcome == JobOutcome.CHANNEL_UNAVAILABLE) {
            log.warn("[Dispatch] job={} channel={} unavailable, circuit open", job.getJobId(), job.getChannel());
        } else {
            log.error("[Dispatch] job={} channel={} failed after {} attempt(s) ({}): {}",
                    job.getJobId(), job.getChannel(), attempts, decision.getCode(), err);
        }
        complete(job, promise, outcome, attempts, null, decision.getCode(), err);
    }

    /**
     * 终态: 指标 + 审计 + 完成 promise, 审计按完成顺序追加
     */
    private void complete(NotificationJob job, CompletableFuture<JobResult> promise, JobOutcome outcome,
                          int attempts, String providerRef, String errorCode, String error) {
        JobResult result = JobResult.builder()
                .job(job)
                .outcome(outcome)
                .attempts(Math.max(0, attempts))
                .providerRef(providerRef)
                .errorCode(errorCode)
                .error(error)
                .completedAt(clock.instant())
                .build();
        switch (outcome) {
            case SENT -> metrics.incSent();
            case DELIVERY_FAILED -> metrics.incFailed();
            case CHANNEL_UNAVAILABLE -> metrics.incUnavailable();
            case SKIPPED -> metrics.incSkipped();
        }
        metrics.recordAttempts(result.getAttempts());
        if (job.getAlertId() != null) {
            try {
                auditStore.append(DeliveryAuditRecord.builder()
                        .alertId(job.getAlertId())
                        .jobId(job.getJobId())
                        .channel(job.getChannel())
                        .reason(job.getReason())
                        .status(outcome)
                        .attempts(result.getAttempts())
                        .providerRef(providerRef)
                        .errorCode(errorCode)
                        .error(error)
                        .timestamp(result.getCompletedAt())
                        .build());
            } catch (RuntimeException e) {
                log.error("[Dispatch] audit append failed, alert={} job={}", job.getAlertId(), job.getJobId(), e);
            }
        }
        promise.complete(result);
    }

    /**
     * 停止接收新尝试, 等待在途发送完成
     * 时间轮上未触发的重试由调用方 stop 时间轮后 abort
     */
    public void shutdown(long awaitMillis) {
        running.set(false);
        workerExecutor.shutdown();
        sendExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(Math.max(1, awaitMillis), TimeUnit.MILLISECONDS)) {
                workerExecutor.shutdownNow();
                log.warn("[Dispatch] workerExecutor forced shutdown after {} ms", awaitMillis);
            }
            if (!sendExecutor.awaitTermination(Math.min(2000, Math.max(1, awaitMillis)), TimeUnit.MILLISECONDS)) {
                sendExecutor.shutdownNow();
                log.warn("[Dispatch] sendExecutor forced shutdown");
            }
        } catch (InterruptedException ie) {
            workerExecutor.shutdownNow();
            sendExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private static String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
