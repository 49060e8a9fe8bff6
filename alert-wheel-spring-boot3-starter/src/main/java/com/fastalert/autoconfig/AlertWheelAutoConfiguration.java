package com.fastalert.autoconfig;

import com.fastalert.annotation.EnableAlertWheel;
import com.fastalert.config.AlertGuardProperties;
import com.fastalert.config.AlertRoutingProperties;
import com.fastalert.config.AlertWheelProperties;
import com.fastalert.core.AlertPipeline;
import com.fastalert.core.AlertWheelLifecycle;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.dispatch.BatchDispatcher;
import com.fastalert.core.dispatch.NotificationFanout;
import com.fastalert.core.escalation.EscalationScheduler;
import com.fastalert.core.fingerprint.FingerprintEngine;
import com.fastalert.core.guard.ChannelHealthTracker;
import com.fastalert.core.lifecycle.AlertLifecycleManager;
import com.fastalert.core.lifecycle.KeyedLocks;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.retention.RetentionSweeper;
import com.fastalert.core.route.RoutingEngine;
import com.fastalert.core.spi.BackoffPolicy;
import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.core.spi.PayloadRenderer;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.store.AlertHistoryStore;
import com.fastalert.store.AlertStore;
import com.fastalert.store.DeliveryAuditStore;
import com.fastalert.store.EscalationScheduleStore;
import com.fastalert.store.memory.InMemoryAlertHistoryStore;
import com.fastalert.store.memory.InMemoryAlertStore;
import com.fastalert.store.memory.InMemoryDeliveryAuditStore;
import com.fastalert.store.memory.InMemoryEscalationScheduleStore;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、线程池、存储及管线组件
 */
@AutoConfiguration(after = {
        AlertMetricsAutoConfiguration.class,
        AlertGuardAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class,
        AlertChannelAutoConfiguration.class
})
@EnableConfigurationProperties({
        AlertWheelProperties.class,
        AlertRoutingProperties.class
})
public class AlertWheelAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock alertClock() {
        return Clock.systemUTC();
    }

    /**
     * 时间轮, 升级计划与投递重试共用
     */
    @Bean("alertWheelTimer")
    public HashedWheelTimer alertWheelTimer(AlertWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("alert-wheel-timer"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 派发 worker 线程池, 固定大小 = 并发上限
     */
    @Bean("alertDispatchExecutor")
    public ExecutorService alertDispatchExecutor(AlertWheelProperties props) {
        int n = props.getDispatch().getConcurrency();
        if (n < 1) {
            throw new IllegalArgumentException("alert.dispatch.concurrency must be >= 1");
        }
        if (props.getDispatch().getBatchSize() < 1) {
            throw new IllegalArgumentException("alert.dispatch.batch-size must be >= 1");
        }
        return new ThreadPoolExecutor(n, n, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("alert-dispatch-exec"));
    }

    /**
     * 渠道调用线程池
     */
    @Bean("alertSendExecutor")
    public ExecutorService alertSendExecutor(AlertWheelProperties props) {
        int n = Math.max(1, props.getDispatch().getConcurrency());
        return new ThreadPoolExecutor(n, n, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("alert-send-exec"));
    }

    /**
     * 升级执行线程池
     */
    @Bean("alertEscalationExecutor")
    public ExecutorService alertEscalationExecutor(AlertWheelProperties props) {
        AlertWheelProperties.Exec exec = props.getEscalation().getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("alert-escalation-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    // ----------------- 存储, 可由业务替换为持久化实现 -----------------

    @Bean
    @ConditionalOnMissingBean
    public AlertStore alertStore() { return new InMemoryAlertStore(); }

    @Bean
    @ConditionalOnMissingBean
    public EscalationScheduleStore escalationScheduleStore() { return new InMemoryEscalationScheduleStore(); }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryAuditStore deliveryAuditStore() { return new InMemoryDeliveryAuditStore(); }

    @Bean
    @ConditionalOnMissingBean
    public AlertHistoryStore alertHistoryStore() { return new InMemoryAlertHistoryStore(); }

    // ----------------- 管线组件 -----------------

    @Bean
    @ConditionalOnMissingBean
    public FingerprintEngine fingerprintEngine() { return new FingerprintEngine(); }

    @Bean
    @ConditionalOnMissingBean
    public RoutingEngine routingEngine(AlertRoutingProperties props) { return new RoutingEngine(props); }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(AlertWheelProperties props,
                                           ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchDispatcher batchDispatcher(ObjectProvider<ChannelAdapter> adapters,
                                           ChannelHealthTracker guard,
                                           BackoffRegistry backoffRegistry,
                                           FailureDecider failureDecider,
                                           DeliveryAuditStore auditStore,
                                           AlertMetrics metrics,
                                           @Qualifier("alertWheelTimer") HashedWheelTimer timer,
                                           @Qualifier("alertDispatchExecutor") ExecutorService dispatchExecutor,
                                           @Qualifier("alertSendExecutor") ExecutorService sendExecutor,
                                           AlertWheelProperties props,
                                           Clock clock) {
        return new BatchDispatcher(adapters.orderedStream().toList(), guard, backoffRegistry, failureDecider,
                auditStore, metrics, timer, dispatchExecutor, sendExecutor, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationFanout notificationFanout(PayloadRenderer renderer, BatchDispatcher dispatcher,
                                                 BackoffRegistry backoffRegistry) {
        return new NotificationFanout(renderer, dispatcher, backoffRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationScheduler escalationScheduler(@Qualifier("alertWheelTimer") HashedWheelTimer timer,
                                                   EscalationScheduleStore store,
                                                   @Qualifier("alertEscalationExecutor") ExecutorService executor,
                                                   AlertWheelProperties props,
                                                   Clock clock) {
        return new EscalationScheduler(timer, store, executor, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertLifecycleManager alertLifecycleManager(AlertStore alertStore,
                                                       AlertHistoryStore historyStore,
                                                       EscalationScheduleStore scheduleStore,
                                                       DeliveryAuditStore auditStore,
                                                       FingerprintEngine fingerprintEngine,
                                                       RoutingEngine routingEngine,
                                                       EscalationScheduler scheduler,
                                                       NotificationFanout fanout,
                                                       AlertMetrics metrics,
                                                       Clock clock) {
        return new AlertLifecycleManager(alertStore, historyStore, scheduleStore, auditStore, fingerprintEngine,
                routingEngine, scheduler, fanout, metrics, new KeyedLocks(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionSweeper retentionSweeper(AlertStore alertStore, AlertLifecycleManager lifecycle,
                                             AlertMetrics metrics, AlertWheelProperties props, Clock clock) {
        return new RetentionSweeper(alertStore, lifecycle, metrics, props, clock);
    }

    /**
     * 对外入口
     */
    @Bean
    @ConditionalOnMissingBean
    public AlertPipeline alertPipeline(AlertLifecycleManager lifecycle,
                                       AlertStore alertStore,
                                       DeliveryAuditStore auditStore,
                                       AlertHistoryStore historyStore,
                                       BatchDispatcher dispatcher,
                                       EscalationScheduler scheduler,
                                       ChannelHealthTracker guard,
                                       RetentionSweeper sweeper,
                                       @Qualifier("alertWheelTimer") HashedWheelTimer timer,
                                       @Qualifier("alertEscalationExecutor") ExecutorService escalationExecutor) {
        return new AlertPipeline(lifecycle, alertStore, auditStore, historyStore, dispatcher, scheduler,
                guard, sweeper, timer, escalationExecutor);
    }

    /**
     * 启停: 恢复升级计划、启动清理、优雅停机
     */
    @Bean
    public AlertWheelLifecycle alertWheelLifecycle(AlertPipeline pipeline,
                                                   AlertWheelProperties props,
                                                   AlertGuardProperties guardProps,
                                                   ApplicationContext applicationContext) {
        EnableAlertWheel enableAlertWheel = findEnableAlertWheel(applicationContext);
        if (enableAlertWheel != null) {
            props.setEnabled(enableAlertWheel.value());
        }
        return new AlertWheelLifecycle(pipeline, props, guardProps);
    }

    private EnableAlertWheel findEnableAlertWheel(ListableBeanFactory factory) {
        for (String n : factory.getBeanDefinitionNames()) {
            Class<?> type = factory.getType(n, false);
            if (type == null) continue;
            EnableAlertWheel an = type.getAnnotation(EnableAlertWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}
