package com.fastalert.core.failure;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.NotificationJob;

import java.util.Comparator;
import java.util.List;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认决策 */
    private final Decision defaultDecision;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.RETRY, Category.UNKNOWN).withCode("DELIVERY_FAILED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision defaultDecision) {
        this.handlers = handlers.stream().distinct().toList();
        this.defaultDecision = defaultDecision;
    }

    /**
     * 先本体再逐级 cause, 同层匹配多个时选继承距离最近的处理器
     * Throwable 兜底处理器只在整条 cause 链都未命中时使用
     */
    @Override
    public Decision decide(Throwable t, NotificationJob job) {
        for (boolean catchAll : new boolean[]{false, true}) {
            for (Throwable e = t; e != null; e = e.getCause()) {
                FailureCaseHandler<?> matched = findBestHandler(e, catchAll);
                if (matched != null) {
                    return safeCall(matched, e, job);
                }
                if (e.getCause() == e) {
                    break;
                }
            }
        }
        return defaultDecision;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Decision safeCall(FailureCaseHandler h, Throwable e, NotificationJob job) {
        return h.execute(e, job);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e, boolean catchAll) {
        return handlers.stream()
                .filter(h -> catchAll || h.exceptionType() != Throwable.class)
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
