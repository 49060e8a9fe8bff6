package com.fastalert.core;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 本地时间轮上的`业务型`任务封装
 * 让 timer.stop() 返回的 Timeout 能识别任务类型并做收尾
 */
public class WheelTask implements TimerTask {

    public enum Kind { ESCALATION, DELIVERY_RETRY }

    private final Kind kind;

    /** 升级计划键 alertId#level 或通知任务 jobId */
    private final String key;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    /** 时间轮停止时未触发的收尾逻辑, 可为 null */
    private final Runnable onAbort;

    public WheelTask(Kind kind, String key, Runnable actual, Runnable onAbort) {
        this.kind = kind;
        this.key = key;
        this.actual = actual;
        this.onAbort = onAbort;
    }

    @Override
    public void run(Timeout timeout) {
        actual.run();
    }

    public void abort() {
        if (onAbort != null) {
            onAbort.run();
        }
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }
}
