package com.fastalert.model.enums;

/**
 * 告警级别, 顺序即升级顺序
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** 是否已是最高级别 */
    public boolean isMax() {
        return this == CRITICAL;
    }

    /** 升一级, 已是最高级别则返回自身 */
    public Severity next() {
        return isMax() ? this : values()[ordinal() + 1];
    }
}
