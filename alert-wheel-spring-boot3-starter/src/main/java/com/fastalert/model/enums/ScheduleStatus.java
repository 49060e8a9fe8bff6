package com.fastalert.model.enums;

/**
 * 升级计划状态
 */
public enum ScheduleStatus {
    /** 已挂入时间轮, 等待触发 */
    PENDING,

    /** 已触发并执行升级 */
    FIRED,

    /** 触发时告警已不是 OPEN, 跳过 */
    SUPPRESSED,

    /** 确认/解决时取消 */
    CANCELLED
}
