package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 告警状态
 */
@AllArgsConstructor
@Getter
public enum AlertStatus {
    OPEN("open", "新建/待确认"),
    ACKNOWLEDGED("acknowledged", "已确认, 处理中"),
    RESOLVED("resolved", "已解决, 终态, 退出去重窗口"),
    CLOSED("closed", "保留期结束后关闭, 终态")
    ;

    public final String code;
    public final String desc;

    /** 终态: 不再参与指纹去重 */
    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }
}
