package com.fastalert.model;

import lombok.Value;

/**
 * 上报结果: 新建 or 命中已有告警
 */
@Value
public class AdmitResult {
    Alert alert;
    boolean isNew;
}
