package com.fastalert.model;

import com.fastalert.model.enums.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 协作方上报的原始告警事实, 创建后不可变
 */
@Value
@Builder
public class AlertFact {

    /** 类型标签, 如 compliance_violation */
    String kind;

    Severity severity;

    String title;

    String description;

    /** 告警关联实体（可选） */
    String subjectType;

    String subjectId;

    /** 扩展属性 */
    @Singular
    Map<String, Object> attributes;
}
