package com.fastalert.model;

import lombok.Value;

import java.util.List;

/**
 * 路由结果
 */
@Value
public class RouteDecision {

    String team;

    List<String> channels;

    /** 命中的规则名, 默认路由为 null */
    String matchedRule;
}
