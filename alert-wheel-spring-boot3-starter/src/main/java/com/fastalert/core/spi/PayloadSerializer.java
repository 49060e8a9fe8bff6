package com.fastalert.core.spi;

import java.util.Optional;

/**
 * HTTP 渠道的请求体写出与服务商响应读取
 */
public interface PayloadSerializer {

    /** 渠道请求体转 JSON */
    String toJson(Object body);

    /**
     * 从响应 JSON 顶层按顺序取第一个非空字段的文本值
     * @throws IllegalArgumentException 响应不是合法 JSON
     */
    Optional<String> readText(String json, String... fields);
}
