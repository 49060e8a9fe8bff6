package com.fastalert.model;

import lombok.Builder;
import lombok.Value;

/**
 * 模板协作方渲染好的通知内容
 */
@Value
@Builder
public class RenderedPayload {

    String channel;

    String recipient;

    String subject;

    String body;
}
