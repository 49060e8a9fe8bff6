package com.fastalert.core.spi;

import com.fastalert.model.Alert;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.NotificationReason;

/**
 * 模板协作方, 按渠道渲染通知内容
 */
public interface PayloadRenderer {

    RenderedPayload render(Alert alert, String channel, NotificationReason reason);
}
