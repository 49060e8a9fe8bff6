package com.fastalert.core.channel;

import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP 渠道公共部分: JSON POST + 错误分类
 * 4xx（429 除外）视为明确拒绝不重试; 5xx、429、连接/读超时可重试
 */
public abstract class AbstractHttpChannelAdapter implements ChannelAdapter {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RestTemplate restTemplate;

    protected final PayloadSerializer serializer;

    protected AbstractHttpChannelAdapter(RestTemplate restTemplate, PayloadSerializer serializer) {
        this.restTemplate = restTemplate;
        this.serializer = serializer;
    }

    /**
     * 带连接/读超时的 RestTemplate
     */
    public static RestTemplate restTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        int ms = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        f.setConnectTimeout(ms);
        f.setReadTimeout(ms);
        return new RestTemplate(f);
    }

    protected DeliveryResult postJson(String url, Map<String, String> extraHeaders, Object body,
                                      NotificationJob job) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (extraHeaders != null) {
            extraHeaders.forEach(headers::set);
        }
        HttpEntity<String> entity = new HttpEntity<>(serializer.toJson(body), headers);
        try {
            ResponseEntity<String> resp = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            return DeliveryResult.sent(providerRef(resp, job));
        } catch (HttpClientErrorException e) {
            String err = "HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString();
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return DeliveryResult.failed(err);
            }
            return DeliveryResult.rejected(err);
        } catch (HttpServerErrorException e) {
            return DeliveryResult.failed("HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            return DeliveryResult.failed("I/O error: " + e.getMessage());
        } catch (RestClientException e) {
            log.warn("[Channel-{}] unexpected client error, job={}", channel(), job.getJobId(), e);
            return DeliveryResult.failed(e.getMessage());
        }
    }

    /**
     * 服务商回执号, 默认取 X-Request-Id 头
     */
    protected String providerRef(ResponseEntity<String> resp, NotificationJob job) {
        String ref = resp.getHeaders().getFirst("X-Request-Id");
        return ref != null ? ref : channel() + "-" + job.getJobId();
    }

    protected static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
