package com.imperium.riskguide.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

/**
 * 请求 ID：优先取请求属性，其次取 X-Request-Id 头，都没有时生成。
 * 错误响应体和日志 MDC 使用同一个值。
 */
public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        Object attr = request.getAttribute(ATTR_REQUEST_ID);
        if (attr instanceof String value && !value.isBlank()) {
            return value;
        }
        String headerValue = request.getHeader(HEADER_REQUEST_ID);
        String requestId = (headerValue != null && !headerValue.isBlank()) ? headerValue : newRequestId();
        request.setAttribute(ATTR_REQUEST_ID, requestId);
        return requestId;
    }

    /** 当前线程绑定的请求的 ID；不在请求线程上时生成新的 */
    public static String current() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return resolve(attributes.getRequest());
        }
        return newRequestId();
    }
}
