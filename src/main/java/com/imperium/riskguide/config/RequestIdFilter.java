package com.imperium.riskguide.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * requestId 写入 MDC 与响应头，请求结束时输出一行 HTTP_OUT。
 * <p>
 * 一轮对话可能持续数分钟，超过 app.http.slow-request-ms 的请求以 WARN 输出。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    private static final String MDC_HTTP_METHOD = "httpMethod";
    private static final String MDC_HTTP_PATH = "httpPath";

    private final long slowRequestMs;

    public RequestIdFilter(@Value("${app.http.slow-request-ms:120000}") long slowRequestMs) {
        this.slowRequestMs = Math.max(0L, slowRequestMs);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestIdSupport.resolve(request);
        String method = request.getMethod();
        String path = request.getRequestURI();
        response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        MDC.put(MDC_HTTP_METHOD, method);
        MDC.put(MDC_HTTP_PATH, path);

        long startNs = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            if (costMs >= slowRequestMs) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={} (slow)",
                        method, path, response.getStatus(), costMs);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}",
                        method, path, response.getStatus(), costMs);
            }
            MDC.remove(MDC_HTTP_PATH);
            MDC.remove(MDC_HTTP_METHOD);
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
        }
    }
}
