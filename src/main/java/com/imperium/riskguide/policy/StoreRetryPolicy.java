package com.imperium.riskguide.policy;

import com.imperium.riskguide.common.exception.StoreOperationException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 日志库写入 / RPC 读取的统一重试策略：固定次数（默认 3）+ 固定间隔（默认 500ms），基于 resilience4j Retry。
 * <p>
 * 重试用尽后抛出最后一次的错误。配置不可变，可被多个会话并发调用。
 */
@Component
public class StoreRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(StoreRetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_DELAY_MS = 500L;

    private final int maxAttempts;
    private final long delayMs;
    private final RetryConfig retryConfig;

    public StoreRetryPolicy(@Value("${app.store.retry.max-attempts:3}") int maxAttempts,
            @Value("${app.store.retry.delay-ms:500}") long delayMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delayMs = Math.max(0L, delayMs);
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(this.maxAttempts)
                .waitDuration(Duration.ofMillis(this.delayMs))
                .build();
    }

    public static StoreRetryPolicy defaults() {
        return new StoreRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY_MS);
    }

    /**
     * 执行一次带重试的存储操作。
     *
     * @param operation 操作名（用于日志），如 "insert dim_agent_event_log"
     * @param action    实际操作
     * @return 操作结果
     */
    public <T> T execute(String operation, Callable<T> action) {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, event.getNumberOfRetryAttempts(), maxAttempts,
                        event.getWaitInterval().toMillis(), messageOf(event.getLastThrowable())))
                .onError(event -> log.error("{} failed after {} attempts: {}",
                        operation, event.getNumberOfRetryAttempts(), messageOf(event.getLastThrowable())));
        try {
            return retry.executeCallable(action);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreOperationException(operation + " (interrupted)", e);
        } catch (Exception e) {
            throw new StoreOperationException(operation, e);
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMs() {
        return delayMs;
    }

    private static String messageOf(Throwable error) {
        return error != null ? error.getMessage() : "unknown";
    }
}
