package com.gridcast.connector;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.model.FeedType;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * 按数据源节流：相邻请求之间保持最小间隔，收到 429 时阻塞到 Retry-After 之后
 *
 * MAVIR 导出接口限制每分钟请求数；OMSZ 不限速
 */
@Slf4j
@Component
public class ApiRateLimiter {

    private final Map<FeedType, Long> minIntervalMs = new EnumMap<>(FeedType.class);
    private final Map<FeedType, Object> locks = new EnumMap<>(FeedType.class);
    private final Map<FeedType, Long> nextSlotMs = new EnumMap<>(FeedType.class);
    private final Map<FeedType, Long> blockUntilMs = new EnumMap<>(FeedType.class);

    public ApiRateLimiter(ApplicationConfig config) {
        int perMinute = Math.max(1, config.getMavir().getRequestsPerMinute());
        minIntervalMs.put(FeedType.MAVIR, 60_000L / perMinute);
        minIntervalMs.put(FeedType.OMSZ, 0L);
        for (FeedType feed : FeedType.values()) {
            locks.put(feed, new Object());
            nextSlotMs.put(feed, 0L);
            blockUntilMs.put(feed, 0L);
        }
    }

    /**
     * 阻塞直到该数据源允许发出下一个请求。同一数据源的请求串行通过
     */
    public void acquire(FeedType feed) throws InterruptedException {
        synchronized (locks.get(feed)) {
            long now = System.currentTimeMillis();
            long wait = Math.max(nextSlotMs.get(feed), blockUntilMs.get(feed)) - now;
            if (wait > 0) {
                log.debug("{} 请求节流，等待 {}ms", feed, wait);
                Thread.sleep(wait);
            }
            nextSlotMs.put(feed, System.currentTimeMillis() + minIntervalMs.get(feed));
        }
    }

    // 在每次响应后调用，处理429
    public void afterResponse(FeedType feed, Response resp) {
        if (resp.code() != 429) {
            return;
        }
        long retryMs = retryAfterMs(resp.header("Retry-After"));
        synchronized (locks.get(feed)) {
            blockUntilMs.put(feed, System.currentTimeMillis() + retryMs);
        }
        log.warn("{} 收到429限流，{}ms 内暂停请求", feed, retryMs);
    }

    static long retryAfterMs(String header) {
        if (header == null) {
            return 1000L;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException e) {
            log.debug("无法解析 Retry-After: {}", header);
            return 1000L;
        }
    }
}
