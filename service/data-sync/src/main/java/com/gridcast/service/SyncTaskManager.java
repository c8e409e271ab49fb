package com.gridcast.service;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.connector.SourceConnector;
import com.gridcast.model.FeedType;
import com.gridcast.model.SyncReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * 每个数据源同一时刻最多一个同步任务；不同数据源的任务并发执行
 */
@Slf4j
@Service
public class SyncTaskManager {

    private final SyncService syncService;
    private final ThreadPoolTaskExecutor executor;
    private final Duration taskTimeout;
    private final Clock clock;
    private final ConcurrentMap<FeedType, Boolean> enqueuedLocks = new ConcurrentHashMap<>();

    public SyncTaskManager(
            ApplicationConfig config,
            @Qualifier("syncExecutor")
            ThreadPoolTaskExecutor executor,
            SyncService syncService,
            Clock clock) {
        this.taskTimeout = config.getSync().getTaskTimeout();
        this.executor = executor;
        this.syncService = syncService;
        this.clock = clock;
    }

    /**
     * 提交一个同步任务。该数据源已有任务在队列或运行中时直接跳过
     *
     * @return 任务完成（并已释放锁）时完成的 Future；跳过或被拒绝时为空
     */
    public Optional<CompletableFuture<SyncReport>> submit(SourceConnector connector) {
        FeedType feed = connector.feed();
        if (enqueuedLocks.putIfAbsent(feed, Boolean.TRUE) != null) {
            log.debug("队列中已存在任务，跳过入队：{}", feed);
            return Optional.empty();
        }
        try {
            CompletableFuture<SyncReport> f = CompletableFuture
                    .supplyAsync(() -> syncService.syncFeed(connector, clock.instant().plus(taskTimeout)), executor)
                    .whenComplete((report, ex) -> {
                        enqueuedLocks.remove(feed);
                        if (ex != null) {
                            log.warn("同步任务异常结束：{}，feed={}", ex.getMessage(), feed, ex);
                        }
                    });
            return Optional.of(f);
        } catch (RejectedExecutionException e) {
            log.error("同步任务提交失败：{}", feed, e);
            enqueuedLocks.remove(feed);
            return Optional.empty();
        }
    }

    public boolean isRunning(FeedType feed) {
        return enqueuedLocks.containsKey(feed);
    }
}
