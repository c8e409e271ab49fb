package com.gridcast.scheduler;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.connector.SourceConnector;
import com.gridcast.model.FeedType;
import com.gridcast.service.SyncTaskManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class SyncScheduler {

    private final List<SourceConnector> connectors;
    private final SyncTaskManager syncTaskManager;
    private final TaskScheduler taskScheduler;
    private final ApplicationConfig config;
    private final Clock clock;

    // 启动后每个数据源先完整同步一次，不看水位
    private final Set<FeedType> pendingStartup = ConcurrentHashMap.newKeySet();

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        if (!config.getSync().isEnabled()) {
            log.info("同步已禁用，不启动调度");
            return;
        }
        connectors.forEach(c -> pendingStartup.add(c.feed()));
        log.info("应用已就绪，启动同步调度: 数据源={} 间隔={}", pendingStartup, config.getSync().getInterval());
        taskScheduler.scheduleAtFixedRate(this::tick, config.getSync().getInterval());
    }

    // 任务主体
    void tick() {
        Instant now = clock.instant();
        for (SourceConnector connector : connectors) {
            FeedType feed = connector.feed();
            try {
                if (syncTaskManager.isRunning(feed)) {
                    continue;
                }
                if ((pendingStartup.contains(feed) || connector.isUpdateDue(now))
                        && syncTaskManager.submit(connector).isPresent()) {
                    pendingStartup.remove(feed);
                }
            } catch (Exception e) {
                log.warn("SyncScheduler 执行失败: {}", feed, e);
            }
        }
    }

    Set<FeedType> pendingStartup() {
        return pendingStartup;
    }
}
