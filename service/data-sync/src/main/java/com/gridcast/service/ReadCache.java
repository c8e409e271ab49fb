package com.gridcast.service;

import com.gridcast.model.CacheEntry;
import com.gridcast.model.CacheKey;
import com.gridcast.model.DataRow;
import com.gridcast.model.FeedType;
import com.gridcast.model.MergeEvent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 读缓存：不可变快照 + 有效起点 validFrom
 *
 * 每次失效都会推进代数；在失效之前读出的快照只能通过 setIfCurrent 写入，
 * 代数不一致时被丢弃，保证提交之后不会再写回旧快照
 */
@Slf4j
@Service
public class ReadCache implements MergeListener {

    private final ConcurrentMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final Object writeLock = new Object();

    public Optional<CacheEntry> get(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public long generation() {
        return generation.get();
    }

    public void set(CacheKey key, List<DataRow> snapshot, Long validFrom) {
        synchronized (writeLock) {
            entries.put(key, new CacheEntry(key, List.copyOf(snapshot), validFrom));
        }
    }

    /**
     * 仅当读取快照以来没有发生失效时写入
     */
    public boolean setIfCurrent(CacheKey key, List<DataRow> snapshot, Long validFrom, long expectedGeneration) {
        synchronized (writeLock) {
            if (generation.get() != expectedGeneration) {
                log.debug("缓存写入被丢弃（期间发生失效）: {}", key);
                return false;
            }
            entries.put(key, new CacheEntry(key, List.copyOf(snapshot), validFrom));
            return true;
        }
    }

    public void invalidate(CacheKey key) {
        synchronized (writeLock) {
            generation.incrementAndGet();
            entries.remove(key);
        }
    }

    /**
     * 失效所有依赖该实体的条目；entityId 为 null 时失效该数据源的全部条目
     */
    public void invalidateEntity(FeedType feed, String entityId) {
        synchronized (writeLock) {
            generation.incrementAndGet();
            entries.keySet().removeIf(k -> k.dependsOn(feed, entityId));
        }
    }

    @Override
    public void afterCommit(MergeEvent event) {
        invalidateEntity(event.getFeed(), event.getEntityId());
    }

    /**
     * 从缓存读取 [fromMs, toMs] 的切片；条目不存在或不覆盖 fromMs 时为空。
     * 返回独立副本
     */
    public Optional<List<DataRow>> read(CacheKey key, long fromMs, long toMs) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !entry.servesFrom(fromMs)) {
            return Optional.empty();
        }
        return Optional.of(slice(entry.getSnapshot(), fromMs, toMs));
    }

    /**
     * 快照按 timeMs 升序，二分定位起点
     */
    static List<DataRow> slice(List<DataRow> snapshot, long fromMs, long toMs) {
        int lo = 0;
        int hi = snapshot.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (snapshot.get(mid).getTimeMs() < fromMs) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        List<DataRow> out = new ArrayList<>();
        for (int i = lo; i < snapshot.size(); i++) {
            DataRow row = snapshot.get(i);
            if (row.getTimeMs() > toMs) break;
            out.add(row);
        }
        return out;
    }
}
