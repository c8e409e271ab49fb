package com.gridcast.service;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.model.FeedType;
import com.gridcast.model.MergeEvent;
import com.gridcast.model.MergeMode;
import com.gridcast.model.Observation;
import com.gridcast.model.WriteResult;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 合并引擎：暂存 -> 合并到事实表 -> 记录水位 -> 监听器（聚合），同一事务内完成
 *
 * 写入模式由调用方决定：INSERT_IF_ABSENT 不覆盖已有时间点，REPLACE 以新数据为准
 */
@Slf4j
@Service
public class MergeService {

    private final TransactionRunner transactionRunner;
    private final WatermarkRegistry watermarkRegistry;
    private final List<MergeListener> listeners;
    private final int batchSize;

    // 串行化会改写共享聚合行的事务，持有到提交之后
    private final ReentrantLock serialCommitLock = new ReentrantLock();

    private final AtomicLong batchIds = new AtomicLong(System.currentTimeMillis() * 1000L);

    public MergeService(TransactionRunner transactionRunner,
                        WatermarkRegistry watermarkRegistry,
                        List<MergeListener> listeners,
                        ApplicationConfig config) {
        this.transactionRunner = transactionRunner;
        this.watermarkRegistry = watermarkRegistry;
        this.listeners = List.copyOf(listeners);
        this.batchSize = Math.max(1, config.getStore().getBatchSize());
    }

    public WriteResult merge(FeedType feed, String entityId, List<Observation> rows, MergeMode mode) {
        if (rows == null || rows.isEmpty()) {
            return WriteResult.empty(feed, entityId, mode);
        }

        // 批内去重：同一时间点以后出现的行为准
        Map<Long, Observation> byTime = new LinkedHashMap<>();
        for (Observation o : rows) {
            if (!entityId.equals(o.getEntityId())) {
                throw new IllegalArgumentException("批次中包含其它实体的行: " + o.getEntityId() + " != " + entityId);
            }
            byTime.put(o.getTimeMs(), o);
        }
        List<Observation> unique = new ArrayList<>(byTime.values());
        long minTime = unique.stream().mapToLong(Observation::getTimeMs).min().orElseThrow();
        long maxTime = unique.stream().mapToLong(Observation::getTimeMs).max().orElseThrow();

        long batchId = batchIds.incrementAndGet();
        MergeEvent event = new MergeEvent(feed, entityId, batchId, minTime, maxTime, false);
        String label = String.format("merge %s %s [%d - %d]", feed, entityId, minTime, maxTime);

        int written = commitInOrder(event, () -> transactionRunner.inTransaction(label, conn -> {
            stage(conn, feed, batchId, unique);
            int n = mergeStaged(conn, feed, batchId, mode);
            watermarkRegistry.recordWrite(conn, feed, entityId, minTime, maxTime);
            for (MergeListener listener : listeners) {
                listener.onMerged(conn, event);
            }
            clearStaging(conn, feed, batchId);
            return n;
        }));

        watermarkRegistry.evict(feed, entityId);
        fireAfterCommit(event);

        log.debug("合并完成: {} {} 模式={} 暂存={} 写入={} 范围=[{} - {}]",
                feed, entityId, mode, unique.size(), written, Instant.ofEpochMilli(minTime), Instant.ofEpochMilli(maxTime));
        return WriteResult.builder()
                .feed(feed)
                .entityId(entityId)
                .mode(mode)
                .stagedRows(unique.size())
                .writtenRows(written)
                .minTime(Instant.ofEpochMilli(minTime))
                .maxTime(Instant.ofEpochMilli(maxTime))
                .build();
    }

    /**
     * 更正路径：删除实体在 [from, to] 内的观测，修复水位，并让监听器按空值重算
     */
    public int deleteRange(FeedType feed, String entityId, Instant from, Instant to) {
        long fromMs = from.toEpochMilli();
        long toMs = to.toEpochMilli();
        long batchId = batchIds.incrementAndGet();
        MergeEvent event = new MergeEvent(feed, entityId, batchId, fromMs, toMs, true);
        String label = String.format("delete %s %s [%d - %d]", feed, entityId, fromMs, toMs);

        int deleted = commitInOrder(event, () -> transactionRunner.inTransaction(label, conn -> {
            // 先把受影响的时间点记入暂存表，供监听器读取
            String copySql = String.format("""
                INSERT INTO %1$s (batch_id, %2$s, time_ms)
                SELECT ?, %2$s, time_ms FROM %3$s
                WHERE %2$s = ? AND time_ms >= ? AND time_ms <= ?
                """, feed.getStagingTable(), feed.getEntityColumn(), feed.getDataTable());
            try (PreparedStatement stmt = conn.prepareStatement(copySql)) {
                stmt.setLong(1, batchId);
                JdbcSupport.bindEntity(stmt, 2, feed, entityId);
                stmt.setLong(3, fromMs);
                stmt.setLong(4, toMs);
                stmt.executeUpdate();
            }
            int n;
            String deleteSql = String.format("DELETE FROM %s WHERE %s = ? AND time_ms >= ? AND time_ms <= ?",
                    feed.getDataTable(), feed.getEntityColumn());
            try (PreparedStatement stmt = conn.prepareStatement(deleteSql)) {
                JdbcSupport.bindEntity(stmt, 1, feed, entityId);
                stmt.setLong(2, fromMs);
                stmt.setLong(3, toMs);
                n = stmt.executeUpdate();
            }
            watermarkRegistry.repair(conn, feed, entityId);
            for (MergeListener listener : listeners) {
                listener.onMerged(conn, event);
            }
            clearStaging(conn, feed, batchId);
            return n;
        }));

        watermarkRegistry.evict(feed, entityId);
        fireAfterCommit(event);
        log.info("已删除 {} {} 区间 [{} - {}] 内 {} 行", feed, entityId, from, to, deleted);
        return deleted;
    }

    /**
     * 当前线程是否持有串行提交锁，监听器在 onMerged 中可据此确认
     */
    boolean holdsSerialCommitLock() {
        return serialCommitLock.isHeldByCurrentThread();
    }

    // ==================== 内部步骤 ====================

    private <T> T commitInOrder(MergeEvent event, Supplier<T> transaction) {
        boolean serial = listeners.stream().anyMatch(l -> l.requiresSerialCommit(event));
        if (!serial) {
            return transaction.get();
        }
        serialCommitLock.lock();
        try {
            return transaction.get();
        } finally {
            serialCommitLock.unlock();
        }
    }

    private void stage(Connection conn, FeedType feed, long batchId, List<Observation> rows) throws SQLException {
        List<String> valueColumns = feed.valueColumns();
        String sql = String.format("INSERT INTO %s (batch_id, %s, time_ms, %s) VALUES (%s)",
                feed.getStagingTable(),
                feed.getEntityColumn(),
                String.join(", ", valueColumns),
                JdbcSupport.placeholders(valueColumns.size() + 3));

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int batchCount = 0;
            for (Observation o : rows) {
                stmt.setLong(1, batchId);
                JdbcSupport.bindEntity(stmt, 2, feed, o.getEntityId());
                stmt.setLong(3, o.getTimeMs());
                int idx = 4;
                for (String column : valueColumns) {
                    JdbcSupport.setNullableDouble(stmt, idx++, o.getValues().get(column));
                }
                stmt.addBatch();

                batchCount++;
                if (batchCount >= batchSize) {
                    stmt.executeBatch();
                    stmt.clearBatch();
                    batchCount = 0;
                }
            }
            if (batchCount > 0) stmt.executeBatch();
        }
    }

    private int mergeStaged(Connection conn, FeedType feed, long batchId, MergeMode mode) throws SQLException {
        List<String> valueColumns = feed.valueColumns();
        String columns = feed.getEntityColumn() + ", time_ms, " + String.join(", ", valueColumns);
        String conflict = switch (mode) {
            case INSERT_IF_ABSENT -> "DO NOTHING";
            case REPLACE -> "DO UPDATE SET " + JdbcSupport.excludedAssignments(valueColumns);
        };
        String sql = String.format("""
            INSERT INTO %s (%s)
            SELECT %s FROM %s WHERE batch_id = ?
            ON CONFLICT (%s, time_ms) %s
            """, feed.getDataTable(), columns, columns, feed.getStagingTable(), feed.getEntityColumn(), conflict);
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, batchId);
            return stmt.executeUpdate();
        }
    }

    private void clearStaging(Connection conn, FeedType feed, long batchId) throws SQLException {
        String sql = String.format("DELETE FROM %s WHERE batch_id = ?", feed.getStagingTable());
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, batchId);
            stmt.executeUpdate();
        }
    }

    private void fireAfterCommit(MergeEvent event) {
        for (MergeListener listener : listeners) {
            try {
                listener.afterCommit(event);
            } catch (RuntimeException e) {
                log.warn("提交后回调失败 {}: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
