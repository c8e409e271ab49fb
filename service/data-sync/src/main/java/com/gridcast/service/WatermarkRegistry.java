package com.gridcast.service;

import com.gridcast.exception.StoreTransactionException;
import com.gridcast.model.FeedType;
import com.gridcast.model.Watermark;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 实体水位登记：每个实体已知数据范围 [start_date, end_date]
 *
 * 持久化在元数据表中，内存镜像按需加载，事务提交后由合并引擎驱逐
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatermarkRegistry {

    private final DataSource dataSource;

    private final ConcurrentMap<String, Optional<Watermark>> mirror = new ConcurrentHashMap<>();

    private String key(FeedType feed, String entityId) {
        return feed.key() + "|" + entityId;
    }

    /**
     * 实体水位；尚无数据或实体未知时为空
     */
    public Optional<Watermark> watermark(FeedType feed, String entityId) {
        return mirror.computeIfAbsent(key(feed, entityId), k -> load(feed, entityId));
    }

    public boolean covered(FeedType feed, String entityId, Instant from, Instant to) {
        return watermark(feed, entityId).map(w -> w.covers(from, to)).orElse(false);
    }

    /**
     * 在调用方事务内记录一次写入，两端各自只向外扩展
     */
    public void recordWrite(Connection conn, FeedType feed, String entityId, long minTimeMs, long maxTimeMs)
            throws SQLException {
        String sql = String.format("""
            UPDATE %s SET
                start_date = CASE WHEN start_date IS NULL OR start_date > ? THEN ? ELSE start_date END,
                end_date = CASE WHEN end_date IS NULL OR end_date < ? THEN ? ELSE end_date END
            WHERE %s = ?
            """, feed.getMetaTable(), feed.getEntityColumn());
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, minTimeMs);
            stmt.setLong(2, minTimeMs);
            stmt.setLong(3, maxTimeMs);
            stmt.setLong(4, maxTimeMs);
            JdbcSupport.bindEntity(stmt, 5, feed, entityId);
            if (stmt.executeUpdate() == 0) {
                throw new SQLException("元数据中不存在实体: " + feed + " " + entityId);
            }
        }
    }

    /**
     * 显式修复：按事实表重新计算水位，可以收缩
     */
    public void repair(Connection conn, FeedType feed, String entityId) throws SQLException {
        String sql = String.format("""
            UPDATE %1$s SET
                start_date = (SELECT MIN(time_ms) FROM %2$s WHERE %3$s = ?),
                end_date = (SELECT MAX(time_ms) FROM %2$s WHERE %3$s = ?)
            WHERE %3$s = ?
            """, feed.getMetaTable(), feed.getDataTable(), feed.getEntityColumn());
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            JdbcSupport.bindEntity(stmt, 1, feed, entityId);
            JdbcSupport.bindEntity(stmt, 2, feed, entityId);
            JdbcSupport.bindEntity(stmt, 3, feed, entityId);
            stmt.executeUpdate();
        }
        log.info("水位已按事实表修复: {} {}", feed, entityId);
    }

    public void evict(FeedType feed, String entityId) {
        mirror.remove(key(feed, entityId));
    }

    /**
     * 数据源内最新的 end_date，用于判断是否到了更新时间
     */
    public Optional<Instant> latestEnd(FeedType feed) {
        String sql = String.format("SELECT MAX(end_date) AS e FROM %s WHERE end_date IS NOT NULL",
                feed.getMetaTable());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.ofNullable(JdbcSupport.getNullableInstant(rs, "e"));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreTransactionException("读取水位失败: " + feed, e);
        }
    }

    private Optional<Watermark> load(FeedType feed, String entityId) {
        String sql = String.format("SELECT start_date, end_date FROM %s WHERE %s = ?",
                feed.getMetaTable(), feed.getEntityColumn());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            JdbcSupport.bindEntity(stmt, 1, feed, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Instant start = JdbcSupport.getNullableInstant(rs, "start_date");
                Instant end = JdbcSupport.getNullableInstant(rs, "end_date");
                if (start == null || end == null) {
                    return Optional.empty();
                }
                return Optional.of(new Watermark(entityId, start, end));
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("读取水位失败: " + feed + " " + entityId, e);
        }
    }
}
