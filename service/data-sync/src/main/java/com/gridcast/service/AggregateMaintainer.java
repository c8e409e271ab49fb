package com.gridcast.service;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.model.FeedType;
import com.gridcast.model.MavirColumn;
import com.gridcast.model.MergeEvent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 增量聚合维护
 *
 * ai_10min: 每个时间点一行，电力列来自 NetSystemLoad，气象列来自所有站点同一时间点的汇总
 *   (Prec 求和，其余取平均，Wind = AvgWS 平均)。
 * ai_1hour: 标签为 H 的桶覆盖 (H-1h, H]，NetSystemLoad 取平均、Prec 求和、其余取平均。
 *
 * 每次合并只重算受影响时间点上属于该数据源的单元格，再重算受影响的小时桶
 */
@Slf4j
@Service
public class AggregateMaintainer implements MergeListener {

    static final long HOUR_MS = 3_600_000L;

    private static final String BUCKET_EXPR = "((time_ms + 3599999) / 3600000) * 3600000";

    private final long fromTimeMs;

    public AggregateMaintainer(ApplicationConfig config) {
        this.fromTimeMs = config.getAggregate().getFromTime().toEpochMilli();
    }

    /**
     * 小时桶由 ai_10min 整行重算，气象与负荷的事务若并发，后提交者会用旧快照覆盖先提交者的列
     */
    @Override
    public boolean requiresSerialCommit(MergeEvent event) {
        return event.getMaxTimeMs() >= fromTimeMs && feedsAggregates(event);
    }

    @Override
    public void onMerged(Connection conn, MergeEvent event) throws SQLException {
        if (event.getMaxTimeMs() < fromTimeMs) {
            return;
        }
        boolean touched = switch (event.getFeed()) {
            case OMSZ -> refreshWeatherCells(conn, event);
            case MAVIR -> feedsAggregates(event) && refreshLoadCells(conn, event);
        };
        if (!touched) {
            return;
        }
        List<Long> times = stagedTimes(conn, event);
        int buckets = refreshHourlyBuckets(conn, times);
        log.debug("聚合已更新: {} {} 时间点={} 小时桶={}", event.getFeed(), event.getEntityId(), times.size(), buckets);
    }

    private static boolean feedsAggregates(MergeEvent event) {
        return event.getFeed() == FeedType.OMSZ
                || MavirColumn.NET_SYSTEM_LOAD.getApiName().equals(event.getEntityId());
    }

    // ==================== 10 分钟单元格 ====================

    private boolean refreshWeatherCells(Connection conn, MergeEvent event) throws SQLException {
        String staged = "SELECT s.time_ms FROM omsz_staging s WHERE s.batch_id = ?";

        // 先清空再重算，删除或更正后没有剩余观测的时间点得到空值
        String clearSql = "UPDATE ai_10min SET prec = NULL, temp = NULL, rhum = NULL, grad = NULL, pres = NULL, wind = NULL "
                + "WHERE time_ms IN (" + staged + ")";
        try (PreparedStatement stmt = conn.prepareStatement(clearSql)) {
            stmt.setLong(1, event.getBatchId());
            stmt.executeUpdate();
        }

        String upsertSql = """
            INSERT INTO ai_10min (time_ms, prec, temp, rhum, grad, pres, wind)
            SELECT d.time_ms, SUM(d.prec), AVG(d.temp), AVG(d.rhum), AVG(d.grad), AVG(d.pres), AVG(d.avgws)
            FROM omsz_data d
            WHERE d.time_ms >= ? AND d.time_ms IN (SELECT s.time_ms FROM omsz_staging s WHERE s.batch_id = ?)
            GROUP BY d.time_ms
            ON CONFLICT (time_ms) DO UPDATE SET
                prec = excluded.prec,
                temp = excluded.temp,
                rhum = excluded.rhum,
                grad = excluded.grad,
                pres = excluded.pres,
                wind = excluded.wind
            """;
        try (PreparedStatement stmt = conn.prepareStatement(upsertSql)) {
            stmt.setLong(1, fromTimeMs);
            stmt.setLong(2, event.getBatchId());
            stmt.executeUpdate();
        }
        return true;
    }

    private boolean refreshLoadCells(Connection conn, MergeEvent event) throws SQLException {
        String clearSql = """
            UPDATE ai_10min SET net_system_load = NULL
            WHERE time_ms IN (SELECT s.time_ms FROM mavir_staging s WHERE s.batch_id = ?)
            """;
        try (PreparedStatement stmt = conn.prepareStatement(clearSql)) {
            stmt.setLong(1, event.getBatchId());
            stmt.executeUpdate();
        }

        String upsertSql = """
            INSERT INTO ai_10min (time_ms, net_system_load)
            SELECT d.time_ms, d.value
            FROM mavir_data d
            WHERE d.column_name = ? AND d.time_ms >= ?
              AND d.time_ms IN (SELECT s.time_ms FROM mavir_staging s WHERE s.batch_id = ?)
            ON CONFLICT (time_ms) DO UPDATE SET net_system_load = excluded.net_system_load
            """;
        try (PreparedStatement stmt = conn.prepareStatement(upsertSql)) {
            stmt.setString(1, event.getEntityId());
            stmt.setLong(2, fromTimeMs);
            stmt.setLong(3, event.getBatchId());
            stmt.executeUpdate();
        }
        return true;
    }

    private List<Long> stagedTimes(Connection conn, MergeEvent event) throws SQLException {
        FeedType feed = event.getFeed();
        String sql = String.format("SELECT DISTINCT time_ms FROM %s WHERE batch_id = ? AND time_ms >= ?",
                feed.getStagingTable());
        List<Long> times = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, event.getBatchId());
            stmt.setLong(2, fromTimeMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    times.add(rs.getLong(1));
                }
            }
        }
        return times;
    }

    // ==================== 小时桶 ====================

    /**
     * 重算受影响的小时桶，连续的桶合并为一条分组语句
     *
     * @return 重算的桶数
     */
    int refreshHourlyBuckets(Connection conn, List<Long> times) throws SQLException {
        TreeSet<Long> labels = new TreeSet<>();
        for (long t : times) {
            labels.add(bucketLabel(t));
        }
        if (labels.isEmpty()) {
            return 0;
        }

        String sql = String.format("""
            INSERT INTO ai_1hour (time_ms, net_system_load, prec, temp, rhum, grad, pres, wind)
            SELECT %1$s, AVG(net_system_load), SUM(prec), AVG(temp), AVG(rhum), AVG(grad), AVG(pres), AVG(wind)
            FROM ai_10min
            WHERE time_ms > ? AND time_ms <= ?
            GROUP BY %1$s
            ON CONFLICT (time_ms) DO UPDATE SET
                net_system_load = excluded.net_system_load,
                prec = excluded.prec,
                temp = excluded.temp,
                rhum = excluded.rhum,
                grad = excluded.grad,
                pres = excluded.pres,
                wind = excluded.wind
            """, BUCKET_EXPR);

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (long[] run : contiguousRuns(labels)) {
                stmt.setLong(1, run[0] - HOUR_MS);
                stmt.setLong(2, run[1]);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return labels.size();
    }

    /**
     * 时间点所属小时桶的标签：向上取整到整点，整点本身属于以它为标签的桶
     */
    static long bucketLabel(long timeMs) {
        return Math.floorDiv(timeMs + HOUR_MS - 1, HOUR_MS) * HOUR_MS;
    }

    static List<long[]> contiguousRuns(TreeSet<Long> labels) {
        List<long[]> runs = new ArrayList<>();
        long start = -1;
        long prev = -1;
        boolean open = false;
        for (long label : labels) {
            if (open && label == prev + HOUR_MS) {
                prev = label;
                continue;
            }
            if (open) {
                runs.add(new long[]{start, prev});
            }
            start = label;
            prev = label;
            open = true;
        }
        if (open) {
            runs.add(new long[]{start, prev});
        }
        return runs;
    }
}
