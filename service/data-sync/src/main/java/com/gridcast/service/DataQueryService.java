package com.gridcast.service;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.InvalidQueryException;
import com.gridcast.exception.StoreTransactionException;
import com.gridcast.model.AggregateLevel;
import com.gridcast.model.CacheKey;
import com.gridcast.model.DataRow;
import com.gridcast.model.FeedType;
import com.gridcast.model.MavirColumn;
import com.gridcast.model.OmszField;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * 查询服务：元数据、状态、列、区间数据、聚合数据
 *
 * 区间查询先校验跨度（超限直接拒绝，不访问缓存与存储），再优先走缓存，
 * 缓存不覆盖时直接查询存储
 */
@Slf4j
@Service
public class DataQueryService {

    private static final Map<String, String> AGGREGATE_COLUMNS = aggregateColumns();

    private final DataSource dataSource;
    private final ReadCache readCache;
    private final MetadataRepository metadataRepository;
    private final ApplicationConfig config;
    private final Clock clock;

    public DataQueryService(DataSource dataSource,
                            ReadCache readCache,
                            MetadataRepository metadataRepository,
                            ApplicationConfig config,
                            Clock clock) {
        this.dataSource = dataSource;
        this.readCache = readCache;
        this.metadataRepository = metadataRepository;
        this.config = config;
        this.clock = clock;
    }

    // ==================== 元数据与状态 ====================

    public List<DataRow> getMeta(FeedType feed) {
        CacheKey key = CacheKey.meta(feed);
        return cachedInFull(key, () -> switch (feed) {
            case OMSZ -> queryRows("""
                SELECT station_number, station_name, regio_name, county_name, latitude, longitude, elevation
                FROM omsz_meta ORDER BY station_number
                """, rs -> DataRow.of(String.valueOf(rs.getInt("station_number")), null, mapOf(
                    "StationName", rs.getString("station_name"),
                    "RegioName", rs.getString("regio_name"),
                    "CountyName", rs.getString("county_name"),
                    "Latitude", JdbcSupport.getNullableDouble(rs, "latitude"),
                    "Longitude", JdbcSupport.getNullableDouble(rs, "longitude"),
                    "Elevation", JdbcSupport.getNullableDouble(rs, "elevation"))));
            case MAVIR -> queryRows("SELECT column_name, unit FROM mavir_meta ORDER BY column_name",
                    rs -> DataRow.of(rs.getString("column_name"), null, mapOf("Unit", rs.getString("unit"))));
        });
    }

    public List<DataRow> getStatus(FeedType feed) {
        CacheKey key = CacheKey.status(feed);
        String sql = String.format("SELECT * FROM %s ORDER BY %s", feed.getStatusView(), feed.getEntityColumn());
        return cachedInFull(key, () -> queryRows(sql, rs -> DataRow.of(
                JdbcSupport.readEntity(rs, feed.getEntityColumn(), feed), null, mapOf(
                        "StartDate", JdbcSupport.getNullableInstant(rs, "start_date"),
                        "EndDate", JdbcSupport.getNullableInstant(rs, "end_date")))));
    }

    /**
     * 列名 -> 单位
     */
    public Map<String, String> getColumns(FeedType feed) {
        Map<String, String> out = new LinkedHashMap<>();
        switch (feed) {
            case OMSZ -> {
                for (OmszField f : OmszField.values()) {
                    out.put(f.getApiName(), f.getUnit());
                }
            }
            case MAVIR -> {
                for (DataRow row : getMeta(FeedType.MAVIR)) {
                    out.put(row.getEntityId(), (String) row.getValues().get("Unit"));
                }
            }
        }
        return out;
    }

    /**
     * 某站点至少有一个非空值的列
     */
    public List<String> getStationColumns(String stationId) {
        String station = requireStation(stationId);
        StringBuilder select = new StringBuilder();
        for (OmszField f : OmszField.values()) {
            if (select.length() > 0) select.append(", ");
            select.append("COUNT(").append(f.column()).append(") AS ").append(f.column());
        }
        String sql = "SELECT " + select + " FROM omsz_data WHERE station_number = ?";
        List<String> columns = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, Integer.parseInt(station));
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    for (OmszField f : OmszField.values()) {
                        if (rs.getLong(f.column()) > 0) columns.add(f.getApiName());
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("查询站点列失败: " + station, e);
        }
        return columns;
    }

    // ==================== 区间数据 ====================

    /**
     * @param entityId OMSZ 为站号，null 表示所有站点；MAVIR 为列名，null 表示 cols 指定的列
     * @param cols     请求的列，null 或空表示全部
     */
    public List<DataRow> getRange(FeedType feed, String entityId, Instant from, Instant to, List<String> cols) {
        requireOrderedRange(from, to);
        boolean allEntities = feed == FeedType.OMSZ && entityId == null;
        Duration limit = allEntities
                ? config.getQuery().getAllEntitiesLimit()
                : config.getQuery().getSingleEntityLimit();
        if (Duration.between(from, to).compareTo(limit) > 0) {
            throw new InvalidQueryException(String.format("查询跨度超过上限 %s: [%s, %s]", limit, from, to));
        }

        long fromMs = from.toEpochMilli();
        long toMs = to.toEpochMilli();
        return switch (feed) {
            case OMSZ -> {
                List<String> columns = resolveOmszColumns(cols);
                List<DataRow> rows;
                if (entityId == null) {
                    rows = readCache.read(CacheKey.range(FeedType.OMSZ), fromMs, toMs)
                            .orElseGet(() -> queryOmsz(null, fromMs, toMs));
                } else {
                    rows = queryOmsz(requireStation(entityId), fromMs, toMs);
                }
                yield project(rows, columns);
            }
            case MAVIR -> {
                List<String> columns = resolveMavirColumns(entityId, cols);
                List<DataRow> rows = readCache.read(CacheKey.range(FeedType.MAVIR), fromMs, toMs)
                        .orElseGet(() -> queryMavir(fromMs, toMs));
                yield project(rows, columns);
            }
        };
    }

    // ==================== 聚合 ====================

    public List<DataRow> getAggregate(AggregateLevel level, Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidQueryException("起始时间晚于结束时间: " + from + " > " + to);
        }
        long fromMs = from != null ? from.toEpochMilli() : Long.MIN_VALUE;
        long toMs = to != null ? to.toEpochMilli() : Long.MAX_VALUE;

        if (level == AggregateLevel.HOURLY) {
            CacheKey key = CacheKey.aggregate(level);
            Optional<List<DataRow>> cached = readCache.read(key, fromMs, toMs);
            if (cached.isPresent()) {
                return cached.get();
            }
            long generation = readCache.generation();
            List<DataRow> all = queryAggregate(level, Long.MIN_VALUE, Long.MAX_VALUE);
            readCache.setIfCurrent(key, all, null, generation);
            return ReadCache.slice(all, fromMs, toMs);
        }
        return queryAggregate(level, fromMs, toMs);
    }

    // ==================== 缓存预热 ====================

    /**
     * 同步周期结束后按尾部窗口预热热点数据
     */
    public void prewarm(FeedType feed) {
        Duration window = feed == FeedType.OMSZ
                ? config.getCache().getOmszPrewarmWindow()
                : config.getCache().getMavirPrewarmWindow();
        long generation = readCache.generation();
        long fromMs = clock.instant().minus(window).toEpochMilli();
        List<DataRow> rows = feed == FeedType.OMSZ
                ? queryOmsz(null, fromMs, Long.MAX_VALUE)
                : queryMavir(fromMs, Long.MAX_VALUE);
        boolean stored = readCache.setIfCurrent(CacheKey.range(feed), rows, fromMs, generation);
        log.info("缓存预热 {}: 窗口={} 行数={} 写入={}", feed, window, rows.size(), stored);
    }

    // ==================== 存储查询 ====================

    private List<DataRow> queryOmsz(String station, long fromMs, long toMs) {
        StringBuilder sql = new StringBuilder("SELECT station_number, time_ms");
        for (OmszField f : OmszField.values()) {
            sql.append(", ").append(f.column());
        }
        sql.append(" FROM omsz_data WHERE ");
        if (station != null) sql.append("station_number = ? AND ");
        sql.append("time_ms >= ? AND time_ms <= ? ORDER BY time_ms, station_number");

        List<DataRow> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            if (station != null) stmt.setInt(idx++, Integer.parseInt(station));
            stmt.setLong(idx++, fromMs);
            stmt.setLong(idx, toMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (OmszField f : OmszField.values()) {
                        values.put(f.getApiName(), JdbcSupport.getNullableDouble(rs, f.column()));
                    }
                    rows.add(DataRow.of(String.valueOf(rs.getInt("station_number")), rs.getLong("time_ms"), values));
                }
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("查询气象数据失败", e);
        }
        return rows;
    }

    /**
     * 窄表按时间透视为宽行
     */
    private List<DataRow> queryMavir(long fromMs, long toMs) {
        String sql = """
            SELECT column_name, time_ms, value FROM mavir_data
            WHERE time_ms >= ? AND time_ms <= ?
            ORDER BY time_ms
            """;
        TreeMap<Long, Map<String, Object>> byTime = new TreeMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, fromMs);
            stmt.setLong(2, toMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    byTime.computeIfAbsent(rs.getLong("time_ms"), k -> new LinkedHashMap<>())
                            .put(rs.getString("column_name"), JdbcSupport.getNullableDouble(rs, "value"));
                }
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("查询电力负荷数据失败", e);
        }
        List<DataRow> rows = new ArrayList<>(byTime.size());
        byTime.forEach((time, values) -> rows.add(DataRow.of(null, time, values)));
        return rows;
    }

    private List<DataRow> queryAggregate(AggregateLevel level, long fromMs, long toMs) {
        StringBuilder sql = new StringBuilder("SELECT time_ms");
        AGGREGATE_COLUMNS.keySet().forEach(c -> sql.append(", ").append(c));
        sql.append(" FROM ").append(level.getTable()).append(" WHERE time_ms >= ? AND time_ms <= ?");
        if (level == AggregateLevel.HOURLY) {
            // 只返回底层时间段已经完整的桶
            sql.append(" AND time_ms <= (SELECT MAX(time_ms) FROM ai_10min WHERE temp IS NOT NULL)");
        }
        sql.append(" ORDER BY time_ms");

        List<DataRow> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            stmt.setLong(1, fromMs);
            stmt.setLong(2, toMs);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (Map.Entry<String, String> c : AGGREGATE_COLUMNS.entrySet()) {
                        values.put(c.getValue(), JdbcSupport.getNullableDouble(rs, c.getKey()));
                    }
                    rows.add(DataRow.of(null, rs.getLong("time_ms"), values));
                }
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("查询聚合数据失败: " + level, e);
        }
        return rows;
    }

    @FunctionalInterface
    private interface RowMapper {
        DataRow map(ResultSet rs) throws SQLException;
    }

    private List<DataRow> queryRows(String sql, RowMapper mapper) {
        List<DataRow> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(mapper.map(rs));
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("查询失败: " + sql.strip(), e);
        }
        return rows;
    }

    private List<DataRow> cachedInFull(CacheKey key, Supplier<List<DataRow>> loader) {
        Optional<List<DataRow>> cached = readCache.get(key).<List<DataRow>>map(e -> new ArrayList<>(e.getSnapshot()));
        if (cached.isPresent()) {
            return cached.get();
        }
        long generation = readCache.generation();
        List<DataRow> rows = loader.get();
        readCache.setIfCurrent(key, rows, null, generation);
        return rows;
    }

    // ==================== 参数校验 ====================

    /**
     * 校验实体存在并返回规范化的实体标识（MAVIR 列名大小写不敏感）
     */
    public String requireEntity(FeedType feed, String entityId) {
        String id = entityId.strip();
        return switch (feed) {
            case OMSZ -> requireStation(id);
            case MAVIR -> MavirColumn.fromApiName(id)
                    .map(MavirColumn::getApiName)
                    .orElseThrow(() -> new InvalidQueryException("未知负荷列: " + id));
        };
    }

    private void requireOrderedRange(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new InvalidQueryException("必须同时指定起止时间");
        }
        if (from.isAfter(to)) {
            throw new InvalidQueryException("起始时间晚于结束时间: " + from + " > " + to);
        }
    }

    /**
     * @return 规范化站号（去掉前导零）
     */
    private String requireStation(String station) {
        if (station == null) {
            throw new InvalidQueryException("缺少站号");
        }
        String canonical;
        try {
            canonical = String.valueOf(Integer.parseInt(station.strip()));
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("站号格式错误: " + station);
        }
        if (!metadataRepository.knownEntities(FeedType.OMSZ).contains(canonical)) {
            throw new InvalidQueryException("未知站点: " + station);
        }
        return canonical;
    }

    private List<String> resolveOmszColumns(List<String> cols) {
        if (cols == null || cols.isEmpty()) {
            return Arrays.stream(OmszField.values()).map(OmszField::getApiName).toList();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String c : cols) {
            OmszField.fromApiName(c.strip()).ifPresent(f -> out.add(f.getApiName()));
        }
        if (out.isEmpty()) {
            throw new InvalidQueryException("没有有效的列: " + cols);
        }
        return new ArrayList<>(out);
    }

    private List<String> resolveMavirColumns(String entityId, List<String> cols) {
        List<String> requested = new ArrayList<>();
        if (entityId != null) {
            requested.add(entityId);
        } else if (cols != null) {
            requested.addAll(cols);
        }
        if (requested.isEmpty()) {
            return Arrays.stream(MavirColumn.values()).map(MavirColumn::getApiName).toList();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String c : requested) {
            MavirColumn.fromApiName(c.strip()).ifPresent(m -> out.add(m.getApiName()));
        }
        if (out.isEmpty()) {
            throw new InvalidQueryException("没有有效的列: " + requested);
        }
        return new ArrayList<>(out);
    }

    private List<DataRow> project(List<DataRow> rows, List<String> columns) {
        List<DataRow> out = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            out.add(row.project(columns));
        }
        return out;
    }

    private static Map<String, Object> mapOf(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    private static Map<String, String> aggregateColumns() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("net_system_load", "NetSystemLoad");
        m.put("prec", "Prec");
        m.put("temp", "Temp");
        m.put("rhum", "RHum");
        m.put("grad", "GRad");
        m.put("pres", "Pres");
        m.put("wind", "Wind");
        return m;
    }
}
