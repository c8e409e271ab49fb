package com.gridcast.support;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.model.MavirColumn;
import com.gridcast.model.Station;
import com.gridcast.service.AggregateMaintainer;
import com.gridcast.service.DatabaseService;
import com.gridcast.service.MergeService;
import com.gridcast.service.MetadataRepository;
import com.gridcast.service.ReadCache;
import com.gridcast.service.TransactionRunner;
import com.gridcast.service.WatermarkRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.Getter;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * 测试用存储：临时目录下的 SQLite 文件 + HikariCP，并按生产方式装配存储层组件
 */
@Getter
public final class TestDatabase implements AutoCloseable {

    private final HikariDataSource dataSource;
    private final ApplicationConfig config;
    private final TransactionRunner transactionRunner;
    private final WatermarkRegistry watermarkRegistry;
    private final MetadataRepository metadataRepository;
    private final ReadCache readCache;
    private final AggregateMaintainer aggregateMaintainer;
    private final MergeService mergeService;

    private TestDatabase(HikariDataSource dataSource, ApplicationConfig config) {
        this.dataSource = dataSource;
        this.config = config;
        this.transactionRunner = new TransactionRunner(dataSource, config);
        this.watermarkRegistry = new WatermarkRegistry(dataSource);
        this.metadataRepository = new MetadataRepository(dataSource, transactionRunner);
        this.readCache = new ReadCache();
        this.aggregateMaintainer = new AggregateMaintainer(config);
        this.mergeService = new MergeService(transactionRunner, watermarkRegistry,
                List.of(aggregateMaintainer, readCache), config);
    }

    public static TestDatabase create(Path dir) throws SQLException {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + dir.resolve("gridcast-test.db"));
        cfg.setPoolName("gridcast-test-pool");
        cfg.setMaximumPoolSize(4);
        cfg.setMinimumIdle(1);
        HikariDataSource ds = new HikariDataSource(cfg);
        new DatabaseService(ds).initSchema();
        return new TestDatabase(ds, testConfig());
    }

    /**
     * 默认配置，去掉重试等待与节流，便于测试快速失败
     */
    public static ApplicationConfig testConfig() {
        ApplicationConfig config = new ApplicationConfig();
        config.getStore().setRetryDelayMs(0);
        config.getStore().setBatchSize(3);
        config.getHttp().setRetries(1);
        config.getHttp().setBackoffBaseMs(1);
        config.getMavir().setRequestsPerMinute(60_000);
        return config;
    }

    // ==================== 数据准备 ====================

    public void addStations(int... numbers) {
        List<Station> stations = new java.util.ArrayList<>();
        for (int n : numbers) {
            stations.add(Station.builder().stationNumber(n).stationName("Station " + n).regioName("Test").build());
        }
        metadataRepository.upsertStations(stations);
    }

    public void addMavirColumns() {
        metadataRepository.upsertSeriesColumns(List.of(MavirColumn.values()));
    }

    // ==================== 查询辅助 ====================

    public long count(String sql, Object... params) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * 单值查询，SQL NULL 返回 null
     */
    public Double queryDouble(String sql, Object... params) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) return null;
            double v = rs.getDouble(1);
            return rs.wasNull() ? null : v;
        }
    }

    private PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
        return stmt;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
