package com.gridcast.service;

import com.gridcast.model.AggregateLevel;
import com.gridcast.model.FeedType;
import com.gridcast.model.OmszField;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Collectors;

/**
 * 数据库服务 - 负责存储结构
 *
 * 职责：
 * - 应用启动时建表（幂等）
 * - 每个数据源：元数据表、事实表、暂存表、状态视图
 * - 联合 10 分钟表与小时汇总表
 *
 * 时间统一存为 UTC 毫秒（BIGINT），SQL 保持 PostgreSQL 与 SQLite 通用
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseService implements ApplicationRunner {

    private final DataSource dataSource;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        initSchema();
    }

    public void initSchema() throws SQLException {
        log.info("开始数据库初始化...");
        try (Connection connection = dataSource.getConnection()) {

            // 1) OMSZ 气象站
            createOmszTables(connection);

            // 2) MAVIR 电力负荷
            createMavirTables(connection);

            // 3) 状态视图
            createStatusViews(connection);

            // 4) 聚合表
            for (AggregateLevel level : AggregateLevel.values()) {
                createAggregateTable(connection, level.getTable());
            }

            log.info("数据库初始化完成");
        } catch (SQLException e) {
            log.error("数据库初始化失败", e);
            throw e;
        }
    }

    // ==================== OMSZ ====================

    private void createOmszTables(Connection connection) throws SQLException {
        String fieldColumns = FeedType.OMSZ.valueColumns().stream()
                .map(c -> "    " + c + " DOUBLE PRECISION")
                .collect(Collectors.joining(",\n"));

        execute(connection, """
            CREATE TABLE IF NOT EXISTS omsz_meta (
                station_number INTEGER PRIMARY KEY,
                station_name VARCHAR(128),
                regio_name VARCHAR(128),
                county_name VARCHAR(128),
                latitude DOUBLE PRECISION,
                longitude DOUBLE PRECISION,
                elevation DOUBLE PRECISION,
                start_date BIGINT,
                end_date BIGINT
            )
            """);

        execute(connection, String.format("""
            CREATE TABLE IF NOT EXISTS omsz_data (
                station_number INTEGER NOT NULL,
                time_ms BIGINT NOT NULL,
            %s,
                PRIMARY KEY (station_number, time_ms)
            )
            """, fieldColumns));
        execute(connection, "CREATE INDEX IF NOT EXISTS ix_omsz_data_time ON omsz_data (time_ms)");

        execute(connection, String.format("""
            CREATE TABLE IF NOT EXISTS omsz_staging (
                batch_id BIGINT NOT NULL,
                station_number INTEGER NOT NULL,
                time_ms BIGINT NOT NULL,
            %s
            )
            """, fieldColumns));
        execute(connection, "CREATE INDEX IF NOT EXISTS ix_omsz_staging_batch ON omsz_staging (batch_id)");
        log.info("OMSZ 表创建完成（{} 个观测字段）", OmszField.values().length);
    }

    // ==================== MAVIR ====================

    private void createMavirTables(Connection connection) throws SQLException {
        execute(connection, """
            CREATE TABLE IF NOT EXISTS mavir_meta (
                column_name VARCHAR(64) PRIMARY KEY,
                unit VARCHAR(16),
                start_date BIGINT,
                end_date BIGINT
            )
            """);

        execute(connection, """
            CREATE TABLE IF NOT EXISTS mavir_data (
                column_name VARCHAR(64) NOT NULL,
                time_ms BIGINT NOT NULL,
                value DOUBLE PRECISION,
                PRIMARY KEY (column_name, time_ms)
            )
            """);
        execute(connection, "CREATE INDEX IF NOT EXISTS ix_mavir_data_time ON mavir_data (time_ms)");

        execute(connection, """
            CREATE TABLE IF NOT EXISTS mavir_staging (
                batch_id BIGINT NOT NULL,
                column_name VARCHAR(64) NOT NULL,
                time_ms BIGINT NOT NULL,
                value DOUBLE PRECISION
            )
            """);
        execute(connection, "CREATE INDEX IF NOT EXISTS ix_mavir_staging_batch ON mavir_staging (batch_id)");
        log.info("MAVIR 表创建完成");
    }

    // ==================== 视图与聚合 ====================

    private void createStatusViews(Connection connection) throws SQLException {
        execute(connection, "DROP VIEW IF EXISTS omsz_status");
        execute(connection, """
            CREATE VIEW omsz_status AS
            SELECT station_number, station_name, start_date, end_date
            FROM omsz_meta
            """);
        execute(connection, "DROP VIEW IF EXISTS mavir_status");
        execute(connection, """
            CREATE VIEW mavir_status AS
            SELECT column_name, start_date, end_date
            FROM mavir_meta
            """);
    }

    private void createAggregateTable(Connection connection, String tableName) throws SQLException {
        execute(connection, String.format("""
            CREATE TABLE IF NOT EXISTS %s (
                time_ms BIGINT PRIMARY KEY,
                net_system_load DOUBLE PRECISION,
                prec DOUBLE PRECISION,
                temp DOUBLE PRECISION,
                rhum DOUBLE PRECISION,
                grad DOUBLE PRECISION,
                pres DOUBLE PRECISION,
                wind DOUBLE PRECISION
            )
            """, tableName));
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }
}
