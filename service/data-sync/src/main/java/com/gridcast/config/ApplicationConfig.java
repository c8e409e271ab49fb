package com.gridcast.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

import java.time.Duration;
import java.time.Instant;

/**
 * 应用配置类 - 集中管理配置参数
 *
 * 配置分层策略：
 * 1. application.yml: 数据源地址、存储连接、滞后容忍度、缓存预热窗口
 * 2. ApplicationConfig: 技术参数默认值
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class ApplicationConfig {

    // ========== 核心业务配置（从yml读取） ==========
    private Database database = new Database();
    private Omsz omsz = new Omsz();
    private Mavir mavir = new Mavir();
    private Sync sync = new Sync();
    private Cache cache = new Cache();
    private Query query = new Query();
    private Aggregate aggregate = new Aggregate();

    // ========== 技术参数配置（类内默认值） ==========
    private ConnectionPool connectionPool = new ConnectionPool();
    private Http http = new Http();
    private Store store = new Store();
    private Performance performance = new Performance();

    @Data
    public static class Database {
        private String jdbcUrl;
        private String driverClassName;
        private String username;
        private String password;
    }

    @Data
    public static class Omsz {
        private String metaUrl = "https://odp.met.hu/climate/observations_hungary/hourly/station_meta_auto.csv";
        private String historicalUrl = "https://odp.met.hu/climate/observations_hungary/10_minutes/historical/";
        private String recentUrl = "https://odp.met.hu/climate/observations_hungary/10_minutes/recent/";
        private String liveUrl = "https://odp.met.hu/weather/weather_reports/synoptic/hungary/10_minutes/csv/";
        private Duration historicalLag = Duration.ZERO;
        private Duration recentLag = Duration.ofDays(1);
        private Duration liveLag = Duration.ofMinutes(20);
    }

    @Data
    public static class Mavir {
        private String exportUrl = "https://www.mavir.hu/rtdwweb/webuser/chart/7678/export";
        private Instant firstAvailable = Instant.parse("2007-01-01T00:00:00Z");
        private int chunkPeriods = 59_999;
        private int requestsPerMinute = 6;
        private Duration lag = Duration.ofMinutes(10);
        private Duration lookAhead = Duration.ofHours(24);
    }

    @Data
    public static class Sync {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(10);
        private Duration taskTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Cache {
        private Duration omszPrewarmWindow = Duration.ofDays(7);
        private Duration mavirPrewarmWindow = Duration.ofDays(30);
    }

    @Data
    public static class Query {
        private Duration singleEntityLimit = Duration.ofDays(3 * 365 + 2 * 366);
        private Duration allEntitiesLimit = Duration.ofDays(7);
    }

    @Data
    public static class Aggregate {
        private Instant fromTime = Instant.parse("2015-01-01T00:00:00Z");
    }

    // ========== 技术参数配置类 ==========
    @Data
    public static class ConnectionPool {
        private int maxConnections = 10;
        private int minConnections = 2;
        private int connectionTimeout = 30000;
        private int maxIdleTime = 600000;
        private int validationTimeout = 5000;
        private String validationQuery = "SELECT 1";
    }

    @Data
    public static class Http {
        private int connectTimeoutSeconds = 20;
        private int readTimeoutSeconds = 60;
        private int callTimeoutSeconds = 180;
        private int retries = 3;
        private long backoffBaseMs = 1000;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    }

    @Data
    public static class Store {
        private int batchSize = 4096;
        private int transactionRetries = 1;
        private long retryDelayMs = 500;
    }

    @Data
    public static class Performance {
        private int syncCoreSize = 2;
        private int syncMaxSize = 4;
        private int syncQueueCapacity = 16;
        private int schedulePoolSize = 2;
    }

    /**
     * 存储数据源（HikariCP 连接池）
     */
    @Bean
    public DataSource dataSource() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(database.getJdbcUrl());
        if (database.getDriverClassName() != null) {
            cfg.setDriverClassName(database.getDriverClassName());
        }
        cfg.setUsername(database.getUsername());
        cfg.setPassword(database.getPassword());
        cfg.setPoolName("gridcast-pool");

        cfg.setConnectionTestQuery(connectionPool.getValidationQuery());
        cfg.setAutoCommit(true);

        cfg.setMaximumPoolSize(connectionPool.getMaxConnections());
        cfg.setMinimumIdle(connectionPool.getMinConnections());
        cfg.setConnectionTimeout(connectionPool.getConnectionTimeout());
        cfg.setIdleTimeout(connectionPool.getMaxIdleTime());
        cfg.setValidationTimeout(connectionPool.getValidationTimeout());

        HikariDataSource ds = new HikariDataSource(cfg);
        log.info("存储数据源(HikariCP)配置完成: {}", database.getJdbcUrl());
        return ds;
    }
}
