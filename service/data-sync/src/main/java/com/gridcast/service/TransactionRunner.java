package com.gridcast.service;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.StoreTransactionException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * 作用域事务：获取连接 -> 执行 -> 成功提交 / 异常回滚 -> 释放连接
 *
 * SQLException 视为存储事务失败：回滚后从连接池重新取连接，按配置重试（默认一次）。
 * 业务代码抛出的 RuntimeException 回滚后原样抛出，不重试
 */
@Slf4j
@Service
public class TransactionRunner {

    @FunctionalInterface
    public interface TransactionBody<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final DataSource dataSource;
    private final int retries;
    private final long retryDelayMs;

    public TransactionRunner(DataSource dataSource, ApplicationConfig config) {
        this.dataSource = dataSource;
        this.retries = Math.max(0, config.getStore().getTransactionRetries());
        this.retryDelayMs = Math.max(0, config.getStore().getRetryDelayMs());
    }

    public <T> T inTransaction(String label, TransactionBody<T> body) {
        int maxAttempts = retries + 1;
        SQLException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return runOnce(body);
            } catch (SQLException e) {
                last = e;
                log.warn("事务失败并已回滚 ({}/{}) {}: {} [SQLState={}]",
                        attempt, maxAttempts, label, e.getMessage(), e.getSQLState());
                if (attempt < maxAttempts) {
                    sleep(retryDelayMs * attempt);
                }
            }
        }
        throw new StoreTransactionException("事务失败: " + label, last);
    }

    private <T> T runOnce(TransactionBody<T> body) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = body.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        }
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            // 连接已损坏时交给连接池回收
            log.warn("恢复 autoCommit 失败: {}", e.getMessage());
        }
    }

    private void sleep(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
