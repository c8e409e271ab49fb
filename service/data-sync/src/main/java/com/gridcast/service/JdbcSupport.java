package com.gridcast.service;

import com.gridcast.model.FeedType;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * JDBC 小工具：实体主键绑定、可空数值读写、SQL 片段拼接
 */
final class JdbcSupport {

    private JdbcSupport() {}

    static void bindEntity(PreparedStatement stmt, int index, FeedType feed, String entityId) throws SQLException {
        if (feed.numericEntity()) {
            stmt.setInt(index, Integer.parseInt(entityId));
        } else {
            stmt.setString(index, entityId);
        }
    }

    static String readEntity(ResultSet rs, String column, FeedType feed) throws SQLException {
        return feed.numericEntity() ? String.valueOf(rs.getInt(column)) : rs.getString(column);
    }

    static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null || value.isNaN()) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }

    static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    static Instant getNullableInstant(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * 生成 "c = excluded.c" 更新列表（PostgreSQL 与 SQLite 通用的 upsert 语法）
     */
    static String excludedAssignments(List<String> columns) {
        StringBuilder sb = new StringBuilder();
        for (String c : columns) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(c).append(" = excluded.").append(c);
        }
        return sb.toString();
    }
}
