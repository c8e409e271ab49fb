package com.gridcast.model;

import java.util.Optional;

public enum AggregateLevel {

    TEN_MINUTE("ai_10min", "10min"),
    HOURLY("ai_1hour", "1hour");

    private final String table;
    private final String path;

    AggregateLevel(String table, String path) {
        this.table = table;
        this.path = path;
    }

    public String getTable() { return table; }
    public String getPath() { return path; }

    public static Optional<AggregateLevel> fromPath(String path) {
        for (AggregateLevel level : values()) {
            if (level.path.equalsIgnoreCase(path)) return Optional.of(level);
        }
        return Optional.empty();
    }
}
