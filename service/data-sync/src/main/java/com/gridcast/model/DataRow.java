package com.gridcast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 查询结果行，不可变。元数据行的 timeMs 为 null
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataRow {

    String entityId;
    Long timeMs;
    Map<String, Object> values;

    public static DataRow of(String entityId, Long timeMs, Map<String, ?> values) {
        return new DataRow(entityId, timeMs, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * 只保留给定列，列不存在时值为 null
     */
    public DataRow project(Iterable<String> columns) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String c : columns) {
            out.put(c, values.get(c));
        }
        return new DataRow(entityId, timeMs, Collections.unmodifiableMap(out));
    }
}
