package com.gridcast.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 规范化后的单条观测：实体 + UTC 毫秒时间 + 数据库列名到数值的映射（null 表示未测量）
 */
@Value
@Builder
public class Observation {

    String entityId;
    long timeMs;
    Map<String, Double> values;
}
