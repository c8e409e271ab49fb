package com.gridcast.model;

import lombok.Value;

import java.time.Instant;

/**
 * 实体已知数据范围 [startDate, endDate]
 */
@Value
public class Watermark {

    String entityId;
    Instant startDate;
    Instant endDate;

    public boolean covers(Instant from, Instant to) {
        return !startDate.isAfter(from) && !endDate.isBefore(to);
    }
}
