package com.gridcast.support;

import com.gridcast.model.Observation;
import com.gridcast.model.OmszField;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 构造测试观测
 */
public final class Observations {

    private Observations() {}

    public static long ms(String isoInstant) {
        return Instant.parse(isoInstant).toEpochMilli();
    }

    public static Observation weather(String station, String time, double temp) {
        Map<String, Double> values = new HashMap<>();
        values.put(OmszField.TEMP.column(), temp);
        values.put(OmszField.PREC.column(), 0.5);
        values.put(OmszField.AVG_WS.column(), 2.0);
        return Observation.builder().entityId(station).timeMs(ms(time)).values(values).build();
    }

    public static Observation load(String column, String time, double value) {
        return Observation.builder().entityId(column).timeMs(ms(time)).values(Map.of("value", value)).build();
    }
}
