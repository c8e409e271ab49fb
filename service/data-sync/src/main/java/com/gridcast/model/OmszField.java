package com.gridcast.model;

import java.util.Locale;
import java.util.Optional;

/**
 * OMSZ 气象观测字段：源文件列代码 -> 对外列名 + 单位
 */
public enum OmszField {

    PREC("r", "Prec", "mm"),
    TEMP("t", "Temp", "°C"),
    AVG_TEMP("ta", "AvgTemp", "°C"),
    MIN_TEMP("tn", "MinTemp", "°C"),
    MAX_TEMP("tx", "MaxTemp", "°C"),
    VIEW("v", "View", "m"),
    PRES("p", "Pres", "hPa"),
    RHUM("u", "RHum", "%"),
    AVG_GAMMA("sg", "AvgGamma", "nSv/h"),
    GRAD("sr", "GRad", "W/m²"),
    AVG_UV("suv", "AvgUV", "MED/h"),
    AVG_WS("fs", "AvgWS", "m/s"),
    AVG_WD("fsd", "AvgWD", "°"),
    MAX_WS("fx", "MaxWS", "m/s"),
    MAX_WD("fxd", "MaxWD", "°"),
    MAX_W_MIN("fxm", "MaxWMin", "min"),
    MAX_W_SEC("fxs", "MaxWSec", "s"),
    STEMP5("et5", "STemp5", "°C"),
    STEMP10("et10", "STemp10", "°C"),
    STEMP20("et20", "STemp20", "°C"),
    STEMP50("et50", "STemp50", "°C"),
    STEMP100("et100", "STemp100", "°C"),
    MIN_NS_TEMP("tsn", "MinNSTemp", "°C"),
    WTEMP("tviz", "WTemp", "°C");

    private final String sourceCode;
    private final String apiName;
    private final String unit;

    OmszField(String sourceCode, String apiName, String unit) {
        this.sourceCode = sourceCode;
        this.apiName = apiName;
        this.unit = unit;
    }

    public String getApiName() { return apiName; }
    public String getUnit() { return unit; }

    /**
     * 数据库列名（对外列名的小写形式）
     */
    public String column() {
        return apiName.toLowerCase(Locale.ROOT);
    }

    public static Optional<OmszField> fromSourceCode(String code) {
        for (OmszField f : values()) {
            if (f.sourceCode.equals(code)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static Optional<OmszField> fromApiName(String name) {
        for (OmszField f : values()) {
            if (f.apiName.equalsIgnoreCase(name)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
