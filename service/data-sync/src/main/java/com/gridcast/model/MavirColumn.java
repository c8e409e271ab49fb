package com.gridcast.model;

import java.util.Optional;

/**
 * MAVIR 负荷导出列：导出表头 -> 对外列名
 */
public enum MavirColumn {

    NET_SYSTEM_LOAD("Nettó terhelés", "NetSystemLoad"),
    NET_SYSTEM_LOAD_FACT_PLANT_MANAGMENT("Nettó rendszerterhelés tény - üzemirányítási", "NetSystemLoadFactPlantManagment"),
    NET_SYSTEM_LOAD_NET_TRADE_SETTLEMENT("Nettó tény rendszerterhelés - net.ker.elsz.meres", "NetSystemLoadNetTradeSettlement"),
    NET_PLAN_SYSTEM_LOAD("Nettó terv rendszerterhelés", "NetPlanSystemLoad"),
    NET_SYSTEM_LOAD_DAY_AHEAD_ESTIMATE("Nettó rendszerterhelés becslés (dayahead)", "NetSystemLoadDayAheadEstimate"),
    NET_PLAN_SYSTEM_PRODUCTION("Nettó terv rendszertermelés", "NetPlanSystemProduction"),
    GROSS_SYSTEM_LOAD("Bruttó tény rendszerterhelés", "GrossSystemLoad"),
    GROSS_CERTIFIED_SYSTEM_LOAD("Bruttó hitelesített rendszerterhelés tény", "GrossCertifiedSystemLoad"),
    GROSS_PLAN_SYSTEM_LOAD("Bruttó terv rendszerterhelés", "GrossPlanSystemLoad"),
    GROSS_SYSTEM_LOAD_DAY_AHEAD_ESTIMATE("Bruttó rendszerterhelés becslés (dayahead)", "GrossSystemLoadDayAheadEstimate");

    public static final String TIME_HEADER = "Időpont";
    public static final String UNIT = "MW";

    private final String header;
    private final String apiName;

    MavirColumn(String header, String apiName) {
        this.header = header;
        this.apiName = apiName;
    }

    public String getHeader() { return header; }
    public String getApiName() { return apiName; }

    public static Optional<MavirColumn> fromApiName(String name) {
        for (MavirColumn c : values()) {
            if (c.apiName.equalsIgnoreCase(name)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
