package com.gridcast.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 外部数据源类型
 *
 * 每个数据源对应一组固定的表：元数据表、事实表、暂存表，以及实体主键列
 */
public enum FeedType {

    OMSZ("omsz_meta", "omsz_data", "omsz_staging", "omsz_status", "station_number"),
    MAVIR("mavir_meta", "mavir_data", "mavir_staging", "mavir_status", "column_name");

    private final String metaTable;
    private final String dataTable;
    private final String stagingTable;
    private final String statusView;
    private final String entityColumn;

    FeedType(String metaTable, String dataTable, String stagingTable, String statusView, String entityColumn) {
        this.metaTable = metaTable;
        this.dataTable = dataTable;
        this.stagingTable = stagingTable;
        this.statusView = statusView;
        this.entityColumn = entityColumn;
    }

    public String getMetaTable() { return metaTable; }
    public String getDataTable() { return dataTable; }
    public String getStagingTable() { return stagingTable; }
    public String getStatusView() { return statusView; }
    public String getEntityColumn() { return entityColumn; }

    /**
     * 事实表中除实体、时间以外的数值列
     */
    public List<String> valueColumns() {
        return switch (this) {
            case OMSZ -> Arrays.stream(OmszField.values()).map(OmszField::column).toList();
            case MAVIR -> List.of("value");
        };
    }

    public boolean numericEntity() {
        return this == OMSZ;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
