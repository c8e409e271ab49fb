package com.gridcast.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 气象站元数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Station {

    private Integer stationNumber;
    private String stationName;
    private String regioName;
    private String countyName;
    private Double latitude;
    private Double longitude;
    private Double elevation;
}
