package com.gridcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * GridCast 数据同步服务主类
 *
 * 功能特性：
 * - 周期性同步 OMSZ 气象站数据与 MAVIR 电力负荷数据
 * - 增量维护联合 10 分钟表与小时汇总表
 * - 通过读缓存提供区间查询
 */
@SpringBootApplication(scanBasePackages = "com.gridcast")
@EnableScheduling
public class DataSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataSyncApplication.class, args);
    }
}
