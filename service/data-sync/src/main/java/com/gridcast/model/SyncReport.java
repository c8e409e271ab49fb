package com.gridcast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一个数据源一次同步周期的结果汇总
 */
@Value
@Builder
public class SyncReport {

    FeedType feed;
    Instant startedAt;
    Instant finishedAt;
    int discovered;
    int notNeeded;
    int fetched;
    int transientFailures;
    int malformed;
    int unchanged;
    int failedEntities;
    long writtenRows;
    boolean deadlineReached;
}
