package com.gridcast.model;

import lombok.Value;

/**
 * 一次已暂存写入的描述。受影响的时间点保存在暂存表中 batchId 对应的行里，
 * 监听器在同一事务内读取它们
 */
@Value
public class MergeEvent {

    FeedType feed;
    String entityId;
    long batchId;
    long minTimeMs;
    long maxTimeMs;
    boolean deletion;
}
