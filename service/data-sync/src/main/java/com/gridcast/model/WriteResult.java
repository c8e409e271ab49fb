package com.gridcast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WriteResult {

    FeedType feed;
    String entityId;
    MergeMode mode;
    int stagedRows;
    int writtenRows;
    Instant minTime;
    Instant maxTime;

    public static WriteResult empty(FeedType feed, String entityId, MergeMode mode) {
        return WriteResult.builder().feed(feed).entityId(entityId).mode(mode).build();
    }
}
