package com.gridcast.model;

import lombok.Value;

/**
 * 缓存键。feed 为 null 表示依赖所有数据源（聚合），entityId 为 null 表示该数据源全部实体
 */
@Value
public class CacheKey {

    FeedType feed;
    String view;
    String entityId;

    public static CacheKey meta(FeedType feed) { return new CacheKey(feed, "meta", null); }
    public static CacheKey status(FeedType feed) { return new CacheKey(feed, "status", null); }
    public static CacheKey range(FeedType feed) { return new CacheKey(feed, "range", null); }
    public static CacheKey aggregate(AggregateLevel level) { return new CacheKey(null, level.getPath(), null); }

    public boolean dependsOn(FeedType changedFeed, String changedEntity) {
        if (feed == null) return true;
        if (feed != changedFeed) return false;
        return entityId == null || changedEntity == null || entityId.equals(changedEntity);
    }
}
