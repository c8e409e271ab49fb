package com.gridcast.model;

import lombok.Value;

import java.util.List;

/**
 * 不可变缓存条目。validFrom 为 null 表示快照覆盖实体全部历史
 */
@Value
public class CacheEntry {

    CacheKey key;
    List<DataRow> snapshot;
    Long validFrom;

    public boolean servesFrom(long fromMs) {
        return validFrom == null || validFrom <= fromMs;
    }
}
