package com.gridcast.model;

public enum MergeMode {
    /** 只写入尚不存在的时间点，已有值不覆盖 */
    INSERT_IF_ABSENT,
    /** 覆盖或插入，最新一次拉取为准 */
    REPLACE
}
