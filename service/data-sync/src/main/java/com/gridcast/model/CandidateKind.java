package com.gridcast.model;

/**
 * 远端可拉取单元的种类
 */
public enum CandidateKind {
    /** 按年归档的历史文件 */
    HISTORICAL,
    /** 当年截至昨日的近期文件 */
    RECENT,
    /** 近 24 小时的 10 分钟快照 */
    LIVE,
    /** 在线导出窗口 */
    EXPORT;

    /**
     * 归档数据只补缺；实时快照与导出窗口会修订已有值，以最新为准
     */
    public MergeMode mergeMode() {
        return switch (this) {
            case HISTORICAL, RECENT -> MergeMode.INSERT_IF_ABSENT;
            case LIVE, EXPORT -> MergeMode.REPLACE;
        };
    }
}
