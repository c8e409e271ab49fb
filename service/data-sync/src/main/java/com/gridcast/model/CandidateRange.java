package com.gridcast.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Comparator;

/**
 * 一个可发现、可拉取的远端单元（一个归档文件或一个导出窗口）
 */
@Value
@Builder(toBuilder = true)
public class CandidateRange {

    public static final Comparator<CandidateRange> FETCH_ORDER = Comparator
            .comparing(CandidateRange::getKind)
            .thenComparing(CandidateRange::getCoverageEnd)
            .thenComparing(CandidateRange::getName);

    FeedType feed;
    CandidateKind kind;
    String name;
    String url;
    /** 单实体文件解析出的实体；多实体快照为 null */
    String entityId;
    Instant coverageStart;
    Instant coverageEnd;
    /** 上次被判定格式错误时的指纹 */
    @With
    PayloadFingerprint rejected;
}
