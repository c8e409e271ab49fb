package com.gridcast.connector;

import com.gridcast.exception.FetchException;
import com.gridcast.model.CandidateRange;
import com.gridcast.model.FeedType;
import com.gridcast.model.NormalizedBatch;

import java.time.Instant;
import java.util.List;

/**
 * 外部数据源连接器
 *
 * 一个同步周期的调用顺序：refreshMetadata -> discover -> 对每个候选 isNeeded -> fetch。
 * fetch 的失败只影响当前候选
 */
public interface SourceConnector {

    FeedType feed();

    /**
     * 刷新实体元数据（气象站列表 / 负荷列集合）
     */
    void refreshMetadata() throws FetchException;

    /**
     * 按当前水位判断是否应开始新的同步周期
     */
    boolean isUpdateDue(Instant now);

    List<CandidateRange> discover() throws FetchException;

    boolean isNeeded(CandidateRange candidate);

    NormalizedBatch fetch(CandidateRange candidate) throws FetchException;
}
