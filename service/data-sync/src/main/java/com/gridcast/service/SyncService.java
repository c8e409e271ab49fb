package com.gridcast.service;

import com.gridcast.connector.SourceConnector;
import com.gridcast.exception.FetchException;
import com.gridcast.exception.MalformedPayloadException;
import com.gridcast.exception.PayloadUnchangedException;
import com.gridcast.exception.StoreTransactionException;
import com.gridcast.exception.TransientFetchException;
import com.gridcast.model.CandidateRange;
import com.gridcast.model.FeedType;
import com.gridcast.model.MergeMode;
import com.gridcast.model.NormalizedBatch;
import com.gridcast.model.Observation;
import com.gridcast.model.PayloadFingerprint;
import com.gridcast.model.SyncReport;
import com.gridcast.model.WriteResult;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 一个数据源的一次同步周期：刷新元数据 -> 发现候选 -> 逐个判断、拉取、合并
 *
 * 候选之间互相隔离：任何一个候选拉取或合并失败都不影响同周期的其它候选
 */
@Slf4j
@Service
public class SyncService {

    private final MergeService mergeService;
    private final ReadCache readCache;
    private final DataQueryService dataQueryService;
    private final Clock clock;

    // 被判定格式错误的负载指纹，远端变化前不再合并
    private final ConcurrentMap<String, PayloadFingerprint> rejectedPayloads = new ConcurrentHashMap<>();
    private final ConcurrentMap<FeedType, Instant> lastUpdates = new ConcurrentHashMap<>();

    public SyncService(MergeService mergeService,
                       ReadCache readCache,
                       DataQueryService dataQueryService,
                       Clock clock) {
        this.mergeService = mergeService;
        this.readCache = readCache;
        this.dataQueryService = dataQueryService;
        this.clock = clock;
    }

    public SyncReport syncFeed(SourceConnector connector, Instant deadline) {
        FeedType feed = connector.feed();
        SyncReport.SyncReportBuilder report = SyncReport.builder().feed(feed).startedAt(clock.instant());
        Counters counters = new Counters();

        refreshMetadata(connector);

        List<CandidateRange> candidates;
        try {
            candidates = new ArrayList<>(connector.discover());
        } catch (FetchException | StoreTransactionException e) {
            log.warn("{} 候选发现失败，本周期跳过: {}", feed, e.getMessage());
            return report.finishedAt(clock.instant()).transientFailures(1).build();
        }
        candidates.sort(CandidateRange.FETCH_ORDER);
        report.discovered(candidates.size());
        pruneRejected(feed, candidates);

        boolean deadlineReached = false;
        for (CandidateRange candidate : candidates) {
            if (clock.instant().isAfter(deadline)) {
                deadlineReached = true;
                log.warn("{} 同步超过截止时间，放弃剩余候选 {} 个", feed, candidates.size() - counters.processed);
                break;
            }
            counters.processed++;
            if (!processCandidate(connector, candidate, deadline, counters)) {
                deadlineReached = true;
                break;
            }
        }

        if (counters.mergedBatches > 0) {
            lastUpdates.put(feed, clock.instant());
        }
        try {
            dataQueryService.prewarm(feed);
        } catch (StoreTransactionException e) {
            log.warn("{} 缓存预热失败: {}", feed, e.getMessage());
        }

        SyncReport result = report
                .finishedAt(clock.instant())
                .notNeeded(counters.notNeeded)
                .fetched(counters.fetched)
                .transientFailures(counters.transientFailures)
                .malformed(counters.malformed)
                .unchanged(counters.unchanged)
                .failedEntities(counters.failedEntities)
                .writtenRows(counters.writtenRows)
                .deadlineReached(deadlineReached)
                .build();
        log.info("{} 同步周期完成: 候选={} 无需={} 拉取={} 暂时失败={} 格式错误={} 未变化={} 合并失败实体={} 写入行={}",
                feed, result.getDiscovered(), result.getNotNeeded(), result.getFetched(), result.getTransientFailures(),
                result.getMalformed(), result.getUnchanged(), result.getFailedEntities(), result.getWrittenRows());
        return result;
    }

    /**
     * 每个数据源最近一次成功合并数据的时间
     */
    public Map<FeedType, Instant> getLastUpdates() {
        Map<FeedType, Instant> out = new EnumMap<>(FeedType.class);
        out.putAll(lastUpdates);
        return Collections.unmodifiableMap(out);
    }

    private void refreshMetadata(SourceConnector connector) {
        FeedType feed = connector.feed();
        try {
            connector.refreshMetadata();
            readCache.invalidateEntity(feed, null);
        } catch (MalformedPayloadException e) {
            log.error("{} 元数据格式错误，沿用已有元数据: {}", feed, e.getMessage());
        } catch (FetchException | StoreTransactionException e) {
            log.warn("{} 元数据刷新失败，沿用已有元数据: {}", feed, e.getMessage());
        }
    }

    /**
     * 本周期未再发现的候选（如结束时间已推进的 MAVIR 窗口）不再保留其格式错误记录
     */
    private void pruneRejected(FeedType feed, List<CandidateRange> candidates) {
        Set<String> discovered = new HashSet<>();
        for (CandidateRange c : candidates) {
            discovered.add(rejectedKey(feed, c.getName()));
        }
        String prefix = feed.key() + ":";
        rejectedPayloads.keySet().removeIf(k -> k.startsWith(prefix) && !discovered.contains(k));
    }

    private static String rejectedKey(FeedType feed, String candidateName) {
        return feed.key() + ":" + candidateName;
    }

    /**
     * @return false 表示拉取完成时已超过截止时间，批次被丢弃
     */
    private boolean processCandidate(SourceConnector connector, CandidateRange candidate, Instant deadline,
                                     Counters counters) {
        FeedType feed = connector.feed();
        String key = rejectedKey(feed, candidate.getName());
        NormalizedBatch batch;
        try {
            if (!connector.isNeeded(candidate)) {
                counters.notNeeded++;
                return true;
            }
            batch = connector.fetch(candidate.withRejected(rejectedPayloads.get(key)));
            rejectedPayloads.remove(key);
        } catch (PayloadUnchangedException e) {
            counters.unchanged++;
            log.debug("{} 负载未变化，跳过: {}", feed, candidate.getName());
            return true;
        } catch (MalformedPayloadException e) {
            counters.malformed++;
            rejectedPayloads.put(key, e.getFingerprint());
            log.error("{} 负载格式错误，在远端变化前不再重试: {} {}", feed, e.getCandidateName(), e.getMessage());
            return true;
        } catch (TransientFetchException e) {
            counters.transientFailures++;
            log.warn("{} 拉取失败，下个周期重试: {} code={} {}", feed, e.getCandidateName(), e.getStatusCode(), e.getMessage());
            return true;
        } catch (FetchException | StoreTransactionException e) {
            counters.transientFailures++;
            log.warn("{} 处理候选失败，下个周期重试: {} {}", feed, candidate.getName(), e.getMessage());
            return true;
        }

        if (clock.instant().isAfter(deadline)) {
            log.warn("{} 拉取完成时已超过截止时间，丢弃未合并批次: {}", feed, candidate.getName());
            return false;
        }
        counters.fetched++;
        mergeBatch(feed, batch, candidate.getKind().mergeMode(), counters);
        return true;
    }

    private void mergeBatch(FeedType feed, NormalizedBatch batch, MergeMode mode, Counters counters) {
        if (batch.isEmpty()) {
            log.debug("{} 批次为空: {} 丢弃行={}", feed, batch.getCandidate().getName(), batch.getDroppedRows());
            return;
        }
        for (Map.Entry<String, List<Observation>> entry : batch.byEntity().entrySet()) {
            try {
                WriteResult result = mergeService.merge(feed, entry.getKey(), entry.getValue(), mode);
                counters.writtenRows += result.getWrittenRows();
                counters.mergedBatches++;
            } catch (StoreTransactionException e) {
                counters.failedEntities++;
                log.error("{} 实体 {} 合并失败，已回滚: {}", feed, entry.getKey(), e.getMessage());
            }
        }
    }

    private static final class Counters {
        int processed;
        int notNeeded;
        int fetched;
        int transientFailures;
        int malformed;
        int unchanged;
        int failedEntities;
        int mergedBatches;
        long writtenRows;
    }
}
