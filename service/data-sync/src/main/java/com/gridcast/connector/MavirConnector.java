package com.gridcast.connector;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.FetchException;
import com.gridcast.exception.MalformedPayloadException;
import com.gridcast.model.CandidateKind;
import com.gridcast.model.CandidateRange;
import com.gridcast.model.FeedType;
import com.gridcast.model.MavirColumn;
import com.gridcast.model.NormalizedBatch;
import com.gridcast.model.Observation;
import com.gridcast.model.PayloadFingerprint;
import com.gridcast.model.Watermark;
import com.gridcast.service.MetadataRepository;
import com.gridcast.service.WatermarkRegistry;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MAVIR 电力负荷连接器
 *
 * 导出接口按时间窗口返回所有负荷列，单次请求最多 chunk-periods 个 10 分钟时段，
 * 且受每分钟请求数限制。发现阶段按自然年切分窗口，拉取阶段在窗口内按块顺序请求
 */
@Slf4j
@Service
public class MavirConnector implements SourceConnector {

    static final String PRIMARY_COLUMN = MavirColumn.NET_SYSTEM_LOAD.getApiName();
    static final long PERIOD_MS = Duration.ofMinutes(10).toMillis();

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss Z");
    private static final Set<String> MISSING = Set.of("-", "N/A");

    private final ApplicationConfig.Mavir mavirConfig;
    private final FeedHttpClient httpClient;
    private final MetadataRepository metadataRepository;
    private final WatermarkRegistry watermarkRegistry;
    private final Clock clock;

    public MavirConnector(ApplicationConfig config,
                          FeedHttpClient httpClient,
                          MetadataRepository metadataRepository,
                          WatermarkRegistry watermarkRegistry,
                          Clock clock) {
        this.mavirConfig = config.getMavir();
        this.httpClient = httpClient;
        this.metadataRepository = metadataRepository;
        this.watermarkRegistry = watermarkRegistry;
        this.clock = clock;
    }

    @Override
    public FeedType feed() {
        return FeedType.MAVIR;
    }

    /**
     * 列集合固定，元数据只需登记列名与单位
     */
    @Override
    public void refreshMetadata() {
        metadataRepository.upsertSeriesColumns(List.of(MavirColumn.values()));
    }

    @Override
    public boolean isUpdateDue(Instant now) {
        Optional<Watermark> wm = watermarkRegistry.watermark(FeedType.MAVIR, PRIMARY_COLUMN);
        return wm.isEmpty() || now.isAfter(wm.get().getEndDate().plus(mavirConfig.getLag()));
    }

    // ==================== 候选发现 ====================

    @Override
    public List<CandidateRange> discover() {
        Instant start = watermarkRegistry.watermark(FeedType.MAVIR, PRIMARY_COLUMN)
                .map(Watermark::getEndDate)
                .orElse(mavirConfig.getFirstAvailable());
        long nowMs = clock.millis();
        Instant end = Instant.ofEpochMilli(Math.floorDiv(nowMs, PERIOD_MS) * PERIOD_MS).plus(mavirConfig.getLookAhead());

        List<CandidateRange> candidates = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            ZonedDateTime nextYear = cursor.atZone(ZoneOffset.UTC)
                    .withDayOfYear(1).toLocalDate().atStartOfDay(ZoneOffset.UTC).plusYears(1);
            Instant windowEnd = nextYear.toInstant().isBefore(end) ? nextYear.toInstant() : end;
            candidates.add(CandidateRange.builder()
                    .feed(FeedType.MAVIR)
                    .kind(CandidateKind.EXPORT)
                    .name(String.format("mavir_%d_%d", cursor.toEpochMilli(), windowEnd.toEpochMilli()))
                    .url(mavirConfig.getExportUrl())
                    .coverageStart(cursor)
                    .coverageEnd(windowEnd)
                    .build());
            cursor = windowEnd;
        }
        log.info("MAVIR 发现导出窗口 {} 个: [{}, {})", candidates.size(), start, end);
        return candidates;
    }

    @Override
    public boolean isNeeded(CandidateRange candidate) {
        Optional<Watermark> wm = watermarkRegistry.watermark(FeedType.MAVIR, PRIMARY_COLUMN);
        if (wm.isEmpty()) {
            return true;
        }
        Instant now = clock.instant();
        Instant horizon = candidate.getCoverageEnd().isBefore(now) ? candidate.getCoverageEnd() : now;
        return wm.get().getEndDate().isBefore(horizon.minus(mavirConfig.getLag()));
    }

    // ==================== 拉取与规范化 ====================

    /**
     * 窗口按块顺序请求；起点前移一个时段使窗口起点包含在内
     */
    @Override
    public NormalizedBatch fetch(CandidateRange candidate) throws FetchException {
        long chunkMs = PERIOD_MS * Math.max(1, mavirConfig.getChunkPeriods());
        long fromMs = candidate.getCoverageStart().toEpochMilli() - PERIOD_MS;
        long endMs = candidate.getCoverageEnd().toEpochMilli();

        List<Observation> rows = new ArrayList<>();
        int dropped = 0;
        PayloadFingerprint fingerprint = null;
        int chunk = 0;
        while (fromMs < endMs) {
            long toMs = Math.min(fromMs + chunkMs, endMs);
            String chunkName = candidate.getName() + "#" + chunk;
            FetchedPayload payload = httpClient.get(FeedType.MAVIR, chunkName,
                    exportUrl(candidate.getUrl(), fromMs, toMs), candidate.getRejected());
            fingerprint = payload.getFingerprint();
            dropped += parseExport(chunkName, payload, rows);
            fromMs = toMs;
            chunk++;
        }
        log.debug("{} 拉取完成: 块数={} 行数={} 丢弃={}", candidate.getName(), chunk, rows.size(), dropped);
        return new NormalizedBatch(candidate, rows, dropped, fingerprint);
    }

    static String exportUrl(String base, long fromMs, long toMs) {
        return HttpUrl.get(base).newBuilder()
                .addQueryParameter("exportType", "csv")
                .addQueryParameter("fromTime", String.valueOf(fromMs))
                .addQueryParameter("toTime", String.valueOf(toMs))
                .addQueryParameter("periodType", "min")
                .addQueryParameter("period", "10")
                .build()
                .toString();
    }

    /**
     * 解析一个导出块，把每个非空单元格变成一条观测。返回丢弃的行数
     */
    private int parseExport(String name, FetchedPayload payload, List<Observation> out) throws FetchException {
        DelimitedText table = DelimitedText.parse(payload.text(), MISSING);
        int idxTime = table.indexOf(MavirColumn.TIME_HEADER);
        if (idxTime < 0) {
            throw new MalformedPayloadException(name, payload.getFingerprint(),
                    "导出缺少时间列: " + table.getHeader());
        }
        Map<MavirColumn, Integer> columnIndex = new EnumMap<>(MavirColumn.class);
        for (MavirColumn c : MavirColumn.values()) {
            int idx = table.indexOf(c.getHeader());
            if (idx >= 0) columnIndex.put(c, idx);
        }
        if (columnIndex.isEmpty()) {
            throw new MalformedPayloadException(name, payload.getFingerprint(),
                    "导出中没有可识别的负荷列: " + table.getHeader());
        }

        int dropped = 0;
        for (List<String> row : table.getRows()) {
            Long timeMs = parseTime(DelimitedText.cell(row, idxTime));
            if (timeMs == null) {
                dropped++;
                continue;
            }
            for (Map.Entry<MavirColumn, Integer> e : columnIndex.entrySet()) {
                Double v = parseValue(DelimitedText.cell(row, e.getValue()));
                if (v == null) {
                    continue;
                }
                out.add(Observation.builder()
                        .entityId(e.getKey().getApiName())
                        .timeMs(timeMs)
                        .values(Map.of("value", v))
                        .build());
            }
        }
        return dropped;
    }

    static Long parseTime(String cell) {
        if (cell == null) return null;
        try {
            return OffsetDateTime.parse(cell, TIME_FORMAT).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 兼容小数逗号
     */
    static Double parseValue(String cell) {
        if (cell == null) return null;
        try {
            return Double.parseDouble(cell.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
