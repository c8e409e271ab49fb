package com.gridcast.connector;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.FetchException;
import com.gridcast.exception.MalformedPayloadException;
import com.gridcast.model.CandidateKind;
import com.gridcast.model.CandidateRange;
import com.gridcast.model.FeedType;
import com.gridcast.model.NormalizedBatch;
import com.gridcast.model.Observation;
import com.gridcast.model.OmszField;
import com.gridcast.model.PayloadFingerprint;
import com.gridcast.model.Station;
import com.gridcast.model.Watermark;
import com.gridcast.service.MetadataRepository;
import com.gridcast.service.WatermarkRegistry;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * OMSZ 气象数据连接器
 *
 * 三个归档目录：按年历史文件、当年近期文件、近 24 小时的 10 分钟快照。
 * 历史与近期文件每站一个，快照文件每个时间槽一个，包含所有站点
 */
@Slf4j
@Service
public class OmszConnector implements SourceConnector {

    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"']+\\.zip)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATION = Pattern.compile("_(\\d{5})_");
    private static final Pattern HIST_RANGE = Pattern.compile("_(\\d{8})_(\\d{4})1231_");
    private static final Pattern LIVE_SLOT = Pattern.compile("_(\\d{12})\\.csv\\.zip$");

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmm");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Set<String> MISSING = Set.of("EOR");
    private static final double MISSING_VALUE = -999d;

    private final ApplicationConfig.Omsz omszConfig;
    private final FeedHttpClient httpClient;
    private final MetadataRepository metadataRepository;
    private final WatermarkRegistry watermarkRegistry;
    private final Clock clock;

    public OmszConnector(ApplicationConfig config,
                         FeedHttpClient httpClient,
                         MetadataRepository metadataRepository,
                         WatermarkRegistry watermarkRegistry,
                         Clock clock) {
        this.omszConfig = config.getOmsz();
        this.httpClient = httpClient;
        this.metadataRepository = metadataRepository;
        this.watermarkRegistry = watermarkRegistry;
        this.clock = clock;
    }

    @Override
    public FeedType feed() {
        return FeedType.OMSZ;
    }

    // ==================== 元数据 ====================

    @Override
    public void refreshMetadata() throws FetchException {
        String name = "station_meta";
        FetchedPayload payload = httpClient.get(FeedType.OMSZ, name, omszConfig.getMetaUrl(), null);
        DelimitedText table = DelimitedText.parse(payload.text(), MISSING);

        int idxNumber = table.indexOf("StationNumber");
        if (idxNumber < 0) {
            throw new MalformedPayloadException(name, payload.getFingerprint(), "元数据缺少 StationNumber 列");
        }
        int idxName = table.indexOf("StationName");
        int idxRegio = table.indexOf("RegioName");
        int idxCounty = table.indexOf("CountyName");
        int idxLat = table.indexOf("Latitude");
        int idxLon = table.indexOf("Longitude");
        int idxElev = table.indexOf("Elevation") >= 0 ? table.indexOf("Elevation") : table.indexOf("StationAltitude");

        // 同一站点多行时以最后一行为准
        Map<Integer, Station> stations = new LinkedHashMap<>();
        for (List<String> row : table.getRows()) {
            Integer number = parseStation(DelimitedText.cell(row, idxNumber));
            if (number == null) {
                continue;
            }
            stations.put(number, Station.builder()
                    .stationNumber(number)
                    .stationName(DelimitedText.cell(row, idxName))
                    .regioName(DelimitedText.cell(row, idxRegio))
                    .countyName(DelimitedText.cell(row, idxCounty))
                    .latitude(parseValue(DelimitedText.cell(row, idxLat)))
                    .longitude(parseValue(DelimitedText.cell(row, idxLon)))
                    .elevation(parseValue(DelimitedText.cell(row, idxElev)))
                    .build());
        }
        metadataRepository.upsertStations(new ArrayList<>(stations.values()));
    }

    @Override
    public boolean isUpdateDue(Instant now) {
        Optional<Instant> latest = watermarkRegistry.latestEnd(FeedType.OMSZ);
        return latest.isEmpty() || now.isAfter(latest.get().plus(omszConfig.getLiveLag()));
    }

    // ==================== 候选发现 ====================

    @Override
    public List<CandidateRange> discover() throws FetchException {
        Set<String> stations = metadataRepository.knownEntities(FeedType.OMSZ);
        List<CandidateRange> candidates = new ArrayList<>();

        for (String url : listArchives(omszConfig.getHistoricalUrl())) {
            String file = fileName(url);
            String station = stationOf(file);
            Matcher m = HIST_RANGE.matcher(file);
            String startDay = null;
            String endYear = null;
            while (m.find()) {
                startDay = m.group(1);
                endYear = m.group(2);
            }
            if (station == null || endYear == null || !stations.contains(station)) {
                continue;
            }
            Instant coverageStart;
            try {
                coverageStart = LocalDate.parse(startDay, DAY_FORMAT).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.debug("历史文件起始日期无法解析: {}", file);
                coverageStart = null;
            }
            candidates.add(CandidateRange.builder()
                    .feed(FeedType.OMSZ)
                    .kind(CandidateKind.HISTORICAL)
                    .name(file)
                    .url(url)
                    .entityId(station)
                    .coverageStart(coverageStart)
                    .coverageEnd(LocalDateTime.of(Integer.parseInt(endYear), 12, 31, 23, 50).toInstant(ZoneOffset.UTC))
                    .build());
        }

        Instant now = clock.instant();
        for (String url : listArchives(omszConfig.getRecentUrl())) {
            String file = fileName(url);
            String station = stationOf(file);
            if (station == null || !file.contains("akt") || !stations.contains(station)) {
                continue;
            }
            candidates.add(CandidateRange.builder()
                    .feed(FeedType.OMSZ)
                    .kind(CandidateKind.RECENT)
                    .name(file)
                    .url(url)
                    .entityId(station)
                    .coverageEnd(now)
                    .build());
        }

        for (String url : listArchives(omszConfig.getLiveUrl())) {
            String file = fileName(url);
            // LATEST 与最新时间槽的文件重复
            if (file.contains("LATEST")) {
                continue;
            }
            Matcher m = LIVE_SLOT.matcher(file);
            Long slotMs = m.find() ? parseTime(m.group(1)) : null;
            if (slotMs == null) {
                continue;
            }
            Instant slot = Instant.ofEpochMilli(slotMs);
            candidates.add(CandidateRange.builder()
                    .feed(FeedType.OMSZ)
                    .kind(CandidateKind.LIVE)
                    .name(file)
                    .url(url)
                    .coverageStart(slot)
                    .coverageEnd(slot)
                    .build());
        }

        log.info("OMSZ 发现候选 {} 个", candidates.size());
        return candidates;
    }

    @Override
    public boolean isNeeded(CandidateRange candidate) {
        if (candidate.getKind() == CandidateKind.LIVE) {
            Optional<Instant> latest = watermarkRegistry.latestEnd(FeedType.OMSZ);
            return latest.isEmpty() || latest.get().isBefore(candidate.getCoverageEnd());
        }
        Optional<Watermark> wm = watermarkRegistry.watermark(FeedType.OMSZ, candidate.getEntityId());
        if (wm.isEmpty()) {
            return true;
        }
        Instant coverageEnd = candidate.getCoverageEnd();
        if (candidate.getKind() == CandidateKind.HISTORICAL) {
            return wm.get().getEndDate().isBefore(coverageEnd.minus(omszConfig.getHistoricalLag()))
                    || wm.get().getStartDate().isAfter(coverageEnd);
        }
        return wm.get().getEndDate().isBefore(coverageEnd.minus(omszConfig.getRecentLag()));
    }

    // ==================== 拉取与规范化 ====================

    @Override
    public NormalizedBatch fetch(CandidateRange candidate) throws FetchException {
        FetchedPayload payload = httpClient.get(FeedType.OMSZ, candidate.getName(), candidate.getUrl(), candidate.getRejected());
        PayloadFingerprint fingerprint = payload.getFingerprint();
        String text = unzipSingleEntry(candidate.getName(), payload);
        DelimitedText table = DelimitedText.parse(text, MISSING);

        int idxStation = table.indexOf("StationNumber") >= 0 ? table.indexOf("StationNumber") : table.indexOf("Station Number");
        int idxTime = table.indexOf("Time");
        if (idxStation < 0 || idxTime < 0) {
            throw new MalformedPayloadException(candidate.getName(), fingerprint,
                    "缺少 StationNumber 或 Time 列: " + table.getHeader());
        }
        Map<OmszField, Integer> fieldIndex = new LinkedHashMap<>();
        for (int i = 0; i < table.getHeader().size(); i++) {
            String h = table.getHeader().get(i);
            Optional<OmszField> field = h != null ? OmszField.fromSourceCode(h) : Optional.empty();
            if (field.isPresent()) {
                fieldIndex.putIfAbsent(field.get(), i);
            }
        }

        Set<String> known = metadataRepository.knownEntities(FeedType.OMSZ);
        List<Observation> rows = new ArrayList<>(table.getRows().size());
        int dropped = 0;
        for (List<String> row : table.getRows()) {
            Integer number = parseStation(DelimitedText.cell(row, idxStation));
            String station = number != null ? String.valueOf(number) : null;
            Long timeMs = parseTime(DelimitedText.cell(row, idxTime));
            if (station == null || timeMs == null || !known.contains(station)
                    || (candidate.getEntityId() != null && !candidate.getEntityId().equals(station))) {
                dropped++;
                continue;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<OmszField, Integer> e : fieldIndex.entrySet()) {
                Double v = parseValue(DelimitedText.cell(row, e.getValue()));
                values.put(e.getKey().column(), v != null && v == MISSING_VALUE ? null : v);
            }
            rows.add(Observation.builder().entityId(station).timeMs(timeMs).values(values).build());
        }
        if (dropped > 0) {
            log.debug("{} 丢弃无法归属的行 {} 条", candidate.getName(), dropped);
        }
        return new NormalizedBatch(candidate, rows, dropped, fingerprint);
    }

    private String unzipSingleEntry(String name, FetchedPayload payload) throws FetchException {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(payload.getBody()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    return new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            throw new MalformedPayloadException(name, payload.getFingerprint(), "压缩包损坏", e);
        }
        throw new MalformedPayloadException(name, payload.getFingerprint(), "压缩包中没有文件");
    }

    // ==================== 目录解析 ====================

    /**
     * 抓取目录页，返回去重后的 .zip 绝对地址
     */
    private List<String> listArchives(String listingUrl) throws FetchException {
        FetchedPayload page = httpClient.get(FeedType.OMSZ, "listing " + listingUrl, listingUrl, null);
        HttpUrl base = HttpUrl.get(listingUrl);
        Set<String> urls = new LinkedHashSet<>();
        Matcher m = HREF.matcher(page.text());
        while (m.find()) {
            HttpUrl resolved = base.resolve(m.group(1).strip());
            if (resolved != null) {
                urls.add(resolved.toString());
            }
        }
        return new ArrayList<>(urls);
    }

    private static String fileName(String url) {
        return url.substring(url.lastIndexOf('/') + 1);
    }

    private static String stationOf(String file) {
        Matcher m = STATION.matcher(file);
        return m.find() ? String.valueOf(Integer.parseInt(m.group(1))) : null;
    }

    // ==================== 单元格解析 ====================

    private static Integer parseStation(String cell) {
        if (cell == null) return null;
        try {
            return Integer.parseInt(cell);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseTime(String cell) {
        if (cell == null) return null;
        try {
            return LocalDateTime.parse(cell, TIME_FORMAT).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Double parseValue(String cell) {
        if (cell == null) return null;
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
