package com.gridcast.controller;

import com.gridcast.exception.InvalidQueryException;
import com.gridcast.model.AggregateLevel;
import com.gridcast.model.FeedType;
import com.gridcast.service.DataQueryService;
import com.gridcast.service.MergeService;
import com.gridcast.service.SyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DataQueryController {

    private final DataQueryService dataQueryService;
    private final SyncService syncService;
    private final MergeService mergeService;

    @GetMapping
    public ResponseEntity<?> getLastUpdates() {
        return respond("获取更新时间失败", () -> {
            Map<String, Object> out = new LinkedHashMap<>();
            for (FeedType feed : FeedType.values()) {
                Instant last = syncService.getLastUpdates().get(feed);
                out.put(feed.key(), last != null ? last.toString() : null);
            }
            return out;
        });
    }

    // ==================== 元数据 ====================

    @GetMapping("/{feed}/meta")
    public ResponseEntity<?> getMeta(@PathVariable String feed) {
        return respond("获取元数据失败", () -> dataQueryService.getMeta(parseFeed(feed)));
    }

    @GetMapping("/{feed}/status")
    public ResponseEntity<?> getStatus(@PathVariable String feed) {
        return respond("获取数据状态失败", () -> dataQueryService.getStatus(parseFeed(feed)));
    }

    @GetMapping("/omsz/columns")
    public ResponseEntity<?> getOmszColumns(@RequestParam(required = false) String station) {
        return respond("获取气象列失败", () -> station == null
                ? dataQueryService.getColumns(FeedType.OMSZ)
                : dataQueryService.getStationColumns(station));
    }

    @GetMapping("/mavir/columns")
    public ResponseEntity<?> getMavirColumns() {
        return respond("获取负荷列失败", () -> dataQueryService.getColumns(FeedType.MAVIR));
    }

    // ==================== 区间数据 ====================

    @GetMapping("/omsz/weather")
    public ResponseEntity<?> getWeather(@RequestParam("start_date") String startDate,
                                        @RequestParam("end_date") String endDate,
                                        @RequestParam(required = false) String station,
                                        @RequestParam(value = "col", required = false) List<String> cols) {
        return respond("获取气象数据失败", () -> dataQueryService.getRange(FeedType.OMSZ, station,
                parseDate(startDate, "start_date"), parseDate(endDate, "end_date"), cols));
    }

    @GetMapping("/mavir/load")
    public ResponseEntity<?> getLoad(@RequestParam("start_date") String startDate,
                                     @RequestParam("end_date") String endDate,
                                     @RequestParam(value = "col", required = false) List<String> cols) {
        return respond("获取负荷数据失败", () -> dataQueryService.getRange(FeedType.MAVIR, null,
                parseDate(startDate, "start_date"), parseDate(endDate, "end_date"), cols));
    }

    @GetMapping("/ai/{level}")
    public ResponseEntity<?> getAggregate(@PathVariable String level,
                                          @RequestParam(value = "start_date", required = false) String startDate,
                                          @RequestParam(value = "end_date", required = false) String endDate) {
        return respond("获取聚合数据失败", () -> {
            AggregateLevel parsed = AggregateLevel.fromPath(level)
                    .orElseThrow(() -> new InvalidQueryException("未知聚合粒度: " + level));
            return dataQueryService.getAggregate(parsed,
                    startDate != null ? parseDate(startDate, "start_date") : null,
                    endDate != null ? parseDate(endDate, "end_date") : null);
        });
    }

    // ==================== 更正 ====================

    /**
     * 删除实体在区间内的观测并修复水位，下个同步周期会按需重新拉取
     */
    @DeleteMapping("/{feed}/data")
    public ResponseEntity<?> deleteRange(@PathVariable String feed,
                                         @RequestParam String entity,
                                         @RequestParam("start_date") String startDate,
                                         @RequestParam("end_date") String endDate) {
        return respond("删除数据失败", () -> {
            FeedType parsed = parseFeed(feed);
            Instant from = parseDate(startDate, "start_date");
            Instant to = parseDate(endDate, "end_date");
            if (from.isAfter(to)) {
                throw new InvalidQueryException("start_date 晚于 end_date");
            }
            String entityId = dataQueryService.requireEntity(parsed, entity);
            int deleted = mergeService.deleteRange(parsed, entityId, from, to);
            return Map.of("deleted", deleted);
        });
    }

    // ==================== 辅助 ====================

    private ResponseEntity<?> respond(String failure, Callable<Object> body) {
        try {
            return ResponseEntity.ok(Map.of(
                "success", true,
                "data", body.call()
            ));
        } catch (InvalidQueryException e) {
            log.debug("{}: {}", failure, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "message", e.getMessage()
            ));
        } catch (Exception e) {
            log.error(failure, e);
            return ResponseEntity.internalServerError().body(Map.of(
                "success", false,
                "message", failure + ": " + e.getMessage()
            ));
        }
    }

    private static FeedType parseFeed(String feed) {
        try {
            return FeedType.valueOf(feed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("未知数据源: " + feed);
        }
    }

    /**
     * 接受 ISO-8601 时刻、本地日期时间或日期，后两者按 UTC 解释
     */
    static Instant parseDate(String value, String param) {
        String v = value.strip();
        try {
            if (v.length() <= 10) {
                return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(v, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("日期格式错误 " + param + ": " + value);
        }
    }
}
