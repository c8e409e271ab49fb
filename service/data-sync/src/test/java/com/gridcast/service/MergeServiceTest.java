package com.gridcast.service;

import com.gridcast.exception.StoreTransactionException;
import com.gridcast.model.FeedType;
import com.gridcast.model.MergeEvent;
import com.gridcast.model.MergeMode;
import com.gridcast.model.Observation;
import com.gridcast.model.WriteResult;
import com.gridcast.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.gridcast.support.Observations.load;
import static com.gridcast.support.Observations.ms;
import static com.gridcast.support.Observations.weather;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class MergeServiceTest {

    @TempDir
    Path tempDir;

    private TestDatabase db;
    private MergeService mergeService;
    private WatermarkRegistry watermarks;

    @BeforeEach
    void setUp() throws SQLException {
        db = TestDatabase.create(tempDir);
        db.addStations(13704, 44527);
        db.addMavirColumns();
        mergeService = db.getMergeService();
        watermarks = db.getWatermarkRegistry();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void firstMergeOnEmptyEntitySetsWatermarkToBatchBounds() {
        List<Observation> rows = List.of(
                weather("13704", "2020-01-01T00:00:00Z", 1.0),
                weather("13704", "2020-01-01T12:00:00Z", 2.0),
                weather("13704", "2020-01-02T00:00:00Z", 3.0));

        WriteResult result = mergeService.merge(FeedType.OMSZ, "13704", rows, MergeMode.INSERT_IF_ABSENT);

        assertThat(result.getWrittenRows()).isEqualTo(3);
        assertThat(watermarks.watermark(FeedType.OMSZ, "13704")).hasValueSatisfying(wm -> {
            assertThat(wm.getStartDate()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
            assertThat(wm.getEndDate()).isEqualTo(Instant.parse("2020-01-02T00:00:00Z"));
        });
    }

    @Test
    void mergingSameBatchTwiceIsIdempotent() throws SQLException {
        List<Observation> rows = List.of(
                weather("13704", "2021-06-01T00:00:00Z", 20.0),
                weather("13704", "2021-06-01T00:10:00Z", 21.0));

        mergeService.merge(FeedType.OMSZ, "13704", rows, MergeMode.INSERT_IF_ABSENT);
        WriteResult second = mergeService.merge(FeedType.OMSZ, "13704", rows, MergeMode.INSERT_IF_ABSENT);

        assertThat(second.getWrittenRows()).isZero();
        assertThat(db.count("SELECT COUNT(*) FROM omsz_data")).isEqualTo(2);
        assertThat(db.count("SELECT COUNT(*) FROM omsz_staging")).isZero();
    }

    @Test
    void insertIfAbsentKeepsExistingValue() throws SQLException {
        mergeService.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2021-06-01T00:00:00Z", 20.0)), MergeMode.INSERT_IF_ABSENT);
        mergeService.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2021-06-01T00:00:00Z", 99.0)), MergeMode.INSERT_IF_ABSENT);

        assertThat(db.queryDouble("SELECT temp FROM omsz_data WHERE station_number = 13704")).isEqualTo(20.0);
    }

    @Test
    void replaceOverwritesValueAtSameTime() throws SQLException {
        mergeService.merge(FeedType.MAVIR, "NetSystemLoad",
                List.of(load("NetSystemLoad", "2024-03-01T10:00:00Z", 5.0)), MergeMode.REPLACE);
        mergeService.merge(FeedType.MAVIR, "NetSystemLoad",
                List.of(load("NetSystemLoad", "2024-03-01T10:00:00Z", 7.0)), MergeMode.REPLACE);

        assertThat(db.queryDouble("SELECT value FROM mavir_data WHERE column_name = 'NetSystemLoad'")).isEqualTo(7.0);
        assertThat(db.count("SELECT COUNT(*) FROM mavir_data")).isEqualTo(1);
    }

    @Test
    void duplicateTimesInBatchKeepLastRow() throws SQLException {
        mergeService.merge(FeedType.MAVIR, "NetSystemLoad", List.of(
                load("NetSystemLoad", "2024-03-01T10:00:00Z", 1.0),
                load("NetSystemLoad", "2024-03-01T10:00:00Z", 2.0)), MergeMode.REPLACE);

        assertThat(db.queryDouble("SELECT value FROM mavir_data")).isEqualTo(2.0);
    }

    @Test
    void watermarkOnlyExtendsOutward() {
        mergeService.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2020-01-01T00:00:00Z", 1.0), weather("13704", "2020-12-31T00:00:00Z", 1.0)),
                MergeMode.INSERT_IF_ABSENT);
        mergeService.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2020-06-01T00:00:00Z", 1.0)), MergeMode.INSERT_IF_ABSENT);

        assertThat(watermarks.watermark(FeedType.OMSZ, "13704")).hasValueSatisfying(wm -> {
            assertThat(wm.getStartDate()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
            assertThat(wm.getEndDate()).isEqualTo(Instant.parse("2020-12-31T00:00:00Z"));
        });
    }

    @Test
    void rowsOfOtherEntityAreRejected() {
        assertThatThrownBy(() -> mergeService.merge(FeedType.OMSZ, "13704",
                List.of(weather("44527", "2020-01-01T00:00:00Z", 1.0)), MergeMode.INSERT_IF_ABSENT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownEntityRollsBackWholeBatch() throws SQLException {
        assertThatThrownBy(() -> mergeService.merge(FeedType.OMSZ, "99999",
                List.of(weather("99999", "2020-01-01T00:00:00Z", 1.0)), MergeMode.INSERT_IF_ABSENT))
                .isInstanceOf(StoreTransactionException.class);

        assertThat(db.count("SELECT COUNT(*) FROM omsz_data")).isZero();
        assertThat(db.count("SELECT COUNT(*) FROM ai_10min")).isZero();
    }

    // ==================== 原子性 ====================

    @Test
    void faultBetweenInsertAndWatermarkIsRetriedOnFreshConnection() throws SQLException {
        WatermarkRegistry faulty = spy(new WatermarkRegistry(db.getDataSource()));
        doThrow(new SQLException("injected fault"))
                .doCallRealMethod()
                .when(faulty).recordWrite(any(), any(), anyString(), anyLong(), anyLong());
        MergeService service = new MergeService(db.getTransactionRunner(), faulty,
                List.of(db.getAggregateMaintainer(), db.getReadCache()), db.getConfig());

        WriteResult result = service.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2022-05-05T10:00:00Z", 15.0)), MergeMode.INSERT_IF_ABSENT);

        assertThat(result.getWrittenRows()).isEqualTo(1);
        assertThat(db.count("SELECT COUNT(*) FROM omsz_data")).isEqualTo(1);
        assertThat(db.count("SELECT COUNT(*) FROM omsz_staging")).isZero();
        assertThat(faulty.watermark(FeedType.OMSZ, "13704")).isPresent();
    }

    @Test
    void persistentFaultLeavesNoPartialState() throws SQLException {
        WatermarkRegistry faulty = spy(new WatermarkRegistry(db.getDataSource()));
        doThrow(new SQLException("injected fault"))
                .when(faulty).recordWrite(any(), any(), anyString(), anyLong(), anyLong());
        MergeService service = new MergeService(db.getTransactionRunner(), faulty,
                List.of(db.getAggregateMaintainer(), db.getReadCache()), db.getConfig());

        assertThatThrownBy(() -> service.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2022-05-05T10:00:00Z", 15.0)), MergeMode.INSERT_IF_ABSENT))
                .isInstanceOf(StoreTransactionException.class)
                .hasRootCauseMessage("injected fault");

        assertThat(db.count("SELECT COUNT(*) FROM omsz_data")).isZero();
        assertThat(db.count("SELECT COUNT(*) FROM omsz_staging")).isZero();
        assertThat(db.count("SELECT COUNT(*) FROM ai_10min")).isZero();
        assertThat(watermarks.watermark(FeedType.OMSZ, "13704")).isEmpty();
    }

    // ==================== 更正路径 ====================

    @Test
    void deleteRangeShrinksWatermarkAndClearsAggregate() throws SQLException {
        mergeService.merge(FeedType.OMSZ, "13704", List.of(
                weather("13704", "2022-01-01T00:10:00Z", 1.0),
                weather("13704", "2022-01-01T00:20:00Z", 2.0),
                weather("13704", "2022-01-01T00:30:00Z", 3.0)), MergeMode.INSERT_IF_ABSENT);

        int deleted = mergeService.deleteRange(FeedType.OMSZ, "13704",
                Instant.parse("2022-01-01T00:25:00Z"), Instant.parse("2022-01-01T01:00:00Z"));

        assertThat(deleted).isEqualTo(1);
        assertThat(watermarks.watermark(FeedType.OMSZ, "13704")).hasValueSatisfying(wm ->
                assertThat(wm.getEndDate()).isEqualTo(Instant.parse("2022-01-01T00:20:00Z")));
        assertThat(db.queryDouble("SELECT temp FROM ai_10min WHERE time_ms = ?", ms("2022-01-01T00:30:00Z"))).isNull();
        assertThat(db.queryDouble("SELECT temp FROM ai_1hour WHERE time_ms = ?", ms("2022-01-01T01:00:00Z"))).isEqualTo(1.5);
    }

    // ==================== 串行提交 ====================

    @Test
    void aggregateWritesHoldSerialCommitLockWhileListenersRun() {
        AtomicReference<MergeService> serviceRef = new AtomicReference<>();
        List<String> observed = new ArrayList<>();
        MergeListener recorder = new MergeListener() {
            @Override
            public void onMerged(Connection connection, MergeEvent event) {
                observed.add(event.getEntityId() + "=" + serviceRef.get().holdsSerialCommitLock());
            }
        };
        MergeService service = new MergeService(db.getTransactionRunner(), watermarks,
                List.of(db.getAggregateMaintainer(), recorder), db.getConfig());
        serviceRef.set(service);

        service.merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2022-03-01T00:10:00Z", 1.0)), MergeMode.INSERT_IF_ABSENT);
        service.merge(FeedType.MAVIR, "NetSystemLoad",
                List.of(load("NetSystemLoad", "2022-03-01T00:10:00Z", 100.0)), MergeMode.REPLACE);
        service.merge(FeedType.MAVIR, "NetPlanSystemLoad",
                List.of(load("NetPlanSystemLoad", "2022-03-01T00:10:00Z", 100.0)), MergeMode.REPLACE);
        service.deleteRange(FeedType.OMSZ, "13704",
                Instant.parse("2022-03-01T00:00:00Z"), Instant.parse("2022-03-01T01:00:00Z"));

        assertThat(observed).containsExactly(
                "13704=true", "NetSystemLoad=true", "NetPlanSystemLoad=false", "13704=true");
        assertThat(service.holdsSerialCommitLock()).isFalse();
    }

    @Test
    void concurrentWeatherAndLoadMergesKeepHourlyBucketConsistent() throws Exception {
        long label = ms("2022-03-01T01:00:00Z");
        int rounds = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> weatherWriter = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    mergeService.merge(FeedType.OMSZ, "13704", List.of(
                            weather("13704", "2022-03-01T00:10:00Z", i),
                            weather("13704", "2022-03-01T00:20:00Z", i + 1.0)), MergeMode.REPLACE);
                }
                return null;
            });
            Future<?> loadWriter = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    mergeService.merge(FeedType.MAVIR, "NetSystemLoad", List.of(
                            load("NetSystemLoad", "2022-03-01T00:10:00Z", 100.0 + i),
                            load("NetSystemLoad", "2022-03-01T00:20:00Z", 200.0 + i)), MergeMode.REPLACE);
                }
                return null;
            });
            start.countDown();
            weatherWriter.get(60, TimeUnit.SECONDS);
            loadWriter.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        String window = " FROM ai_10min WHERE time_ms > ? AND time_ms <= ?";
        long from = label - AggregateMaintainer.HOUR_MS;
        assertThat(db.queryDouble("SELECT net_system_load FROM ai_1hour WHERE time_ms = ?", label))
                .isEqualTo(db.queryDouble("SELECT AVG(net_system_load)" + window, from, label))
                .isEqualTo(157.0);
        assertThat(db.queryDouble("SELECT temp FROM ai_1hour WHERE time_ms = ?", label))
                .isEqualTo(db.queryDouble("SELECT AVG(temp)" + window, from, label))
                .isEqualTo(7.5);
        assertThat(db.queryDouble("SELECT prec FROM ai_1hour WHERE time_ms = ?", label))
                .isEqualTo(db.queryDouble("SELECT SUM(prec)" + window, from, label))
                .isEqualTo(1.0);
    }
}
