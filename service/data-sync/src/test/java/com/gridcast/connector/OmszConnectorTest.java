package com.gridcast.connector;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.MalformedPayloadException;
import com.gridcast.exception.PayloadUnchangedException;
import com.gridcast.exception.TransientFetchException;
import com.gridcast.model.CandidateKind;
import com.gridcast.model.CandidateRange;
import com.gridcast.model.FeedType;
import com.gridcast.model.MergeMode;
import com.gridcast.model.NormalizedBatch;
import com.gridcast.model.Observation;
import com.gridcast.model.OmszField;
import com.gridcast.support.TestDatabase;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.gridcast.support.Observations.ms;
import static com.gridcast.support.Observations.weather;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OmszConnectorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:03:00Z"), ZoneOffset.UTC);

    private static final String META = """
            StationNumber;StartDate;EndDate;Latitude;Longitude;Elevation;StationName;RegioName;CountyName
            13704;20050101;EOR;47.6783;16.6022;232.8;Sopron Kuruc-domb  ;Nyugat-Dunántúl;Győr-Moson-Sopron
            44527;20050101;EOR;46.6906;21.0858;84.0;Békéscsaba;Dél-Alföld;Békés
            """;

    private static final String HIST_CSV = """
            # 10 perces adatok
            StationNumber;Time;r;Q_r;t;Q_t;u;Q_u;fs;EOR
            13704;202301010000;0.0;;-1.5;;-999;;2.1;EOR
            13704;202301010010;0.2;;-1.4;;85;;2.3;EOR
            44527;202301010010;0.1;;3.0;;90;;1.0;EOR
            13704;nonsense;0.1;;3.0;;90;;1.0;EOR
            """;

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private TestDatabase db;
    private OmszConnector connector;
    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                MockResponse response = routes.get(request.getPath());
                return response != null ? response : new MockResponse().setResponseCode(404);
            }
        });
        server.start();

        db = TestDatabase.create(tempDir);
        ApplicationConfig config = db.getConfig();
        config.getOmsz().setMetaUrl(server.url("/meta.csv").toString());
        config.getOmsz().setHistoricalUrl(server.url("/hist/").toString());
        config.getOmsz().setRecentUrl(server.url("/rec/").toString());
        config.getOmsz().setLiveUrl(server.url("/live/").toString());

        FeedHttpClient http = new FeedHttpClient(config, new ApiRateLimiter(config));
        connector = new OmszConnector(config, http, db.getMetadataRepository(), db.getWatermarkRegistry(), CLOCK);

        routes.put("/meta.csv", new MockResponse().setBody(META));
        routes.put("/hist/", listing("HABP_10M_13704_20050101_20231231_hist.zip", "HABP_10M_99999_20050101_20231231_hist.zip"));
        routes.put("/rec/", listing("HABP_10M_13704_akt.zip", "HABP_10M_99999_akt.zip"));
        routes.put("/live/", listing("HABP_10M_SYNOP_202405011150.csv.zip", "HABP_10M_SYNOP_LATEST.csv.zip"));
        routes.put("/hist/HABP_10M_13704_20050101_20231231_hist.zip", new MockResponse().setBody(zip(HIST_CSV)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        db.close();
    }

    @Test
    void metadataRefreshRegistersStations() throws Exception {
        connector.refreshMetadata();

        assertThat(db.getMetadataRepository().knownEntities(FeedType.OMSZ)).containsExactly("13704", "44527");
    }

    @Test
    void discoverKeepsKnownStationsAndSkipsLatest() throws Exception {
        db.addStations(13704);

        List<CandidateRange> candidates = connector.discover();

        assertThat(candidates).extracting(CandidateRange::getName).containsExactlyInAnyOrder(
                "HABP_10M_13704_20050101_20231231_hist.zip",
                "HABP_10M_13704_akt.zip",
                "HABP_10M_SYNOP_202405011150.csv.zip");
        CandidateRange hist = candidates.stream().filter(c -> c.getKind() == CandidateKind.HISTORICAL).findFirst().orElseThrow();
        assertThat(hist.getEntityId()).isEqualTo("13704");
        assertThat(hist.getCoverageEnd()).isEqualTo(Instant.parse("2023-12-31T23:50:00Z"));
        assertThat(hist.getUrl()).isEqualTo(server.url("/hist/HABP_10M_13704_20050101_20231231_hist.zip").toString());
    }

    @Test
    void historicalArchiveIsNormalized() throws Exception {
        db.addStations(13704, 44527);

        NormalizedBatch batch = connector.fetch(historical());

        assertThat(batch.getRows()).hasSize(2);
        assertThat(batch.getDroppedRows()).isEqualTo(2);
        Observation first = batch.getRows().get(0);
        assertThat(first.getEntityId()).isEqualTo("13704");
        assertThat(first.getTimeMs()).isEqualTo(ms("2023-01-01T00:00:00Z"));
        assertThat(first.getValues())
                .containsEntry(OmszField.TEMP.column(), -1.5)
                .containsEntry(OmszField.AVG_WS.column(), 2.1)
                .containsEntry(OmszField.RHUM.column(), null);
    }

    @Test
    void errorStatusIsTransient() {
        routes.put("/hist/HABP_10M_13704_20050101_20231231_hist.zip", new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> connector.fetch(historical()))
                .isInstanceOf(TransientFetchException.class);
    }

    @Test
    void malformedArchiveIsRejectedUntilItChanges() throws Exception {
        db.addStations(13704);
        routes.put("/hist/HABP_10M_13704_20050101_20231231_hist.zip", new MockResponse().setBody("not a zip"));

        MalformedPayloadException malformed = null;
        try {
            connector.fetch(historical());
        } catch (MalformedPayloadException e) {
            malformed = e;
        }
        assertThat(malformed).isNotNull();
        assertThat(malformed.getFingerprint().getSha256()).isNotBlank();

        CandidateRange retry = historical().withRejected(malformed.getFingerprint());
        assertThatThrownBy(() -> connector.fetch(retry)).isInstanceOf(PayloadUnchangedException.class);

        routes.put("/hist/HABP_10M_13704_20050101_20231231_hist.zip", new MockResponse().setBody(zip(HIST_CSV)));
        assertThat(connector.fetch(retry).getRows()).hasSize(2);
    }

    @Test
    void historicalNeededUntilCoveredToArchiveEnd() {
        db.addStations(13704);
        CandidateRange hist = historical();
        assertThat(connector.isNeeded(hist)).isTrue();

        db.getMergeService().merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2023-12-31T23:50:00Z", 1.0)), hist.getKind().mergeMode());

        assertThat(connector.isNeeded(hist)).isFalse();
    }

    @Test
    void updateDueFollowsLiveLag() {
        db.addStations(13704);
        assertThat(connector.isUpdateDue(CLOCK.instant())).isTrue();

        db.getMergeService().merge(FeedType.OMSZ, "13704",
                List.of(weather("13704", "2024-05-01T11:50:00Z", 1.0)), MergeMode.REPLACE);

        assertThat(connector.isUpdateDue(CLOCK.instant())).isFalse();
        assertThat(connector.isUpdateDue(Instant.parse("2024-05-01T12:11:00Z"))).isTrue();
    }

    private CandidateRange historical() {
        return CandidateRange.builder()
                .feed(FeedType.OMSZ)
                .kind(CandidateKind.HISTORICAL)
                .name("HABP_10M_13704_20050101_20231231_hist.zip")
                .url(server.url("/hist/HABP_10M_13704_20050101_20231231_hist.zip").toString())
                .entityId("13704")
                .coverageEnd(Instant.parse("2023-12-31T23:50:00Z"))
                .build();
    }

    private static MockResponse listing(String... files) {
        StringBuilder html = new StringBuilder("<html><body><pre>");
        for (String f : files) {
            html.append("<a href=\"").append(f).append("\">").append(f).append("</a>\n");
            html.append("<a href=\"").append(f).append("\">").append(f).append("</a>\n");
        }
        html.append("</pre></body></html>");
        return new MockResponse().setBody(html.toString());
    }

    static Buffer zip(String csv) {
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (ZipOutputStream out = new ZipOutputStream(bytes)) {
                out.putNextEntry(new ZipEntry("data.csv"));
                out.write(csv.getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
            return new Buffer().write(bytes.toByteArray());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
