package com.apod.pipeline.etl.extract;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.http.ApodApiClient;
import com.apod.pipeline.etl.http.FatalUpstreamException;
import com.apod.pipeline.etl.http.RetryPolicy;
import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.ExtractionOutcome;
import com.apod.pipeline.etl.model.ExtractionState;
import com.apod.pipeline.etl.model.MediaType;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import com.apod.pipeline.etl.persistence.ApodCsvStore;
import com.apod.pipeline.etl.service.ApodNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionCoordinatorTest {
    private static final String BODY = """
        {"date":"2024-11-14","title":"Test Nebula","url":"https://apod.example/n.jpg",
         "media_type":"image","explanation":"Gas and dust."}
        """;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    private MockWebServer server;
    private ExecutorService executor;
    private PipelineProperties properties;
    private ApodCsvStore csvStore;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new PipelineProperties();
        properties.getApi().setBaseUrl(server.url("/planetary/apod").toString());
        properties.getApi().setApiKey("TEST_KEY");
        properties.getApi().setMaxRetries(5);
        properties.getApi().setRetryBaseDelayMs(1);
        properties.getData().setDir(dataDir.toString());
        csvStore = new ApodCsvStore(properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    private ExtractionCoordinator coordinator() {
        ApodApiClient client = new ApodApiClient(properties, executor, new ObjectMapper());
        RetryPolicy retryPolicy = new RetryPolicy(properties, millis -> { });
        return new ExtractionCoordinator(
            client,
            retryPolicy,
            List.of(new CachedRecordResolver(csvStore), new PlaceholderRecordResolver(CLOCK))
        );
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4})
    void succeedsLiveAfterTransientFailures(int failures) {
        for (int i = 0; i < failures; i++) {
            server.enqueue(new MockResponse().setResponseCode(i % 2 == 0 ? 429 : 503));
        }
        server.enqueue(new MockResponse().setResponseCode(200).setBody(BODY));

        ExtractionOutcome outcome = coordinator().extract();

        assertThat(outcome.state()).isEqualTo(ExtractionState.SUCCESS);
        assertThat(outcome.provenance()).isEqualTo(Provenance.LIVE);
        assertThat(outcome.attempts()).isEqualTo(failures + 1);
        assertThat(outcome.raw().title()).isEqualTo("Test Nebula");
        assertThat(server.getRequestCount()).isEqualTo(failures + 1);
    }

    @Test
    void fallsBackToNewestCachedRowWhenRetriesExhausted() throws Exception {
        csvStore.appendAndDedupe(record("2024-11-10", "Older"));
        csvStore.appendAndDedupe(record("2024-11-12", "Newest"));
        csvStore.appendAndDedupe(record("2024-11-11", "Middle"));
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(429));
        }

        ExtractionOutcome outcome = coordinator().extract();

        assertThat(outcome.state()).isEqualTo(ExtractionState.FALLBACK_CACHED);
        assertThat(outcome.provenance()).isEqualTo(Provenance.CACHED);
        assertThat(outcome.attempts()).isEqualTo(5);
        assertThat(outcome.raw().date()).isEqualTo("2024-11-12");
        assertThat(outcome.raw().title()).isEqualTo("Newest");
        assertThat(server.getRequestCount()).isEqualTo(5);
    }

    @Test
    void fallsBackToPlaceholderWhenNothingCached() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(429));
        }

        ExtractionOutcome outcome = coordinator().extract();

        assertThat(outcome.state()).isEqualTo(ExtractionState.FALLBACK_PLACEHOLDER);
        assertThat(outcome.provenance()).isEqualTo(Provenance.PLACEHOLDER);
        assertThat(outcome.raw().date()).isEqualTo("2025-03-01");
        assertThat(outcome.raw().title()).isEqualTo(PlaceholderRecordResolver.PLACEHOLDER_TITLE);
        assertThat(outcome.raw().mediaType()).isEqualTo("image");
        assertThat(outcome.raw().copyright()).isEqualTo("NASA");
    }

    @Test
    void cachedFallbackSkipsPlaceholderRows() throws Exception {
        csvStore.appendAndDedupe(record("2024-11-10", "Real"));
        csvStore.appendAndDedupe(record("2024-11-12", PlaceholderRecordResolver.PLACEHOLDER_TITLE, Provenance.PLACEHOLDER));
        enqueueOutage();

        ExtractionOutcome outcome = coordinator().extract();

        assertThat(outcome.state()).isEqualTo(ExtractionState.FALLBACK_CACHED);
        assertThat(outcome.raw().date()).isEqualTo("2024-11-10");
        assertThat(outcome.raw().title()).isEqualTo("Real");
    }

    @Test
    void secondOutageAfterPlaceholderStaysPlaceholder() throws Exception {
        ApodNormalizer normalizer = new ApodNormalizer(CLOCK);
        enqueueOutage();
        ExtractionOutcome first = coordinator().extract();
        csvStore.appendAndDedupe(normalizer.normalize(first));
        enqueueOutage();

        ExtractionOutcome second = coordinator().extract();

        assertThat(second.provenance()).isEqualTo(Provenance.PLACEHOLDER);
        assertThat(second.state()).isEqualTo(ExtractionState.FALLBACK_PLACEHOLDER);
        assertThat(csvStore.readAll()).extracting(RawApod::provenance).containsExactly("placeholder");
    }

    @Test
    void cachedReserveKeepsStoredLiveProvenance() throws Exception {
        ApodNormalizer normalizer = new ApodNormalizer(CLOCK);
        server.enqueue(new MockResponse().setResponseCode(200).setBody(BODY));
        csvStore.appendAndDedupe(normalizer.normalize(coordinator().extract()));
        enqueueOutage();

        ExtractionOutcome outcome = coordinator().extract();
        ApodRecord reserved = normalizer.normalize(outcome);
        csvStore.appendAndDedupe(reserved);

        assertThat(outcome.provenance()).isEqualTo(Provenance.CACHED);
        assertThat(reserved.provenance()).isEqualTo(Provenance.LIVE);
        assertThat(csvStore.readAll()).singleElement()
            .satisfies(row -> {
                assertThat(row.title()).isEqualTo("Test Nebula");
                assertThat(row.provenance()).isEqualTo("live");
            });
    }

    @Test
    void backfillOutageServesRequestedDateFromCache() throws Exception {
        csvStore.appendAndDedupe(record("2020-01-01", "New Year"));
        csvStore.appendAndDedupe(record("2024-11-12", "Newest"));
        enqueueOutage();

        ExtractionOutcome outcome = coordinator().extract(LocalDate.parse("2020-01-01"));

        assertThat(outcome.state()).isEqualTo(ExtractionState.FALLBACK_CACHED);
        assertThat(outcome.raw().date()).isEqualTo("2020-01-01");
        assertThat(outcome.raw().title()).isEqualTo("New Year");
        assertThat(server.takeRequest().getRequestUrl().queryParameter("date")).isEqualTo("2020-01-01");
    }

    @Test
    void backfillOutageWithoutCachedRowDatesPlaceholderWithRequestedDay() throws Exception {
        csvStore.appendAndDedupe(record("2024-11-12", "Newest"));
        enqueueOutage();

        ExtractionOutcome outcome = coordinator().extract(LocalDate.parse("2020-01-01"));

        assertThat(outcome.state()).isEqualTo(ExtractionState.FALLBACK_PLACEHOLDER);
        assertThat(outcome.raw().date()).isEqualTo("2020-01-01");
        assertThat(outcome.raw().title()).isEqualTo(PlaceholderRecordResolver.PLACEHOLDER_TITLE);
    }

    @Test
    void fatalResponseSkipsFallbacks() throws Exception {
        csvStore.appendAndDedupe(record("2024-11-10", "Cached"));
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad request"));

        assertThatThrownBy(() -> coordinator().extract())
            .isInstanceOf(FatalUpstreamException.class);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    private void enqueueOutage() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }
    }

    private static ApodRecord record(String date, String title) {
        return record(date, title, Provenance.LIVE);
    }

    private static ApodRecord record(String date, String title, Provenance provenance) {
        return new ApodRecord(
            LocalDate.parse(date),
            title,
            "https://apod.example/" + date + ".jpg",
            null,
            MediaType.IMAGE,
            "explanation",
            "NASA",
            Instant.parse("2024-11-12T00:00:00Z"),
            provenance
        );
    }
}
