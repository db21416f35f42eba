package com.apod.pipeline.etl;

import com.apod.pipeline.etl.model.CommandResult;
import com.apod.pipeline.etl.model.ExtractionState;
import com.apod.pipeline.etl.model.MetadataSource;
import com.apod.pipeline.etl.model.PipelineRunReport;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.persistence.ApodJdbcRepository;
import com.apod.pipeline.etl.service.PipelineRunService;
import com.apod.pipeline.etl.util.HashUtils;
import com.apod.pipeline.etl.versioning.CommandRunner;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@SpringBootTest
@ActiveProfiles("test")
class PipelineEndToEndTest {
    private static final MockWebServer SERVER = new MockWebServer();
    private static final Path DATA_DIR;

    static {
        try {
            SERVER.start();
            DATA_DIR = Files.createTempDirectory("apod-e2e");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void pipelineProperties(DynamicPropertyRegistry registry) {
        registry.add("apod.api.base-url", () -> SERVER.url("/planetary/apod").toString());
        registry.add("apod.data.dir", DATA_DIR::toString);
    }

    @AfterAll
    static void shutdown() throws IOException {
        SERVER.shutdown();
    }

    @Autowired
    private PipelineRunService runService;

    @Autowired
    private ApodJdbcRepository repository;

    @Autowired
    private CommandRunner commandRunner;

    @Test
    void liveRunLandsInBothSinksAndIsCommitted() throws Exception {
        CommandResult gitVersion = commandRunner.run(null, Duration.ofSeconds(10), "git", "--version");
        assumeTrue(gitVersion.isSuccessful());
        SERVER.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"date":"2024-11-14","title":"Test Nebula","url":"https://apod.example/nebula.jpg",
                 "hdurl":"https://apod.example/nebula_hd.jpg","media_type":"image",
                 "explanation":"A test nebula.","copyright":"Test Observatory"}
                """));

        PipelineRunReport report = runService.run();

        assertThat(report.status()).isEqualTo(PipelineRunService.STATUS_SUCCEEDED);
        assertThat(report.extractionState()).isEqualTo(ExtractionState.SUCCESS);
        assertThat(report.attempts()).isEqualTo(1);
        assertThat(report.record().provenance()).isEqualTo(Provenance.LIVE);
        assertThat(report.verification().passed()).isTrue();
        assertThat(repository.findByDate(LocalDate.parse("2024-11-14")))
            .get()
            .extracting(stored -> stored.title())
            .isEqualTo("Test Nebula");

        Path csv = DATA_DIR.resolve("apod_data.csv");
        assertThat(report.metadata().source()).isEqualTo(MetadataSource.SIMULATED);
        assertThat(report.metadata().checksum()).isEqualTo(HashUtils.md5Hex(csv));
        assertThat(Files.readString(DATA_DIR.resolve("apod_data.csv.dvc"))).contains(HashUtils.md5Hex(csv));
        assertThat(report.commit().madeNewCommit()).isTrue();
        assertThat(report.commit().hash()).isNotBlank();
        assertThat(report.publish().ok()).isFalse();
        assertThat(report.publish().reason()).isEqualTo("no-remote");
        assertThat(SERVER.takeRequest().getPath()).isEqualTo("/planetary/apod?api_key=TEST_KEY");
    }
}
