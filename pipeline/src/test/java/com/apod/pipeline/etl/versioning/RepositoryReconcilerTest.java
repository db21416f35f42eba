package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommitResult;
import com.apod.pipeline.etl.model.MetadataResult;
import com.apod.pipeline.etl.model.VersioningState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RepositoryReconcilerTest {

    @TempDir
    Path workTree;

    private PipelineProperties properties;
    private CommandRunner commandRunner;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getData().setDir(workTree.toString());
        properties.getVersioning().setAuthorName("APOD Test");
        properties.getVersioning().setAuthorEmail("apod-test@localhost");
        properties.getVersioning().setCommandTimeoutSeconds(30);
        commandRunner = new CommandRunner();
    }

    private RepositoryReconciler reconciler(CommandRunner runner) {
        return new RepositoryReconciler(properties, new GitClient(properties, runner));
    }

    private MetadataResult writeVersionedData(String content) throws Exception {
        Path csv = workTree.resolve("apod_data.csv");
        Files.writeString(csv, content, StandardCharsets.UTF_8);
        return new SimulatedMetadataProducer().produceMetadata(csv);
    }

    private String git(String... args) {
        return new GitClient(properties, commandRunner).git(args).stdout().trim();
    }

    @Test
    void secondReconcileIsANoOp() throws Exception {
        assumeTrue(GitSupport.gitAvailable());
        RepositoryReconciler reconciler = reconciler(commandRunner);
        reconciler.ensureInitialized();
        MetadataResult metadata = writeVersionedData("date,title\n2024-11-14,Test Nebula\n");

        VersioningState state = reconciler.inspect(metadata);
        CommitResult first = reconciler.reconcile("2024-11-14");
        CommitResult second = reconciler.reconcile("2024-11-14");

        assertTrue(state.repoDirty());
        assertTrue(state.metadataPresent());
        assertTrue(first.madeNewCommit());
        assertNotNull(first.hash());
        assertFalse(second.madeNewCommit());
        assertEquals(first.hash(), second.hash());
        assertEquals("1", git("rev-list", "--count", "HEAD"));
        assertFalse(reconciler.inspect(metadata).repoDirty());
    }

    @Test
    void commitsMetadataDocumentWithDatedMessage() throws Exception {
        assumeTrue(GitSupport.gitAvailable());
        RepositoryReconciler reconciler = reconciler(commandRunner);
        reconciler.ensureInitialized();
        writeVersionedData("date,title\n2024-11-14,Test Nebula\n");

        CommitResult commit = reconciler.reconcile("2024-11-14");

        assertTrue(commit.madeNewCommit());
        assertEquals("Update APOD data version for 2024-11-14", git("log", "-1", "--pretty=%s"));
        assertThat(git("show", "--name-only", "--pretty=format:", "HEAD").lines())
            .contains("apod_data.csv.dvc", ".gitignore")
            .doesNotContain("apod_data.csv");
        assertEquals("main", git("rev-parse", "--abbrev-ref", "HEAD"));
    }

    @Test
    void changedDataProducesANewCommit() throws Exception {
        assumeTrue(GitSupport.gitAvailable());
        RepositoryReconciler reconciler = reconciler(commandRunner);
        reconciler.ensureInitialized();
        writeVersionedData("date,title\n2024-11-14,Test Nebula\n");
        CommitResult first = reconciler.reconcile("2024-11-14");

        writeVersionedData("date,title\n2024-11-15,Next\n2024-11-14,Test Nebula\n");
        CommitResult second = reconciler.reconcile("2024-11-15");

        assertTrue(second.madeNewCommit());
        assertThat(second.hash()).isNotEqualTo(first.hash());
    }

    @Test
    void ensureInitializedKeepsExistingIdentity() {
        assumeTrue(GitSupport.gitAvailable());
        GitClient client = new GitClient(properties, commandRunner);
        client.git("init");
        client.git("config", "user.name", "Existing User");

        reconciler(commandRunner).ensureInitialized();
        reconciler(commandRunner).ensureInitialized();

        assertEquals("Existing User", git("config", "--get", "user.name"));
        assertThat(git("config", "--get", "user.email")).isNotBlank();
    }

    @Test
    void ensureInitializedAddsConfiguredRemoteOnce() {
        assumeTrue(GitSupport.gitAvailable());
        properties.getVersioning().setRemoteUrl("https://git.example/apod-data.git");

        reconciler(commandRunner).ensureInitialized();
        reconciler(commandRunner).ensureInitialized();

        assertEquals("https://git.example/apod-data.git", git("remote", "get-url", "origin"));
        assertEquals("origin", git("remote"));
    }

    @Test
    void failedCommitKeepsPriorHash() throws Exception {
        ScriptedCommandRunner runner = new ScriptedCommandRunner(args -> switch (args) {
            case "rev-parse --verify -q HEAD" -> ScriptedCommandRunner.ok("abc123");
            case "diff --cached --quiet" -> ScriptedCommandRunner.exit(1, "");
            case "-c commit.gpgsign=false commit -m Update APOD data version for 2024-11-14" ->
                ScriptedCommandRunner.exit(1, "error: unable to write new index file");
            default -> ScriptedCommandRunner.ok("");
        });

        CommitResult result = reconciler(runner).reconcile("2024-11-14");

        assertFalse(result.madeNewCommit());
        assertEquals("abc123", result.hash());
    }

    @Test
    void unreadableHeadAfterCommitIsARepositoryStateError() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner(args -> switch (args) {
            case "rev-parse --verify -q HEAD" -> ScriptedCommandRunner.exit(1, "");
            case "diff --cached --quiet" -> ScriptedCommandRunner.exit(1, "");
            case "rev-parse HEAD" -> ScriptedCommandRunner.exit(128, "fatal: bad object HEAD");
            default -> ScriptedCommandRunner.ok("");
        });

        assertThatThrownBy(() -> reconciler(runner).reconcile("2024-11-14"))
            .isInstanceOf(RepositoryStateException.class)
            .hasMessageContaining("HEAD");
    }

    @Test
    void cleanTreeOnUnbornBranchReturnsNoHash() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner(args -> switch (args) {
            case "rev-parse --verify -q HEAD" -> ScriptedCommandRunner.exit(1, "");
            case "diff --cached --quiet" -> ScriptedCommandRunner.ok("");
            default -> ScriptedCommandRunner.ok("");
        });

        CommitResult result = reconciler(runner).reconcile("2024-11-14");

        assertFalse(result.madeNewCommit());
        assertEquals(null, result.hash());
        assertThat(runner.executed()).noneMatch(args -> args.contains("commit -m"));
    }
}
