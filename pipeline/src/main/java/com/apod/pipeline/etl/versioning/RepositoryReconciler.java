package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommandResult;
import com.apod.pipeline.etl.model.CommitResult;
import com.apod.pipeline.etl.model.MetadataResult;
import com.apod.pipeline.etl.model.VersioningState;
import com.apod.pipeline.etl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the metadata document committed. A commit is only made when the staged tree differs
 * from {@code HEAD}, so repeated runs over unchanged data leave history alone.
 */
@Service
public class RepositoryReconciler {
    private static final Logger log = LoggerFactory.getLogger(RepositoryReconciler.class);

    static final String COMMIT_MESSAGE_PREFIX = "Update APOD data version for ";

    private final PipelineProperties properties;
    private final GitClient git;

    public RepositoryReconciler(PipelineProperties properties, GitClient git) {
        this.properties = properties;
        this.git = git;
    }

    public void ensureInitialized() {
        PipelineProperties.Versioning versioning = properties.getVersioning();
        try {
            Files.createDirectories(git.workTree());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create working tree " + git.workTree(), e);
        }
        if (!git.isRepository()) {
            require(git.git("init"), "git init");
            require(git.git("symbolic-ref", "HEAD", "refs/heads/" + versioning.getBranch()), "git symbolic-ref");
            log.info("Initialized git repository in {} on branch {}", git.workTree(), versioning.getBranch());
        }
        setConfigIfAbsent("user.name", versioning.getAuthorName());
        setConfigIfAbsent("user.email", versioning.getAuthorEmail());

        String remoteUrl = versioning.getRemoteUrl();
        if (remoteUrl != null && !remoteUrl.isBlank()) {
            CommandResult existing = git.git("remote", "get-url", git.remoteName());
            if (!existing.isSuccessful()) {
                require(git.git("remote", "add", git.remoteName(), remoteUrl.trim()), "git remote add");
                log.info("Added remote {} -> {}", git.remoteName(), remoteUrl.trim());
            }
        }
    }

    public VersioningState inspect(MetadataResult metadata) {
        stageTrackedPaths(metadata.documentPath());
        boolean dirty = hasStagedChanges();
        String checksum = metadata.checksum();
        if (checksum == null && Files.isRegularFile(metadata.dataPath())) {
            try {
                checksum = HashUtils.md5Hex(metadata.dataPath());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to hash " + metadata.dataPath(), e);
            }
        }
        VersioningState state = new VersioningState(
            checksum,
            Files.isRegularFile(metadata.documentPath()),
            metadata.source(),
            dirty
        );
        log.info("Versioning state: metadataPresent={} source={} repoDirty={}", state.metadataPresent(), state.metadataSource(), dirty);
        return state;
    }

    public CommitResult reconcile(String commitLabel) {
        Path document = MetadataDocument.documentPathFor(properties.getData().csvPath());
        stageTrackedPaths(document);
        String priorHash = currentHead();
        if (!hasStagedChanges()) {
            log.info("Repository clean, no commit needed (HEAD={})", priorHash);
            return new CommitResult(priorHash, false);
        }

        String message = COMMIT_MESSAGE_PREFIX + commitLabel;
        CommandResult commit = git.git("-c", "commit.gpgsign=false", "commit", "-m", message);
        if (!commit.isSuccessful()) {
            log.warn("git commit failed (exit={}): {}", commit.exitCode(), commit.combinedOutput());
            return new CommitResult(priorHash, false);
        }

        CommandResult history = git.git("log", "--oneline", "-5");
        if (!history.isSuccessful()) {
            throw new RepositoryStateException("Failed to read git log after commit: " + history.combinedOutput());
        }
        log.debug("Recent history:\n{}", history.stdout());
        CommandResult head = git.git("rev-parse", "HEAD");
        if (!head.isSuccessful() || head.stdout().isBlank()) {
            throw new RepositoryStateException("Failed to resolve HEAD after commit: " + head.combinedOutput());
        }
        String hash = head.stdout().trim();
        log.info("Committed '{}' as {}", message, hash);
        return new CommitResult(hash, true);
    }

    String currentHead() {
        CommandResult head = git.git("rev-parse", "--verify", "-q", "HEAD");
        if (!head.isSuccessful() || head.stdout().isBlank()) {
            return null;
        }
        return head.stdout().trim();
    }

    private void stageTrackedPaths(Path document) {
        Path workTree = git.workTree();
        List<String> paths = new ArrayList<>();
        addIfExists(paths, workTree, document);
        addIfExists(paths, workTree, workTree.resolve(".gitignore"));
        addIfExists(paths, workTree, workTree.resolve(".dvcignore"));
        addIfExists(paths, workTree, workTree.resolve(".dvc").resolve("config"));
        if (paths.isEmpty()) {
            return;
        }
        List<String> args = new ArrayList<>();
        args.add("add");
        args.add("--");
        args.addAll(paths);
        require(git.git(args.toArray(new String[0])), "git add");
    }

    private boolean hasStagedChanges() {
        CommandResult diff = git.git("diff", "--cached", "--quiet");
        if (diff.errorCode() != null || diff.exitCode() > 1) {
            throw new RepositoryStateException("Failed to diff staged changes: " + diff.combinedOutput());
        }
        return diff.exitCode() == 1;
    }

    private void setConfigIfAbsent(String key, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        CommandResult current = git.git("config", "--get", key);
        if (current.isSuccessful() && !current.stdout().isBlank()) {
            return;
        }
        require(git.git("config", key, value), "git config " + key);
    }

    private static void addIfExists(List<String> paths, Path workTree, Path candidate) {
        if (Files.exists(candidate)) {
            paths.add(workTree.relativize(candidate.toAbsolutePath().normalize()).toString());
        }
    }

    private static void require(CommandResult result, String step) {
        if (!result.isSuccessful()) {
            throw new RepositoryStateException(step + " failed (exit=" + result.exitCode() + "): " + result.combinedOutput());
        }
    }
}
