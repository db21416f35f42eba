package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommandResult;
import com.apod.pipeline.etl.model.PublishResult;
import com.apod.pipeline.etl.util.PublishReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Best-effort push of the versioned metadata. Git failures come back as a reason code.
 */
@Service
public class PublishAttempt {
    private static final Logger log = LoggerFactory.getLogger(PublishAttempt.class);

    private final PipelineProperties properties;
    private final GitClient git;

    public PublishAttempt(PipelineProperties properties, GitClient git) {
        this.properties = properties;
        this.git = git;
    }

    public PublishResult publish(String branch) {
        if (!properties.getVersioning().isPublishEnabled()) {
            return new PublishResult(false, PublishReasonClassifier.DISABLED, branch);
        }
        try {
            return doPublish(branch);
        } catch (RuntimeException e) {
            log.warn("Publish to {} failed unexpectedly: {}", branch, e.getMessage());
            return new PublishResult(false, PublishReasonClassifier.PUSH_FAILED, branch);
        }
    }

    private PublishResult doPublish(String branch) {
        if (!git.isRepository()) {
            log.warn("No git repository in {}, skipping publish", git.workTree());
            return new PublishResult(false, PublishReasonClassifier.NO_REPOSITORY, branch);
        }
        String remote = git.remoteName();
        if (!git.git("remote", "get-url", remote).isSuccessful()) {
            log.warn("Remote '{}' is not configured, skipping publish", remote);
            return new PublishResult(false, PublishReasonClassifier.NO_REMOTE, branch);
        }
        if (!git.git("rev-parse", "--verify", "-q", "HEAD").isSuccessful()) {
            log.warn("Nothing committed yet, skipping publish");
            return new PublishResult(false, PublishReasonClassifier.NO_COMMITS, branch);
        }

        String pushBranch = switchBranch(branch);
        CommandResult push = git.git(Map.of("GIT_TERMINAL_PROMPT", "0"), "push", "-u", remote, pushBranch);
        log.debug("git push output: {}", push.combinedOutput());
        if (push.isSuccessful()) {
            String reason = PublishReasonClassifier.isUpToDate(push)
                ? PublishReasonClassifier.UP_TO_DATE
                : PublishReasonClassifier.PUSHED;
            log.info("Publish to {}/{}: {}", remote, pushBranch, reason);
            return new PublishResult(true, reason, pushBranch);
        }
        String reason = PublishReasonClassifier.classify(push);
        log.warn("Publish to {}/{} failed: {} (exit={})", remote, pushBranch, reason, push.exitCode());
        return new PublishResult(false, reason, pushBranch);
    }

    private String switchBranch(String branch) {
        CommandResult current = git.git("rev-parse", "--abbrev-ref", "HEAD");
        String currentBranch = current.isSuccessful() ? current.stdout().trim() : "";
        if (branch == null || branch.isBlank() || branch.equals(currentBranch)) {
            return currentBranch.isEmpty() ? branch : currentBranch;
        }
        if (git.git("checkout", branch).isSuccessful()) {
            return branch;
        }
        if (git.git("checkout", "-b", branch).isSuccessful()) {
            log.info("Created branch {}", branch);
            return branch;
        }
        log.warn("Could not switch to branch {}, pushing {} instead", branch, currentBranch);
        return currentBranch;
    }
}
