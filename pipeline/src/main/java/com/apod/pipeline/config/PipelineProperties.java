package com.apod.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "apod")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "apod-pipeline/0.1 (+contact)";

    private Api api = new Api();
    private Data data = new Data();
    private Verification verification = new Verification();
    private Versioning versioning = new Versioning();
    private Schedule schedule = new Schedule();
    private Cli cli = new Cli();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Verification getVerification() {
        return verification;
    }

    public void setVerification(Verification verification) {
        this.verification = verification;
    }

    public Versioning getVersioning() {
        return versioning;
    }

    public void setVersioning(Versioning versioning) {
        this.versioning = versioning;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = "https://api.nasa.gov/planetary/apod";
        private String apiKey = "DEMO_KEY";
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int maxRetries = 5;
        private long retryBaseDelayMs = 5000;
        private long retryMaxDelayMs = 0;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null ? null : baseUrl.trim();
        }

        public String getApiKey() {
            return apiKey == null || apiKey.isBlank() ? "DEMO_KEY" : apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(1, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(1, maxRetries);
        }

        public long getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public long getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }
    }

    public static class Data {
        private String dir = "data";
        private String csvFileName = "apod_data.csv";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getCsvFileName() {
            return csvFileName == null || csvFileName.isBlank() ? "apod_data.csv" : csvFileName.trim();
        }

        public void setCsvFileName(String csvFileName) {
            this.csvFileName = csvFileName;
        }

        public Path directory() {
            return Path.of(dir == null || dir.isBlank() ? "data" : dir).toAbsolutePath().normalize();
        }

        public Path csvPath() {
            return directory().resolve(getCsvFileName());
        }
    }

    public static class Verification {
        private boolean failRunOnFailure = true;

        public boolean isFailRunOnFailure() {
            return failRunOnFailure;
        }

        public void setFailRunOnFailure(boolean failRunOnFailure) {
            this.failRunOnFailure = failRunOnFailure;
        }
    }

    public static class Versioning {
        private boolean enabled = true;
        private String metadataTool = "dvc";
        private String gitBinary = "git";
        private String authorName = "APOD Pipeline";
        private String authorEmail = "apod-pipeline@localhost";
        private String remoteName = "origin";
        private String remoteUrl;
        private String branch = "main";
        private boolean publishEnabled = true;
        private int commandTimeoutSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMetadataTool() {
            return metadataTool == null || metadataTool.isBlank() ? "dvc" : metadataTool.trim();
        }

        public void setMetadataTool(String metadataTool) {
            this.metadataTool = metadataTool;
        }

        public String getGitBinary() {
            return gitBinary == null || gitBinary.isBlank() ? "git" : gitBinary.trim();
        }

        public void setGitBinary(String gitBinary) {
            this.gitBinary = gitBinary;
        }

        public String getAuthorName() {
            return authorName;
        }

        public void setAuthorName(String authorName) {
            this.authorName = authorName;
        }

        public String getAuthorEmail() {
            return authorEmail;
        }

        public void setAuthorEmail(String authorEmail) {
            this.authorEmail = authorEmail;
        }

        public String getRemoteName() {
            return remoteName == null || remoteName.isBlank() ? "origin" : remoteName.trim();
        }

        public void setRemoteName(String remoteName) {
            this.remoteName = remoteName;
        }

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public String getBranch() {
            return branch == null || branch.isBlank() ? "main" : branch.trim();
        }

        public void setBranch(String branch) {
            this.branch = branch;
        }

        public boolean isPublishEnabled() {
            return publishEnabled;
        }

        public void setPublishEnabled(boolean publishEnabled) {
            this.publishEnabled = publishEnabled;
        }

        public int getCommandTimeoutSeconds() {
            return Math.max(1, commandTimeoutSeconds);
        }

        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
            this.commandTimeoutSeconds = Math.max(1, commandTimeoutSeconds);
        }
    }

    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 0 * * *";
        private String zone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
