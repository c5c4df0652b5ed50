package io.middleware4j.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job engine and the replicated-store wrapper.
 */
@ConfigurationProperties(prefix = "middleware")
public class MiddlewareProperties {
    private int threadPoolSize = 20;
    private int processPoolSize = 4;
    private Path jobLogsDir = Path.of(System.getProperty("java.io.tmpdir"), "middleware4j", "jobs");
    private int jobLogsExcerptLines = 10;
    private Duration healthRecheckInterval = Duration.ofSeconds(30);
    private int lockRegistryWarnThreshold = 10_000;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;
    /**
     * Whether replicated stores run against the clustered backend. When false they use the local datastore.
     */
    private boolean replicatedClustered = true;

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getProcessPoolSize() {
        return processPoolSize;
    }

    public void setProcessPoolSize(int processPoolSize) {
        this.processPoolSize = processPoolSize;
    }

    public Path getJobLogsDir() {
        return jobLogsDir;
    }

    public void setJobLogsDir(Path jobLogsDir) {
        this.jobLogsDir = jobLogsDir;
    }

    public int getJobLogsExcerptLines() {
        return jobLogsExcerptLines;
    }

    public void setJobLogsExcerptLines(int jobLogsExcerptLines) {
        this.jobLogsExcerptLines = jobLogsExcerptLines;
    }

    public Duration getHealthRecheckInterval() {
        return healthRecheckInterval;
    }

    public void setHealthRecheckInterval(Duration healthRecheckInterval) {
        this.healthRecheckInterval = healthRecheckInterval;
    }

    public int getLockRegistryWarnThreshold() {
        return lockRegistryWarnThreshold;
    }

    public void setLockRegistryWarnThreshold(int lockRegistryWarnThreshold) {
        this.lockRegistryWarnThreshold = lockRegistryWarnThreshold;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isReplicatedClustered() {
        return replicatedClustered;
    }

    public void setReplicatedClustered(boolean replicatedClustered) {
        this.replicatedClustered = replicatedClustered;
    }
}
