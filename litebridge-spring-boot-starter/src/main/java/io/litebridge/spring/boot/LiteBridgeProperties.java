package io.litebridge.spring.boot;

import io.litebridge.JournalMode;
import io.litebridge.OpenFlag;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the litebridge connection pool.
 *
 * @see LiteBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "litebridge")
public class LiteBridgeProperties {

    /**
     * Whether to create the pool bean.
     */
    private boolean enabled = true;

    /**
     * Database file. Unset means one in-memory database per connection.
     */
    private String path;

    /**
     * Journal mode applied to every connection after it opens.
     */
    private JournalMode journalMode;

    /**
     * SQLite open flags. Empty keeps the driver default (read/write, create).
     */
    private List<OpenFlag> flags = new ArrayList<>();

    /**
     * Statements executed in order on every connection after it opens.
     */
    private List<String> pragmas = new ArrayList<>();

    /**
     * Number of connections: one writer plus readers. Unset means the number of processors.
     */
    private Integer poolSize;

    /**
     * How long close waits for queued jobs. Unset means no limit.
     */
    private Duration drainTimeout;

    /**
     * Prefix of connection thread names.
     */
    private String threadNamePrefix = "litebridge-";

    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public JournalMode getJournalMode() {
        return journalMode;
    }

    public void setJournalMode(JournalMode journalMode) {
        this.journalMode = journalMode;
    }

    public List<OpenFlag> getFlags() {
        return flags;
    }

    public void setFlags(List<OpenFlag> flags) {
        this.flags = flags;
    }

    public List<String> getPragmas() {
        return pragmas;
    }

    public void setPragmas(List<String> pragmas) {
        this.pragmas = pragmas;
    }

    public Integer getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(Integer poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        /**
         * Whether to export metrics through Micrometer.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "litebridge";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
