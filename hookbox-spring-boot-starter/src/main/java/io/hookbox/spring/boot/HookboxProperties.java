package io.hookbox.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for webhook delivery.
 *
 * @see HookboxAutoConfiguration
 */
@ConfigurationProperties(prefix = "hookbox")
public class HookboxProperties {

    /**
     * Whether the relay is wired at all.
     */
    private boolean enabled = true;

    /**
     * Window in which a repeated (subscription, event, entity) triple is dropped.
     */
    private Duration dedupWindow = Duration.ofSeconds(60);

    private final Retry retry = new Retry();
    private final Http http = new Http();
    private final Queue queue = new Queue();
    private final Poller poller = new Poller();
    private final ClaimLocking claimLocking = new ClaimLocking();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public void setDedupWindow(Duration dedupWindow) {
        this.dedupWindow = dedupWindow;
    }

    public Retry getRetry() {
        return retry;
    }

    public Http getHttp() {
        return http;
    }

    public Queue getQueue() {
        return queue;
    }

    public Poller getPoller() {
        return poller;
    }

    public ClaimLocking getClaimLocking() {
        return claimLocking;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        /**
         * Delay before each retry; the last entry repeats once the list runs out.
         */
        private List<Duration> schedule = new ArrayList<>(List.of(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(8), Duration.ofSeconds(16)));

        public List<Duration> getSchedule() {
            return schedule;
        }

        public void setSchedule(List<Duration> schedule) {
            this.schedule = schedule;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Queue {
        private int workerCount = 4;
        private int capacity = 1000;
        private Duration drainTimeout = Duration.ofSeconds(5);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Poller {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private int batchSize = 50;
        private Duration skipRecent = Duration.ofSeconds(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getSkipRecent() {
            return skipRecent;
        }

        public void setSkipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
        }
    }

    public static class ClaimLocking {
        private boolean enabled = false;
        private String ownerId = "";
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "hookbox";

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
