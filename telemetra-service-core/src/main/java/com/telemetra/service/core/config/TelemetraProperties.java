package com.telemetra.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "telemetra")
public class TelemetraProperties {
    private Ingest ingest = new Ingest();
    private Jobs jobs = new Jobs();
    private Query query = new Query();

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public static class Ingest {
        private int batchSize = 500;
        private int maxBatchAttempts = 3;
        /** Uploads larger than this many bytes are queued as background jobs. */
        private long asyncThresholdBytes = 1024L * 1024L;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatchAttempts() {
            return maxBatchAttempts;
        }

        public void setMaxBatchAttempts(int maxBatchAttempts) {
            this.maxBatchAttempts = maxBatchAttempts;
        }

        public long getAsyncThresholdBytes() {
            return asyncThresholdBytes;
        }

        public void setAsyncThresholdBytes(long asyncThresholdBytes) {
            this.asyncThresholdBytes = asyncThresholdBytes;
        }
    }

    public static class Jobs {
        private int workers = 4;
        private int queueCapacity = 1000;
        private int sweepBatchSize = 100;
        private String spoolDir = System.getProperty("java.io.tmpdir") + "/telemetra-spool";

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getSweepBatchSize() {
            return sweepBatchSize;
        }

        public void setSweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = sweepBatchSize;
        }

        public String getSpoolDir() {
            return spoolDir;
        }

        public void setSpoolDir(String spoolDir) {
            this.spoolDir = spoolDir;
        }
    }

    public static class Query {
        private int defaultLimit = 1000;
        private int maxLimit = 10000;
        private int timeoutSeconds = 30;
        private String tenantColumn = "organization_id";

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getTenantColumn() {
            return tenantColumn;
        }

        public void setTenantColumn(String tenantColumn) {
            this.tenantColumn = tenantColumn;
        }
    }
}
