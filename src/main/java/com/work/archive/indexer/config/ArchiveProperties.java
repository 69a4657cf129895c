package com.work.archive.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 归档流水线配置（启动时绑定一次，之后只读）。
 *
 * 以 bean 名 archiveProperties 注册，供 @Scheduled 的 SpEL 表达式引用。
 */
@Component("archiveProperties")
@ConfigurationProperties(prefix = "archive")
@Validated
public class ArchiveProperties {

    /**
     * 解码 worker 数（并发取块 + 解码）。
     */
    @Min(1)
    private int decodeWorkers = 8;

    /**
     * storage 恢复 worker 数（并发重放区块）。
     */
    @Min(1)
    private int recoveryWorkers = 4;

    /**
     * 写入 worker 数（按高度分片）。必须小于连接池大小。
     */
    @Min(1)
    private int writerWorkers = 2;

    /**
     * 写入单批最大 op 数，同时也是单条多行 INSERT 的行数上限。
     */
    @Min(1)
    private int batchSize = 1000;

    /**
     * 单条语句允许的绑定参数上限（pgjdbc 上限 32767）。
     */
    @Min(1)
    @Max(32767)
    private int maxParamsPerStatement = 32767;

    /**
     * 单轮调度最多处理的缺口高度数。
     */
    @Min(1)
    private int maxBlockLoad = 100_000;

    /**
     * 单个解码/恢复任务的超时。
     */
    @NotNull
    private Duration taskTimeout = Duration.ofSeconds(20);

    /**
     * 主调度周期（读链头 + 扫描缺口）。
     */
    @NotNull
    private Duration scanInterval = Duration.ofSeconds(2);

    /**
     * 恢复队列轮询周期。
     */
    @NotNull
    private Duration recoveryScanInterval = Duration.ofSeconds(1);

    /**
     * 只回填链头以下多少个块；0 表示回填全部历史。
     */
    @Min(0)
    private long backfillDepth = 0;

    /**
     * 起始高度（低于该高度的块不索引）。
     */
    @Min(0)
    private long startHeight = 0;

    /**
     * 缺口扫描时单次查询覆盖的高度窗口。
     */
    @Min(1)
    private int scanWindow = 10_000;

    /**
     * 取块最大尝试次数（含首次）。
     */
    @Min(1)
    private int fetchMaxAttempts = 3;

    /**
     * 恢复任务最大尝试次数，达到后进入永久 FAILED。
     */
    @Min(1)
    private int recoveryMaxAttempts = 5;

    /**
     * 退避基数：base * 2^(attempt-1)。
     */
    @NotNull
    private Duration backoffBase = Duration.ofSeconds(2);

    /**
     * 退避上限。
     */
    @NotNull
    private Duration backoffMax = Duration.ofMinutes(5);

    /**
     * 是否索引 storage（关闭后不再入队恢复任务）。
     */
    private boolean storageIndexing = true;

    @Valid
    private Notify notify = new Notify();

    @Valid
    private Chain chain = new Chain();

    @Valid
    private Cleanup cleanup = new Cleanup();

    public static class Notify {

        /**
         * pg / redis / none
         */
        @NotBlank
        private String transport = "pg";

        @NotBlank
        private String channel = "archive_changes";

        public String getTransport() {
            return transport;
        }

        public void setTransport(String transport) {
            this.transport = transport;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }
    }

    public static class Chain {

        /**
         * mock 或 rpc
         */
        @NotBlank
        private String mode = "mock";

        /**
         * Substrate 节点 HTTP RPC 地址。
         */
        private String rpcUrl = "http://localhost:9933";

        /**
         * mock 模式：每多少个块升级一次 runtime。
         */
        @Min(1)
        private long mockUpgradeEvery = 1000;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public long getMockUpgradeEvery() {
            return mockUpgradeEvery;
        }

        public void setMockUpgradeEvery(long mockUpgradeEvery) {
            this.mockUpgradeEvery = mockUpgradeEvery;
        }
    }

    public static class Cleanup {

        private boolean enabled = false;

        /**
         * DONE 任务保留时长。
         */
        @NotNull
        private Duration retention = Duration.ofDays(7);

        @NotNull
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public int getDecodeWorkers() {
        return decodeWorkers;
    }

    public void setDecodeWorkers(int decodeWorkers) {
        this.decodeWorkers = decodeWorkers;
    }

    public int getRecoveryWorkers() {
        return recoveryWorkers;
    }

    public void setRecoveryWorkers(int recoveryWorkers) {
        this.recoveryWorkers = recoveryWorkers;
    }

    public int getWriterWorkers() {
        return writerWorkers;
    }

    public void setWriterWorkers(int writerWorkers) {
        this.writerWorkers = writerWorkers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxParamsPerStatement() {
        return maxParamsPerStatement;
    }

    public void setMaxParamsPerStatement(int maxParamsPerStatement) {
        this.maxParamsPerStatement = maxParamsPerStatement;
    }

    public int getMaxBlockLoad() {
        return maxBlockLoad;
    }

    public void setMaxBlockLoad(int maxBlockLoad) {
        this.maxBlockLoad = maxBlockLoad;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public Duration getScanInterval() {
        return scanInterval;
    }

    public void setScanInterval(Duration scanInterval) {
        this.scanInterval = scanInterval;
    }

    public Duration getRecoveryScanInterval() {
        return recoveryScanInterval;
    }

    public void setRecoveryScanInterval(Duration recoveryScanInterval) {
        this.recoveryScanInterval = recoveryScanInterval;
    }

    public long getBackfillDepth() {
        return backfillDepth;
    }

    public void setBackfillDepth(long backfillDepth) {
        this.backfillDepth = backfillDepth;
    }

    public long getStartHeight() {
        return startHeight;
    }

    public void setStartHeight(long startHeight) {
        this.startHeight = startHeight;
    }

    public int getScanWindow() {
        return scanWindow;
    }

    public void setScanWindow(int scanWindow) {
        this.scanWindow = scanWindow;
    }

    public int getFetchMaxAttempts() {
        return fetchMaxAttempts;
    }

    public void setFetchMaxAttempts(int fetchMaxAttempts) {
        this.fetchMaxAttempts = fetchMaxAttempts;
    }

    public int getRecoveryMaxAttempts() {
        return recoveryMaxAttempts;
    }

    public void setRecoveryMaxAttempts(int recoveryMaxAttempts) {
        this.recoveryMaxAttempts = recoveryMaxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }

    public boolean isStorageIndexing() {
        return storageIndexing;
    }

    public void setStorageIndexing(boolean storageIndexing) {
        this.storageIndexing = storageIndexing;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public Chain getChain() {
        return chain;
    }

    public void setChain(Chain chain) {
        this.chain = chain;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }
}
