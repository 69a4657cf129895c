package com.work.archive.indexer.service.version;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.archive.core.exception.ArchiveException;
import com.work.archive.core.exception.SchemaNotFoundException;
import com.work.archive.core.version.VersionBreakpoint;
import com.work.archive.core.version.VersionResolver;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.RawBlock;
import com.work.archive.indexer.repository.entity.MetadataEntity;
import com.work.archive.indexer.repository.mapper.MetadataMapper;
import com.work.archive.indexer.service.writer.WriteCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * 维护 VersionResolver 的断点与 metadata blob：
 *
 * - 启动时从 metadata(first_height, version) 重建断点
 * - 区块报告了比末尾断点更新的版本时，取 metadata 并先持久化，再追加断点
 * - metadata blob 按版本缓存（Caffeine）
 */
@Service
public class RuntimeVersionService {

    private static final Logger log = LoggerFactory.getLogger(RuntimeVersionService.class);

    private final VersionResolver resolver;
    private final ChainClient chain;
    private final MetadataMapper metadataMapper;
    private final WriteCoordinator writer;

    private final Cache<Integer, byte[]> metadataCache = Caffeine.newBuilder()
            .maximumSize(64)
            .build();

    public RuntimeVersionService(VersionResolver resolver,
                                 ChainClient chain,
                                 MetadataMapper metadataMapper,
                                 WriteCoordinator writer) {
        this.resolver = resolver;
        this.chain = chain;
        this.metadataMapper = metadataMapper;
        this.writer = writer;
    }

    @PostConstruct
    public void load() {
        List<MetadataEntity> rows = metadataMapper.selectBreakpoints();
        List<VersionBreakpoint> loaded = new ArrayList<>();
        if (rows != null) {
            for (MetadataEntity row : rows) {
                if (row.getFirstHeight() != null && row.getVersion() != null) {
                    loaded.add(new VersionBreakpoint(row.getFirstHeight(), row.getVersion()));
                }
            }
        }
        resolver.reload(loaded);
        log.info("version breakpoints loaded. count={} latest={}", loaded.size(), resolver.latest().orElse(null));
    }

    /**
     * 首次运行（无断点）时，以起始高度的链上版本作为第一个断点。
     */
    public void bootstrapIfEmpty(long startHeight) {
        if (resolver.latest().isPresent()) {
            return;
        }
        int version = chain.runtimeVersionAt(startHeight);
        observe(startHeight, version);
        log.info("version resolver bootstrapped. height={} version={}", startHeight, version);
    }

    /**
     * 解析区块的 spec 版本。
     *
     * 区块自带版本时以链为准（必要时登记新断点）；否则只能查断点表，查不到抛 SchemaNotFoundException。
     */
    public int versionFor(RawBlock raw) {
        long height = raw.getHeight();
        Integer reported = raw.getSpecVersion();
        if (reported == null) {
            return resolver.resolve(height);
        }
        if (!resolver.knowsVersion(reported)) {
            observe(height, reported);
            return reported;
        }
        int resolved;
        try {
            resolved = resolver.resolve(height);
        } catch (SchemaNotFoundException e) {
            return reported;
        }
        if (resolved != reported) {
            log.debug("reported version differs from breakpoints. height={} reported={} resolved={}",
                    height, reported, resolved);
        }
        return reported;
    }

    /**
     * 某版本的 metadata blob；本地没有时从链上该高度获取并持久化。
     */
    public byte[] metadata(int version, long height) {
        try {
            return metadataCache.get(version, v -> loadOrFetch(v, height));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ArchiveException("persist metadata failed version=" + version, cause);
        }
    }

    public List<VersionBreakpoint> breakpoints() {
        return resolver.snapshot();
    }

    public Optional<VersionBreakpoint> latest() {
        return resolver.latest();
    }

    private void observe(long height, int version) {
        // metadata 先落库：blocks.spec 外键依赖它
        metadata(version, height);
        if (resolver.insert(height, version)) {
            log.info("runtime upgrade observed. height={} version={}", height, version);
        }
    }

    private byte[] loadOrFetch(int version, long height) {
        MetadataEntity existing = metadataMapper.selectByVersion(version);
        if (existing != null && existing.getMeta() != null) {
            return existing.getMeta();
        }
        byte[] meta = chain.fetchMetadata(height);
        writer.submitMetadata(version, height, meta).join();
        return meta;
    }
}
