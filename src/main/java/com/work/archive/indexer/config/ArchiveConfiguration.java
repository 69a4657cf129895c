package com.work.archive.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.core.codec.BlockCodec;
import com.work.archive.core.codec.JsonBlockCodec;
import com.work.archive.core.version.VersionResolver;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.MockChainClient;
import com.work.archive.indexer.repository.mapper.NotifyMapper;
import com.work.archive.indexer.service.ExitingFatalErrorHandler;
import com.work.archive.indexer.service.FatalErrorHandler;
import com.work.archive.indexer.service.notify.ChangeNotifier;
import com.work.archive.indexer.service.notify.NoopChangeNotifier;
import com.work.archive.indexer.service.notify.PgNotifyChangeNotifier;
import com.work.archive.indexer.service.notify.RedisChangeNotifier;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import com.work.archive.indexer.support.metrics.NoopArchiveMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class ArchiveConfiguration {

    @Bean
    public VersionResolver versionResolver() {
        return new VersionResolver();
    }

    /**
     * 默认 codec 只认识 mock 链的 JSON body；接入真实链时提供自定义 BlockCodec Bean。
     */
    @Bean
    @ConditionalOnMissingBean(BlockCodec.class)
    public BlockCodec blockCodec(ObjectMapper objectMapper) {
        return new JsonBlockCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "archive.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public ChainClient mockChainClient(ArchiveProperties props) {
        return new MockChainClient(props.getStartHeight(), props.getChain().getMockUpgradeEvery());
    }

    @Bean
    @ConditionalOnProperty(prefix = "archive.notify", name = "transport", havingValue = "pg", matchIfMissing = true)
    public ChangeNotifier pgNotifyChangeNotifier(NotifyMapper notifyMapper,
                                                 ArchiveProperties props,
                                                 ObjectMapper objectMapper,
                                                 ArchiveMetrics metrics) {
        return new PgNotifyChangeNotifier(notifyMapper, props.getNotify().getChannel(), objectMapper, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "archive.notify", name = "transport", havingValue = "redis")
    public ChangeNotifier redisChangeNotifier(StringRedisTemplate redisTemplate,
                                              ArchiveProperties props,
                                              ObjectMapper objectMapper,
                                              ArchiveMetrics metrics) {
        return new RedisChangeNotifier(redisTemplate, props.getNotify().getChannel(), objectMapper, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "archive.notify", name = "transport", havingValue = "none")
    public ChangeNotifier noopChangeNotifier() {
        return new NoopChangeNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(ArchiveMetrics.class)
    public ArchiveMetrics archiveMetrics() {
        return new NoopArchiveMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(FatalErrorHandler.class)
    public FatalErrorHandler fatalErrorHandler(ConfigurableApplicationContext context) {
        return new ExitingFatalErrorHandler(context);
    }
}
