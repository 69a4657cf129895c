package com.work.archive.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.rpc.JsonRpcChainClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.http.HttpService;

/**
 * Substrate JSON-RPC 装配：
 * 当 archive.chain.mode=rpc 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "archive.chain", name = "mode", havingValue = "rpc")
public class RpcChainConfiguration {

    @Bean
    public HttpService chainHttpService(ArchiveProperties properties) {
        return new HttpService(properties.getChain().getRpcUrl());
    }

    @Bean
    public ChainClient jsonRpcChainClient(HttpService chainHttpService, ObjectMapper objectMapper) {
        return new JsonRpcChainClient(chainHttpService, objectMapper);
    }
}
