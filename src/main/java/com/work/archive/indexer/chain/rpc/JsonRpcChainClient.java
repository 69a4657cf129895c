package com.work.archive.indexer.chain.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.core.exception.BlockExecutionException;
import com.work.archive.core.exception.BlockNotFoundException;
import com.work.archive.core.exception.ChainClientException;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.RawBlock;
import com.work.archive.indexer.chain.StorageChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基于 Substrate JSON-RPC 的链客户端（传输层复用 web3j 的 HttpService）。
 *
 * - canonicalHeight: chain_getFinalizedHead + chain_getHeader，只索引已终局的块
 * - fetchBlock: chain_getBlockHash + chain_getBlock + state_getRuntimeVersion
 * - executeBlock: state_traceBlock（节点需开启 unsafe RPC）
 *
 * 说明：RPC 无法随块返回 storage，inlineStorage 恒为 null，storage 全部走恢复队列。
 * body 为 extrinsics 十六进制数组的 JSON 文本，需配合对应的 BlockCodec。
 */
public class JsonRpcChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcChainClient.class);

    private final Web3jService service;
    private final ObjectMapper objectMapper;

    public JsonRpcChainClient(Web3jService service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    @Override
    public long canonicalHeight() {
        String head = call("chain_getFinalizedHead", Collections.emptyList(), StringResponse.class);
        JsonNode header = call("chain_getHeader", Collections.singletonList(head), JsonResponse.class);
        if (header == null || !header.hasNonNull("number")) {
            throw new ChainClientException("chain_getHeader returned no number for head=" + head);
        }
        return Numeric.toBigInt(header.get("number").asText()).longValueExact();
    }

    @Override
    public RawBlock fetchBlock(long height) {
        String hash = blockHash(height);
        JsonNode signed = call("chain_getBlock", Collections.singletonList(hash), JsonResponse.class);
        if (signed == null || !signed.has("block")) {
            throw new BlockNotFoundException(height);
        }
        JsonNode header = signed.get("block").path("header");
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(signed.get("block").path("extrinsics"));
        } catch (IOException e) {
            throw new ChainClientException("serialize extrinsics failed height=" + height, e);
        }
        byte[] digest = header.has("digest")
                ? header.get("digest").toString().getBytes(StandardCharsets.UTF_8)
                : null;
        return new RawBlock(height,
                Numeric.hexStringToByteArray(hash),
                hex(header, "parentHash"),
                hex(header, "stateRoot"),
                hex(header, "extrinsicsRoot"),
                digest,
                body,
                specVersionAt(hash),
                null);
    }

    @Override
    public List<StorageChange> executeBlock(long height) {
        String hash;
        try {
            hash = blockHash(height);
        } catch (ChainClientException e) {
            throw new BlockExecutionException("resolve hash failed height=" + height, e);
        }
        JsonNode trace;
        try {
            trace = call("state_traceBlock", Arrays.asList(hash, "state", "", ""), JsonResponse.class);
        } catch (ChainClientException e) {
            throw new BlockExecutionException("state_traceBlock failed height=" + height, e);
        }
        JsonNode events = trace == null ? null : trace.path("blockTrace").path("events");
        if (events == null || !events.isArray()) {
            String err = trace == null ? "empty" : trace.path("traceError").asText("no blockTrace");
            throw new BlockExecutionException("trace unavailable height=" + height + " err=" + err);
        }
        List<StorageChange> out = new ArrayList<>();
        for (JsonNode ev : events) {
            JsonNode values = ev.path("data").path("stringValues");
            String key = values.path("key").asText(null);
            if (key == null || key.isEmpty()) {
                continue;
            }
            String value = values.path("value").asText(null);
            byte[] data = value == null || value.isEmpty() || "None".equals(value)
                    ? null
                    : Numeric.hexStringToByteArray(value);
            out.add(new StorageChange(Numeric.hexStringToByteArray(key), data));
        }
        return out;
    }

    @Override
    public int runtimeVersionAt(long height) {
        return specVersionAt(blockHash(height));
    }

    @Override
    public byte[] fetchMetadata(long height) {
        String meta = call("state_getMetadata", Collections.singletonList(blockHash(height)), StringResponse.class);
        if (meta == null) {
            throw new ChainClientException("state_getMetadata returned null height=" + height);
        }
        return Numeric.hexStringToByteArray(meta);
    }

    private String blockHash(long height) {
        String hash = call("chain_getBlockHash", Collections.singletonList(height), StringResponse.class);
        if (hash == null) {
            throw new BlockNotFoundException(height);
        }
        return hash;
    }

    private int specVersionAt(String hash) {
        JsonNode rv = call("state_getRuntimeVersion", Collections.singletonList(hash), JsonResponse.class);
        if (rv == null || !rv.hasNonNull("specVersion")) {
            throw new ChainClientException("state_getRuntimeVersion missing specVersion at hash=" + hash);
        }
        return rv.get("specVersion").asInt();
    }

    private static byte[] hex(JsonNode node, String field) {
        String v = node.path(field).asText(null);
        return v == null ? null : Numeric.hexStringToByteArray(v);
    }

    private <T, R extends Response<T>> T call(String method, List<Object> params, Class<R> type) {
        try {
            R resp = new Request<Object, R>(method, params, service, type).send();
            if (resp.hasError()) {
                throw new ChainClientException(method + " error code=" + resp.getError().getCode()
                        + " msg=" + resp.getError().getMessage());
            }
            return resp.getResult();
        } catch (IOException e) {
            log.warn("rpc call failed. method={} err={}", method, e.getMessage());
            throw new ChainClientException(method + " io failure", e);
        }
    }

    public static class StringResponse extends Response<String> {
    }

    public static class JsonResponse extends Response<JsonNode> {
    }
}
