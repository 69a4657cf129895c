package com.work.archive.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.core.exception.DecodeException;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 开发/联调用 codec：body 为 JSON 文本（MockChainClient 产出的格式），与 metadata 无关。
 *
 * 格式：
 * <pre>
 * {"extrinsics":[{"module":"Timestamp","call":"set","signature":"0x..","args":{...}}],
 *  "events":[{"module":"System","event":"ExtrinsicSuccess","params":{...}}]}
 * </pre>
 * 生产环境替换为真正的二进制 codec Bean。
 */
public class JsonBlockCodec implements BlockCodec {

    private final ObjectMapper objectMapper;

    public JsonBlockCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public DecodedBody decode(byte[] body, int specVersion, byte[] metadata) {
        if (body == null || body.length == 0) {
            return new DecodedBody(null, null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new DecodeException("malformed block body for spec=" + specVersion, e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("block body is not an object, spec=" + specVersion);
        }

        List<DecodedExtrinsic> extrinsics = new ArrayList<>();
        int i = 0;
        for (JsonNode x : root.path("extrinsics")) {
            String module = requireText(x, "module");
            String call = requireText(x, "call");
            String sig = x.path("signature").asText(null);
            byte[] signature = sig == null || sig.isEmpty() ? null : Numeric.hexStringToByteArray(sig);
            extrinsics.add(new DecodedExtrinsic(i++, module, call, signature, jsonOrEmpty(x.path("args"))));
        }

        List<DecodedEvent> events = new ArrayList<>();
        int j = 0;
        for (JsonNode e : root.path("events")) {
            events.add(new DecodedEvent(j++, requireText(e, "module"), requireText(e, "event"), jsonOrEmpty(e.path("params"))));
        }
        return new DecodedBody(extrinsics, events);
    }

    private String jsonOrEmpty(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? "{}" : node.toString();
    }

    private String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isEmpty()) {
            throw new DecodeException("missing field '" + field + "'");
        }
        return v.asText();
    }
}
