package com.work.archive.core.codec;

/**
 * 解码后的 extrinsic。args 为 JSON 文本，写库时 CAST 为 jsonb。
 */
public class DecodedExtrinsic {

    private final int index;
    private final String module;
    private final String callName;
    private final byte[] signature;
    private final String argsJson;

    public DecodedExtrinsic(int index, String module, String callName, byte[] signature, String argsJson) {
        this.index = index;
        this.module = module;
        this.callName = callName;
        this.signature = signature;
        this.argsJson = argsJson;
    }

    public int getIndex() {
        return index;
    }

    public String getModule() {
        return module;
    }

    public String getCallName() {
        return callName;
    }

    public byte[] getSignature() {
        return signature;
    }

    public String getArgsJson() {
        return argsJson;
    }
}
