package com.work.archive.core.codec;

import com.work.archive.core.exception.DecodeException;

/**
 * 外部 codec 端口：原始区块字节 + schema 版本 -> 结构化 extrinsics/events。
 *
 * 实现应当是无状态、线程安全的；解码池会并发调用。
 */
public interface BlockCodec {

    /**
     * @param body        区块 body 原始字节
     * @param specVersion 该高度生效的 schema 版本
     * @param metadata    该版本对应的 metadata blob（可能为 null，取决于 codec 是否需要）
     */
    DecodedBody decode(byte[] body, int specVersion, byte[] metadata) throws DecodeException;
}
