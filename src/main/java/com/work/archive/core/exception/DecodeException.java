package com.work.archive.core.exception;

/**
 * codec 无法解析某个高度的区块内容。按高度跳过并记录，不会中断解码池。
 */
public class DecodeException extends ArchiveException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
