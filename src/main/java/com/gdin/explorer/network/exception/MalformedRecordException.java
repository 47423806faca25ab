package com.gdin.explorer.network.exception;

/**
 * 单条实体记录未通过形状校验。调用方跳过该记录并计数，不中止构建。
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String message) {
        super(message);
    }
}
