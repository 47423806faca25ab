package com.gdin.explorer.network.exception;

/**
 * 必需的数据源（实体目录、articles.json、index.json）无法读取。整个构建中止，不写任何输出。
 */
public class MissingSourceException extends RuntimeException {

    private final String source;

    public MissingSourceException(String source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public MissingSourceException(String source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
