package com.gdin.explorer.network.exception;

import lombok.Getter;

/**
 * 流水线某一步失败时由 runner 抛出，快照不会被写入。
 */
@Getter
public class NetworkBuildException extends RuntimeException {

    private final String workflow;

    public NetworkBuildException(String workflow, Throwable cause) {
        super("network build failed at workflow " + workflow + ": " + cause.getMessage(), cause);
        this.workflow = workflow;
    }
}
