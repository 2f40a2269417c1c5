package com.graph.dfs.worker;

public class HaloExchangeException extends RuntimeException {

    public HaloExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
