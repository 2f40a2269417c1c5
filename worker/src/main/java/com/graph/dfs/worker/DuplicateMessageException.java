package com.graph.dfs.worker;

public class DuplicateMessageException extends IllegalStateException {

    public DuplicateMessageException(String message) {
        super(message);
    }
}
