package com.sifinder.service;

public record OperationFailedEvent(String slot, long generation, FailureKind kind, String message)
        implements WorkerEvent {

    public enum FailureKind {
        DECODE,
        NOT_FOUND,
        BUSY,
        STORE,
        IO,
        INVALID_REQUEST,
        UNEXPECTED
    }

    public boolean recoverable() {
        return kind == FailureKind.DECODE || kind == FailureKind.INVALID_REQUEST || kind == FailureKind.BUSY;
    }
}
