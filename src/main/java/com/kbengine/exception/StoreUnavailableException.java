package com.kbengine.exception;

import lombok.Getter;

@Getter
public class StoreUnavailableException extends KbEngineException {
    private final String store;

    public StoreUnavailableException(String store, Throwable cause) {
        super("Store unavailable: " + store + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.store = store;
    }
}
