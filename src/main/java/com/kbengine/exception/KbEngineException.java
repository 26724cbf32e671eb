package com.kbengine.exception;

public class KbEngineException extends RuntimeException {

    public KbEngineException(String message) {
        super(message);
    }

    public KbEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
