package com.kbengine.exception;

public class EmbeddingException extends KbEngineException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
