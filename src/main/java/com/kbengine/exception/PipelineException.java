package com.kbengine.exception;

import lombok.Getter;

@Getter
public class PipelineException extends KbEngineException {
    private final String documentId;

    public PipelineException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }
}
