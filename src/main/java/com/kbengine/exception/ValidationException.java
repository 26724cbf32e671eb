package com.kbengine.exception;

public class ValidationException extends KbEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
