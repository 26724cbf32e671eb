package com.kbengine.exception;

public class ConfigurationException extends KbEngineException {

    public ConfigurationException(String message) {
        super(message);
    }
}
