package com.kbengine.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends KbEngineException {
    private final String entityId;

    public EntityNotFoundException(String kind, Object entityId) {
        super(kind + " not found: " + entityId);
        this.entityId = String.valueOf(entityId);
    }
}
