package com.kbengine.extraction;

/**
 * Deterministic node ids, namespaced by kind.
 */
public final class NodeIds {

    private NodeIds() {
    }

    public static String entity(String name) {
        return "entity:" + name.trim();
    }

    public static String attribute(String entity, String attribute) {
        return "concept:" + entity.trim() + "." + attribute.trim();
    }

    public static String state(String entity, String state) {
        return "concept:" + entity.trim() + "::" + state.trim();
    }

    public static String event(String name) {
        return "event:" + name.trim();
    }

    public static String document(String documentId) {
        return "doc:" + documentId;
    }
}
