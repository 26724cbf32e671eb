package com.kbengine.extraction;

import java.util.List;

public record ParsedEntity(
    String name,
    String description,
    List<String> aliases,
    String codeClass,
    String codeTable,
    List<Attribute> attributes,
    List<Relation> relations,
    List<State> states,
    List<String> eventsEmitted,
    List<String> eventsConsumed
) {

    public record Attribute(String name, String code, String type, String description, String referenceEntity) {

        public boolean isReference() {
            return referenceEntity != null && !referenceEntity.isBlank();
        }
    }

    public record Relation(String name, String code, String cardinality, String targetEntity, String description) {}

    public record State(String name, String description, boolean initial, boolean terminal) {}
}
