package com.kbengine.chunking;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a JSON tree into sections: scalars of an object become {@code key: value} lines of one section,
 * nested containers open a sub-section. Below {@link #MAX_DEPTH} the subtree is rendered inline.
 */
final class StructuredContentFlattener {

    static final int MAX_DEPTH = 3;

    private static final List<String> ITEM_LABEL_KEYS = List.of("name", "id", "title", "key");

    private StructuredContentFlattener() {
    }

    static List<Section> flatten(JsonNode root) {
        List<Section> sections = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return sections;
        }
        if (root.isValueNode()) {
            sections.add(new Section(List.of(), root.asText()));
            return sections;
        }
        visit(root, new ArrayList<>(), 0, sections);
        return sections;
    }

    private static void visit(JsonNode node, List<String> path, int depth, List<Section> sections) {
        StringBuilder scalars = new StringBuilder();
        List<Map.Entry<String, JsonNode>> containers = new ArrayList<>();

        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(field.getKey(), field.getValue(), depth, scalars, containers);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                JsonNode item = node.get(i);
                collect(itemLabel(item, i), item, depth, scalars, containers);
            }
        }

        if (!scalars.isEmpty()) {
            sections.add(new Section(path, scalars.toString().strip()));
        }
        for (Map.Entry<String, JsonNode> container : containers) {
            List<String> childPath = new ArrayList<>(path);
            childPath.add(container.getKey());
            visit(container.getValue(), childPath, depth + 1, sections);
        }
    }

    private static void collect(String key, JsonNode value, int depth, StringBuilder scalars,
                                List<Map.Entry<String, JsonNode>> containers) {
        if (value.isContainerNode() && depth + 1 < MAX_DEPTH && !value.isEmpty()) {
            containers.add(Map.entry(key, value));
        } else if (value.isContainerNode()) {
            scalars.append(key).append(": ").append(value.toString()).append('\n');
        } else {
            scalars.append(key).append(": ").append(value.asText()).append('\n');
        }
    }

    private static String itemLabel(JsonNode item, int index) {
        if (item.isObject()) {
            for (String key : ITEM_LABEL_KEYS) {
                JsonNode label = item.get(key);
                if (label != null && label.isValueNode() && !label.asText().isBlank()) {
                    return label.asText();
                }
            }
        }
        return "[" + index + "]";
    }
}
