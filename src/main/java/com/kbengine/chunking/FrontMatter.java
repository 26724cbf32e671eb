package com.kbengine.chunking;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML front matter delimited by {@code ---} lines at the very top of a document.
 */
@Slf4j
public record FrontMatter(Map<String, Object> attributes, String body) {

    private static final Pattern BLOCK = Pattern.compile("\\A---\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)", Pattern.DOTALL);

    public static FrontMatter parse(String content) {
        if (content == null) {
            return new FrontMatter(Map.of(), "");
        }
        Matcher matcher = BLOCK.matcher(content);
        if (!matcher.find()) {
            return new FrontMatter(Map.of(), content);
        }

        String body = content.substring(matcher.end());
        try {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(matcher.group(1));
            if (loaded instanceof Map<?, ?> map) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                map.forEach((key, value) -> attributes.put(String.valueOf(key), value));
                return new FrontMatter(attributes, body);
            }
        } catch (YAMLException e) {
            log.debug("Ignoring malformed front matter: {}", e.getMessage());
        }
        return new FrontMatter(Map.of(), body);
    }

    public static String strip(String content) {
        return parse(content).body();
    }

    public String string(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString().trim();
    }

    public List<String> strings(String key) {
        Object value = attributes.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(Object::toString).map(String::trim).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        return List.of();
    }
}
