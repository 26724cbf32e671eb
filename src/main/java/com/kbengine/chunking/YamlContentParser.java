package com.kbengine.chunking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbengine.exception.ValidationException;
import com.kbengine.model.ContentFormat;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.List;

@Component
public class YamlContentParser implements ContentParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public ContentFormat format() {
        return ContentFormat.YAML;
    }

    @Override
    public List<Section> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        try {
            Object tree = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
            return StructuredContentFlattener.flatten(objectMapper.valueToTree(tree));
        } catch (YAMLException | IllegalArgumentException e) {
            throw new ValidationException("Invalid YAML content: " + e.getMessage());
        }
    }
}
