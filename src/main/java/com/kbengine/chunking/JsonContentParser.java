package com.kbengine.chunking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbengine.exception.ValidationException;
import com.kbengine.model.ContentFormat;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class JsonContentParser implements ContentParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public ContentFormat format() {
        return ContentFormat.JSON;
    }

    @Override
    public List<Section> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        try {
            return StructuredContentFlattener.flatten(objectMapper.readTree(content));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON content: " + e.getOriginalMessage());
        }
    }
}
