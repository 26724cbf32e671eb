package com.kbengine.chunking;

import com.kbengine.model.ContentFormat;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class PlainTextContentParser implements ContentParser {

    @Override
    public ContentFormat format() {
        return ContentFormat.PLAINTEXT;
    }

    @Override
    public List<Section> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String paragraphs = Arrays.stream(content.split("\\r?\\n\\s*\\r?\\n"))
            .map(String::strip)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.joining("\n\n"));
        return List.of(new Section(List.of(), paragraphs));
    }
}
