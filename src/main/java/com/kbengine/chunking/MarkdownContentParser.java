package com.kbengine.chunking;

import com.kbengine.model.ContentFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class MarkdownContentParser implements ContentParser {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*\\s*$");

    @Override
    public ContentFormat format() {
        return ContentFormat.MARKDOWN;
    }

    @Override
    public List<Section> parse(String content) {
        String body = FrontMatter.strip(content);
        List<Section> sections = new ArrayList<>();
        String[] headings = new String[6];
        StringBuilder current = new StringBuilder();
        List<String> currentPath = List.of();
        boolean inFence = false;

        for (String line : body.split("\\r?\\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                inFence = !inFence;
            }

            Matcher heading = inFence ? null : HEADING.matcher(line);
            if (heading != null && heading.matches()) {
                flush(sections, currentPath, current);
                int level = heading.group(1).length();
                headings[level - 1] = heading.group(2).trim();
                for (int i = level; i < headings.length; i++) {
                    headings[i] = null;
                }
                currentPath = path(headings, level);
                continue;
            }
            current.append(line).append('\n');
        }
        flush(sections, currentPath, current);
        return sections;
    }

    private static List<String> path(String[] headings, int level) {
        List<String> path = new ArrayList<>();
        for (int i = 0; i < level; i++) {
            if (headings[i] != null) {
                path.add(headings[i]);
            }
        }
        return path;
    }

    private static void flush(List<Section> sections, List<String> path, StringBuilder buffer) {
        String text = buffer.toString().strip();
        buffer.setLength(0);
        if (!text.isEmpty()) {
            sections.add(new Section(path, text));
        }
    }
}
