package com.kbengine.chunking;

import com.kbengine.model.ContentFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * reStructuredText sections. Heading levels follow the order in which adornment styles first appear.
 */
@Component
public class RstContentParser implements ContentParser {

    private static final String ADORNMENT_CHARS = "=-`:'\"~^_*+#<>.";

    @Override
    public ContentFormat format() {
        return ContentFormat.RST;
    }

    @Override
    public List<Section> parse(String content) {
        String[] lines = (content == null ? "" : content).split("\\r?\\n", -1);
        List<String> styles = new ArrayList<>();
        List<String> headingStack = new ArrayList<>();
        List<Section> sections = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            boolean overline = isAdornment(line) && i + 2 < lines.length
                && isAdornment(lines[i + 2]) && !lines[i + 1].isBlank()
                && lines[i + 2].trim().charAt(0) == line.trim().charAt(0);

            String title = null;
            String style = null;
            int consumed = 0;
            if (overline) {
                title = lines[i + 1].trim();
                style = "over" + line.trim().charAt(0);
                consumed = 3;
            } else if (!line.isBlank() && i + 1 < lines.length && isAdornment(lines[i + 1])
                && lines[i + 1].trim().length() >= line.trim().length()) {
                title = line.trim();
                style = String.valueOf(lines[i + 1].trim().charAt(0));
                consumed = 2;
            }

            if (title != null) {
                flush(sections, headingStack, current);
                int level = styles.indexOf(style);
                if (level < 0) {
                    styles.add(style);
                    level = styles.size() - 1;
                }
                while (headingStack.size() > level) {
                    headingStack.remove(headingStack.size() - 1);
                }
                headingStack.add(title);
                i += consumed;
                continue;
            }

            current.append(line).append('\n');
            i++;
        }
        flush(sections, headingStack, current);
        return sections;
    }

    private static boolean isAdornment(String line) {
        String trimmed = line.trim();
        if (trimmed.length() < 3) {
            return false;
        }
        char first = trimmed.charAt(0);
        if (ADORNMENT_CHARS.indexOf(first) < 0) {
            return false;
        }
        for (int i = 1; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) != first) {
                return false;
            }
        }
        return true;
    }

    private static void flush(List<Section> sections, List<String> headings, StringBuilder buffer) {
        String text = buffer.toString().strip();
        buffer.setLength(0);
        if (!text.isEmpty()) {
            sections.add(new Section(headings, text));
        }
    }
}
