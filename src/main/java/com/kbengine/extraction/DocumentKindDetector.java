package com.kbengine.extraction;

import com.kbengine.chunking.FrontMatter;
import com.kbengine.model.Document;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides what a document describes. A declared {@code kind} in the front matter always wins;
 * otherwise headings and the file location are inspected.
 */
@Component
public class DocumentKindDetector {

    private static final Pattern ATTRIBUTE_HEADING =
        Pattern.compile("(?im)^#{2,3}\\s+(attributes|atributos|fields|campos)\\s*$");
    private static final Pattern TABLE_ROW = Pattern.compile("(?m)^\\s*\\|.+\\|\\s*$");
    private static final Pattern USE_CASE_HEADING =
        Pattern.compile("(?im)^#{2,3}\\s+(actors?|actores|main flow|flujo principal|preconditions|precondiciones)\\s*$");
    private static final Pattern RULE_HEADING =
        Pattern.compile("(?im)^#{1,3}\\s+.*\\b(rule|regla|RN-\\d+|BR-\\d+)\\b.*$");
    private static final Pattern PROCESS_HEADING =
        Pattern.compile("(?im)^#{2,3}\\s+(steps|pasos|procedure|procedimiento)\\s*$");

    public KindDetection detect(Document document) {
        FrontMatter frontMatter = FrontMatter.parse(document.content());
        String declared = frontMatter.string("kind");
        if (declared == null) {
            declared = document.kind();
        }
        if (declared != null) {
            DocumentKind kind = DocumentKind.fromValue(declared);
            if (kind != DocumentKind.UNKNOWN) {
                return new KindDetection(kind, 1.0, "front-matter");
            }
        }

        String body = frontMatter.body();
        if (ATTRIBUTE_HEADING.matcher(body).find() && TABLE_ROW.matcher(body).find()) {
            return new KindDetection(DocumentKind.ENTITY, 0.8, "content");
        }
        if (USE_CASE_HEADING.matcher(body).find()) {
            return new KindDetection(DocumentKind.USE_CASE, 0.7, "content");
        }
        if (RULE_HEADING.matcher(body).find()) {
            return new KindDetection(DocumentKind.BUSINESS_RULE, 0.6, "content");
        }
        if (PROCESS_HEADING.matcher(body).find()) {
            return new KindDetection(DocumentKind.PROCESS, 0.5, "content");
        }

        String path = document.displayPath().toLowerCase(Locale.ROOT);
        if (path.contains("/entities/") || path.contains("/entidades/")) {
            return new KindDetection(DocumentKind.ENTITY, 0.6, "path");
        }
        return KindDetection.unknown();
    }
}
