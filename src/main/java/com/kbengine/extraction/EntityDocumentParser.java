package com.kbengine.extraction;

import com.kbengine.chunking.FrontMatter;
import com.kbengine.chunking.MarkdownContentParser;
import com.kbengine.chunking.Section;
import com.kbengine.model.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an entity definition written in markdown: description, attribute and relation tables,
 * lifecycle states and emitted or consumed events. Links to other entities use {@code [[Target]]}.
 */
@Component
@RequiredArgsConstructor
public class EntityDocumentParser {

    static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\]|#]+)(?:#[^\\]|]*)?(?:\\|[^\\]]*)?\\]\\]");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(.+)$");
    private static final Pattern INITIAL_MARKER = Pattern.compile("(?i)\\((initial|inicial)\\)|\\b(initial|inicial)\\b");
    private static final Pattern FINAL_MARKER = Pattern.compile("(?i)\\((final|terminal)\\)|\\b(final|terminal)\\b");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");

    private static final Set<String> ATTRIBUTE_HEADINGS = Set.of("attributes", "atributos", "fields", "campos");
    private static final Set<String> RELATION_HEADINGS = Set.of("relations", "relationships", "relaciones");
    private static final Set<String> STATE_HEADINGS = Set.of("states", "estados", "lifecycle", "ciclo de vida", "state machine");
    private static final Set<String> EVENT_HEADINGS = Set.of("events", "eventos", "domain events", "eventos de dominio");
    private static final Set<String> EMIT_HEADINGS = Set.of("emits", "emitted", "produces", "publishes", "emite", "emitidos", "publica");
    private static final Set<String> CONSUME_HEADINGS = Set.of("consumes", "consumed", "listens", "consume", "consumidos", "escucha");
    private static final Set<String> DESCRIPTION_HEADINGS = Set.of("description", "descripción", "descripcion", "overview");

    private static final int MAX_DESCRIPTION = 500;

    private final MarkdownContentParser markdownParser;

    public ParsedEntity parse(Document document) {
        FrontMatter frontMatter = FrontMatter.parse(document.content());
        List<Section> sections = markdownParser.parse(document.content());

        String name = firstNonBlank(
            frontMatter.string("entity"),
            frontMatter.string("name"),
            frontMatter.string("title"),
            topHeading(sections),
            document.title()
        );

        List<ParsedEntity.Attribute> attributes = new ArrayList<>();
        List<ParsedEntity.Relation> relations = new ArrayList<>();
        List<ParsedEntity.State> states = new ArrayList<>();
        Set<String> emitted = new LinkedHashSet<>();
        Set<String> consumed = new LinkedHashSet<>();
        String description = null;

        for (Section section : sections) {
            String heading = normalize(section.heading());
            List<String> path = section.headingPath().stream().map(EntityDocumentParser::normalize).toList();

            if (ATTRIBUTE_HEADINGS.contains(heading)) {
                attributes.addAll(parseAttributes(section.content()));
            } else if (RELATION_HEADINGS.contains(heading)) {
                relations.addAll(parseRelations(section.content()));
            } else if (STATE_HEADINGS.contains(heading)) {
                states.addAll(parseStates(section.content()));
            } else if (EMIT_HEADINGS.contains(heading) && containsAny(path, EVENT_HEADINGS)) {
                emitted.addAll(listNames(section.content()));
            } else if (CONSUME_HEADINGS.contains(heading) && containsAny(path, EVENT_HEADINGS)) {
                consumed.addAll(listNames(section.content()));
            } else if (EVENT_HEADINGS.contains(heading)) {
                splitEventList(section.content(), emitted, consumed);
            } else if (description == null && (section.headingPath().size() <= 1 || DESCRIPTION_HEADINGS.contains(heading))) {
                description = firstParagraph(section.content());
            }
        }

        return new ParsedEntity(
            name,
            truncate(description),
            frontMatter.strings("aliases"),
            firstNonBlank(frontMatter.string("code_class"), frontMatter.string("class"), nested(frontMatter, "code", "class")),
            firstNonBlank(frontMatter.string("code_table"), frontMatter.string("table"), nested(frontMatter, "code", "table")),
            attributes,
            relations,
            states,
            List.copyOf(emitted),
            List.copyOf(consumed)
        );
    }

    private List<ParsedEntity.Attribute> parseAttributes(String content) {
        List<ParsedEntity.Attribute> attributes = new ArrayList<>();
        Table table = Table.parse(content);
        if (table == null) {
            return attributes;
        }
        int nameCol = table.column("attribute", "atributo", "name", "nombre", "field", "campo");
        int codeCol = table.column("code", "código", "codigo");
        int typeCol = table.column("type", "tipo");
        int descCol = table.column("description", "descripción", "descripcion");

        for (List<String> row : table.rows()) {
            String name = clean(cell(row, nameCol >= 0 ? nameCol : 0));
            if (name.isEmpty()) {
                continue;
            }
            String type = cell(row, typeCol);
            String reference = wikiTarget(type);
            if (reference == null) {
                reference = wikiTarget(String.join(" ", row));
            }
            attributes.add(new ParsedEntity.Attribute(
                name,
                emptyToNull(clean(cell(row, codeCol))),
                emptyToNull(clean(stripLinks(type))),
                emptyToNull(stripLinks(cell(row, descCol)).trim()),
                reference
            ));
        }
        return attributes;
    }

    private List<ParsedEntity.Relation> parseRelations(String content) {
        List<ParsedEntity.Relation> relations = new ArrayList<>();
        Table table = Table.parse(content);
        if (table != null) {
            int nameCol = table.column("relation", "relación", "relacion", "name", "nombre");
            int codeCol = table.column("code", "código", "codigo");
            int cardinalityCol = table.column("cardinality", "cardinalidad");
            int targetCol = table.column("target", "entity", "entidad", "destino");
            int descCol = table.column("description", "descripción", "descripcion");

            for (List<String> row : table.rows()) {
                String target = wikiTarget(cell(row, targetCol));
                if (target == null) {
                    target = wikiTarget(String.join(" ", row));
                }
                if (target == null && targetCol >= 0) {
                    target = emptyToNull(clean(cell(row, targetCol)));
                }
                if (target == null) {
                    continue;
                }
                String name = emptyToNull(clean(stripLinks(cell(row, nameCol))));
                relations.add(new ParsedEntity.Relation(
                    name != null ? name : target,
                    emptyToNull(clean(cell(row, codeCol))),
                    emptyToNull(clean(cell(row, cardinalityCol))),
                    target,
                    emptyToNull(stripLinks(cell(row, descCol)).trim())
                ));
            }
            return relations;
        }

        for (String item : listItems(content)) {
            String target = wikiTarget(item);
            if (target != null) {
                String rest = stripLinks(item);
                int colon = rest.indexOf(':');
                relations.add(new ParsedEntity.Relation(
                    target, null, null, target, colon >= 0 ? emptyToNull(rest.substring(colon + 1).trim()) : null));
            }
        }
        return relations;
    }

    private List<ParsedEntity.State> parseStates(String content) {
        List<ParsedEntity.State> states = new ArrayList<>();
        Table table = Table.parse(content);
        if (table != null) {
            int nameCol = table.column("state", "estado", "name", "nombre");
            int descCol = table.column("description", "descripción", "descripcion");
            for (List<String> row : table.rows()) {
                String raw = cell(row, nameCol >= 0 ? nameCol : 0);
                String name = clean(PARENTHETICAL.matcher(stripLinks(raw)).replaceAll(""));
                if (!name.isEmpty()) {
                    String all = String.join(" ", row);
                    states.add(new ParsedEntity.State(name, emptyToNull(cell(row, descCol).trim()),
                        INITIAL_MARKER.matcher(all).find(), FINAL_MARKER.matcher(all).find()));
                }
            }
            return states;
        }

        for (String item : listItems(content)) {
            String text = stripLinks(item);
            int colon = text.indexOf(':');
            String head = colon >= 0 ? text.substring(0, colon) : text;
            String name = clean(PARENTHETICAL.matcher(head).replaceAll(""));
            if (name.isEmpty()) {
                continue;
            }
            states.add(new ParsedEntity.State(
                name,
                colon >= 0 ? emptyToNull(text.substring(colon + 1).trim()) : null,
                INITIAL_MARKER.matcher(head).find(),
                FINAL_MARKER.matcher(head).find()
            ));
        }
        return states;
    }

    private void splitEventList(String content, Set<String> emitted, Set<String> consumed) {
        for (String item : listItems(content)) {
            String name = itemName(item);
            if (name.isEmpty()) {
                continue;
            }
            String lower = item.toLowerCase(Locale.ROOT);
            if (lower.contains("consum") || lower.contains("escucha") || lower.contains("listens")) {
                consumed.add(name);
            } else {
                emitted.add(name);
            }
        }
    }

    private List<String> listNames(String content) {
        List<String> names = new ArrayList<>();
        for (String item : listItems(content)) {
            String name = itemName(item);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        Table table = Table.parse(content);
        if (names.isEmpty() && table != null) {
            int nameCol = table.column("event", "evento", "name", "nombre");
            for (List<String> row : table.rows()) {
                String name = itemName(cell(row, nameCol >= 0 ? nameCol : 0));
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static String itemName(String item) {
        String link = wikiTarget(item);
        if (link != null) {
            return link;
        }
        String text = item;
        int colon = text.indexOf(':');
        if (colon >= 0) {
            text = text.substring(0, colon);
        }
        int dash = text.indexOf(" - ");
        if (dash >= 0) {
            text = text.substring(0, dash);
        }
        return clean(text);
    }

    private static List<String> listItems(String content) {
        List<String> items = new ArrayList<>();
        for (String line : content.split("\\r?\\n")) {
            Matcher matcher = LIST_ITEM.matcher(line);
            if (matcher.matches()) {
                items.add(matcher.group(1).trim());
            }
        }
        return items;
    }

    static String wikiTarget(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = WIKI_LINK.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private static String stripLinks(String text) {
        if (text == null) {
            return "";
        }
        return WIKI_LINK.matcher(text).replaceAll(match -> Matcher.quoteReplacement(match.group(1).trim()));
    }

    private static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("`", "").replace("**", "").replace("__", "").trim();
    }

    private static String firstParagraph(String content) {
        for (String paragraph : content.split("\\r?\\n\\s*\\r?\\n")) {
            String trimmed = paragraph.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("|") && !trimmed.startsWith("```")) {
                return stripLinks(trimmed).replaceAll("\\s+", " ");
            }
        }
        return null;
    }

    private static String topHeading(List<Section> sections) {
        for (Section section : sections) {
            if (!section.headingPath().isEmpty()) {
                return clean(section.headingPath().get(0));
            }
        }
        return null;
    }

    private static String nested(FrontMatter frontMatter, String parent, String key) {
        Object value = frontMatter.attributes().get(parent);
        if (value instanceof Map<?, ?> map && map.get(key) != null) {
            return map.get(key).toString();
        }
        return null;
    }

    private static String normalize(String heading) {
        return heading == null ? "" : clean(heading).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(List<String> path, Set<String> headings) {
        return path.stream().anyMatch(headings::contains);
    }

    private static String cell(List<String> row, int column) {
        return column >= 0 && column < row.size() ? row.get(column) : "";
    }

    private static String emptyToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_DESCRIPTION) {
            return text;
        }
        return text.substring(0, MAX_DESCRIPTION);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * First pipe table in a block of markdown. Pipes inside wiki links do not split cells.
     */
    record Table(List<String> header, List<List<String>> rows) {

        private static final char PROTECTED_PIPE = '\u0000';

        static Table parse(String content) {
            List<List<String>> lines = new ArrayList<>();
            boolean started = false;
            for (String line : content.split("\\r?\\n")) {
                String trimmed = line.trim();
                if (trimmed.startsWith("|")) {
                    started = true;
                    List<String> cells = split(trimmed);
                    if (!isSeparator(cells)) {
                        lines.add(cells);
                    }
                } else if (started) {
                    break;
                }
            }
            if (lines.isEmpty()) {
                return null;
            }
            List<String> header = lines.get(0).stream().map(h -> clean(h).toLowerCase(Locale.ROOT)).toList();
            return new Table(header, lines.subList(1, lines.size()));
        }

        int column(String... names) {
            for (String name : names) {
                int index = header.indexOf(name);
                if (index >= 0) {
                    return index;
                }
            }
            return -1;
        }

        private static List<String> split(String line) {
            Matcher links = WIKI_LINK.matcher(line);
            StringBuilder protectedLine = new StringBuilder();
            while (links.find()) {
                links.appendReplacement(protectedLine,
                    Matcher.quoteReplacement(links.group().replace('|', PROTECTED_PIPE)));
            }
            links.appendTail(protectedLine);

            String body = protectedLine.toString();
            if (body.startsWith("|")) {
                body = body.substring(1);
            }
            if (body.endsWith("|")) {
                body = body.substring(0, body.length() - 1);
            }
            List<String> cells = new ArrayList<>();
            for (String cell : body.split("\\|", -1)) {
                cells.add(cell.replace(PROTECTED_PIPE, '|').trim());
            }
            return cells;
        }

        private static boolean isSeparator(List<String> cells) {
            return cells.stream().allMatch(c -> c.matches(":?-{2,}:?"));
        }
    }
}
