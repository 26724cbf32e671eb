package com.kbengine.indexing;

import com.kbengine.chunking.FrontMatter;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds documents from files. Markdown front matter supplies the title, domain, tags and any other metadata.
 */
@Component
public class DocumentFactory {

    public Document fromRepositoryFile(RepositoryConfig config, String relativePath, String content,
                                       String revision, String remoteUrl, UUID existingId) {
        Path absolute = Path.of(config.localPath()).resolve(relativePath).toAbsolutePath().normalize();
        return build(content, relativePath)
            .id(existingId)
            .sourcePath(absolute.toString())
            .relativePath(relativePath)
            .externalId(config.externalId(relativePath))
            .repoName(config.name())
            .gitCommit(revision)
            .gitRemoteUrl(remoteUrl)
            .build();
    }

    public Document fromFile(Path file, String content) {
        Path absolute = file.toAbsolutePath().normalize();
        return build(content, absolute.getFileName().toString())
            .sourcePath(absolute.toString())
            .externalId("file:" + absolute)
            .build();
    }

    public Document fromContent(String title, String content, ContentFormat format, String domain, List<String> tags,
                                String externalId) {
        ContentFormat effective = format == null ? ContentFormat.MARKDOWN : format;
        Document parsed = build(content, "untitled." + extensionOf(effective)).build();
        return parsed.toBuilder()
            .title(title != null && !title.isBlank() ? title : parsed.title())
            .format(effective)
            .mimeType(effective.mimeType())
            .domain(domain != null ? domain : parsed.domain())
            .tags(tags != null && !tags.isEmpty() ? tags : parsed.tags())
            .externalId(externalId)
            .build();
    }

    private Document.DocumentBuilder build(String content, String fileName) {
        ContentFormat format = ContentFormat.fromPath(fileName);
        Map<String, Object> metadata = new LinkedHashMap<>();
        String title = stem(fileName);
        String domain = null;
        List<String> tags = List.of();

        if (format == ContentFormat.MARKDOWN) {
            FrontMatter frontMatter = FrontMatter.parse(content);
            metadata.putAll(frontMatter.attributes());
            if (frontMatter.string("title") != null) {
                title = frontMatter.string("title");
            }
            domain = frontMatter.string("domain");
            tags = frontMatter.strings("tags");
        }

        return Document.builder()
            .title(title)
            .content(content)
            .format(format)
            .mimeType(format.mimeType())
            .domain(domain)
            .tags(tags)
            .metadata(metadata);
    }

    private static String stem(String fileName) {
        String name = Path.of(fileName).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extensionOf(ContentFormat format) {
        return switch (format) {
            case MARKDOWN -> "md";
            case JSON -> "json";
            case YAML -> "yaml";
            case RST -> "rst";
            case PLAINTEXT -> "txt";
        };
    }
}
