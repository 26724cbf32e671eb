package com.kbengine.retrieval;

import com.kbengine.config.UrlProperties;
import com.kbengine.model.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Builds the link a reader follows to a document: a repository URL template when one is configured for the
 * document's repository, then the local file, then an internal {@code doc://} link.
 */
@Component
@RequiredArgsConstructor
public class UrlResolver {

    private final UrlProperties urlProperties;

    public String resolve(Document document, String anchor) {
        String base = base(document);
        return anchor == null || anchor.isBlank() ? base : base + "#" + anchor;
    }

    private String base(Document document) {
        String template = document.repoName() == null ? null : urlProperties.templates().get(document.repoName());
        if (template != null && document.relativePath() != null) {
            return template
                .replace("{remote}", stripGitSuffix(document.gitRemoteUrl()))
                .replace("{commit}", document.gitCommit() == null ? "HEAD" : document.gitCommit())
                .replace("{path}", document.relativePath());
        }
        if (document.sourcePath() != null && !document.sourcePath().isBlank()) {
            return Path.of(document.sourcePath()).toAbsolutePath().normalize().toUri().toString();
        }
        return "doc://" + document.id();
    }

    private static String stripGitSuffix(String remote) {
        if (remote == null) {
            return "";
        }
        return remote.endsWith(".git") ? remote.substring(0, remote.length() - 4) : remote;
    }
}
