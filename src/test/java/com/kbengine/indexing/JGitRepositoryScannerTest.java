package com.kbengine.indexing;

import com.kbengine.exception.ValidationException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JGitRepositoryScannerTest {

    @TempDir
    Path workTree;

    private Git git;

    private RepositoryConfig config;

    private final JGitRepositoryScanner scanner = new JGitRepositoryScanner();

    @BeforeEach
    void initRepository() throws Exception {
        git = Git.init().setDirectory(workTree.toFile()).call();
        config = RepositoryConfig.builder()
            .name("handbook")
            .localPath(workTree.toString())
            .excludePatterns(List.of("drafts/**"))
            .build();
    }

    @AfterEach
    void closeRepository() {
        git.close();
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = workTree.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private RevCommit commitAll(String message) throws Exception {
        git.add().addFilepattern(".").call();
        git.add().addFilepattern(".").setUpdate(true).call();
        return git.commit()
            .setMessage(message)
            .setAuthor("Docs Bot", "docs@example.com")
            .setCommitter("Docs Bot", "docs@example.com")
            .setSign(false)
            .call();
    }

    @Test
    @DisplayName("Only matching files outside excluded directories are scanned")
    void scansMatchingFiles() throws Exception {
        write("README.md", "# Readme");
        write("docs/User.md", "# User");
        write("docs/notes.txt", "notes");
        write("drafts/Idea.md", "# Idea");
        commitAll("initial");

        assertThat(scanner.scanFiles(config)).containsExactly("README.md", "docs/User.md");
        assertThat(scanner.readFile(config, "docs/User.md")).isEqualTo("# User");
    }

    @Test
    @DisplayName("HEAD and the origin remote are read from the repository")
    void revisionAndRemote() throws Exception {
        write("README.md", "# Readme");
        RevCommit head = commitAll("initial");
        StoredConfig gitConfig = git.getRepository().getConfig();
        gitConfig.setString("remote", "origin", "url", "https://github.com/acme/handbook.git");
        gitConfig.save();

        assertThat(scanner.isRepository(config)).isTrue();
        assertThat(scanner.currentRevision(config)).isEqualTo(head.getName());
        assertThat(scanner.remoteUrl(config)).isEqualTo("https://github.com/acme/handbook.git");
        assertThat(scanner.remoteUrl(config.toBuilder().remoteUrl("https://mirror/handbook").build()))
            .isEqualTo("https://mirror/handbook");
    }

    @Test
    @DisplayName("Changes since a revision are split into changed and deleted paths")
    void changesSince() throws Exception {
        write("docs/A.md", "# A");
        write("docs/B.md", "# B");
        RevCommit first = commitAll("first");

        write("docs/A.md", "# A\nchanged");
        Files.delete(workTree.resolve("docs/B.md"));
        write("docs/C.md", "# C");
        write("drafts/D.md", "# D");
        RevCommit second = commitAll("second");

        ChangeSet changes = scanner.changesSince(config, first.getName());

        assertThat(changes.changed()).containsExactly("docs/A.md", "docs/C.md");
        assertThat(changes.deleted()).containsExactly("docs/B.md");
        assertThat(changes.currentRevision()).isEqualTo(second.getName());
    }

    @Test
    @DisplayName("An unknown starting revision is rejected")
    void unknownRevision() throws Exception {
        write("README.md", "# Readme");
        commitAll("initial");

        assertThatThrownBy(() -> scanner.changesSince(config, "no-such-branch"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("A plain directory is not a repository")
    void plainDirectory(@TempDir Path plain) {
        assertThat(scanner.isRepository(config.toBuilder().localPath(plain.toString()).build())).isFalse();
    }
}
