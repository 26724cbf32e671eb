package com.kbengine.indexing;

import com.kbengine.exception.PipelineException;
import com.kbengine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Component
public class JGitRepositoryScanner implements RepositoryScanner {

    @Override
    public boolean isRepository(RepositoryConfig config) {
        try (Git git = Git.open(new File(config.localPath()))) {
            return git.getRepository().getObjectDatabase().exists();
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public String currentRevision(RepositoryConfig config) {
        try (Git git = Git.open(new File(config.localPath()))) {
            ObjectId head = git.getRepository().resolve("HEAD");
            if (head == null) {
                throw new PipelineException(null, "No HEAD commit in repository " + config.localPath(), null);
            }
            return head.getName();
        } catch (IOException e) {
            throw new PipelineException(null, "Failed to read HEAD of " + config.localPath(), e);
        }
    }

    @Override
    public String remoteUrl(RepositoryConfig config) {
        if (config.remoteUrl() != null) {
            return config.remoteUrl();
        }
        try (Git git = Git.open(new File(config.localPath()))) {
            return git.getRepository().getConfig().getString("remote", "origin", "url");
        } catch (IOException e) {
            log.debug("No remote configured for {}: {}", config.localPath(), e.getMessage());
            return null;
        }
    }

    @Override
    public List<String> scanFiles(RepositoryConfig config) {
        Path root = Path.of(config.localPath()).toAbsolutePath().normalize();
        Filter filter = new Filter(config);
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .map(path -> root.relativize(path).toString().replace(File.separatorChar, '/'))
                .filter(relative -> !relative.startsWith(".git/"))
                .filter(filter::accepts)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
    }

    @Override
    public String readFile(RepositoryConfig config, String relativePath) {
        Path path = Path.of(config.localPath()).resolve(relativePath);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @Override
    public ChangeSet changesSince(RepositoryConfig config, String sinceRevision) {
        Filter filter = new Filter(config);
        List<String> changed = new ArrayList<>();
        List<String> deleted = new ArrayList<>();

        try (Git git = Git.open(new File(config.localPath()))) {
            Repository repo = git.getRepository();
            ObjectId head = repo.resolve("HEAD");
            ObjectId oldTree = repo.resolve(sinceRevision + "^{tree}");
            ObjectId newTree = repo.resolve("HEAD^{tree}");
            if (oldTree == null) {
                throw new ValidationException("Unknown revision: " + sinceRevision);
            }
            if (head == null || newTree == null) {
                throw new PipelineException(null, "No HEAD commit in repository " + config.localPath(), null);
            }

            try (ObjectReader reader = repo.newObjectReader()) {
                CanonicalTreeParser oldParser = new CanonicalTreeParser();
                oldParser.reset(reader, oldTree);
                CanonicalTreeParser newParser = new CanonicalTreeParser();
                newParser.reset(reader, newTree);

                List<DiffEntry> diffs = git.diff()
                    .setOldTree(oldParser)
                    .setNewTree(newParser)
                    .call();

                for (DiffEntry diff : diffs) {
                    switch (diff.getChangeType()) {
                        case ADD, MODIFY, COPY -> addIf(filter, changed, diff.getNewPath());
                        case DELETE -> addIf(filter, deleted, diff.getOldPath());
                        case RENAME -> {
                            addIf(filter, deleted, diff.getOldPath());
                            addIf(filter, changed, diff.getNewPath());
                        }
                        default -> log.debug("Ignoring diff entry {}", diff);
                    }
                }
            }
            return new ChangeSet(changed, deleted, head.getName());
        } catch (IOException | GitAPIException e) {
            throw new PipelineException(null, "Failed to compute changes since " + sinceRevision, e);
        }
    }

    private static void addIf(Filter filter, List<String> target, String path) {
        if (filter.accepts(path)) {
            target.add(path);
        }
    }

    /**
     * Glob filter over repository-relative paths. A leading {@code **}{@code /} also matches files at the root.
     */
    static final class Filter {

        private final List<PathMatcher> includes;
        private final List<PathMatcher> excludes;

        Filter(RepositoryConfig config) {
            this.includes = matchers(config.includePatterns());
            this.excludes = matchers(config.excludePatterns());
        }

        boolean accepts(String relativePath) {
            Path path = Path.of(relativePath);
            return includes.stream().anyMatch(m -> m.matches(path)) && excludes.stream().noneMatch(m -> m.matches(path));
        }

        private static List<PathMatcher> matchers(List<String> patterns) {
            List<PathMatcher> matchers = new ArrayList<>();
            for (String pattern : patterns) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
                if (pattern.startsWith("**/")) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3)));
                }
            }
            return matchers;
        }
    }
}
