package com.kbengine.indexing;

import java.util.List;

public interface RepositoryScanner {

    boolean isRepository(RepositoryConfig config);

    String currentRevision(RepositoryConfig config);

    /**
     * Remote URL of {@code origin}, or the configured one, or null.
     */
    String remoteUrl(RepositoryConfig config);

    /**
     * Repository-relative paths matching the include patterns and none of the exclude patterns, sorted.
     */
    List<String> scanFiles(RepositoryConfig config);

    String readFile(RepositoryConfig config, String relativePath);

    ChangeSet changesSince(RepositoryConfig config, String sinceRevision);
}
