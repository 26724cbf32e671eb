package com.kbengine.indexing;

import java.util.List;

/**
 * Files touched between two revisions, as repository-relative paths. A rename shows up as a deletion
 * of the old path and a change of the new one.
 */
public record ChangeSet(List<String> changed, List<String> deleted, String currentRevision) {

    public ChangeSet {
        changed = List.copyOf(changed);
        deleted = List.copyOf(deleted);
    }
}
