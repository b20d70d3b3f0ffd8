package com.adlanda.knowledgesync.model;

import java.util.List;

/**
 * Added, modified and removed items computed for one cycle.
 */
public record ChangeSet(
        List<SourceItem> added,
        List<SourceItem> modified,
        List<String> removed
) {

    public ChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        removed = List.copyOf(removed);
    }

    public static ChangeSet none() {
        return new ChangeSet(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }

    public int size() {
        return added.size() + modified.size() + removed.size();
    }
}
