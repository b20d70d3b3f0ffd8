package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.model.SourceItem;

import java.util.List;

/**
 * Raw result of listing a source, before it is diffed.
 *
 * @param items  Every item that could be listed
 * @param errors Locations that could not be listed; their contents are unknown for this cycle
 */
public record SourceListing(List<SourceItem> items, List<ListingError> errors) {

    public SourceListing {
        items = List.copyOf(items);
        errors = List.copyOf(errors);
    }

    /**
     * @param path    Location under the watch root (a folder or a single file)
     * @param message Why it could not be listed
     */
    public record ListingError(String path, String message) {

        /**
         * True if the item at {@code itemPath} lies at or below this error's location.
         */
        public boolean covers(String itemPath) {
            if (itemPath == null) {
                return false;
            }
            return path.isEmpty() || itemPath.equals(path) || itemPath.startsWith(path + "/");
        }

        @Override
        public String toString() {
            return path + ": " + message;
        }
    }
}
