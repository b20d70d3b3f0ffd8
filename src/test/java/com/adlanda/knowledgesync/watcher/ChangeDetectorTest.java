package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.model.WatchResult;
import com.adlanda.knowledgesync.watcher.SourceListing.ListingError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector();

    @Test
    void detect_emptyCheckpoint_reportsEverythingAsAdded() {
        // Setup
        SourceListing listing = new SourceListing(
                List.of(item("a.txt", "1"), item("b.md", "1"), item("docs/c.txt", "1")), List.of());

        // Execute
        WatchResult result = detector.detect(SyncCheckpoint.empty(), listing);

        // Verify
        assertThat(result.initialScan()).isTrue();
        assertThat(result.changes().added()).extracting(SourceItem::id)
                .containsExactlyInAnyOrder("a.txt", "b.md", "docs/c.txt");
        assertThat(result.changes().modified()).isEmpty();
        assertThat(result.changes().removed()).isEmpty();
        assertThat(result.candidateItems()).containsOnlyKeys("a.txt", "b.md", "docs/c.txt");
    }

    @Test
    void detect_changedVersion_reportsModified() {
        // Setup
        SyncCheckpoint checkpoint = checkpointOf(item("a.txt", "1"), item("b.txt", "1"));
        SourceListing listing = new SourceListing(List.of(item("a.txt", "2"), item("b.txt", "1")), List.of());

        // Execute
        WatchResult result = detector.detect(checkpoint, listing);

        // Verify
        assertThat(result.initialScan()).isFalse();
        assertThat(result.changes().modified()).extracting(SourceItem::id).containsExactly("a.txt");
        assertThat(result.changes().added()).isEmpty();
        assertThat(result.changes().removed()).isEmpty();
    }

    @Test
    void detect_missingItem_reportsRemoved() {
        // Setup
        SyncCheckpoint checkpoint = checkpointOf(item("a.txt", "1"), item("b.txt", "1"));
        SourceListing listing = new SourceListing(List.of(item("a.txt", "1")), List.of());

        // Execute
        WatchResult result = detector.detect(checkpoint, listing);

        // Verify
        assertThat(result.changes().removed()).containsExactly("b.txt");
        assertThat(result.changes().added()).isEmpty();
        assertThat(result.changes().modified()).isEmpty();
        assertThat(result.candidateItems()).containsOnlyKeys("a.txt");
    }

    @Test
    void detect_unlistableSubtree_doesNotRemoveItsItems() {
        // Setup
        SyncCheckpoint checkpoint = checkpointOf(item("a.txt", "1"), item("private/b.txt", "1"));
        SourceListing listing = new SourceListing(
                List.of(item("a.txt", "1")),
                List.of(new ListingError("private", "Permission denied")));

        // Execute
        WatchResult result = detector.detect(checkpoint, listing);

        // Verify
        assertThat(result.changes().removed()).isEmpty();
        assertThat(result.candidateItems()).containsOnlyKeys("a.txt");
        assertThat(result.listingErrors()).isNotEmpty();
        assertThat(result.listingErrors()).containsExactly("private: Permission denied");
    }

    @Test
    void detect_errorOnSiblingPrefix_stillRemovesItem() {
        // Setup
        SyncCheckpoint checkpoint = checkpointOf(item("privateer/b.txt", "1"));
        SourceListing listing = new SourceListing(List.of(), List.of(new ListingError("private", "denied")));

        // Execute
        WatchResult result = detector.detect(checkpoint, listing);

        // Verify
        assertThat(result.changes().removed()).containsExactly("privateer/b.txt");
    }

    private static SourceItem item(String path, String version) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        return new SourceItem(path, name, path, "text/plain", new ItemFingerprint(path, path, version, 10));
    }

    private static SyncCheckpoint checkpointOf(SourceItem... items) {
        Map<String, ItemFingerprint> known = new java.util.LinkedHashMap<>();
        for (SourceItem item : items) {
            known.put(item.id(), item.fingerprint());
        }
        return new SyncCheckpoint(Instant.parse("2026-01-01T00:00:00Z"), known);
    }
}
