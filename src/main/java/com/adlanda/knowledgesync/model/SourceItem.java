package com.adlanda.knowledgesync.model;

/**
 * One document discovered in a source listing.
 *
 * @param id          Stable item identifier (key of the checkpoint's known items)
 * @param name        File name or remote title
 * @param path        Location under the watch root
 * @param mimeType    Content type as reported or guessed from the extension
 * @param fingerprint Fingerprint at listing time
 */
public record SourceItem(
        String id,
        String name,
        String path,
        String mimeType,
        ItemFingerprint fingerprint
) {
}
