package com.adlanda.knowledgesync.model;

/**
 * Cheap comparable proxy for the identity of one source item's content.
 *
 * @param itemId  Local relative path or remote file id
 * @param path    Human-readable location under the watch root, used to attribute listing errors to subtrees
 * @param version Modified time in epoch millis (local) or revision id (remote)
 * @param size    Size in bytes, -1 when the source does not report one
 */
public record ItemFingerprint(
        String itemId,
        String path,
        String version,
        long size
) {
    /**
     * Two fingerprints describe the same content when version and size agree.
     * The path is ignored so that a moved remote file keeps its identity.
     */
    public boolean sameContentAs(ItemFingerprint other) {
        return other != null
                && version != null
                && version.equals(other.version)
                && size == other.size;
    }
}
