package com.adlanda.knowledgesync.watcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * File metadata as returned by the Drive v3 files endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveFile(
        String id,
        String name,
        String mimeType,
        String headRevisionId,
        Long version,
        Long size,
        Instant modifiedTime
) {
    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
    public static final String GOOGLE_DOC = "application/vnd.google-apps.document";
    public static final String GOOGLE_SHEET = "application/vnd.google-apps.spreadsheet";
    public static final String GOOGLE_SLIDES = "application/vnd.google-apps.presentation";

    public boolean isFolder() {
        return FOLDER_MIME_TYPE.equals(mimeType);
    }

    /**
     * Native Google files have no binary content and must be exported.
     */
    public boolean isGoogleNative() {
        return mimeType != null && mimeType.startsWith("application/vnd.google-apps.");
    }

    public boolean isExportable() {
        return GOOGLE_DOC.equals(mimeType) || GOOGLE_SHEET.equals(mimeType) || GOOGLE_SLIDES.equals(mimeType);
    }

    /**
     * Revision identifier used as fingerprint version.
     * Binary files carry a head revision; native files only the per-file version counter.
     */
    public String revision() {
        if (headRevisionId != null && !headRevisionId.isBlank()) {
            return headRevisionId;
        }
        if (version != null) {
            return "v" + version;
        }
        return modifiedTime != null ? modifiedTime.toString() : null;
    }

    /**
     * Export format for native files, or the file's own type.
     */
    public static String contentTypeFor(String mimeType) {
        if (GOOGLE_SHEET.equals(mimeType)) {
            return "text/csv";
        }
        if (GOOGLE_DOC.equals(mimeType) || GOOGLE_SLIDES.equals(mimeType)) {
            return "text/plain";
        }
        return mimeType;
    }
}
