package com.adlanda.knowledgesync.model;

/**
 * Bytes of a source item as fetched from the source, before text extraction.
 */
public record RawContent(byte[] bytes, String mimeType) {
}
