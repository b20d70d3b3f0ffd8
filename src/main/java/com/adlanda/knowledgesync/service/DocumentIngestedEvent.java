package com.adlanda.knowledgesync.service;

/**
 * Published after a document's chunks and record have been written.
 */
public record DocumentIngestedEvent(String documentId, int chunkCount) {
}
