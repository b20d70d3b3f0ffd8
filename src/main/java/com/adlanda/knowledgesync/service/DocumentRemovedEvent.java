package com.adlanda.knowledgesync.service;

/**
 * Published after a removed item's chunks and document record have been deleted.
 *
 * Listeners run in the publishing thread; an exception from one fails the removal,
 * which keeps the item in the checkpoint so the next cycle removes it again.
 */
public record DocumentRemovedEvent(String documentId) {
}
