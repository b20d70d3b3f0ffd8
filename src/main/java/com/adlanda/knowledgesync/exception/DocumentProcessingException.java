package com.adlanda.knowledgesync.exception;

/**
 * Failure to fetch, embed or store a single item.
 */
public class DocumentProcessingException extends Exception {

    private final String itemId;

    public DocumentProcessingException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
