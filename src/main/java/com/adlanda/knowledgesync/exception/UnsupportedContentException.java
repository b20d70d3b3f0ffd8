package com.adlanda.knowledgesync.exception;

/**
 * Thrown when an item's content type cannot be turned into text.
 *
 * Recoverable: the item is skipped for this cycle and left out of the checkpoint.
 */
public class UnsupportedContentException extends Exception {

    private final String itemId;
    private final String mimeType;

    public UnsupportedContentException(String itemId, String mimeType) {
        super("Unsupported content type '" + mimeType + "' for item " + itemId);
        this.itemId = itemId;
        this.mimeType = mimeType;
    }

    public String getItemId() {
        return itemId;
    }

    public String getMimeType() {
        return mimeType;
    }
}
