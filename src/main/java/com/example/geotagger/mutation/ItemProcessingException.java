package com.example.geotagger.mutation;

public class ItemProcessingException extends Exception {
    private final String itemId;

    public ItemProcessingException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
