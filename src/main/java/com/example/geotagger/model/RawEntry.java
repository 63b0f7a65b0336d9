package com.example.geotagger.model;

/**
 * A single identifier as returned by a listing call, before any detail is fetched.
 */
public record RawEntry(String id) {
    private static final String FILE_PREFIX = "File:";

    /**
     * Normalizes a listing title by dropping the file namespace prefix.
     */
    public static RawEntry ofTitle(String title) {
        String id = title.startsWith(FILE_PREFIX) ? title.substring(FILE_PREFIX.length()) : title;
        return new RawEntry(id.trim());
    }
}
