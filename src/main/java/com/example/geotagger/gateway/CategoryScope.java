package com.example.geotagger.gateway;

/**
 * A category and its subcategories down to {@code maxDepth} levels below it.
 */
public record CategoryScope(String category, int maxDepth) implements CrawlScope {
    private static final String CATEGORY_PREFIX = "Category:";

    public CategoryScope {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category scope requires a category name.");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0.");
        }
        category = category.startsWith(CATEGORY_PREFIX) ? category.substring(CATEGORY_PREFIX.length()) : category;
    }

    @Override
    public String describe() {
        return "category " + category + " (depth " + maxDepth + ")";
    }
}
