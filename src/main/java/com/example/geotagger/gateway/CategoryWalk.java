package com.example.geotagger.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first walk over a category tree, held as an explicit queue of {@code (category, depth)}
 * frames so it can be serialized into a continuation cursor between pages.
 */
final class CategoryWalk {
    static final String CURSOR_TYPE = "category";

    private final int maxDepth;
    private final Deque<Frame> queue = new ArrayDeque<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private ObjectNode memberContinue;

    private CategoryWalk(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    static CategoryWalk start(CategoryScope scope) {
        CategoryWalk walk = new CategoryWalk(scope.maxDepth());
        walk.visited.add(scope.category());
        walk.queue.addLast(new Frame(scope.category(), 0));
        return walk;
    }

    /**
     * Restores a walk from a cursor, or returns empty when the cursor was not produced by a category walk.
     */
    static Optional<CategoryWalk> fromCursor(JsonNode token, CategoryScope scope) {
        if (token == null || !CURSOR_TYPE.equals(token.path("type").asText())
                || !scope.category().equals(token.path("root").asText())) {
            return Optional.empty();
        }
        CategoryWalk walk = new CategoryWalk(scope.maxDepth());
        for (JsonNode frame : token.path("queue")) {
            walk.queue.addLast(new Frame(frame.path("category").asText(), frame.path("depth").asInt()));
        }
        for (JsonNode category : token.path("visited")) {
            walk.visited.add(category.asText());
        }
        JsonNode cont = token.get("continue");
        if (cont != null && cont.isObject()) {
            walk.memberContinue = ((ObjectNode) cont).deepCopy();
        }
        return Optional.of(walk);
    }

    boolean isExhausted() {
        return queue.isEmpty();
    }

    Frame head() {
        return queue.peekFirst();
    }

    /**
     * Continuation parameters for the head category's member listing, or null when starting it fresh.
     */
    ObjectNode memberContinue() {
        return memberContinue;
    }

    /**
     * Queues a subcategory found under a category at {@code parentDepth}. Ignored beyond the depth
     * limit or if already seen.
     */
    boolean enqueueSubcategory(String category, int parentDepth) {
        if (parentDepth >= maxDepth || !visited.add(category)) {
            return false;
        }
        queue.addLast(new Frame(category, parentDepth + 1));
        return true;
    }

    /**
     * Moves on after one member page of the head category: stays on it while the API has more, otherwise
     * pops it.
     */
    void advance(ObjectNode nextContinue) {
        if (nextContinue != null) {
            memberContinue = nextContinue;
            return;
        }
        memberContinue = null;
        queue.pollFirst();
    }

    JsonNode toCursor(ObjectMapper mapper, String root) {
        ObjectNode cursor = mapper.createObjectNode();
        cursor.put("type", CURSOR_TYPE);
        cursor.put("root", root);
        ArrayNode frames = cursor.putArray("queue");
        for (Frame frame : queue) {
            frames.addObject().put("category", frame.category()).put("depth", frame.depth());
        }
        ArrayNode seen = cursor.putArray("visited");
        visited.forEach(seen::add);
        if (memberContinue != null) {
            cursor.set("continue", memberContinue);
        }
        return cursor;
    }

    record Frame(String category, int depth) {
    }
}
