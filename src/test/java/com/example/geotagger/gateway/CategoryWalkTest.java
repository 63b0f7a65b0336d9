package com.example.geotagger.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CategoryWalkTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void depthZeroStaysInRootCategory() {
        CategoryWalk walk = CategoryWalk.start(new CategoryScope("Paris", 0));

        assertFalse(walk.enqueueSubcategory("Louvre", 0));
        walk.advance(null);

        assertTrue(walk.isExhausted());
    }

    @Test
    void visitsBreadthFirstWithinDepthLimit() {
        CategoryWalk walk = CategoryWalk.start(new CategoryScope("Category:Paris", 2));
        List<String> visited = new ArrayList<>();

        // Paris -> Museums -> Louvre -> Paintings (too deep); Paris -> Bridges
        while (!walk.isExhausted()) {
            CategoryWalk.Frame frame = walk.head();
            visited.add(frame.category() + "@" + frame.depth());
            switchOn(walk, frame);
            walk.advance(null);
        }

        assertEquals(List.of("Paris@0", "Museums@1", "Bridges@1", "Louvre@2"), visited);
    }

    @Test
    void ignoresCategoriesAlreadySeen() {
        CategoryWalk walk = CategoryWalk.start(new CategoryScope("Paris", 3));

        assertTrue(walk.enqueueSubcategory("Museums", 0));
        assertFalse(walk.enqueueSubcategory("Museums", 0));
        assertFalse(walk.enqueueSubcategory("Paris", 1));
    }

    @Test
    void survivesCursorRoundTrip() throws Exception {
        CategoryScope scope = new CategoryScope("Paris", 2);
        CategoryWalk walk = CategoryWalk.start(scope);
        walk.enqueueSubcategory("Museums", 0);
        walk.advance(mapper.createObjectNode().put("cmcontinue", "file|4c4f55|123").put("continue", "-||"));

        JsonNode cursor = mapper.readTree(mapper.writeValueAsString(walk.toCursor(mapper, scope.category())));
        CategoryWalk restored = CategoryWalk.fromCursor(cursor, scope).orElseThrow();

        assertEquals("Paris", restored.head().category());
        assertEquals("file|4c4f55|123", restored.memberContinue().get("cmcontinue").asText());
        assertFalse(restored.enqueueSubcategory("Museums", 0));
        restored.advance(null);
        assertEquals(new CategoryWalk.Frame("Museums", 1), restored.head());
    }

    @Test
    void rejectsCursorForAnotherRoot() {
        CategoryScope scope = new CategoryScope("Paris", 1);
        JsonNode cursor = CategoryWalk.start(new CategoryScope("Rome", 1)).toCursor(mapper, "Rome");

        assertTrue(CategoryWalk.fromCursor(cursor, scope).isEmpty());
        assertTrue(CategoryWalk.fromCursor(mapper.createObjectNode().put("type", "user"), scope).isEmpty());
    }

    private void switchOn(CategoryWalk walk, CategoryWalk.Frame frame) {
        if (frame.category().equals("Paris")) {
            walk.enqueueSubcategory("Museums", frame.depth());
            walk.enqueueSubcategory("Bridges", frame.depth());
        } else if (frame.category().equals("Museums")) {
            walk.enqueueSubcategory("Louvre", frame.depth());
        } else if (frame.category().equals("Louvre")) {
            walk.enqueueSubcategory("Paintings", frame.depth());
        }
    }
}
