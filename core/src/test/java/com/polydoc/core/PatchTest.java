package com.polydoc.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatchTest {

    @Test
    void explicitNullsAreKeptApartFromUnsetFields() {
        Patch patch = Patch.of("1").set("description", null).set("title", "Dune");

        assertTrue(patch.isSet("description"));
        assertFalse(patch.isSet("isbn"));
        assertEquals("Dune", patch.fields().get("title"));
        assertTrue(patch.fields().containsKey("description"));
    }

    @Test
    void identityFieldsCannotBePatched() {
        Patch patch = Patch.of("1");

        assertThrows(InvalidArgumentException.class, () -> patch.set("id", "2"));
        assertThrows(InvalidArgumentException.class, () -> patch.set("__t", "Truck"));
        assertThrows(InvalidArgumentException.class, () -> patch.set(" ", 1));
    }

    @Test
    void fieldsCannotBeChangedThroughTheView() {
        Map<String, Object> fields = Patch.of("1").set("title", "Dune").fields();

        assertThrows(UnsupportedOperationException.class, () -> fields.put("title", "Emma"));
    }
}
