package io.middleware4j.service;

import io.middleware4j.errors.ValidationErrors;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntrySchemaTest {

    private final EntrySchema entry = EntrySchema.builder("pool_entry")
            .field("id", Long.class, false)
            .field("name", String.class, true)
            .field("size", Long.class, false)
            .field("ratio", Double.class, false)
            .build();

    @Test
    void createSchemaShouldDropPrimaryKeyAndKeepRequiredFields() {
        EntrySchema create = entry.forCreate("id");

        assertEquals("pool_create", create.name());
        assertEquals(List.of("name", "size", "ratio"), List.copyOf(create.fields().keySet()));
        assertTrue(create.fields().get("name").required());
    }

    @Test
    void updateSchemaShouldMakeEverythingOptional() {
        EntrySchema update = entry.forUpdate("id");
        ValidationErrors verrors = new ValidationErrors();

        update.validate(Map.of(), verrors);

        assertEquals("pool_update", update.name());
        assertFalse(update.fields().containsKey("id"));
        assertTrue(verrors.isEmpty());
    }

    @Test
    void numericValuesShouldBeAcceptedAcrossWidths() {
        ValidationErrors verrors = new ValidationErrors();

        entry.validate(Map.of("name", "tank", "size", 10, "ratio", 1), verrors);

        assertTrue(verrors.isEmpty());
    }

    @Test
    void wrongTypeShouldBeReported() {
        ValidationErrors verrors = new ValidationErrors();

        entry.validate(Map.of("name", 5), verrors);

        assertEquals(1, verrors.errors().size());
        assertEquals("pool_entry.name", verrors.errors().get(0).attribute());
        assertEquals("Not a valid String", verrors.errors().get(0).message());
    }

    @Test
    void duplicateFieldShouldFailAtBuild() {
        EntrySchema.Builder builder = EntrySchema.builder("x").field("a", String.class, true);
        assertThrows(IllegalStateException.class, () -> builder.field("a", Long.class, false));
    }
}
