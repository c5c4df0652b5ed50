package io.middleware4j.service;

import io.middleware4j.errors.ValidationErrors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Statically declared shape of an entry. Create and update schemas are derived from it rather than declared twice.
 *
 * <pre>{@code
 * EntrySchema entry = EntrySchema.builder("share_entry")
 *         .field("id", Long.class, false)
 *         .field("name", String.class, true)
 *         .field("enabled", Boolean.class, false)
 *         .build();
 *
 * EntrySchema create = entry.forCreate("id");   // share_create, id removed
 * EntrySchema update = entry.forUpdate("id");   // share_update, id removed, nothing required
 * }</pre>
 */
public final class EntrySchema {

    public record Field(String name, Class<?> type, boolean required, boolean nullable) {
    }

    private final String name;
    private final Map<String, Field> fields;

    private EntrySchema(String name, Map<String, Field> fields) {
        this.name = name;
        this.fields = fields;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Map<String, Field> fields() {
        return fields;
    }

    public EntrySchema forCreate(String primaryKey) {
        Map<String, Field> copy = new LinkedHashMap<>(fields);
        copy.remove(primaryKey);
        return new EntrySchema(derivedName("_create"), Collections.unmodifiableMap(copy));
    }

    public EntrySchema forUpdate(String primaryKey) {
        Map<String, Field> copy = new LinkedHashMap<>();
        for (Field f : fields.values()) {
            if (!f.name().equals(primaryKey)) {
                copy.put(f.name(), new Field(f.name(), f.type(), false, f.nullable()));
            }
        }
        return new EntrySchema(derivedName("_update"), Collections.unmodifiableMap(copy));
    }

    private String derivedName(String suffix) {
        String base = name.endsWith("_entry") ? name.substring(0, name.length() - "_entry".length()) : name;
        return base + suffix;
    }

    /**
     * Collect every problem with {@code data} into {@code verrors}; attributes are {@code <schema>.<field>}.
     */
    public void validate(Map<String, Object> data, ValidationErrors verrors) {
        for (Field f : fields.values()) {
            if (f.required() && !data.containsKey(f.name())) {
                verrors.add(name + "." + f.name(), "attribute required");
            }
        }
        for (Map.Entry<String, Object> e : data.entrySet()) {
            Field f = fields.get(e.getKey());
            String attr = name + "." + e.getKey();
            if (f == null) {
                verrors.add(attr, "Field was not expected");
            } else if (e.getValue() == null) {
                if (!f.nullable()) {
                    verrors.add(attr, "null not allowed");
                }
            } else if (!accepts(f.type(), e.getValue())) {
                verrors.add(attr, "Not a valid " + f.type().getSimpleName());
            }
        }
    }

    private static boolean accepts(Class<?> type, Object value) {
        if (type.isInstance(value)) {
            return true;
        }
        // integral types arrive as whatever width the decoder chose
        if (type == Long.class || type == Integer.class) {
            return value instanceof Integer || value instanceof Long || value instanceof Short;
        }
        return type == Double.class && value instanceof Number;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder field(String field, Class<?> type, boolean required) {
            return field(field, type, required, false);
        }

        public Builder field(String field, Class<?> type, boolean required, boolean nullable) {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(type, "type must not be null");
            if (fields.put(field, new Field(field, type, required, nullable)) != null) {
                throw new IllegalStateException("Duplicate field " + field + " in schema " + name);
            }
            return this;
        }

        public Builder fields(List<Field> list) {
            for (Field f : list) {
                field(f.name(), f.type(), f.required(), f.nullable());
            }
            return this;
        }

        public EntrySchema build() {
            return new EntrySchema(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
