package io.middleware4j.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {major, minor} tag persisted alongside replicated data to detect schema incompatibility across upgrades.
 */
public record VersionStamp(int major, int minor) {

    public static VersionStamp of(int major, int minor) {
        return new VersionStamp(major, minor);
    }

    public static VersionStamp fromMap(Map<?, ?> raw) {
        if (raw == null) {
            return null;
        }
        Object major = raw.get("major");
        Object minor = raw.get("minor");
        if (!(major instanceof Number) || !(minor instanceof Number)) {
            throw new IllegalArgumentException("version stamp requires numeric major and minor: " + raw);
        }
        return new VersionStamp(((Number) major).intValue(), ((Number) minor).intValue());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("major", major);
        m.put("minor", minor);
        return m;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
