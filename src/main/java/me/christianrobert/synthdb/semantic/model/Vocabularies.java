package me.christianrobert.synthdb.semantic.model;

import java.util.List;
import java.util.Locale;

/**
 * Closed vocabularies. They serve both as classification evidence (a sampled value that belongs
 * to one of them identifies the column) and as the value domain for the matching category.
 */
public final class Vocabularies {

    public static final List<String> STATUS = List.of("active", "inactive", "pending", "suspended", "archived");
    public static final List<String> PRIORITY = List.of("low", "medium", "high", "critical", "urgent");
    public static final List<String> SKILL_LEVEL = List.of("beginner", "intermediate", "advanced", "expert", "master");
    public static final List<String> CLASSIFICATION = List.of("public", "internal", "confidential", "restricted", "secret");
    public static final List<String> GENDER = List.of("female", "male", "non-binary", "unspecified");
    public static final List<String> CATEGORY = List.of("standard", "premium", "basic", "enterprise", "custom", "other");

    private Vocabularies() {
    }

    public static boolean contains(List<String> vocabulary, String value) {
        return value != null && vocabulary.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
