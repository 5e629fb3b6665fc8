package me.christianrobert.synthdb.synthesis.context;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Well-known row context keys and key normalization.
 */
public final class ContextKeys {

    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String FULL_NAME = "full_name";
    public static final String USERNAME = "username";
    public static final String COMPANY_NAME = "company_name";
    public static final String DOMAIN_NAME = "domain_name";

    /**
     * Key fragments marking a date as the start of something (contract signed, account created).
     */
    public static final List<String> START_MARKERS = List.of(
            "signed", "created", "established", "start", "launched",
            "founded", "opened", "hired", "joined", "registered");

    private ContextKeys() {
    }

    public static String normalize(String key) {
        if (key == null) {
            return "";
        }
        return key.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_");
    }

    /**
     * The shared key under which values of the given category are also recorded, if any.
     */
    public static Optional<String> derivedKey(SemanticCategory category) {
        return switch (category) {
            case FIRST_NAME -> Optional.of(FIRST_NAME);
            case LAST_NAME -> Optional.of(LAST_NAME);
            case FULL_NAME -> Optional.of(FULL_NAME);
            case USERNAME -> Optional.of(USERNAME);
            case COMPANY_NAME -> Optional.of(COMPANY_NAME);
            case DOMAIN_NAME -> Optional.of(DOMAIN_NAME);
            default -> Optional.empty();
        };
    }

    public static boolean isStartLike(String key) {
        String normalized = normalize(key);
        for (String marker : START_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
