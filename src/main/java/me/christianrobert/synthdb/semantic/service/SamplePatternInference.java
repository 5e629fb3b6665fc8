package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;
import me.christianrobert.synthdb.semantic.model.Vocabularies;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Infers a semantic category from the shape of a single sampled value.
 *
 * Checks, in order:
 * - MAC address: 17 characters with 5 colons ("00:1a:2b:3c:4d:5e")
 * - IPv4 address: 4 dot-separated byte values
 * - Email: contains '@' followed by a '.'
 * - Closed vocabularies: status, skill level, priority, classification
 */
public final class SamplePatternInference {

    private static final Pattern MAC = Pattern.compile("^[0-9A-Fa-f]{2}(:[0-9A-Fa-f]{2}){5}$");
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private SamplePatternInference() {
    }

    public static Optional<SemanticCategory> infer(String sample) {
        if (sample == null || sample.isBlank()) {
            return Optional.empty();
        }
        String value = sample.trim();

        if (value.length() == 17 && MAC.matcher(value).matches()) {
            return Optional.of(SemanticCategory.MAC_ADDRESS);
        }
        if (isIpv4(value)) {
            return Optional.of(SemanticCategory.IPV4_ADDRESS);
        }
        int at = value.indexOf('@');
        if (at > 0 && value.indexOf('.', at) > at + 1) {
            return Optional.of(SemanticCategory.EMAIL);
        }
        if (Vocabularies.contains(Vocabularies.STATUS, value)) {
            return Optional.of(SemanticCategory.STATUS);
        }
        if (Vocabularies.contains(Vocabularies.SKILL_LEVEL, value)) {
            return Optional.of(SemanticCategory.SKILL_LEVEL);
        }
        if (Vocabularies.contains(Vocabularies.PRIORITY, value)) {
            return Optional.of(SemanticCategory.PRIORITY);
        }
        if (Vocabularies.contains(Vocabularies.CLASSIFICATION, value)) {
            return Optional.of(SemanticCategory.CLASSIFICATION);
        }
        return Optional.empty();
    }

    static boolean isIpv4(String value) {
        if (!IPV4.matcher(value).matches()) {
            return false;
        }
        for (String part : value.split("\\.")) {
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }
}
