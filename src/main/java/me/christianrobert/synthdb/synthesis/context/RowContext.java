package me.christianrobert.synthdb.synthesis.context;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Values generated so far for the current row, so later columns can stay consistent with
 * earlier ones (an email built from the first and last name, a contract end date after its
 * signing date).
 *
 * A fresh instance is created for every row; nothing leaks between rows.
 * Keys are normalized (lower-case, separators collapsed to '_'). Writing a null or empty
 * value is a no-op, so a NULL column never overwrites a real value.
 */
public class RowContext {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, LocalDateTime> dates = new LinkedHashMap<>();

    public void set(String key, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        values.put(ContextKeys.normalize(key), value);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(ContextKeys.normalize(key)));
    }

    public void setDate(String key, LocalDateTime date) {
        if (date == null) {
            return;
        }
        dates.put(ContextKeys.normalize(key), date);
    }

    public Optional<LocalDateTime> getDate(String key) {
        return Optional.ofNullable(dates.get(ContextKeys.normalize(key)));
    }

    /**
     * The latest date stored under a start-like key ("contract_signed", "created_at", ...).
     */
    public Optional<LocalDateTime> getMostRecentStartDate() {
        return dates.entrySet().stream()
                .filter(e -> ContextKeys.isStartLike(e.getKey()))
                .map(Map.Entry::getValue)
                .max(LocalDateTime::compareTo);
    }

    /**
     * Records a generated column value under the column's own key and under the shared key of
     * its category. Values that parse as dates are also stored as dates.
     *
     * @param columnName the column the value was generated for
     * @param category   the column's semantic category
     * @param rawValue   the unescaped value, null for SQL NULL
     */
    public void record(String columnName, SemanticCategory category, String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return;
        }
        set(columnName, rawValue);
        ContextKeys.derivedKey(category).ifPresent(key -> set(key, rawValue));
        parseDate(rawValue).ifPresent(date -> setDate(columnName, date));
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(values);
    }

    static Optional<LocalDateTime> parseDate(String value) {
        if (value.length() == 19) {
            try {
                return Optional.of(LocalDateTime.parse(value, TIMESTAMP_FORMAT));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        if (value.length() == 10) {
            try {
                return Optional.of(LocalDate.parse(value, DATE_FORMAT).atStartOfDay());
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
