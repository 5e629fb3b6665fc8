package me.christianrobert.synthdb.synthesis.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.DataTypeTag;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import me.christianrobert.synthdb.semantic.model.Vocabularies;
import me.christianrobert.synthdb.synthesis.context.ContextKeys;
import me.christianrobert.synthdb.synthesis.context.RowContext;
import me.christianrobert.synthdb.synthesis.model.SqlValue;
import net.datafaker.Faker;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

/**
 * Produces one SQL literal for a column from its semantic type, the row context and the
 * reference pool.
 *
 * <p>All randomness flows from the injected {@link Random}; the Datafaker instance is built on
 * the same generator, so a fixed seed reproduces the same values. "Now" comes from the
 * injected {@link Clock}.</p>
 *
 * <p>Rendering follows the declared type: numbers are unquoted for numeric columns and quoted
 * for text columns, temporal values use {@code yyyy-MM-dd} for date columns and
 * {@code yyyy-MM-dd HH:mm:ss} otherwise, and text is cut to the declared character length.</p>
 */
public class ValueSynthesizer {

    static final int DEFAULT_PRECISION = 5;
    static final int DEFAULT_SCALE = 2;
    static final int MAX_WHOLE_DIGITS = 9;

    private static final String HEX = "0123456789abcdef";
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final String BCRYPT_ALPHABET = "./ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Random random;
    private final Faker faker;
    private final Clock clock;
    private final ReferencePool referencePool;

    public ValueSynthesizer(Random random, Clock clock, ReferencePool referencePool) {
        this.random = random;
        this.faker = new Faker(random);
        this.clock = clock;
        this.referencePool = referencePool;
    }

    /**
     * Generates the value of one column for one row.
     *
     * @param type     the column's semantic type
     * @param column   the column metadata (declared type, length, precision, samples)
     * @param context  values generated so far for this row
     * @param rowIndex zero-based index of the row within its table
     */
    public SqlValue synthesize(SemanticType type, ColumnMetadata column, RowContext context, int rowIndex) {
        if (!type.isKey() && column.hasSampleValues()) {
            return fromSamples(column);
        }

        return switch (type.getCategory()) {
            case PRIMARY_KEY -> keyValue(column, rowIndex);
            case FOREIGN_KEY -> referencePool.sample(type.getReferencedTable(), type.getReferencedColumn(), random)
                    .map(value -> keyLiteral(column, value))
                    .orElseGet(() -> defaultSubstitute(column, rowIndex));
            case UUID -> text(column, randomUuid());

            case FIRST_NAME -> text(column, faker.name().firstName());
            case LAST_NAME -> text(column, faker.name().lastName());
            case FULL_NAME -> text(column, fullName(context));
            case USERNAME -> text(column, username(context, rowIndex));
            case GENDER -> text(column, pick(Vocabularies.GENDER));
            case BIRTH_DATE -> temporal(column, now().minusYears(between(18, 80)).minusDays(between(0, 364)), true);
            case AGE -> wholeNumber(column, 18, 80);
            case JOB_TITLE -> text(column, faker.job().title());

            case COMPANY_NAME -> text(column, faker.company().name());
            case DEPARTMENT -> text(column, faker.commerce().department());
            case INDUSTRY -> text(column, faker.company().industry());
            case PRODUCT_NAME -> text(column, faker.commerce().productName());
            case ENTITY_NAME -> text(column, capitalize(faker.lorem().word()) + " " + capitalize(faker.lorem().word()));

            case STREET_ADDRESS -> text(column, faker.address().streetAddress());
            case CITY -> text(column, faker.address().city());
            case STATE -> text(column, faker.address().state());
            case COUNTRY -> text(column, faker.address().country());
            case COUNTRY_CODE -> text(column, faker.address().countryCode());
            case POSTAL_CODE -> text(column, faker.address().zipCode());
            case LATITUDE -> decimal(column, -90, 90, 6);
            case LONGITUDE -> decimal(column, -180, 180, 6);
            case TIMEZONE -> text(column, faker.address().timeZone());

            case EMAIL -> text(column, email(context, rowIndex));
            case PHONE -> text(column, faker.phoneNumber().phoneNumber());

            case URL -> text(column, "https://" + websiteHost(context));
            case DOMAIN_NAME -> text(column, domainName(context));
            case HOSTNAME -> text(column, pick(Corpora.HOST_PREFIXES) + String.format("%02d", between(1, 99))
                    + "." + context.get(ContextKeys.DOMAIN_NAME).orElseGet(() -> companySlug(context).orElse("corp") + ".local"));
            case IPV4_ADDRESS -> text(column, privateIpv4());
            case MAC_ADDRESS -> text(column, macAddress());
            case PORT -> wholeNumber(column, 1024, 65535);
            case USER_AGENT -> text(column, pick(Corpora.USER_AGENTS));

            case START_DATE -> temporal(column, now().minusDays(between(365, 1825)).minusSeconds(between(0, 86_399)), false);
            case END_DATE -> temporal(column, endDate(context), false);
            case UPDATED_DATE -> temporal(column, updatedDate(context), false);

            case MONEY_AMOUNT -> decimal(column, 10, 10_000, DEFAULT_SCALE);
            case CURRENCY_CODE -> text(column, faker.money().currencyCode());
            case PERCENTAGE -> decimal(column, 0, 100, DEFAULT_SCALE);

            case HASH -> text(column, randomString(HEX, 64));
            case PASSWORD_HASH -> text(column, "$2a$10$" + randomString(BCRYPT_ALPHABET, 53));
            case API_TOKEN -> text(column, randomString(ALPHANUMERIC, 32));

            case STATUS -> text(column, pick(Vocabularies.STATUS));
            case PRIORITY -> text(column, pick(Vocabularies.PRIORITY));
            case SKILL_LEVEL -> text(column, pick(Vocabularies.SKILL_LEVEL));
            case CLASSIFICATION -> text(column, pick(Vocabularies.CLASSIFICATION));
            case CATEGORY -> text(column, pick(Vocabularies.CATEGORY));

            case IDENTIFIER_CODE -> text(column, identifierCode(column.getColumnName()));

            case FICTION_LOCATION -> text(column, pick(Corpora.FICTION_PREFIXES) + " " + pick(Corpora.FICTION_SUFFIXES));
            case FICTION_VESSEL -> text(column, pick(Corpora.VESSEL_PREFIXES) + " " + pick(Corpora.VESSEL_NAMES));

            case TITLE -> text(column, stripPeriod(faker.lorem().sentence(between(2, 5))));
            case DESCRIPTION -> text(column, faker.lorem().sentence(between(8, 15)));
            case BODY_TEXT -> text(column, faker.lorem().paragraph());
            case TAG_LIST -> text(column, String.join(",", faker.lorem().words(between(2, 4))));
            case COLOR -> text(column, faker.color().name());

            case FILE_NAME -> text(column, fileName());
            case FILE_PATH -> text(column, pick(Corpora.PATH_ROOTS) + "/" + faker.lorem().word() + "/" + fileName());
            case MIME_TYPE -> text(column, faker.file().mimeType());
            case FILE_SIZE -> wholeNumber(column, 1_024, 50_000_000);

            case QUANTITY -> wholeNumber(column, 1, 1000);
            case CAPACITY -> wholeNumber(column, 1000, 50_000);
            case WEIGHT -> decimal(column, 0.1, 500, DEFAULT_SCALE);
            case DIMENSION -> decimal(column, 1, 500, DEFAULT_SCALE);
            case RATING -> decimal(column, 1, 5, 1);
            case DURATION -> wholeNumber(column, 1, 480);

            case VERSION -> text(column, between(0, 9) + "." + between(0, 20) + "." + between(0, 50));

            case BOOLEAN_FLAG -> column.getTypeTag() == DataTypeTag.BOOLEAN
                    ? SqlValue.unquoted(String.valueOf(random.nextBoolean()))
                    : text(column, String.valueOf(random.nextBoolean()));
            case GENERIC_INTEGER -> wholeNumber(column, 1, 1000);
            case GENERIC_DECIMAL -> genericDecimal(column);
            case GENERIC_TEXT -> text(column, String.join(" ", faker.lorem().words(between(1, 4))));
            case GENERIC_DATE -> temporal(column, now().minusDays(between(0, 730)), true);
            case GENERIC_TIMESTAMP -> temporal(column, now().minusDays(between(0, 730)).minusSeconds(between(0, 86_399)), false);
            case JSON_DOCUMENT -> SqlValue.quoted("{\"generated\": true, \"tag\": \"" + faker.lorem().word() + "\"}");
            case ARRAY_VALUE -> SqlValue.quoted("{\"" + faker.lorem().word() + "\",\"" + faker.lorem().word() + "\"}");
            case UNRECOGNIZED -> SqlValue.nullValue();
        };
    }

    /**
     * Key value used when no referenced value exists: the 1-based row number, or a fresh UUID
     * for uuid columns.
     */
    public SqlValue defaultSubstitute(ColumnMetadata column, int rowIndex) {
        return keyValue(column, rowIndex);
    }

    /**
     * Draws one referenced row for a composite foreign key.
     *
     * @return the referenced column values of that row, empty when no row qualifies
     */
    public Optional<Map<String, String>> drawReferencedRow(String referencedTable, List<String> referencedColumns) {
        return referencePool.sampleRow(referencedTable, referencedColumns, random);
    }

    /** Renders a value taken from a referenced row for the referencing column. */
    public SqlValue referenceValue(ColumnMetadata column, String value) {
        return keyLiteral(column, value);
    }

    // --- keys ---

    private SqlValue keyValue(ColumnMetadata column, int rowIndex) {
        if (column.getTypeTag() == DataTypeTag.UUID) {
            return SqlValue.quoted(randomUuid());
        }
        return keyLiteral(column, String.valueOf(rowIndex + 1));
    }

    private SqlValue keyLiteral(ColumnMetadata column, String value) {
        return column.getTypeTag().isNumeric() ? SqlValue.unquoted(value) : SqlValue.quoted(value);
    }

    private SqlValue fromSamples(ColumnMetadata column) {
        String sample = pick(column.getSampleValues());
        return column.getTypeTag().isUnquotedLiteral() ? SqlValue.unquoted(sample) : SqlValue.quoted(sample);
    }

    // --- people, organisations, web ---

    private String fullName(RowContext context) {
        Optional<String> first = context.get(ContextKeys.FIRST_NAME);
        Optional<String> last = context.get(ContextKeys.LAST_NAME);
        if (first.isPresent() && last.isPresent()) {
            return first.get() + " " + last.get();
        }
        return faker.name().firstName() + " " + faker.name().lastName();
    }

    /**
     * "first.last" from the names in context, "user&lt;n&gt;" without them.
     */
    String username(RowContext context, int rowIndex) {
        Optional<String> first = context.get(ContextKeys.FIRST_NAME);
        Optional<String> last = context.get(ContextKeys.LAST_NAME);
        if (first.isPresent() && last.isPresent()) {
            return slug(first.get()) + "." + slug(last.get());
        }
        Optional<String> fullName = context.get(ContextKeys.FULL_NAME);
        if (fullName.isPresent()) {
            String[] parts = fullName.get().trim().split("\\s+");
            if (parts.length >= 2) {
                return slug(parts[0]) + "." + slug(parts[parts.length - 1]);
            }
        }
        return "user" + (rowIndex + 1);
    }

    String email(RowContext context, int rowIndex) {
        String localPart = context.get(ContextKeys.USERNAME)
                .map(u -> u.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", ""))
                .filter(u -> !u.isEmpty())
                .orElseGet(() -> username(context, rowIndex));

        String domain = context.get(ContextKeys.DOMAIN_NAME)
                .orElseGet(() -> companySlug(context)
                        .map(slug -> slug + ".com")
                        .orElseGet(() -> pick(Corpora.EMAIL_PROVIDERS)));

        return localPart + "@" + domain;
    }

    private String domainName(RowContext context) {
        return companySlug(context)
                .map(slug -> slug + ".com")
                .orElseGet(() -> slug(faker.lorem().word()) + pick(Corpora.TOP_LEVEL_DOMAINS));
    }

    private String websiteHost(RowContext context) {
        return context.get(ContextKeys.DOMAIN_NAME)
                .map(domain -> "www." + domain)
                .orElseGet(() -> "www." + domainName(context));
    }

    /**
     * Lower-case company name without punctuation or legal-form words: "Smith, Jones and Sons" -> "smithjonessons".
     */
    Optional<String> companySlug(RowContext context) {
        return context.get(ContextKeys.COMPANY_NAME).map(company -> {
            StringBuilder slug = new StringBuilder();
            for (String word : company.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
                if (!word.isEmpty() && !Corpora.COMPANY_STOP_WORDS.contains(word)) {
                    slug.append(word);
                }
            }
            return slug.toString();
        }).filter(s -> !s.isEmpty());
    }

    private String identifierCode(String columnName) {
        String name = columnName.toLowerCase(Locale.ROOT);
        String prefix = null;
        for (Map.Entry<String, String> entry : Corpora.IDENTIFIER_PREFIXES.entrySet()) {
            if (name.contains(entry.getKey())) {
                prefix = entry.getValue();
                break;
            }
        }
        if (prefix == null) {
            prefix = randomString("ABCDEFGHIJKLMNOPQRSTUVWXYZ", 3);
        }
        return prefix + "-" + String.format("%04d", between(0, 9999)) + "-" + String.format("%04d", between(0, 9999));
    }

    private String fileName() {
        return slug(faker.lorem().word()) + "_" + slug(faker.lorem().word()) + "." + faker.file().extension();
    }

    // --- network ---

    private String privateIpv4() {
        return switch (random.nextInt(3)) {
            case 0 -> "10." + between(0, 255) + "." + between(0, 255) + "." + between(1, 254);
            case 1 -> "172." + between(16, 31) + "." + between(0, 255) + "." + between(1, 254);
            default -> "192.168." + between(0, 255) + "." + between(1, 254);
        };
    }

    private String macAddress() {
        List<String> pairs = new ArrayList<>(6);
        for (int i = 0; i < 6; i++) {
            pairs.add(randomString(HEX, 2));
        }
        return String.join(":", pairs);
    }

    // --- dates ---

    private LocalDateTime now() {
        return LocalDateTime.now(clock).withNano(0);
    }

    private LocalDateTime endDate(RowContext context) {
        LocalDateTime start = context.getMostRecentStartDate()
                .orElseGet(() -> now().minusDays(between(0, 365)));
        return start.plusDays(between(30, 730));
    }

    private LocalDateTime updatedDate(RowContext context) {
        LocalDateTime updated = now().minusDays(between(1, 90)).minusSeconds(between(0, 86_399));
        Optional<LocalDateTime> start = context.getMostRecentStartDate();
        if (start.isPresent() && updated.isBefore(start.get())) {
            return start.get().plusDays(between(1, 30));
        }
        return updated;
    }

    private SqlValue temporal(ColumnMetadata column, LocalDateTime value, boolean dateOnly) {
        if (dateOnly || column.getTypeTag() == DataTypeTag.DATE) {
            return SqlValue.quoted(value.toLocalDate().format(RowContext.DATE_FORMAT));
        }
        return SqlValue.quoted(value.format(RowContext.TIMESTAMP_FORMAT));
    }

    // --- numbers ---

    private SqlValue number(ColumnMetadata column, String value) {
        return column.getTypeTag().isNumeric() ? SqlValue.unquoted(value) : text(column, value);
    }

    /**
     * A whole number in [min, max]; the upper bound is lowered to what an integer column holds.
     */
    private SqlValue wholeNumber(ColumnMetadata column, int min, int max) {
        int upper = (int) Math.min(max, column.getIntegerMaximum());
        return number(column, String.valueOf(between(Math.min(min, upper), upper)));
    }

    /**
     * A decimal in [min, max], kept within the column's precision and scale.
     * Integer columns get a whole number from the same range.
     */
    private SqlValue decimal(ColumnMetadata column, double min, double max, int preferredScale) {
        if (column.getTypeTag() == DataTypeTag.INTEGER) {
            return wholeNumber(column, (int) Math.ceil(min), (int) Math.floor(max));
        }
        int scale = column.getTypeTag() == DataTypeTag.DECIMAL ? scaleOf(column, preferredScale) : preferredScale;
        double upper = max;
        if (column.getTypeTag() == DataTypeTag.DECIMAL) {
            double limit = Math.pow(10, wholeDigitsOf(column)) - Math.pow(10, -scale);
            upper = Math.min(max, limit);
        }
        double lower = Math.min(min, upper);
        double value = lower + random.nextDouble() * (upper - lower);
        return number(column, BigDecimal.valueOf(value).setScale(scale, RoundingMode.DOWN).toPlainString());
    }

    private SqlValue genericDecimal(ColumnMetadata column) {
        int scale = scaleOf(column, DEFAULT_SCALE);
        double limit = Math.pow(10, wholeDigitsOf(column));
        double value = random.nextDouble() * limit;
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(scale, RoundingMode.DOWN);
        if (decimal.compareTo(BigDecimal.valueOf(limit)) >= 0) {
            decimal = BigDecimal.ZERO.setScale(scale, RoundingMode.DOWN);
        }
        return number(column, decimal.toPlainString());
    }

    private static int scaleOf(ColumnMetadata column, int fallback) {
        if (column.getNumericScale() != null) {
            return Math.max(0, column.getNumericScale());
        }
        return column.getNumericPrecision() != null ? 0 : fallback;
    }

    private static int wholeDigitsOf(ColumnMetadata column) {
        int precision = column.getNumericPrecision() != null ? column.getNumericPrecision() : DEFAULT_PRECISION;
        int scale = scaleOf(column, DEFAULT_SCALE);
        return Math.max(0, Math.min(precision - scale, MAX_WHOLE_DIGITS));
    }

    // --- text ---

    private SqlValue text(ColumnMetadata column, String value) {
        Integer length = column.getCharacterLength();
        if (length != null && length > 0 && value.length() > length) {
            value = value.substring(0, length);
        }
        return SqlValue.quoted(value);
    }

    private static String slug(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    private static String stripPeriod(String sentence) {
        return sentence.endsWith(".") ? sentence.substring(0, sentence.length() - 1) : sentence;
    }

    // --- randomness ---

    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private String randomUuid() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40); // version 4
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80); // IETF variant
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (bytes[i] & 0xff);
        }
        for (int i = 8; i < 16; i++) {
            lsb = (lsb << 8) | (bytes[i] & 0xff);
        }
        return new UUID(msb, lsb).toString();
    }
}
