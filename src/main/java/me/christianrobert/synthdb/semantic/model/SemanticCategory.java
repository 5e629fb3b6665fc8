package me.christianrobert.synthdb.semantic.model;

import me.christianrobert.synthdb.schema.model.DataTypeTag;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of column meanings the synthesizer knows how to generate.
 *
 * <p>Every constant carries:</p>
 * <ul>
 *   <li>its {@link SemanticGroup}</li>
 *   <li>its generation priority: higher values are generated earlier within a row, so that
 *       derived values (usernames, domains, emails) can read the names and organisations
 *       generated before them</li>
 *   <li>its value {@link Shape}, which decides the declared types a name rule may assign it to</li>
 * </ul>
 *
 * <p>The value synthesizer switches exhaustively over this enum; adding a constant without a
 * generation rule does not compile.</p>
 */
public enum SemanticCategory {

    // Identity
    PRIMARY_KEY(SemanticGroup.IDENTITY, Priority.IDENTITY, Shape.ANY),
    FOREIGN_KEY(SemanticGroup.IDENTITY, Priority.IDENTITY, Shape.ANY),
    UUID(SemanticGroup.IDENTITY, Priority.DEFAULT, Shape.ANY),

    // Personal
    FIRST_NAME(SemanticGroup.PERSONAL, Priority.PERSON_NAME, Shape.TEXTUAL),
    LAST_NAME(SemanticGroup.PERSONAL, Priority.PERSON_NAME, Shape.TEXTUAL),
    FULL_NAME(SemanticGroup.PERSONAL, Priority.FULL_NAME, Shape.TEXTUAL),
    USERNAME(SemanticGroup.PERSONAL, Priority.USERNAME, Shape.TEXTUAL),
    GENDER(SemanticGroup.PERSONAL, Priority.DEFAULT, Shape.TEXTUAL),
    BIRTH_DATE(SemanticGroup.PERSONAL, Priority.DEFAULT, Shape.TEMPORAL),
    AGE(SemanticGroup.PERSONAL, Priority.DEFAULT, Shape.NUMERIC),
    JOB_TITLE(SemanticGroup.PERSONAL, Priority.DEFAULT, Shape.TEXTUAL),

    // Organizational
    COMPANY_NAME(SemanticGroup.ORGANIZATIONAL, Priority.ORGANIZATION, Shape.TEXTUAL),
    DEPARTMENT(SemanticGroup.ORGANIZATIONAL, Priority.DEFAULT, Shape.TEXTUAL),
    INDUSTRY(SemanticGroup.ORGANIZATIONAL, Priority.DEFAULT, Shape.TEXTUAL),
    PRODUCT_NAME(SemanticGroup.ORGANIZATIONAL, Priority.DEFAULT, Shape.TEXTUAL),
    ENTITY_NAME(SemanticGroup.ORGANIZATIONAL, Priority.DEFAULT, Shape.TEXTUAL),

    // Geographic
    STREET_ADDRESS(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    CITY(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    STATE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    COUNTRY(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    COUNTRY_CODE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    POSTAL_CODE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    LATITUDE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.NUMERIC),
    LONGITUDE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.NUMERIC),
    TIMEZONE(SemanticGroup.GEOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),

    // Contact
    EMAIL(SemanticGroup.CONTACT, Priority.EMAIL, Shape.TEXTUAL),
    PHONE(SemanticGroup.CONTACT, Priority.DEFAULT, Shape.TEXTUAL),

    // Web / network
    URL(SemanticGroup.WEB_NETWORK, Priority.WEBSITE, Shape.TEXTUAL),
    DOMAIN_NAME(SemanticGroup.WEB_NETWORK, Priority.DOMAIN, Shape.TEXTUAL),
    HOSTNAME(SemanticGroup.WEB_NETWORK, Priority.DEFAULT, Shape.TEXTUAL),
    IPV4_ADDRESS(SemanticGroup.WEB_NETWORK, Priority.DEFAULT, Shape.NETWORK),
    MAC_ADDRESS(SemanticGroup.WEB_NETWORK, Priority.DEFAULT, Shape.HARDWARE),
    PORT(SemanticGroup.WEB_NETWORK, Priority.DEFAULT, Shape.NUMERIC),
    USER_AGENT(SemanticGroup.WEB_NETWORK, Priority.DEFAULT, Shape.TEXTUAL),

    // Temporal
    START_DATE(SemanticGroup.TEMPORAL, Priority.START_DATE, Shape.TEMPORAL),
    END_DATE(SemanticGroup.TEMPORAL, Priority.DEFAULT, Shape.TEMPORAL),
    UPDATED_DATE(SemanticGroup.TEMPORAL, Priority.DEFAULT, Shape.TEMPORAL),

    // Financial
    MONEY_AMOUNT(SemanticGroup.FINANCIAL, Priority.DEFAULT, Shape.NUMERIC),
    CURRENCY_CODE(SemanticGroup.FINANCIAL, Priority.DEFAULT, Shape.TEXTUAL),
    PERCENTAGE(SemanticGroup.FINANCIAL, Priority.DEFAULT, Shape.NUMERIC),

    // Cryptographic-looking
    HASH(SemanticGroup.CRYPTOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    PASSWORD_HASH(SemanticGroup.CRYPTOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),
    API_TOKEN(SemanticGroup.CRYPTOGRAPHIC, Priority.DEFAULT, Shape.TEXTUAL),

    // Status / classification
    STATUS(SemanticGroup.STATUS, Priority.DEFAULT, Shape.TEXTUAL),
    PRIORITY(SemanticGroup.STATUS, Priority.DEFAULT, Shape.TEXTUAL),
    SKILL_LEVEL(SemanticGroup.STATUS, Priority.DEFAULT, Shape.TEXTUAL),
    CLASSIFICATION(SemanticGroup.STATUS, Priority.DEFAULT, Shape.TEXTUAL),
    CATEGORY(SemanticGroup.STATUS, Priority.DEFAULT, Shape.TEXTUAL),

    // Code / identifier
    IDENTIFIER_CODE(SemanticGroup.CODE, Priority.DEFAULT, Shape.TEXTUAL),

    // Domain fiction / gaming
    FICTION_LOCATION(SemanticGroup.DOMAIN_FICTION, Priority.DEFAULT, Shape.TEXTUAL),
    FICTION_VESSEL(SemanticGroup.DOMAIN_FICTION, Priority.DEFAULT, Shape.TEXTUAL),

    // Content
    TITLE(SemanticGroup.CONTENT, Priority.DEFAULT, Shape.TEXTUAL),
    DESCRIPTION(SemanticGroup.CONTENT, Priority.DEFAULT, Shape.TEXTUAL),
    BODY_TEXT(SemanticGroup.CONTENT, Priority.DEFAULT, Shape.TEXTUAL),
    TAG_LIST(SemanticGroup.CONTENT, Priority.DEFAULT, Shape.TEXTUAL),
    COLOR(SemanticGroup.CONTENT, Priority.DEFAULT, Shape.TEXTUAL),

    // File / path
    FILE_NAME(SemanticGroup.FILE, Priority.DEFAULT, Shape.TEXTUAL),
    FILE_PATH(SemanticGroup.FILE, Priority.DEFAULT, Shape.TEXTUAL),
    MIME_TYPE(SemanticGroup.FILE, Priority.DEFAULT, Shape.TEXTUAL),
    FILE_SIZE(SemanticGroup.FILE, Priority.DEFAULT, Shape.NUMERIC),

    // Measurement
    QUANTITY(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),
    CAPACITY(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),
    WEIGHT(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),
    DIMENSION(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),
    RATING(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),
    DURATION(SemanticGroup.MEASUREMENT, Priority.DEFAULT, Shape.NUMERIC),

    // Version
    VERSION(SemanticGroup.VERSION, Priority.DEFAULT, Shape.TEXTUAL),

    // Type-only fallbacks
    BOOLEAN_FLAG(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    GENERIC_INTEGER(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    GENERIC_DECIMAL(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    GENERIC_TEXT(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    GENERIC_DATE(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    GENERIC_TIMESTAMP(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.TEMPORAL),
    JSON_DOCUMENT(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    ARRAY_VALUE(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY),
    UNRECOGNIZED(SemanticGroup.TYPE_FALLBACK, Priority.DEFAULT, Shape.ANY);

    private final SemanticGroup group;
    private final int priority;
    private final Shape shape;

    SemanticCategory(SemanticGroup group, int priority, Shape shape) {
        this.group = group;
        this.priority = priority;
        this.shape = shape;
    }

    public SemanticGroup getGroup() {
        return group;
    }

    /**
     * Generation priority; columns of a row are generated in descending priority.
     */
    public int getPriority() {
        return priority;
    }

    public Shape getShape() {
        return shape;
    }

    /**
     * Whether a value of this category can be stored in a column of the given declared type.
     */
    public boolean isCompatibleWith(DataTypeTag typeTag) {
        return shape.accepts(typeTag);
    }

    /**
     * Generation priorities. Identity first, derived contact data last.
     */
    public static final class Priority {
        public static final int IDENTITY = 100;
        public static final int PERSON_NAME = 90;
        public static final int FULL_NAME = 85;
        public static final int ORGANIZATION = 80;
        public static final int START_DATE = 70;
        public static final int DEFAULT = 50;
        public static final int USERNAME = 40;
        public static final int DOMAIN = 30;
        public static final int WEBSITE = 25;
        public static final int EMAIL = 20;

        private Priority() {
        }
    }

    /**
     * The kind of literal a category produces.
     */
    public enum Shape {
        TEXTUAL(EnumSet.of(DataTypeTag.TEXT)),
        NUMERIC(EnumSet.of(DataTypeTag.INTEGER, DataTypeTag.DECIMAL, DataTypeTag.TEXT)),
        TEMPORAL(EnumSet.of(DataTypeTag.DATE, DataTypeTag.TIMESTAMP, DataTypeTag.TEXT)),
        NETWORK(EnumSet.of(DataTypeTag.NETWORK_ADDRESS, DataTypeTag.TEXT)),
        HARDWARE(EnumSet.of(DataTypeTag.HARDWARE_ADDRESS, DataTypeTag.TEXT)),
        ANY(EnumSet.allOf(DataTypeTag.class));

        private final Set<DataTypeTag> acceptedTypes;

        Shape(Set<DataTypeTag> acceptedTypes) {
            this.acceptedTypes = acceptedTypes;
        }

        public boolean accepts(DataTypeTag typeTag) {
            return acceptedTypes.contains(typeTag);
        }
    }
}
