package me.christianrobert.synthdb.semantic.model;

/**
 * Coarse grouping of semantic categories, used for reporting and rule organisation.
 */
public enum SemanticGroup {
    IDENTITY,
    PERSONAL,
    ORGANIZATIONAL,
    GEOGRAPHIC,
    CONTACT,
    WEB_NETWORK,
    TEMPORAL,
    FINANCIAL,
    CRYPTOGRAPHIC,
    STATUS,
    CODE,
    DOMAIN_FICTION,
    CONTENT,
    FILE,
    MEASUREMENT,
    VERSION,
    TYPE_FALLBACK
}
