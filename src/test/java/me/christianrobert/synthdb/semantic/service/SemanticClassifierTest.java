package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.schema.model.ColumnMetadata;
import me.christianrobert.synthdb.schema.model.ForeignKeyMetadata;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.semantic.model.SemanticCategory;
import me.christianrobert.synthdb.semantic.model.SemanticType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticClassifierTest {

    private final SemanticClassifier classifier = new SemanticClassifier();

    private SemanticCategory categoryOf(String table, String column, String type) {
        return classifier.classify(new ColumnMetadata(column, type, true), table, false, null, null).getCategory();
    }

    @Test
    void testForeignKeyWinsOverEverything() {
        ColumnMetadata companyId = new ColumnMetadata("company_id", "integer", false);
        TableMetadata employees = new TableMetadata("employees",
                List.of(new ColumnMetadata("id", "integer", false).asPrimaryKey(), companyId),
                List.of(new ForeignKeyMetadata("company_id", "companies", "id")));

        SemanticType type = classifier.classify(companyId, employees);

        assertTrue(type.isForeignKey());
        assertEquals("companies", type.getReferencedTable());
        assertEquals("id", type.getReferencedColumn());
    }

    @Test
    void testPrimaryKeyByFlagAndConvention() {
        ColumnMetadata flagged = new ColumnMetadata("code", "text", false).asPrimaryKey();
        assertEquals(SemanticCategory.PRIMARY_KEY,
                classifier.classify(flagged, "currencies", false, null, null).getCategory());

        assertEquals(SemanticCategory.PRIMARY_KEY, categoryOf("employees", "id", "integer"));
        assertEquals(SemanticCategory.PRIMARY_KEY, categoryOf("employees", "employee_id", "integer"));
        assertEquals(SemanticCategory.PRIMARY_KEY, categoryOf("companies", "company_id", "integer"));
        assertEquals(SemanticCategory.PRIMARY_KEY, categoryOf("addresses", "address_id", "integer"));
    }

    @Test
    void testReferenceLikeColumnIsNotPrimaryKey() {
        assertFalse(SemanticClassifier.isPrimaryKeyByConvention("company_id", "employees"));
        assertEquals(SemanticCategory.GENERIC_INTEGER, categoryOf("orders", "company_id", "integer"));
        assertEquals(SemanticCategory.IDENTIFIER_CODE, categoryOf("orders", "external_id", "text"));
    }

    @Test
    void testTableStems() {
        assertTrue(SemanticClassifier.tableStems("companies").contains("company"));
        assertTrue(SemanticClassifier.tableStems("boxes").contains("box"));
        assertTrue(SemanticClassifier.tableStems("users").contains("user"));
        assertFalse(SemanticClassifier.tableStems("address").contains("addres"));
    }

    @Test
    void testPersonalColumns() {
        assertEquals(SemanticCategory.FIRST_NAME, categoryOf("employees", "first_name", "text"));
        assertEquals(SemanticCategory.LAST_NAME, categoryOf("employees", "lastName", "varchar(50)"));
        assertEquals(SemanticCategory.EMAIL, categoryOf("employees", "email", "text"));
        assertEquals(SemanticCategory.PHONE, categoryOf("employees", "phone_number", "text"));
        assertEquals(SemanticCategory.USERNAME, categoryOf("users", "username", "text"));
    }

    @Test
    void testGenericNameResolvedThroughTable() {
        assertEquals(SemanticCategory.COMPANY_NAME, categoryOf("companies", "name", "text"));
        assertEquals(SemanticCategory.FULL_NAME, categoryOf("customers", "name", "text"));
        assertEquals(SemanticCategory.PRODUCT_NAME, categoryOf("products", "name", "text"));
        assertEquals(SemanticCategory.FICTION_LOCATION, categoryOf("planets", "name", "text"));
        assertEquals(SemanticCategory.ENTITY_NAME, categoryOf("widgets", "name", "text"));
    }

    @Test
    void testTemporalColumns() {
        assertEquals(SemanticCategory.START_DATE, categoryOf("employees", "created_at", "timestamp"));
        assertEquals(SemanticCategory.END_DATE, categoryOf("contracts", "expires_on", "date"));
        assertEquals(SemanticCategory.UPDATED_DATE, categoryOf("users", "last_login_at", "timestamp"));
        assertEquals(SemanticCategory.BIRTH_DATE, categoryOf("users", "date_of_birth", "date"));
    }

    @Test
    void testNetworkColumnsBeforeStreetAddress() {
        assertEquals(SemanticCategory.IPV4_ADDRESS, categoryOf("sessions", "ip_address", "text"));
        assertEquals(SemanticCategory.MAC_ADDRESS, categoryOf("devices", "mac_address", "text"));
        assertEquals(SemanticCategory.STREET_ADDRESS, categoryOf("orders", "shipping_address", "text"));
        assertEquals(SemanticCategory.USER_AGENT, categoryOf("sessions", "user_agent", "text"));
    }

    @Test
    void testEntityPrefixedAttributesKeepTheirAttributeCategory() {
        assertEquals(SemanticCategory.STREET_ADDRESS, categoryOf("orders", "customer_address", "text"));
        assertEquals(SemanticCategory.STREET_ADDRESS, categoryOf("orders", "company_address", "text"));
        assertEquals(SemanticCategory.STATUS, categoryOf("orders", "customer_status", "text"));
        assertEquals(SemanticCategory.STATUS, categoryOf("orders", "vendor_status", "text"));
        assertEquals(SemanticCategory.CITY, categoryOf("orders", "customer_city", "text"));
        assertEquals(SemanticCategory.COUNTRY, categoryOf("orders", "company_country", "text"));
        assertEquals(SemanticCategory.DESCRIPTION, categoryOf("orders", "product_description", "text"));
        assertEquals(SemanticCategory.CATEGORY, categoryOf("orders", "product_category", "text"));
        assertEquals(SemanticCategory.BODY_TEXT, categoryOf("orders", "owner_notes", "text"));
    }

    @Test
    void testEntityNamesStillMatch() {
        assertEquals(SemanticCategory.COMPANY_NAME, categoryOf("orders", "company_name", "text"));
        assertEquals(SemanticCategory.COMPANY_NAME, categoryOf("orders", "vendor", "text"));
        assertEquals(SemanticCategory.PRODUCT_NAME, categoryOf("orders", "product_name", "text"));
        assertEquals(SemanticCategory.FULL_NAME, categoryOf("orders", "customer", "text"));
        assertEquals(SemanticCategory.FULL_NAME, categoryOf("tickets", "assignee", "text"));
    }

    @Test
    void testEmailDomainIsADomain() {
        assertEquals(SemanticCategory.DOMAIN_NAME, categoryOf("users", "email_domain", "text"));
        assertEquals(SemanticCategory.EMAIL, categoryOf("users", "domain_email", "text"));
        assertEquals(SemanticCategory.EMAIL, categoryOf("users", "contact_email", "text"));
    }

    @Test
    void testHardwareAddressTypeNeverBecomesIpAddress() {
        assertEquals(SemanticCategory.MAC_ADDRESS, categoryOf("devices", "device_hw", "macaddr"));
        assertEquals(SemanticCategory.MAC_ADDRESS, categoryOf("devices", "last_ip", "macaddr8"));
        assertEquals(SemanticCategory.MAC_ADDRESS, categoryOf("devices", "mac_address", "macaddr"));
        assertEquals(SemanticCategory.IPV4_ADDRESS, categoryOf("devices", "last_seen_from", "inet"));
    }

    @Test
    void testIncompatibleRuleFallsBackToDeclaredType() {
        assertEquals(SemanticCategory.GENERIC_INTEGER, categoryOf("events", "created_at", "integer"));
        assertEquals(SemanticCategory.MONEY_AMOUNT, categoryOf("employees", "salary", "numeric(10,2)"));
        assertEquals(SemanticCategory.JSON_DOCUMENT, categoryOf("users", "settings", "jsonb"));
        assertEquals(SemanticCategory.UNRECOGNIZED, categoryOf("docs", "search_vector", "tsvector"));
    }

    @Test
    void testDeclaredTypeShortcuts() {
        assertEquals(SemanticCategory.UUID, categoryOf("sessions", "token_ref", "uuid"));
        assertEquals(SemanticCategory.BOOLEAN_FLAG, categoryOf("users", "email_verified", "boolean"));
    }

    @Test
    void testSampleValueEvidence() {
        ColumnMetadata column = new ColumnMetadata("code", "text", true);

        SemanticType type = classifier.classify(column, "accounts", false, null, List.of("active", "pending"));

        assertEquals(SemanticCategory.STATUS, type.getCategory());
    }

    @Test
    void testSampleEvidenceMustFitDeclaredType() {
        ColumnMetadata column = new ColumnMetadata("host", "integer", true);

        SemanticType type = classifier.classify(column, "servers", false, null, List.of("10.0.0.1"));

        assertEquals(SemanticCategory.GENERIC_INTEGER, type.getCategory());
    }

    @Test
    void testSameInputsSameResult() {
        ColumnMetadata column = new ColumnMetadata("description", "text", true);

        SemanticType first = classifier.classify(column, "products", false, null, null);
        SemanticType second = new SemanticClassifier().classify(column, "products", false, null, null);

        assertEquals(first, second);
        assertEquals(SemanticCategory.DESCRIPTION, first.getCategory());
    }

    @Test
    void testCustomRules() {
        SemanticClassifier custom = new SemanticClassifier(List.of(
                ClassificationRule.named("ship name").whenToken("vessel").classifyAs(SemanticCategory.FICTION_VESSEL)));

        SemanticType type = custom.classify(new ColumnMetadata("vessel", "text", true), "fleet", false, null, null);
        SemanticType other = custom.classify(new ColumnMetadata("first_name", "text", true), "fleet", false, null, null);

        assertEquals(SemanticCategory.FICTION_VESSEL, type.getCategory());
        assertEquals(SemanticCategory.GENERIC_TEXT, other.getCategory());
    }
}
