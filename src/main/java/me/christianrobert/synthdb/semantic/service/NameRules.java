package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;

import java.util.List;

import static me.christianrobert.synthdb.semantic.service.ClassificationRule.named;

/**
 * Ordered name-based classification rules. The first rule that matches (and whose category is
 * compatible with the column's declared type) wins, so more specific rules come first:
 *
 * 1. Temporal markers ("last_login_at" must not become a username because of "login")
 * 2. Identifier-like names, network and contact data ("ip_address" before the street address rule)
 * 3. Credentials and personal data
 * 4. Files, organisations, geography, money, status vocabularies, codes
 * 5. Domain fiction, content, measurements, versions
 * 6. Generic "name" columns, resolved through the owning table's name
 */
public final class NameRules {

    static final String[] PERSON_TABLES = {
            "user", "users", "person", "persons", "people", "employee", "employees", "customer", "customers",
            "member", "members", "contact", "contacts", "author", "authors", "student", "students",
            "teacher", "teachers", "patient", "patients", "player", "players", "staff", "agent", "agents",
            "account", "accounts", "owner", "owners", "client", "clients", "crew", "pilot", "pilots"
    };

    static final String[] ORGANIZATION_TABLES = {
            "company", "companies", "organization", "organizations", "organisation", "organisations",
            "vendor", "vendors", "supplier", "suppliers", "manufacturer", "manufacturers", "tenant", "tenants",
            "firm", "firms", "agency", "agencies", "corporation", "corporations", "publisher", "publishers",
            "brand", "brands", "partner", "partners", "employer", "employers"
    };

    static final String[] PRODUCT_TABLES = {
            "product", "products", "item", "items", "article", "articles", "good", "goods", "sku", "skus",
            "catalog", "catalogue", "inventory", "merchandise"
    };

    static final String[] FICTION_TABLES = {
            "planet", "planets", "sector", "sectors", "outpost", "outposts", "station", "stations",
            "colony", "colonies", "galaxy", "galaxies", "realm", "realms", "dungeon", "dungeons",
            "world", "worlds", "system", "systems", "moon", "moons", "base", "bases", "zone", "zones"
    };

    static final String[] ADDRESS_TABLES = {
            "address", "addresses", "location", "locations", "office", "offices", "store", "stores",
            "branch", "branches", "warehouse", "warehouses", "site", "sites", "customer", "customers",
            "user", "users", "person", "persons", "people", "contact", "contacts", "employee", "employees",
            "company", "companies", "vendor", "vendors", "supplier", "suppliers", "shipment", "shipments"
    };

    private static final String[] GENERIC_NAME_EXCLUSIONS = {
            "user", "file", "domain", "host", "nick", "screen", "login"
    };

    /**
     * Attribute words that turn an entity prefix into a qualifier: "customer_status" is a status,
     * "company_country" a country and "product_category" a category, not a name.
     */
    private static final String[] ENTITY_ATTRIBUTE_TOKENS = {
            "address", "street", "city", "country", "state", "province", "region", "zip", "postal", "postcode",
            "status", "stage", "type", "kind", "category", "tier", "segment", "description", "desc", "summary",
            "notes", "note", "comment", "comments", "title", "code", "number", "no", "num", "size", "count",
            "level", "rating", "score", "price", "amount", "quantity", "qty", "weight", "version", "color",
            "colour"
    };

    private static final String[] ENTITY_ATTRIBUTE_FRAGMENTS = {
            "address", "street", "city", "country", "postal", "zipcode", "status", "category", "description"
    };

    public static final List<ClassificationRule> DEFAULT_RULES = List.of(
            // Temporal
            named("birth date")
                    .whenContains("birthdate", "birthday", "dateofbirth")
                    .whenToken("dob", "born")
                    .classifyAs(SemanticCategory.BIRTH_DATE),
            named("end date")
                    .whenToken("end", "ends", "ended", "expires", "expired", "expiry", "expiration", "until",
                            "due", "deadline", "closed", "finished", "completed", "terminated", "cancelled",
                            "canceled", "resolved", "retired")
                    .requireTemporalMarker()
                    .classifyAs(SemanticCategory.END_DATE),
            named("start date")
                    .whenToken("start", "started", "starts", "signed", "created", "established", "launched",
                            "founded", "opened", "hired", "joined", "registered", "enrolled", "issued",
                            "began", "since", "commissioned")
                    .requireTemporalMarker()
                    .classifyAs(SemanticCategory.START_DATE),
            named("update date")
                    .whenToken("updated", "modified", "changed", "edited", "synced", "refreshed", "seen",
                            "touched", "last")
                    .requireTemporalMarker()
                    .classifyAs(SemanticCategory.UPDATED_DATE),
            named("timestamp")
                    .whenToken("at", "date", "time", "timestamp", "datetime", "ts", "dt")
                    .classifyAs(SemanticCategory.GENERIC_TIMESTAMP),

            // Identifier-like names that are neither primary nor foreign keys
            named("uuid text")
                    .when(c -> c.lastTokenIs("uuid", "guid"))
                    .classifyAs(SemanticCategory.UUID),
            named("opaque identifier")
                    .when(c -> c.lastTokenIs("id", "ids"))
                    .classifyAs(SemanticCategory.IDENTIFIER_CODE),
            named("numeric identifier")
                    .when(c -> c.lastTokenIs("id", "ids") && c.getTypeTag().isNumeric())
                    .classifyAs(SemanticCategory.GENERIC_INTEGER),

            // Web / network
            named("mac address")
                    .whenToken("mac")
                    .whenContains("macaddress", "macaddr", "hwaddr", "hardwareaddress")
                    .classifyAs(SemanticCategory.MAC_ADDRESS),
            named("ip address")
                    .whenToken("ip", "ipv4", "ipaddr", "inet")
                    .whenContains("ipaddress")
                    .classifyAs(SemanticCategory.IPV4_ADDRESS),
            named("user agent")
                    .whenContains("useragent")
                    .classifyAs(SemanticCategory.USER_AGENT),
            named("port")
                    .whenToken("port")
                    .classifyAs(SemanticCategory.PORT),
            named("domain")
                    .whenToken("domain")
                    .whenContains("domainname")
                    .unless(c -> c.lastTokenIs("email", "emails", "mail"))
                    .classifyAs(SemanticCategory.DOMAIN_NAME),
            named("url")
                    .whenToken("url", "uri", "website", "homepage", "link", "href", "site", "web")
                    .whenContains("website", "webpage")
                    .classifyAs(SemanticCategory.URL),
            named("hostname")
                    .whenToken("host", "hostname", "server", "fqdn")
                    .classifyAs(SemanticCategory.HOSTNAME),

            // Contact
            named("email")
                    .whenContains("email")
                    .classifyAs(SemanticCategory.EMAIL),
            named("phone")
                    .whenContains("phone", "mobile", "telephone")
                    .whenToken("cell", "fax", "tel")
                    .classifyAs(SemanticCategory.PHONE),

            // Credentials
            named("password hash")
                    .whenContains("password", "passwd", "passphrase")
                    .whenToken("pwd", "pw")
                    .classifyAs(SemanticCategory.PASSWORD_HASH),
            named("token")
                    .whenToken("token", "secret", "nonce", "salt", "otp")
                    .whenContains("apikey", "accesskey", "secretkey")
                    .classifyAs(SemanticCategory.API_TOKEN),
            named("hash")
                    .whenToken("hash", "checksum", "digest", "fingerprint", "sha", "sha1", "sha256", "md5", "etag")
                    .classifyAs(SemanticCategory.HASH),

            // Personal
            named("first name")
                    .whenContains("firstname", "givenname", "forename")
                    .whenToken("fname")
                    .classifyAs(SemanticCategory.FIRST_NAME),
            named("last name")
                    .whenContains("lastname", "surname", "familyname")
                    .whenToken("lname")
                    .classifyAs(SemanticCategory.LAST_NAME),
            named("full name")
                    .whenContains("fullname", "displayname", "contactname", "customername", "authorname",
                            "ownername", "realname", "personname", "employeename")
                    .classifyAs(SemanticCategory.FULL_NAME),
            named("username")
                    .whenContains("username", "nickname", "screenname", "gamertag", "loginname")
                    .whenToken("login", "handle", "alias", "callsign")
                    .unlessContains("email")
                    .classifyAs(SemanticCategory.USERNAME),
            named("gender")
                    .whenToken("gender", "sex")
                    .classifyAs(SemanticCategory.GENDER),
            named("age")
                    .whenToken("age")
                    .classifyAs(SemanticCategory.AGE),
            named("job title")
                    .whenContains("jobtitle", "occupation", "profession", "designation")
                    .whenToken("position")
                    .classifyAs(SemanticCategory.JOB_TITLE),
            named("person reference")
                    .whenToken("author", "owner", "assignee", "reporter", "manager", "creator", "recipient",
                            "sender", "contact", "customer", "employee", "supervisor")
                    .unlessToken(ENTITY_ATTRIBUTE_TOKENS)
                    .unlessContains(ENTITY_ATTRIBUTE_FRAGMENTS)
                    .classifyAs(SemanticCategory.FULL_NAME),

            // File / path
            named("mime type")
                    .whenContains("mimetype", "contenttype", "mediatype")
                    .classifyAs(SemanticCategory.MIME_TYPE),
            named("file size")
                    .whenContains("filesize", "sizebytes", "bytes")
                    .classifyAs(SemanticCategory.FILE_SIZE),
            named("file path")
                    .whenContains("filepath", "path", "directory", "folder")
                    .whenToken("dir")
                    .classifyAs(SemanticCategory.FILE_PATH),
            named("file name")
                    .whenContains("filename", "attachment")
                    .whenToken("file")
                    .classifyAs(SemanticCategory.FILE_NAME),

            // Organizational
            named("company")
                    .whenContains("company", "organization", "organisation", "employer", "vendor", "supplier",
                            "manufacturer", "brand", "publisher", "agency", "corporation")
                    .whenToken("org", "firm", "business")
                    .unlessToken(ENTITY_ATTRIBUTE_TOKENS)
                    .unlessContains(ENTITY_ATTRIBUTE_FRAGMENTS)
                    .classifyAs(SemanticCategory.COMPANY_NAME),
            named("department")
                    .whenContains("department", "division")
                    .whenToken("dept", "team")
                    .classifyAs(SemanticCategory.DEPARTMENT),
            named("industry")
                    .whenContains("industry", "vertical")
                    .classifyAs(SemanticCategory.INDUSTRY),
            named("product")
                    .whenContains("productname", "itemname", "product")
                    .unlessToken(ENTITY_ATTRIBUTE_TOKENS)
                    .unlessContains(ENTITY_ATTRIBUTE_FRAGMENTS)
                    .classifyAs(SemanticCategory.PRODUCT_NAME),

            // Geographic
            named("country code")
                    .whenContains("countrycode", "countryiso")
                    .whenNamed("iso2", "iso3", "iso")
                    .classifyAs(SemanticCategory.COUNTRY_CODE),
            named("country")
                    .whenContains("country", "nationality")
                    .whenToken("nation")
                    .classifyAs(SemanticCategory.COUNTRY),
            named("currency")
                    .whenContains("currency")
                    .whenToken("ccy")
                    .classifyAs(SemanticCategory.CURRENCY_CODE),
            named("postal code")
                    .whenContains("zip", "postal", "postcode")
                    .classifyAs(SemanticCategory.POSTAL_CODE),
            named("city")
                    .whenContains("city")
                    .whenToken("town", "municipality", "locality")
                    .classifyAs(SemanticCategory.CITY),
            named("state of an address")
                    .whenToken("province", "county", "region")
                    .whenContains("stateprovince", "statecode")
                    .when(c -> c.hasToken("state") && c.tableHasToken(ADDRESS_TABLES))
                    .classifyAs(SemanticCategory.STATE),
            named("latitude")
                    .whenToken("lat", "latitude")
                    .classifyAs(SemanticCategory.LATITUDE),
            named("longitude")
                    .whenToken("lng", "lon", "longitude")
                    .classifyAs(SemanticCategory.LONGITUDE),
            named("timezone")
                    .whenContains("timezone")
                    .whenToken("tz")
                    .classifyAs(SemanticCategory.TIMEZONE),
            named("street address")
                    .whenContains("address", "street", "shipping", "billing")
                    .unlessToken("mac", "ip")
                    .unlessContains("email")
                    .classifyAs(SemanticCategory.STREET_ADDRESS),

            // Financial
            named("percentage")
                    .whenContains("percent", "taxrate", "discountrate", "interestrate", "conversionrate",
                            "commissionrate")
                    .whenToken("pct", "ratio")
                    .classifyAs(SemanticCategory.PERCENTAGE),
            named("money")
                    .whenToken("price", "amount", "cost", "salary", "balance", "total", "fee", "fees", "revenue",
                            "budget", "wage", "payment", "subtotal", "tax", "discount", "income", "spend",
                            "rate", "credits", "bounty", "payout")
                    .whenContains("price", "salary")
                    .unlessToken("count")
                    .classifyAs(SemanticCategory.MONEY_AMOUNT),

            // Status / classification
            named("priority")
                    .whenToken("priority", "urgency", "severity")
                    .classifyAs(SemanticCategory.PRIORITY),
            named("skill level")
                    .whenContains("skill", "proficiency", "expertise", "experiencelevel")
                    .whenToken("difficulty")
                    .classifyAs(SemanticCategory.SKILL_LEVEL),
            named("classification")
                    .whenContains("classification", "clearance", "sensitivity", "confidentiality",
                            "securitylevel")
                    .classifyAs(SemanticCategory.CLASSIFICATION),
            named("status")
                    .whenToken("status", "state", "stage", "phase", "lifecycle")
                    .classifyAs(SemanticCategory.STATUS),
            named("category")
                    .whenToken("category", "type", "kind", "genre", "segment", "tier")
                    .classifyAs(SemanticCategory.CATEGORY),

            // Codes and identifiers
            named("identifier code")
                    .whenContains("sku", "tracking", "serial", "badge", "reference", "barcode", "isbn",
                            "invoicenumber", "ordernumber", "confirmation", "voucher", "coupon", "promo",
                            "license", "licence", "plate", "ticket", "code")
                    .whenToken("ref", "upc", "ean")
                    .unlessContains("color", "colour", "zip", "postal")
                    .classifyAs(SemanticCategory.IDENTIFIER_CODE),

            // Domain fiction / gaming
            named("fictional location")
                    .whenToken("sector", "outpost", "planet", "station", "colony", "galaxy", "realm",
                            "dungeon", "quadrant", "moon", "starbase", "homeworld", "world")
                    .classifyAs(SemanticCategory.FICTION_LOCATION),
            named("fictional vessel")
                    .whenToken("ship", "starship", "vessel", "spacecraft", "shuttle", "frigate", "flagship")
                    .classifyAs(SemanticCategory.FICTION_VESSEL),

            // Content
            named("title")
                    .whenToken("title", "headline", "subject", "heading", "caption", "label")
                    .classifyAs(SemanticCategory.TITLE),
            named("description")
                    .whenContains("description", "summary", "biography", "abstract", "overview", "synopsis")
                    .whenToken("desc", "bio", "about", "details")
                    .classifyAs(SemanticCategory.DESCRIPTION),
            named("body text")
                    .whenToken("body", "comment", "comments", "content", "message", "notes", "note", "text",
                            "review", "feedback", "transcript", "lore", "story", "remarks", "instructions")
                    .classifyAs(SemanticCategory.BODY_TEXT),
            named("tags")
                    .whenToken("tags", "keywords", "labels")
                    .classifyAs(SemanticCategory.TAG_LIST),
            named("color")
                    .whenContains("color", "colour")
                    .whenToken("hue")
                    .classifyAs(SemanticCategory.COLOR),

            // Measurement
            named("capacity")
                    .whenContains("capacity", "occupancy")
                    .classifyAs(SemanticCategory.CAPACITY),
            named("quantity")
                    .whenToken("quantity", "qty", "stock", "count", "units", "population", "headcount", "level")
                    .whenContains("quantity")
                    .classifyAs(SemanticCategory.QUANTITY),
            named("weight")
                    .whenToken("weight", "mass", "kg", "lbs", "grams")
                    .classifyAs(SemanticCategory.WEIGHT),
            named("dimension")
                    .whenToken("height", "width", "length", "depth", "size", "diameter", "radius", "distance",
                            "area", "volume")
                    .classifyAs(SemanticCategory.DIMENSION),
            named("rating")
                    .whenToken("rating", "score", "stars", "rank", "grade")
                    .classifyAs(SemanticCategory.RATING),
            named("duration")
                    .whenToken("duration", "minutes", "seconds", "hours", "days", "elapsed", "runtime", "ttl")
                    .classifyAs(SemanticCategory.DURATION),

            // Version
            named("version")
                    .whenToken("version", "ver", "release", "revision", "semver")
                    .classifyAs(SemanticCategory.VERSION),

            // Generic "name" columns, resolved through the table name
            named("organisation name")
                    .whenToken("name")
                    .requireTable(ORGANIZATION_TABLES)
                    .unlessContains(GENERIC_NAME_EXCLUSIONS)
                    .classifyAs(SemanticCategory.COMPANY_NAME),
            named("person name")
                    .whenToken("name")
                    .requireTable(PERSON_TABLES)
                    .unlessContains(GENERIC_NAME_EXCLUSIONS)
                    .classifyAs(SemanticCategory.FULL_NAME),
            named("product name")
                    .whenToken("name")
                    .requireTable(PRODUCT_TABLES)
                    .unlessContains(GENERIC_NAME_EXCLUSIONS)
                    .classifyAs(SemanticCategory.PRODUCT_NAME),
            named("fictional place name")
                    .whenToken("name")
                    .requireTable(FICTION_TABLES)
                    .unlessContains(GENERIC_NAME_EXCLUSIONS)
                    .classifyAs(SemanticCategory.FICTION_LOCATION),
            named("entity name")
                    .whenToken("name", "nom", "naam")
                    .unlessContains(GENERIC_NAME_EXCLUSIONS)
                    .classifyAs(SemanticCategory.ENTITY_NAME)
    );

    private NameRules() {
    }
}
