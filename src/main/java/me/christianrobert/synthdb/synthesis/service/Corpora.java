package me.christianrobert.synthdb.synthesis.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small word lists for the categories Datafaker does not cover (or covers too loosely).
 */
final class Corpora {

    static final List<String> EMAIL_PROVIDERS = List.of("gmail.com", "outlook.com", "yahoo.com", "hotmail.com");

    static final List<String> TOP_LEVEL_DOMAINS = List.of(".com", ".net", ".org", ".io", ".dev");

    static final List<String> HOST_PREFIXES = List.of("srv", "web", "db", "app", "node", "api", "cache", "mail");

    static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_4) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64; rv:125.0) Gecko/20100101 Firefox/125.0",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_4 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Mobile/15E148 Safari/604.1",
            "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Mobile Safari/537.36",
            "curl/8.5.0");

    /** Column name fragment -> code prefix; first match wins. */
    static final Map<String, String> IDENTIFIER_PREFIXES = new LinkedHashMap<>();

    static {
        IDENTIFIER_PREFIXES.put("sku", "SKU");
        IDENTIFIER_PREFIXES.put("tracking", "TRK");
        IDENTIFIER_PREFIXES.put("serial", "SER");
        IDENTIFIER_PREFIXES.put("badge", "BDG");
        IDENTIFIER_PREFIXES.put("ref", "REF");
        IDENTIFIER_PREFIXES.put("invoice", "INV");
        IDENTIFIER_PREFIXES.put("order", "ORD");
        IDENTIFIER_PREFIXES.put("ticket", "TKT");
        IDENTIFIER_PREFIXES.put("license", "LIC");
        IDENTIFIER_PREFIXES.put("coupon", "CPN");
        IDENTIFIER_PREFIXES.put("promo", "PRM");
    }

    static final List<String> FICTION_PREFIXES = List.of(
            "Nova", "Kepler", "Orion", "Vega", "Cygnus", "Draco", "Helios", "Tau", "Zeta", "Altair", "Rigel", "Sol");

    static final List<String> FICTION_SUFFIXES = List.of(
            "Prime", "Station", "Outpost", "Reach", "Expanse", "Sector", "Gate", "Drift", "Haven", "Spire", "IX", "Deep");

    static final List<String> VESSEL_PREFIXES = List.of("ISS", "SS", "HMS", "CSV", "UNS");

    static final List<String> VESSEL_NAMES = List.of(
            "Endeavour", "Resolute", "Nomad", "Valiant", "Horizon", "Tempest", "Meridian", "Solstice",
            "Wanderer", "Aurora", "Vanguard", "Corsair");

    static final List<String> PATH_ROOTS = List.of("/var/data", "/srv/files", "/home/shared", "/opt/app/uploads", "/mnt/archive");

    static final List<String> COMPANY_STOP_WORDS = List.of("and", "inc", "llc", "ltd", "group", "the", "co", "plc");

    private Corpora() {
    }
}
