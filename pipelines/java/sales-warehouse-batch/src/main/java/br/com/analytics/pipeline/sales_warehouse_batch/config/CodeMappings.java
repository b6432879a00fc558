package br.com.analytics.pipeline.sales_warehouse_batch.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup tables that translate source codes into the descriptive values used by the warehouse.
 *
 * <p>
 * Keys are matched after trimming and upper-casing the raw value, so {@code " m "} and {@code "M"}
 * resolve to the same entry. Anything without an entry, including blanks and nulls, resolves to
 * {@link #notAvailable()}.
 * </p>
 */
public record CodeMappings(
        Map<String, String> maritalStatus,
        Map<String, String> gender,
        Map<String, String> erpGender,
        Map<String, String> productLine,
        Map<String, String> country,
        String notAvailable
) {

    public static final String NOT_AVAILABLE = "N/A";

    public CodeMappings {
        maritalStatus = normalizeKeys(maritalStatus);
        gender = normalizeKeys(gender);
        erpGender = normalizeKeys(erpGender);
        productLine = normalizeKeys(productLine);
        country = normalizeKeys(country);
        notAvailable = StringUtils.defaultIfBlank(notAvailable, NOT_AVAILABLE);
    }

    public static CodeMappings defaults() {
        return new CodeMappings(
                defaultMaritalStatus(),
                defaultGender(),
                defaultErpGender(),
                defaultProductLine(),
                defaultCountry(),
                NOT_AVAILABLE);
    }

    public String maritalStatusOf(String code) {
        return lookup(maritalStatus, code);
    }

    public String genderOf(String code) {
        return lookup(gender, code);
    }

    public String erpGenderOf(String text) {
        return lookup(erpGender, text);
    }

    public String productLineOf(String code) {
        return lookup(productLine, code);
    }

    public String countryOf(String text) {
        return lookup(country, text);
    }

    public boolean isNotAvailable(String value) {
        return value == null || notAvailable.equals(value);
    }

    private String lookup(Map<String, String> table, String raw) {
        String key = normalizeKey(raw);
        if (key.isEmpty()) {
            return notAvailable;
        }
        return table.getOrDefault(key, notAvailable);
    }

    private static String normalizeKey(String raw) {
        return StringUtils.trimToEmpty(raw).toUpperCase(Locale.ROOT);
    }

    private static Map<String, String> normalizeKeys(Map<String, String> source) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> normalized.put(normalizeKey(key), value));
        }
        return Collections.unmodifiableMap(normalized);
    }

    static Map<String, String> defaultMaritalStatus() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("S", "Single");
        map.put("M", "Married");
        return map;
    }

    static Map<String, String> defaultGender() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("M", "Male");
        map.put("F", "Female");
        return map;
    }

    static Map<String, String> defaultErpGender() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("M", "Male");
        map.put("MALE", "Male");
        map.put("F", "Female");
        map.put("FEMALE", "Female");
        return map;
    }

    static Map<String, String> defaultProductLine() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("M", "Mountain");
        map.put("R", "Road");
        map.put("S", "Other Sales");
        map.put("T", "Touring");
        return map;
    }

    static Map<String, String> defaultCountry() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("USA", "USA");
        map.put("UNITED STATES", "USA");
        map.put("US", "USA");
        map.put("DE", "Germany");
        map.put("GERMANY", "Germany");
        map.put("FRANCE", "France");
        map.put("CANADA", "Canada");
        map.put("UNITED KINGDOM", "UK");
        map.put("AUSTRALIA", "Australia");
        return map;
    }
}
