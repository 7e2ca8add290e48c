package com.business.deduplication.core.model;

/**
 * Postal address of a business. Blank components are stored as {@code null}.
 */
public record Address(
        String street,
        String city,
        String province,
        String postalCode
) {
    public Address {
        street = blankToNull(street);
        city = blankToNull(city);
        province = blankToNull(province);
        postalCode = blankToNull(postalCode);
    }

    public static Address of(String street, String city, String province, String postalCode) {
        return new Address(street, city, province, postalCode);
    }

    /**
     * Returns true if no component is populated.
     */
    public boolean isEmpty() {
        return street == null && city == null && province == null && postalCode == null;
    }

    /**
     * Number of populated components, used as a completeness measure.
     */
    public int populatedComponents() {
        int count = 0;
        if (street != null) count++;
        if (city != null) count++;
        if (province != null) count++;
        if (postalCode != null) count++;
        return count;
    }

    /**
     * Single-line form, e.g. {@code 123 Main Street, Toronto, ON, M5V 3A8}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{street, city, province, postalCode}) {
            if (part != null) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(part);
            }
        }
        return sb.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
