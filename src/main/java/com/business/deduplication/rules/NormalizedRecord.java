package com.business.deduplication.rules;

import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.RecordField;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized comparison snapshot of a {@link BusinessRecord}.
 *
 * <p>Every string component is non-null; an empty string means the value is absent.
 * {@code nameCodes} holds the phonetic code of each name token and {@code nameSoundex}
 * the Soundex code of the first token, computed once per record.</p>
 */
public record NormalizedRecord(
        BusinessRecord source,
        String name,
        List<String> nameTokens,
        List<String> nameCodes,
        String nameSoundex,
        String businessNumber,
        String phone,
        String email,
        String emailDomain,
        String website,
        String street,
        String city,
        String province,
        String postalCode,
        Set<String> industry
) {
    public NormalizedRecord {
        Objects.requireNonNull(source, "source is required");
        name = nullToEmpty(name);
        nameTokens = nameTokens != null ? List.copyOf(nameTokens) : List.of();
        nameCodes = nameCodes != null ? List.copyOf(nameCodes) : List.of();
        nameSoundex = nullToEmpty(nameSoundex);
        businessNumber = nullToEmpty(businessNumber);
        phone = nullToEmpty(phone);
        email = nullToEmpty(email);
        emailDomain = nullToEmpty(emailDomain);
        website = nullToEmpty(website);
        street = nullToEmpty(street);
        city = nullToEmpty(city);
        province = nullToEmpty(province);
        postalCode = nullToEmpty(postalCode);
        industry = industry != null ? Set.copyOf(industry) : Set.of();
    }

    public String id() {
        return source.getId();
    }

    public boolean hasAddress() {
        return !street.isEmpty() || !city.isEmpty() || !province.isEmpty() || !postalCode.isEmpty();
    }

    /**
     * Returns true if the normalized form of the field carries data.
     */
    public boolean has(RecordField field) {
        return switch (field) {
            case NAME -> !name.isEmpty();
            case BUSINESS_NUMBER -> !businessNumber.isEmpty();
            case PHONE -> !phone.isEmpty();
            case EMAIL -> !email.isEmpty();
            case WEBSITE -> !website.isEmpty();
            case ADDRESS -> hasAddress();
            case INDUSTRY -> !industry.isEmpty();
            default -> field.isPresent(source);
        };
    }

    /**
     * The normalized single-valued form of a comparable string field.
     *
     * @throws IllegalArgumentException for address and industry, which are composite
     */
    public String value(RecordField field) {
        return switch (field) {
            case NAME -> name;
            case BUSINESS_NUMBER -> businessNumber;
            case PHONE -> phone;
            case EMAIL -> email;
            case WEBSITE -> website;
            default -> throw new IllegalArgumentException("Field " + field.key() + " has no single normalized value");
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
