package com.business.deduplication.rules;

import com.business.deduplication.core.model.Address;
import com.business.deduplication.core.model.RecordField;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Decides whether a raw field value is usable, i.e. worth keeping when records are merged.
 */
public final class FieldValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s.]{2,}$");
    private static final Pattern HOST = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?(\\.[a-z0-9]([a-z0-9-]*[a-z0-9])?)+$");
    private static final int MIN_PHONE_DIGITS = 7;

    private final FieldNormalizer normalizer;

    public FieldValidator(FieldNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email.trim()).matches();
    }

    public boolean isValidWebsite(String website) {
        String host = normalizer.normalizeWebsite(website);
        return !host.isEmpty() && HOST.matcher(host).matches();
    }

    public boolean isValidPhone(String phone) {
        return phone != null && phone.replaceAll("\\D", "").length() >= MIN_PHONE_DIGITS;
    }

    /**
     * Returns true if the value is present and, for contact fields, syntactically valid.
     */
    public boolean isUsable(RecordField field, Object value) {
        if (value == null) {
            return false;
        }
        return switch (field) {
            case EMAIL -> isValidEmail((String) value);
            case WEBSITE -> isValidWebsite((String) value);
            case PHONE -> isValidPhone((String) value);
            case ADDRESS -> !((Address) value).isEmpty();
            case INDUSTRY -> !((Collection<?>) value).isEmpty();
            default -> !(value instanceof String s) || !s.isBlank();
        };
    }
}
