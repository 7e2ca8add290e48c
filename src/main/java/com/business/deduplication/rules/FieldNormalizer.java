package com.business.deduplication.rules;

import com.business.deduplication.core.model.Address;
import com.business.deduplication.core.model.BusinessRecord;
import com.business.deduplication.core.model.RecordField;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Produces canonical comparison forms of business record fields.
 *
 * <p>All methods are total: null or unparseable input yields an empty string,
 * never an exception. Instances are immutable and thread-safe.</p>
 */
public class FieldNormalizer {

    private final NormalizationEngine engine;
    private final PhoneticEncoder phoneticEncoder = new PhoneticEncoder();

    public FieldNormalizer() {
        this(NormalizationTables.defaults());
    }

    public FieldNormalizer(NormalizationTables tables) {
        this(DefaultNormalizationRules.createEngine(Objects.requireNonNull(tables, "tables is required")));
    }

    public FieldNormalizer(NormalizationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
    }

    public NormalizationEngine getEngine() {
        return engine;
    }

    public PhoneticEncoder getPhoneticEncoder() {
        return phoneticEncoder;
    }

    /**
     * Normalizes a single raw value of the given field.
     */
    public String normalize(RecordField field, String raw) {
        return switch (field) {
            case NAME -> normalizeName(raw);
            case PHONE -> normalizePhone(raw);
            case EMAIL -> normalizeEmail(raw);
            case WEBSITE -> normalizeWebsite(raw);
            case BUSINESS_NUMBER -> normalizeBusinessNumber(raw);
            case ADDRESS -> normalizeAddressComponent(raw);
            case INDUSTRY -> normalizeIndustryTag(raw);
            default -> raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        };
    }

    /**
     * Builds the comparison snapshot of a record.
     */
    public NormalizedRecord normalize(BusinessRecord record) {
        Objects.requireNonNull(record, "record is required");
        String name = normalizeName(record.getName());
        List<String> nameTokens = tokens(name);
        Address address = record.getAddress();

        Set<String> industry = new LinkedHashSet<>();
        for (String tag : record.getIndustry()) {
            String normalized = normalizeIndustryTag(tag);
            if (!normalized.isEmpty()) {
                industry.add(normalized);
            }
        }

        return new NormalizedRecord(
                record,
                name,
                nameTokens,
                phoneticEncoder.encodeTokens(name),
                nameTokens.isEmpty() ? "" : phoneticEncoder.soundex(nameTokens.get(0)),
                normalizeBusinessNumber(record.getBusinessNumber()),
                normalizePhone(record.getPhone()),
                normalizeEmail(record.getEmail()),
                emailDomain(record.getEmail()),
                normalizeWebsite(record.getWebsite()),
                address != null ? normalizeAddressComponent(address.street()) : "",
                address != null ? normalizeAddressComponent(address.city()) : "",
                address != null ? normalizeAddressComponent(address.province()) : "",
                address != null ? normalizePostalCode(address.postalCode()) : "",
                industry
        );
    }

    /**
     * Lowercase, no diacritics or punctuation, connectors and legal suffixes removed.
     */
    public String normalizeName(String raw) {
        return engine.normalize(decompose(raw), RecordField.NAME);
    }

    /**
     * Digits only. An 11-digit number starting with 1 loses its NANP country code.
     */
    public String normalizePhone(String raw) {
        if (raw == null) {
            return "";
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return digits.substring(1);
        }
        return digits;
    }

    public String normalizeEmail(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * The part after the last {@code @}, or an empty string if there is none.
     */
    public String emailDomain(String raw) {
        String email = normalizeEmail(raw);
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            return "";
        }
        return email.substring(at + 1);
    }

    public String emailLocalPart(String raw) {
        String email = normalizeEmail(raw);
        int at = email.lastIndexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }

    /**
     * Bare lowercase host: protocol, credentials, {@code www.}, port, path, query and fragment removed.
     */
    public String normalizeWebsite(String raw) {
        if (raw == null) {
            return "";
        }
        String host = raw.trim().toLowerCase(Locale.ROOT);

        int scheme = host.indexOf("://");
        if (scheme >= 0) {
            host = host.substring(scheme + 3);
        } else if (host.startsWith("//")) {
            host = host.substring(2);
        }

        int end = firstIndexOf(host, '/', '?', '#');
        if (end >= 0) {
            host = host.substring(0, end);
        }

        int credentials = host.lastIndexOf('@');
        if (credentials >= 0) {
            host = host.substring(credentials + 1);
        }

        int port = host.indexOf(':');
        if (port >= 0) {
            host = host.substring(0, port);
        }

        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.trim();
    }

    /**
     * Uppercased with whitespace and hyphens removed.
     */
    public String normalizeBusinessNumber(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);
    }

    public String normalizePostalCode(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("\\s", "").toUpperCase(Locale.ROOT);
    }

    /**
     * Street, city or province: lowercase, punctuation removed, abbreviations expanded.
     */
    public String normalizeAddressComponent(String raw) {
        return engine.normalize(decompose(raw), RecordField.ADDRESS);
    }

    /**
     * Normalized like a name, without suffix stripping.
     */
    public String normalizeIndustryTag(String raw) {
        return engine.normalize(decompose(raw), RecordField.INDUSTRY);
    }

    public Set<String> normalizeIndustry(Collection<String> tags) {
        Set<String> result = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                String normalized = normalizeIndustryTag(tag);
                if (!normalized.isEmpty()) {
                    result.add(normalized);
                }
            }
        }
        return result;
    }

    static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        return Arrays.stream(normalized.trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private static String decompose(String raw) {
        if (raw == null) {
            return null;
        }
        return Normalizer.normalize(raw, Normalizer.Form.NFD);
    }

    private static int firstIndexOf(String s, char... chars) {
        int result = -1;
        for (char c : chars) {
            int i = s.indexOf(c);
            if (i >= 0 && (result < 0 || i < result)) {
                result = i;
            }
        }
        return result;
    }
}
