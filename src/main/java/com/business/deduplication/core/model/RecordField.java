package com.business.deduplication.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Named fields of a {@link BusinessRecord}.
 *
 * <p>Comparable fields take part in match scoring and can be named in
 * {@code checkFields}, {@code fieldThresholds} and {@code customComparators}.
 * Every field can be read and written generically, which is what the merge
 * strategies rely on.</p>
 */
public enum RecordField {
    NAME("name", true, BusinessRecord::getName,
            (b, v) -> b.name((String) v)),
    BUSINESS_TYPE("businessType", false, BusinessRecord::getBusinessType,
            (b, v) -> b.businessType((String) v)),
    BUSINESS_NUMBER("businessNumber", true, BusinessRecord::getBusinessNumber,
            (b, v) -> b.businessNumber((String) v)),
    PHONE("phone", true, BusinessRecord::getPhone,
            (b, v) -> b.phone((String) v)),
    EMAIL("email", true, BusinessRecord::getEmail,
            (b, v) -> b.email((String) v)),
    WEBSITE("website", true, BusinessRecord::getWebsite,
            (b, v) -> b.website((String) v)),
    ADDRESS("address", true, BusinessRecord::getAddress,
            (b, v) -> b.address((Address) v)),
    DESCRIPTION("description", false, BusinessRecord::getDescription,
            (b, v) -> b.description((String) v)),
    INDUSTRY("industry", true, BusinessRecord::getIndustry,
            (b, v) -> b.industry((Collection<String>) v)),
    CONFIDENCE("confidence", false, BusinessRecord::getConfidence,
            (b, v) -> b.confidence((Double) v));

    private final String key;
    private final boolean comparable;
    private final Function<BusinessRecord, Object> getter;
    private final BiConsumer<BusinessRecord.Builder, Object> setter;

    RecordField(String key, boolean comparable, Function<BusinessRecord, Object> getter,
                BiConsumer<BusinessRecord.Builder, Object> setter) {
        this.key = key;
        this.comparable = comparable;
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * The field name as used in options, e.g. {@code businessNumber}.
     */
    public String key() {
        return key;
    }

    /**
     * The key under which this field's score appears in match details, e.g. {@code phoneMatch}.
     */
    public String detailKey() {
        return key + "Match";
    }

    public boolean isComparable() {
        return comparable;
    }

    public Object get(BusinessRecord record) {
        return getter.apply(record);
    }

    public void set(BusinessRecord.Builder builder, Object value) {
        setter.accept(builder, value);
    }

    /**
     * Returns true if the record carries a value for this field.
     */
    public boolean isPresent(BusinessRecord record) {
        Object value = get(record);
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    /**
     * Resolves a field from its option key.
     *
     * @throws IllegalArgumentException if the key names no field
     */
    public static RecordField fromKey(String key) {
        for (RecordField field : values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown field: '" + key + "'. Known fields: "
                + Arrays.toString(Arrays.stream(values()).map(RecordField::key).toArray()));
    }

    /**
     * Resolves a comparable field from its option key.
     *
     * @throws IllegalArgumentException if the key is unknown or the field is not comparable
     */
    public static RecordField comparableFromKey(String key) {
        RecordField field = fromKey(key);
        if (!field.comparable) {
            throw new IllegalArgumentException("Field '" + key + "' is informational and cannot be compared");
        }
        return field;
    }

    public static Set<RecordField> comparableFields() {
        Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
        for (RecordField field : values()) {
            if (field.comparable) {
                fields.add(field);
            }
        }
        return fields;
    }
}
