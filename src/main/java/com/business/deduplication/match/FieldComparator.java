package com.business.deduplication.match;

import com.business.deduplication.core.model.BusinessRecord;

/**
 * Caller-supplied comparison for one field, registered through the
 * {@code customComparators} option. It takes precedence over the built-in
 * algorithms for that field.
 *
 * <p>The scorer only calls it when the field is populated on both records, always in
 * ascending id order. A thrown exception or a result outside [0,1] makes the scorer
 * fall back to the built-in algorithms for that field.</p>
 */
@FunctionalInterface
public interface FieldComparator {

    double compare(BusinessRecord first, BusinessRecord second);
}
