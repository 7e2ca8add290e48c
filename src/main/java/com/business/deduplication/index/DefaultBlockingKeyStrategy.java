package com.business.deduplication.index;

import com.business.deduplication.rules.NormalizedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Default blocking keys:
 * <ul>
 *   <li>{@code bn:} business number, {@code ph:} phone digits, {@code em:} email domain,
 *       {@code web:} website host</li>
 *   <li>{@code pfx:} first four characters of the normalized name</li>
 *   <li>{@code tok:} first two tokens of the name in sorted order (e.g. {@code tok:bakery|joes})</li>
 *   <li>{@code snd:} Double Metaphone code of the first name token</li>
 * </ul>
 *
 * <p>The token key groups reordered names, the phonetic key groups spelling
 * variants, and the identifier keys group records whose names differ entirely.</p>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    static final int PREFIX_LENGTH = 4;

    @Override
    public Set<String> generateKeys(NormalizedRecord record) {
        Set<String> keys = new LinkedHashSet<>();

        if (!record.businessNumber().isEmpty()) {
            keys.add("bn:" + record.businessNumber());
        }
        if (!record.phone().isEmpty()) {
            keys.add("ph:" + record.phone());
        }
        if (!record.emailDomain().isEmpty()) {
            keys.add("em:" + record.emailDomain());
        }
        if (!record.website().isEmpty()) {
            keys.add("web:" + record.website());
        }

        String name = record.name();
        if (name.isEmpty()) {
            return keys;
        }

        String compact = name.replace(" ", "");
        keys.add("pfx:" + compact.substring(0, Math.min(PREFIX_LENGTH, compact.length())));

        List<String> tokens = new ArrayList<>(record.nameTokens());
        if (tokens.size() >= 2) {
            Collections.sort(tokens);
            keys.add("tok:" + tokens.get(0) + "|" + tokens.get(1));
        } else if (tokens.size() == 1) {
            keys.add("tok:" + tokens.get(0));
        }

        if (!record.nameCodes().isEmpty()) {
            keys.add("snd:" + record.nameCodes().get(0));
        }
        return keys;
    }
}
