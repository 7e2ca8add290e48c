package com.business.deduplication.rules;

import org.apache.commons.codec.language.DoubleMetaphone;
import org.apache.commons.codec.language.Soundex;

import java.util.ArrayList;
import java.util.List;

/**
 * Double Metaphone and Soundex codes for normalized name tokens.
 *
 * <p>Tokens that yield no phonetic code (numbers, for instance) are returned verbatim
 * so that {@code business 1} and {@code business 2} keep distinct code sequences.</p>
 */
public class PhoneticEncoder {

    private final DoubleMetaphone doubleMetaphone;
    private final Soundex soundex;

    public PhoneticEncoder() {
        this.doubleMetaphone = new DoubleMetaphone();
        this.doubleMetaphone.setMaxCodeLen(6);
        this.soundex = new Soundex();
    }

    /**
     * Primary Double Metaphone code of a token, or the token itself if it has none.
     */
    public String encode(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        String code = doubleMetaphone.doubleMetaphone(token);
        return code == null || code.isEmpty() ? token : code;
    }

    public List<String> encodeTokens(String normalized) {
        List<String> codes = new ArrayList<>();
        if (normalized == null || normalized.isBlank()) {
            return codes;
        }
        for (String token : normalized.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                codes.add(encode(token));
            }
        }
        return codes;
    }

    /**
     * Soundex code of a token. Empty when the token has no letters Soundex can map.
     */
    public String soundex(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        try {
            String code = soundex.soundex(token);
            return code == null ? "" : code;
        } catch (IllegalArgumentException e) {
            // Soundex rejects characters outside its mapping; treat as "no code"
            return "";
        }
    }
}
