package org.pokeai.runtime.rules;

import java.util.Locale;

/**
 * Normalization of content identifiers. Every table is keyed by the normalized form,
 * so "Stealth Rock", "stealth-rock" and "stealthrock" all resolve to the same entry.
 */
public final class Ids {

    private Ids() {
        throw new AssertionError("Utility class");
    }

    /**
     * Lower-cases the given identifier and strips every character outside {@code [a-z0-9]}.
     *
     * @param raw the raw identifier, may be {@code null}
     * @return the normalized identifier, or an empty string for {@code null}
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
