package org.pokeai.runtime.rules;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Format gating applied while building rosters and computing legal actions.
 * All identifier sets hold normalized identifiers.
 */
public record FormatRules(String name, boolean teraAllowed, Set<String> bannedSpecies, Set<String> bannedMoves,
                          Set<String> bannedItems, Set<String> bannedAbilities) {

    public FormatRules {
        bannedSpecies = normalizeAll(bannedSpecies);
        bannedMoves = normalizeAll(bannedMoves);
        bannedItems = normalizeAll(bannedItems);
        bannedAbilities = normalizeAll(bannedAbilities);
    }

    private static Set<String> normalizeAll(Set<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        return ids.stream().map(Ids::normalize).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * A format with Tera enabled and nothing banned.
     */
    public static FormatRules unrestricted() {
        return new FormatRules("unrestricted", true, Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean isSpeciesBanned(String id) {
        return bannedSpecies.contains(Ids.normalize(id));
    }

    public boolean isMoveBanned(String id) {
        return bannedMoves.contains(Ids.normalize(id));
    }

    public boolean isItemBanned(String id) {
        return bannedItems.contains(Ids.normalize(id));
    }

    public boolean isAbilityBanned(String id) {
        return bannedAbilities.contains(Ids.normalize(id));
    }
}
