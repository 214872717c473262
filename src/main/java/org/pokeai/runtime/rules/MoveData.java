package org.pokeai.runtime.rules;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable move descriptor.
 *
 * @param accuracy base accuracy 1..100, or {@code null} for moves that always hit
 * @param minHits  lower bound of the hit count (1 for single-hit moves)
 * @param maxHits  upper bound of the hit count
 * @param secondary chance-based side effect, or {@code null}
 * @param effect   primary effect, never {@code null}
 */
public record MoveData(String id, String name, ElementType type, MoveCategory category, int power,
                       Integer accuracy, int pp, int priority, Set<MoveFlag> flags,
                       int minHits, int maxHits, SecondaryEffect secondary, MoveEffect effect) {

    public static final String STRUGGLE_ID = "struggle";

    /**
     * Substitute for move identifiers missing from the move table.
     */
    public static final MoveData BASELINE = new MoveData("tackle", "Tackle", ElementType.NORMAL,
            MoveCategory.PHYSICAL, 40, 100, 35, 0, EnumSet.of(MoveFlag.CONTACT), 1, 1, null, MoveEffect.NONE);

    /**
     * Used when no other move is usable. Typeless, always hits and costs a quarter of max HP.
     */
    public static final MoveData STRUGGLE = new MoveData(STRUGGLE_ID, "Struggle", ElementType.TYPELESS,
            MoveCategory.PHYSICAL, 50, null, 1, 0, EnumSet.of(MoveFlag.CONTACT), 1, 1, null, MoveEffect.NONE);

    public MoveData {
        if (category == MoveCategory.STATUS && power != 0 && (effect == null || effect.fixedDamage() == null)) {
            throw new IllegalArgumentException("Status move " + id + " must have power 0");
        }
        if (minHits < 1 || maxHits < minHits) {
            throw new IllegalArgumentException("Invalid hit range for " + id + ": " + minHits + ".." + maxHits);
        }
        flags = flags == null || flags.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        effect = effect == null ? MoveEffect.NONE : effect;
    }

    public boolean hasFlag(MoveFlag flag) {
        return flags.contains(flag);
    }

    public boolean isDamaging() {
        return category != MoveCategory.STATUS || effect.fixedDamage() != null;
    }

    public boolean alwaysHits() {
        return accuracy == null;
    }

    public boolean isMultiHit() {
        return maxHits > 1;
    }

    /**
     * Whether the move acts on the user or its own side only, so protection, accuracy and
     * substitutes of the target do not matter.
     */
    public boolean targetsSelf() {
        if (isDamaging()) {
            return false;
        }
        if (effect.volatileKind() == VolatileKind.PROTECT
                || effect.volatileKind() == VolatileKind.SUBSTITUTE
                || effect.volatileKind() == VolatileKind.IMPRISON
                || effect.volatileKind() == VolatileKind.PERISH_SONG) {
            return true;
        }
        return effect.status() == null && effect.volatileKind() == null && effect.hazard() == null
                && effect.targetBoosts().isEmpty() && effect.hazardClear() != HazardClearKind.DEFOG;
    }
}
