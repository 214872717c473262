package org.pokeai.runtime.model;

import org.pokeai.runtime.BattleInvariantViolation;
import org.pokeai.runtime.rules.HazardKind;
import org.pokeai.runtime.rules.ScreenKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-player container: the roster in its submitted order, which member is active, and the
 * side-scoped field state (hazard layers, screens, tailwind, Tera usage).
 */
public class SideState {

    private final Side side;
    private final List<Combatant> roster;
    private int activeIndex;

    private final EnumMap<HazardKind, Integer> hazards = new EnumMap<>(HazardKind.class);
    private final EnumMap<ScreenKind, Integer> screens = new EnumMap<>(ScreenKind.class);
    private int tailwindTurns;
    private boolean teraUsed;

    public SideState(Side side, List<Combatant> roster) {
        if (roster == null || roster.isEmpty() || roster.size() > 6) {
            throw new IllegalArgumentException("A roster holds 1 to 6 combatants");
        }
        Map<Combatant, Boolean> seen = new IdentityHashMap<>();
        for (Combatant combatant : roster) {
            if (seen.put(combatant, Boolean.TRUE) != null) {
                throw new BattleInvariantViolation("Combatant " + combatant.name() + " appears twice on side " + side);
            }
            if (combatant.side() != side) {
                throw new BattleInvariantViolation("Combatant " + combatant.name() + " belongs to side " + combatant.side());
            }
        }
        this.side = side;
        this.roster = new ArrayList<>(roster);
        this.activeIndex = 0;
    }

    public Side side() {
        return side;
    }

    public Combatant active() {
        return roster.get(activeIndex);
    }

    public int activeIndex() {
        return activeIndex;
    }

    public List<Combatant> roster() {
        return Collections.unmodifiableList(roster);
    }

    public Combatant member(int rosterIndex) {
        return roster.get(rosterIndex);
    }

    /**
     * Roster indices of the benched combatants that can still battle, in roster order.
     */
    public List<Integer> switchableIndices() {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < roster.size(); i++) {
            if (i != activeIndex && !roster.get(i).isFainted()) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * The non-active combatants in roster order, fainted ones included.
     */
    public List<Combatant> bench() {
        List<Combatant> bench = new ArrayList<>(roster);
        bench.remove(activeIndex);
        return bench;
    }

    public boolean hasLivingCombatants() {
        return roster.stream().anyMatch(c -> !c.isFainted());
    }

    public long livingCount() {
        return roster.stream().filter(c -> !c.isFainted()).count();
    }

    /**
     * Makes the combatant at {@code rosterIndex} the active one.
     */
    public void setActive(int rosterIndex) {
        if (rosterIndex < 0 || rosterIndex >= roster.size()) {
            throw new IllegalArgumentException("No roster slot " + rosterIndex + " on side " + side);
        }
        this.activeIndex = rosterIndex;
    }

    public int hazardLayers(HazardKind kind) {
        return hazards.getOrDefault(kind, 0);
    }

    public boolean hasHazard(HazardKind kind) {
        return hazardLayers(kind) > 0;
    }

    public void setHazardLayers(HazardKind kind, int layers) {
        if (layers < 0 || layers > kind.maxLayers()) {
            throw new BattleInvariantViolation(kind + " layers " + layers + " outside [0, " + kind.maxLayers() + "]");
        }
        if (layers == 0) {
            hazards.remove(kind);
        } else {
            hazards.put(kind, layers);
        }
    }

    public Map<HazardKind, Integer> hazards() {
        return Collections.unmodifiableMap(hazards);
    }

    public void clearHazards() {
        hazards.clear();
    }

    public int screenTurns(ScreenKind kind) {
        return screens.getOrDefault(kind, 0);
    }

    public boolean hasScreen(ScreenKind kind) {
        return screenTurns(kind) > 0;
    }

    public void setScreen(ScreenKind kind, int turns) {
        if (turns <= 0) {
            screens.remove(kind);
        } else {
            screens.put(kind, turns);
        }
    }

    public Map<ScreenKind, Integer> screens() {
        return Collections.unmodifiableMap(screens);
    }

    public void clearScreens() {
        screens.clear();
    }

    public int tailwindTurns() {
        return tailwindTurns;
    }

    public boolean hasTailwind() {
        return tailwindTurns > 0;
    }

    public void setTailwindTurns(int tailwindTurns) {
        this.tailwindTurns = Math.max(0, tailwindTurns);
    }

    public boolean isTeraUsed() {
        return teraUsed;
    }

    public void markTeraUsed() {
        this.teraUsed = true;
    }

    /**
     * Exchanges every side condition with the other side (Court Change).
     */
    public void swapConditionsWith(SideState other) {
        EnumMap<HazardKind, Integer> myHazards = new EnumMap<>(hazards);
        EnumMap<ScreenKind, Integer> myScreens = new EnumMap<>(screens);
        int myTailwind = tailwindTurns;
        hazards.clear();
        hazards.putAll(other.hazards);
        screens.clear();
        screens.putAll(other.screens);
        tailwindTurns = other.tailwindTurns;
        other.hazards.clear();
        other.hazards.putAll(myHazards);
        other.screens.clear();
        other.screens.putAll(myScreens);
        other.tailwindTurns = myTailwind;
    }
}
