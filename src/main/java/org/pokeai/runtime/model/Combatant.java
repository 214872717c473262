package org.pokeai.runtime.model;

import org.pokeai.runtime.BattleInvariantViolation;
import org.pokeai.runtime.rules.AbilityData;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.ItemData;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatBlock;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.VolatileKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One battling creature. Every mutation that could break a battle invariant (HP bounds, boost
 * range, single major status) validates its result and throws {@link BattleInvariantViolation}
 * instead of silently clamping.
 */
public class Combatant {

    public static final int MIN_STAGE = -6;
    public static final int MAX_STAGE = 6;

    private final String speciesId;
    private final String name;
    private final Side side;
    private final int level;
    private final StatBlock stats;
    private final List<ElementType> originalTypes;
    private final AbilityData ability;
    private final List<MoveSlot> moves;
    private final ElementType teraType;

    private int hp;
    private ItemData item;
    private List<ElementType> types;
    private StatusCondition status = StatusCondition.NONE;
    private int statusCounter;
    private final EnumMap<Stat, Integer> boosts = new EnumMap<>(Stat.class);
    private final EnumMap<VolatileKind, VolatileState> volatiles = new EnumMap<>(VolatileKind.class);

    private String lastMoveUsed;
    private String choiceLockedMove;
    private boolean terastallized;
    private boolean formChangeUsed;
    private boolean boosterEnergyActive;
    private Stat paradoxStat;
    private boolean flashFireActive;
    private int protectStreak;
    private boolean movedThisTurn;
    private int physicalDamageTaken;
    private int specialDamageTaken;
    private boolean faintReported;

    public Combatant(String speciesId, String name, Side side, int level, StatBlock stats, List<ElementType> types,
                     AbilityData ability, ItemData item, List<MoveSlot> moves, ElementType teraType) {
        if (types == null || types.isEmpty() || types.size() > 2) {
            throw new IllegalArgumentException("A combatant has one or two types");
        }
        if (stats.hp() <= 0) {
            throw new IllegalArgumentException("Max HP must be positive for " + name);
        }
        this.speciesId = speciesId;
        this.name = name;
        this.side = side;
        this.level = level;
        this.stats = stats;
        this.originalTypes = List.copyOf(types);
        this.types = this.originalTypes;
        this.ability = ability == null ? AbilityData.NONE : ability;
        this.item = item == null ? ItemData.NONE : item;
        this.moves = new ArrayList<>(moves);
        this.teraType = teraType;
        this.hp = stats.hp();
        for (Stat stat : Stat.values()) {
            if (stat.isBoostable()) {
                boosts.put(stat, 0);
            }
        }
    }

    public String speciesId() {
        return speciesId;
    }

    public String name() {
        return name;
    }

    public Side side() {
        return side;
    }

    public int level() {
        return level;
    }

    public StatBlock stats() {
        return stats;
    }

    public int stat(Stat stat) {
        return stats.get(stat);
    }

    public int maxHp() {
        return stats.hp();
    }

    public int hp() {
        return hp;
    }

    public boolean isFainted() {
        return hp == 0;
    }

    public boolean isAtFullHp() {
        return hp == stats.hp();
    }

    /**
     * Lowers HP by the given amount, stopping at zero.
     *
     * @return the HP actually lost
     */
    public int takeDamage(int amount) {
        if (amount < 0) {
            throw new BattleInvariantViolation("Negative damage " + amount + " applied to " + name);
        }
        int dealt = Math.min(amount, hp);
        setHp(hp - dealt);
        return dealt;
    }

    /**
     * Raises HP by the given amount, stopping at max HP. Fainted combatants are not healed.
     *
     * @return the HP actually restored
     */
    public int heal(int amount) {
        if (amount < 0) {
            throw new BattleInvariantViolation("Negative heal " + amount + " applied to " + name);
        }
        if (isFainted()) {
            return 0;
        }
        int restored = Math.min(amount, stats.hp() - hp);
        setHp(hp + restored);
        return restored;
    }

    public void setHp(int value) {
        if (value < 0 || value > stats.hp()) {
            throw new BattleInvariantViolation("HP " + value + " outside [0, " + stats.hp() + "] for " + name);
        }
        this.hp = value;
    }

    public List<ElementType> types() {
        return types;
    }

    public List<ElementType> originalTypes() {
        return originalTypes;
    }

    public boolean hasType(ElementType type) {
        return types.contains(type);
    }

    public ElementType teraType() {
        return teraType;
    }

    public boolean isTerastallized() {
        return terastallized;
    }

    /**
     * Replaces the defensive typing with the Tera type for the rest of the battle.
     */
    public void terastallize() {
        if (teraType == null) {
            throw new BattleInvariantViolation(name + " has no Tera type");
        }
        if (terastallized) {
            throw new BattleInvariantViolation(name + " is already terastallized");
        }
        this.terastallized = true;
        this.formChangeUsed = true;
        this.types = List.of(teraType);
    }

    public boolean isFormChangeUsed() {
        return formChangeUsed;
    }

    public AbilityData ability() {
        return ability;
    }

    public boolean hasAbility(AbilityKind kind) {
        return ability.is(kind);
    }

    public ItemData item() {
        return item;
    }

    /**
     * Removes a single-use held item.
     */
    public void consumeItem() {
        this.item = ItemData.NONE;
    }

    public List<MoveSlot> moves() {
        return Collections.unmodifiableList(moves);
    }

    public MoveSlot moveSlot(int index) {
        return moves.get(index);
    }

    public int indexOfMove(String moveId) {
        for (int i = 0; i < moves.size(); i++) {
            if (moves.get(i).moveId().equals(moveId)) {
                return i;
            }
        }
        return -1;
    }

    public boolean knowsMove(String moveId) {
        return indexOfMove(moveId) >= 0;
    }

    public StatusCondition status() {
        return status;
    }

    public boolean hasStatus(StatusCondition candidate) {
        return status == candidate;
    }

    /**
     * Sets a major status on a combatant without one.
     *
     * @throws BattleInvariantViolation if a different major status is already present
     */
    public void setStatus(StatusCondition value) {
        if (value != StatusCondition.NONE && status != StatusCondition.NONE) {
            throw new BattleInvariantViolation(name + " already has status " + status + ", cannot add " + value);
        }
        this.status = value;
        this.statusCounter = value == StatusCondition.BADLY_POISONED ? 1 : 0;
    }

    /**
     * Replaces whatever major status is present.
     */
    public void overwriteStatus(StatusCondition value) {
        this.status = StatusCondition.NONE;
        setStatus(value);
    }

    public void clearStatus() {
        this.status = StatusCondition.NONE;
        this.statusCounter = 0;
    }

    /**
     * Turns asleep so far, or the current toxic stack count.
     */
    public int statusCounter() {
        return statusCounter;
    }

    public void setStatusCounter(int statusCounter) {
        this.statusCounter = statusCounter;
    }

    public int boost(Stat stat) {
        return boosts.getOrDefault(stat, 0);
    }

    public Map<Stat, Integer> boosts() {
        return Collections.unmodifiableMap(boosts);
    }

    /**
     * Sets a boost stage directly.
     *
     * @throws BattleInvariantViolation if the stage is outside [-6, 6]
     */
    public void setBoost(Stat stat, int stage) {
        if (!stat.isBoostable()) {
            throw new BattleInvariantViolation("HP cannot be boosted");
        }
        if (stage < MIN_STAGE || stage > MAX_STAGE) {
            throw new BattleInvariantViolation("Boost " + stage + " for " + stat + " outside [-6, 6] on " + name);
        }
        boosts.put(stat, stage);
    }

    /**
     * Changes a boost stage by {@code delta}, saturating at the bounds.
     *
     * @return the change actually applied
     */
    public int changeBoost(Stat stat, int delta) {
        int current = boost(stat);
        int target = Math.max(MIN_STAGE, Math.min(MAX_STAGE, current + delta));
        setBoost(stat, target);
        return target - current;
    }

    public boolean hasVolatile(VolatileKind kind) {
        return volatiles.containsKey(kind);
    }

    public VolatileState volatileState(VolatileKind kind) {
        return volatiles.get(kind);
    }

    public Map<VolatileKind, VolatileState> volatiles() {
        return Collections.unmodifiableMap(volatiles);
    }

    public void addVolatile(VolatileKind kind, VolatileState state) {
        volatiles.put(kind, state);
    }

    public void removeVolatile(VolatileKind kind) {
        volatiles.remove(kind);
    }

    public String lastMoveUsed() {
        return lastMoveUsed;
    }

    public void setLastMoveUsed(String lastMoveUsed) {
        this.lastMoveUsed = lastMoveUsed;
    }

    public String choiceLockedMove() {
        return choiceLockedMove;
    }

    public void setChoiceLockedMove(String choiceLockedMove) {
        this.choiceLockedMove = choiceLockedMove;
    }

    public boolean isBoosterEnergyActive() {
        return boosterEnergyActive;
    }

    public void setBoosterEnergyActive(boolean boosterEnergyActive) {
        this.boosterEnergyActive = boosterEnergyActive;
    }

    /**
     * The stat raised by Protosynthesis or Quark Drive, or {@code null} while inactive.
     */
    public Stat paradoxStat() {
        return paradoxStat;
    }

    public void setParadoxStat(Stat paradoxStat) {
        this.paradoxStat = paradoxStat;
    }

    public boolean isFlashFireActive() {
        return flashFireActive;
    }

    public void setFlashFireActive(boolean flashFireActive) {
        this.flashFireActive = flashFireActive;
    }

    public int protectStreak() {
        return protectStreak;
    }

    public void setProtectStreak(int protectStreak) {
        this.protectStreak = protectStreak;
    }

    public boolean hasMovedThisTurn() {
        return movedThisTurn;
    }

    public void setMovedThisTurn(boolean movedThisTurn) {
        this.movedThisTurn = movedThisTurn;
    }

    public int damageTakenThisTurn(MoveCategory category) {
        return category == MoveCategory.PHYSICAL ? physicalDamageTaken
                : category == MoveCategory.SPECIAL ? specialDamageTaken : 0;
    }

    public void recordDamageTaken(MoveCategory category, int amount) {
        if (category == MoveCategory.PHYSICAL) {
            physicalDamageTaken += amount;
        } else if (category == MoveCategory.SPECIAL) {
            specialDamageTaken += amount;
        }
    }

    public boolean isFaintReported() {
        return faintReported;
    }

    public void markFaintReported() {
        this.faintReported = true;
    }

    /**
     * Resets per-turn bookkeeping at the start of a turn.
     */
    public void beginTurn() {
        movedThisTurn = false;
        physicalDamageTaken = 0;
        specialDamageTaken = 0;
    }

    /**
     * Clears everything that does not survive leaving the field: volatiles, boosts, last move used,
     * choice lock, protect streak and ability activations. Badly poisoned stacks restart at one.
     */
    public void onSwitchOut() {
        volatiles.clear();
        lastMoveUsed = null;
        for (Stat stat : boosts.keySet()) {
            boosts.put(stat, 0);
        }
        choiceLockedMove = null;
        protectStreak = 0;
        flashFireActive = false;
        boosterEnergyActive = false;
        paradoxStat = null;
        if (status == StatusCondition.BADLY_POISONED) {
            statusCounter = 1;
        }
    }

    @Override
    public String toString() {
        return name + "(" + side + ", " + hp + "/" + stats.hp() + ")";
    }
}
