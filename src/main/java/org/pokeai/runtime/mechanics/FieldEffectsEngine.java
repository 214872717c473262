package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.HazardKind;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.ScreenKind;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.TerrainData;
import org.pokeai.runtime.rules.VolatileKind;
import org.pokeai.runtime.rules.Weather;
import org.pokeai.runtime.rules.WeatherData;

import java.util.List;

/**
 * Owns hazards, screens, rooms, tailwind, weather and terrain: placing them, applying their
 * switch-in and end-of-turn effects, and counting their durations down.
 */
public class FieldEffectsEngine {

    static final double HAZARD_FRACTION = 0.125;
    static final int SCREEN_TURNS = 5;
    static final int TAILWIND_TURNS = 4;
    static final int ROOM_TURNS = 5;

    private final BattleContext ctx;
    private final StatusEngine status;
    private final StatChanges statChanges;

    public FieldEffectsEngine(BattleContext ctx, StatusEngine status, StatChanges statChanges) {
        this.ctx = ctx;
        this.status = status;
        this.statChanges = statChanges;
    }

    /**
     * Grounded combatants are affected by terrain, spikes, toxic spikes and sticky web.
     * Flying types and Levitate are airborne unless Gravity is active.
     */
    public static boolean isGrounded(Combatant combatant, FieldState field) {
        if (field.isActive(FieldCondition.GRAVITY)) {
            return true;
        }
        return !combatant.hasType(ElementType.FLYING) && !combatant.hasAbility(AbilityKind.LEVITATE);
    }

    /**
     * Applies the hazards of the combatant's side to a combatant entering the field.
     *
     * @return the HP lost to hazards
     */
    public int applyEntryHazards(Combatant combatant) {
        SideState side = ctx.state().sideOf(combatant);
        if (side.hazards().isEmpty()) {
            return 0;
        }
        if (ItemEffects.activeItem(combatant, ctx.field()) == ItemKind.HEAVY_DUTY_BOOTS) {
            ctx.log().add(combatant.side(), ActionKind.ITEM_TRIGGER, combatant.name(), combatant.name(),
                    "heavydutyboots", Outcome.BLOCKED);
            return 0;
        }
        boolean grounded = isGrounded(combatant, ctx.field());
        double fraction = 0.0;
        if (side.hasHazard(HazardKind.STEALTH_ROCK)) {
            fraction += HAZARD_FRACTION * ctx.rules().typeChart().effectiveness(ElementType.ROCK, combatant.types());
        }
        if (grounded && side.hasHazard(HazardKind.SPIKES)) {
            fraction += HAZARD_FRACTION * side.hazardLayers(HazardKind.SPIKES);
        }
        int lost = 0;
        if (fraction > 0.0) {
            lost = ctx.indirectDamage(combatant, (int) Math.floor(combatant.maxHp() * fraction), ActionKind.HAZARD, "hazards");
        }
        if (combatant.isFainted()) {
            return lost;
        }
        if (grounded && side.hasHazard(HazardKind.TOXIC_SPIKES)) {
            if (combatant.hasType(ElementType.POISON)) {
                side.setHazardLayers(HazardKind.TOXIC_SPIKES, 0);
                ctx.log().add(combatant.side(), ActionKind.HAZARD, combatant.name(), null, "toxicspikes:absorbed", Outcome.EXPIRED);
            } else {
                StatusCondition poison = side.hazardLayers(HazardKind.TOXIC_SPIKES) >= 2
                        ? StatusCondition.BADLY_POISONED : StatusCondition.POISON;
                status.inflict(poison, combatant, null, ActionKind.HAZARD, false);
            }
        }
        if (grounded && side.hasHazard(HazardKind.STICKY_WEB)) {
            statChanges.apply(combatant, Stat.SPEED, -1, null, ActionKind.HAZARD);
        }
        return lost;
    }

    /**
     * Adds a hazard layer to {@code target}.
     *
     * @return false if the hazard is already at its maximum
     */
    public boolean placeHazard(HazardKind hazard, SideState target, Combatant user) {
        int layers = target.hazardLayers(hazard);
        if (layers >= hazard.maxLayers()) {
            ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, "hazard:" + hazard.name().toLowerCase(), Outcome.FAILED);
            return false;
        }
        target.setHazardLayers(hazard, layers + 1);
        ctx.log().add(target.side(), ActionKind.FIELD_EFFECT, user.name(), null,
                "hazard:" + hazard.name().toLowerCase() + ":" + (layers + 1), Outcome.APPLIED);
        return true;
    }

    /**
     * Raises a screen for five turns. Aurora Veil needs hail or snow.
     */
    public boolean raiseScreen(ScreenKind screen, SideState side, Combatant user) {
        boolean allowed = !side.hasScreen(screen)
                && (screen != ScreenKind.AURORA_VEIL || ctx.field().weather().isHailLike());
        if (!allowed) {
            ctx.log().add(side.side(), ActionKind.FIELD_EFFECT, user.name(), null, "screen:" + screen.name().toLowerCase(), Outcome.FAILED);
            return false;
        }
        side.setScreen(screen, SCREEN_TURNS);
        ctx.log().add(side.side(), ActionKind.FIELD_EFFECT, user.name(), null, "screen:" + screen.name().toLowerCase(), Outcome.APPLIED);
        return true;
    }

    /**
     * Starts tailwind on the user's side, or toggles a room or gravity. Using a room move while
     * that room is active ends it.
     */
    public boolean startCondition(FieldCondition condition, Combatant user) {
        String detail = "field:" + condition.name().toLowerCase();
        if (condition == FieldCondition.TAILWIND) {
            SideState side = ctx.state().sideOf(user);
            if (side.hasTailwind()) {
                ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, detail, Outcome.FAILED);
                return false;
            }
            side.setTailwindTurns(TAILWIND_TURNS);
            ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, detail, Outcome.APPLIED);
            return true;
        }
        FieldState field = ctx.field();
        if (field.isActive(condition)) {
            if (condition == FieldCondition.GRAVITY) {
                ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, detail, Outcome.FAILED);
                return false;
            }
            field.setCondition(condition, 0);
            ctx.log().add(null, ActionKind.FIELD_EFFECT, user.name(), null, detail, Outcome.EXPIRED);
            return true;
        }
        field.setCondition(condition, ROOM_TURNS);
        ctx.log().add(null, ActionKind.FIELD_EFFECT, user.name(), null, detail, Outcome.APPLIED);
        return true;
    }

    /**
     * Sets the weather. {@code turns} of {@link FieldState#SUSTAINED} keeps it until replaced.
     *
     * @return false if the same weather is already active
     */
    public boolean setWeather(Weather weather, int turns, Combatant source, ActionKind kind) {
        FieldState field = ctx.field();
        if (field.weather() == weather && !(turns == FieldState.SUSTAINED && !field.isWeatherSustained())) {
            ctx.log().add(source.side(), kind, source.name(), null, "weather:" + weather.name().toLowerCase(), Outcome.FAILED);
            return false;
        }
        field.setWeather(weather, turns);
        ctx.log().add(null, kind, source.name(), null, "weather:" + weather.name().toLowerCase(), Outcome.APPLIED);
        return true;
    }

    public boolean setTerrain(Terrain terrain, Combatant source, ActionKind kind) {
        FieldState field = ctx.field();
        if (field.terrain() == terrain) {
            ctx.log().add(source.side(), kind, source.name(), null, "terrain:" + terrain.name().toLowerCase(), Outcome.FAILED);
            return false;
        }
        field.setTerrain(terrain, ctx.rules().terrain(terrain).duration());
        ctx.log().add(null, kind, source.name(), null, "terrain:" + terrain.name().toLowerCase(), Outcome.APPLIED);
        return true;
    }

    /**
     * Defog: clears hazards on both sides and screens on the target's side.
     */
    public void defog(Combatant user, SideState targetSide) {
        SideState userSide = ctx.state().sideOf(user);
        userSide.clearHazards();
        targetSide.clearHazards();
        targetSide.clearScreens();
        ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, "defog", Outcome.APPLIED);
    }

    /**
     * Rapid Spin: clears the user's hazards, leech seed and partial trapping.
     */
    public void rapidSpin(Combatant user) {
        ctx.state().sideOf(user).clearHazards();
        user.removeVolatile(VolatileKind.LEECH_SEED);
        user.removeVolatile(VolatileKind.PARTIAL_TRAP);
        ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, "rapidspin", Outcome.APPLIED);
    }

    /**
     * Court Change: swaps every side condition between the two sides.
     */
    public void courtChange(Combatant user) {
        ctx.state().side(user.side()).swapConditionsWith(ctx.state().opponentOf(user));
        ctx.log().add(user.side(), ActionKind.FIELD_EFFECT, user.name(), null, "courtchange", Outcome.APPLIED);
    }

    /**
     * Weather chip damage for non-immune combatants, then weather expiry.
     */
    public void endOfTurnWeather(List<Combatant> order) {
        FieldState field = ctx.field();
        if (field.weather() == Weather.NONE) {
            return;
        }
        WeatherData data = ctx.rules().weather(field.weather());
        if (data.chipFraction() > 0.0) {
            for (Combatant c : order) {
                if (c.isFainted() || c.types().stream().anyMatch(data.immuneTypes()::contains)) {
                    continue;
                }
                ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), data.chipFraction()), ActionKind.WEATHER_TICK,
                        field.weather().name().toLowerCase());
            }
        }
        if (!field.isWeatherSustained()) {
            field.setWeatherTurns(field.weatherTurns() - 1);
            if (field.weatherTurns() <= 0) {
                ctx.log().add(null, ActionKind.WEATHER_TICK, null, null, field.weather().name().toLowerCase(), Outcome.EXPIRED);
                field.setWeather(Weather.NONE, 0);
            }
        }
    }

    /**
     * Grassy Terrain heals grounded combatants, then terrain expiry.
     */
    public void endOfTurnTerrain(List<Combatant> order) {
        FieldState field = ctx.field();
        if (field.terrain() == Terrain.NONE) {
            return;
        }
        TerrainData data = ctx.rules().terrain(field.terrain());
        if (data.healFraction() > 0.0) {
            for (Combatant c : order) {
                if (!c.isFainted() && isGrounded(c, field) && !c.isAtFullHp()) {
                    ctx.restore(c, StatMath.fractionOf(c.maxHp(), data.healFraction()), ActionKind.TERRAIN_TICK,
                            field.terrain().name().toLowerCase());
                }
            }
        }
        field.setTerrainTurns(field.terrainTurns() - 1);
        if (field.terrainTurns() <= 0) {
            ctx.log().add(null, ActionKind.TERRAIN_TICK, null, null, field.terrain().name().toLowerCase(), Outcome.EXPIRED);
            field.setTerrain(Terrain.NONE, 0);
        }
    }

    /**
     * Counts screens, tailwind and global conditions down by one turn.
     */
    public void tickConditions() {
        for (SideState side : List.of(ctx.state().side(Side.A), ctx.state().side(Side.B))) {
            for (ScreenKind screen : ScreenKind.values()) {
                if (side.hasScreen(screen)) {
                    side.setScreen(screen, side.screenTurns(screen) - 1);
                    if (!side.hasScreen(screen)) {
                        ctx.log().add(side.side(), ActionKind.FIELD_EFFECT, null, null,
                                "screen:" + screen.name().toLowerCase(), Outcome.EXPIRED);
                    }
                }
            }
            if (side.hasTailwind()) {
                side.setTailwindTurns(side.tailwindTurns() - 1);
                if (!side.hasTailwind()) {
                    ctx.log().add(side.side(), ActionKind.FIELD_EFFECT, null, null, "field:tailwind", Outcome.EXPIRED);
                }
            }
        }
        FieldState field = ctx.field();
        for (FieldCondition condition : FieldCondition.values()) {
            if (condition.isGlobal() && field.isActive(condition)) {
                field.setCondition(condition, field.turnsLeft(condition) - 1);
                if (!field.isActive(condition)) {
                    ctx.log().add(null, ActionKind.FIELD_EFFECT, null, null,
                            "field:" + condition.name().toLowerCase(), Outcome.EXPIRED);
                }
            }
        }
    }
}
