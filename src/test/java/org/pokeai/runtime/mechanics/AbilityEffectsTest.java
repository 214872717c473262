package org.pokeai.runtime.mechanics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pokeai.junit.extensions.logging.LogWatchExtension;
import org.pokeai.runtime.BattleFixture;
import org.pokeai.runtime.FixedRandom;
import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.LogEntry;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.Weather;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AbilityEffectsTest {

    private static BattleFixture fixture(String a, String b) {
        return BattleFixture.of(FixedRandom.unlucky(), CombatantSpec.of(a, null, null, "tackle"), CombatantSpec.of(b, null, null, "tackle"));
    }

    @Test
    void intimidateLowersTheFoesAttack() {
        BattleFixture f = fixture("gyarados", "garchomp");

        f.abilities().onSwitchIn(f.a());

        assertThat(f.b().boost(Stat.ATTACK)).isEqualTo(-1);
        assertThat(f.details()).containsExactly("intimidate", "boost:atk:-1");
    }

    @Test
    void clearBodyBlocksIntimidateAndContraryInvertsIt() {
        BattleFixture clearBody = fixture("gyarados", "metagross");
        clearBody.abilities().onSwitchIn(clearBody.a());
        assertThat(clearBody.b().boost(Stat.ATTACK)).isZero();
        assertThat(clearBody.log(ActionKind.ABILITY_TRIGGER)).extracting(LogEntry::detail, LogEntry::outcome)
                .contains(tuple("clearbody:atk", Outcome.BLOCKED));

        BattleFixture contrary = fixture("gyarados", "malamar");
        contrary.abilities().onSwitchIn(contrary.a());
        assertThat(contrary.b().boost(Stat.ATTACK)).isEqualTo(1);
    }

    @Test
    void moldBreakerIgnoresBreakableAbilities() {
        BattleFixture f = fixture("excadrill", "metagross");

        f.statChanges().apply(f.b(), Stat.DEFENSE, -1, f.a(), ActionKind.MOVE);

        assertThat(f.b().boost(Stat.DEFENSE)).isEqualTo(-1);
        assertThat(AbilityEffects.ignoresAbility(f.a(), f.b())).isTrue();
        assertThat(AbilityEffects.ignoresAbility(f.b(), f.a())).isFalse();
    }

    @Test
    void weatherSetterAbilitiesSustainTheirWeather() {
        BattleFixture f = fixture("pelipper", "torkoal");

        f.abilities().onSwitchIn(f.a());
        assertThat(f.ctx().field().weather()).isEqualTo(Weather.RAIN);
        assertThat(f.ctx().field().isWeatherSustained()).isTrue();

        f.abilities().onSwitchIn(f.b());
        assertThat(f.ctx().field().weather()).isEqualTo(Weather.SUN);
        assertThat(f.ctx().field().weatherTurns()).isEqualTo(FieldState.SUSTAINED);
    }

    @Test
    void terrainSetterAbilitiesLastFiveTurns() {
        BattleFixture f = fixture("tapukoko", "garchomp");

        f.abilities().onSwitchIn(f.a());

        assertThat(f.ctx().field().terrain()).isEqualTo(Terrain.ELECTRIC);
        assertThat(f.ctx().field().terrainTurns()).isEqualTo(5);
    }

    @Test
    void regeneratorRestoresAThirdOnSwitchOut() {
        BattleFixture f = fixture("toxapex", "garchomp");
        int maxHp = f.a().maxHp();
        f.a().takeDamage(150);

        f.abilities().onSwitchOut(f.a());

        assertThat(f.a().hp()).isEqualTo(maxHp - 150 + StatMath.fractionOf(maxHp, 1.0 / 3.0));
    }

    @Test
    void voltAbsorbHealsAndGrantsImmunity() {
        BattleFixture f = fixture("pikachu", "jolteon");
        int maxHp = f.b().maxHp();
        f.b().takeDamage(100);

        boolean absorbed = f.abilities().tryAbsorb(f.a(), f.b(), ElementType.ELECTRIC);

        assertThat(absorbed).isTrue();
        assertThat(f.b().hp()).isEqualTo(maxHp - 100 + maxHp / 4);
        assertThat(f.abilities().tryAbsorb(f.a(), f.b(), ElementType.WATER)).isFalse();
    }

    @Test
    void flashFireAndStormDrainPowerUpTheHolder() {
        BattleFixture flashFire = fixture("torkoal", "heatran");
        assertThat(flashFire.abilities().tryAbsorb(flashFire.a(), flashFire.b(), ElementType.FIRE)).isTrue();
        assertThat(flashFire.b().isFlashFireActive()).isTrue();

        BattleFixture stormDrain = fixture("pelipper", "gastrodon");
        assertThat(stormDrain.abilities().tryAbsorb(stormDrain.a(), stormDrain.b(), ElementType.WATER)).isTrue();
        assertThat(stormDrain.b().boost(Stat.SPECIAL_ATTACK)).isEqualTo(1);
    }

    @Test
    void moldBreakerBypassesAbsorption() {
        BattleFixture f = fixture("zekrom", "jolteon");

        assertThat(f.abilities().tryAbsorb(f.a(), f.b(), ElementType.ELECTRIC)).isFalse();
    }

    @Test
    void roughSkinAndRockyHelmetPunishContact() {
        BattleFixture roughSkin = BattleFixture.of(FixedRandom.unlucky(),
                CombatantSpec.of("blissey", null, null, "tackle").withStats(Map.of("hp", 800)),
                CombatantSpec.of("garchomp", null, null, "tackle"));
        roughSkin.use(roughSkin.a(), "tackle");
        assertThat(roughSkin.a().hp()).isEqualTo(700);

        BattleFixture both = BattleFixture.of(FixedRandom.unlucky(),
                CombatantSpec.of("blissey", null, null, "tackle").withStats(Map.of("hp", 800)),
                CombatantSpec.of("ferrothorn", null, "rockyhelmet", "tackle"));
        both.use(both.a(), "tackle");
        assertThat(both.a().hp()).isEqualTo(800 - 100 - 133);
    }

    @Test
    void magicGuardIgnoresContactDamage() {
        BattleFixture f = fixture("clefable", "garchomp");

        f.use(f.a(), "tackle");

        assertThat(f.a().isAtFullHp()).isTrue();
        assertThat(f.log(ActionKind.ABILITY_TRIGGER)).extracting(LogEntry::outcome).containsExactly(Outcome.BLOCKED);
    }

    @Test
    void staticParalyzesOnALuckyDraw() {
        BattleFixture lucky = BattleFixture.of(FixedRandom.lucky(), CombatantSpec.of("blissey", null, null, "tackle"),
                CombatantSpec.of("pikachu", null, null, "tackle"));
        lucky.abilities().onContact(lucky.a(), lucky.b());
        assertThat(lucky.a().status()).isEqualTo(StatusCondition.PARALYSIS);

        BattleFixture unlucky = fixture("blissey", "pikachu");
        unlucky.abilities().onContact(unlucky.a(), unlucky.b());
        assertThat(unlucky.a().status()).isEqualTo(StatusCondition.NONE);
    }

    @Test
    void protosynthesisFollowsTheSun() {
        BattleFixture f = fixture("greattusk", "garchomp");
        f.ctx().field().setWeather(Weather.SUN, 5);

        f.abilities().refreshParadox(f.a());
        assertThat(f.a().paradoxStat()).isEqualTo(Stat.ATTACK);

        f.ctx().field().setWeather(Weather.NONE, 0);
        f.abilities().refreshParadox(f.a());
        assertThat(f.a().paradoxStat()).isNull();
        assertThat(f.log(ActionKind.ABILITY_TRIGGER)).extracting(LogEntry::outcome)
                .containsExactly(Outcome.APPLIED, Outcome.EXPIRED);
    }

    @Test
    void boosterEnergyActivatesQuarkDriveWithoutTerrainAndPersists() {
        BattleFixture f = BattleFixture.of(FixedRandom.unlucky(), CombatantSpec.of("ironvaliant", null, "boosterenergy", "tackle"),
                CombatantSpec.of("garchomp", null, null, "tackle"));

        f.abilities().refreshParadox(f.a());

        assertThat(f.a().paradoxStat()).isEqualTo(Stat.ATTACK);
        assertThat(f.a().isBoosterEnergyActive()).isTrue();
        assertThat(f.a().item().kind()).isEqualTo(ItemKind.NONE);

        f.abilities().refreshParadox(f.a());
        assertThat(f.a().paradoxStat()).isEqualTo(Stat.ATTACK);
    }

    @Test
    void priorityBonusesApplyToTheirMoveClasses() {
        BattleFixture prankster = fixture("whimsicott", "garchomp");
        assertThat(AbilityEffects.priorityBonus(prankster.a(), BattleFixture.move("taunt"))).isEqualTo(1);
        assertThat(AbilityEffects.priorityBonus(prankster.a(), BattleFixture.move("tackle"))).isZero();

        BattleFixture galeWings = fixture("talonflame", "garchomp");
        assertThat(AbilityEffects.priorityBonus(galeWings.a(), BattleFixture.move("bravebird"))).isEqualTo(1);
        galeWings.a().takeDamage(1);
        assertThat(AbilityEffects.priorityBonus(galeWings.a(), BattleFixture.move("bravebird"))).isZero();
    }

    @Test
    void ateAbilitiesRetypeNormalMoves() {
        BattleFixture f = fixture("sylveon", "garchomp");

        assertThat(AbilityEffects.moveType(f.a(), BattleFixture.move("tackle"))).isEqualTo(ElementType.FAIRY);
        assertThat(AbilityEffects.moveType(f.a(), BattleFixture.move("surf"))).isEqualTo(ElementType.WATER);
    }
}
