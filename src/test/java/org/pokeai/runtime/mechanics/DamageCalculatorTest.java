package org.pokeai.runtime.mechanics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.pokeai.junit.extensions.logging.LogWatchExtension;
import org.pokeai.runtime.BattleFixture;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.MoveEffect;
import org.pokeai.runtime.rules.ScreenKind;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.spi.IRandomProvider;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
@MockitoSettings(strictness = Strictness.LENIENT)
class DamageCalculatorTest {

    private static final MoveData NORMAL_HIT = physical("normalhit", ElementType.NORMAL);
    private static final MoveData ELECTRIC_HIT = physical("electrichit", ElementType.ELECTRIC);

    @Mock
    private IRandomProvider rng;

    @Mock
    private IRandomProvider untouched;

    @BeforeEach
    void setUp() {
        when(rng.nextDouble()).thenReturn(0.99);
        when(rng.nextInt(16)).thenReturn(15);
    }

    private static MoveData physical(String id, ElementType type) {
        return new MoveData(id, id, type, MoveCategory.PHYSICAL, 100, 100, 10, 0, Set.of(), 1, 1, null, MoveEffect.NONE);
    }

    /** Attack 130 against Defense 95 at level 100 with a neutral, non-STAB, 100-power move. */
    private static BattleFixture neutralMatchup(IRandomProvider rng) {
        return BattleFixture.of(rng,
                CombatantSpec.of("pikachu", null, null, "tackle").withStats(Map.of("atk", 130)),
                CombatantSpec.of("garchomp", null, null, "tackle").withStats(Map.of("def", 95)));
    }

    @Test
    void maximumRollWithoutCriticalHitMatchesReferenceValue() {
        BattleFixture f = neutralMatchup(rng);

        DamageResult result = f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), rng);

        assertThat(result.damage()).isEqualTo(116);
        assertThat(result.criticalHit()).isFalse();
        assertThat(result.effectiveness()).isEqualTo(1.0);
    }

    @Test
    void minimumRollScalesByEightyFivePercent() {
        when(rng.nextInt(16)).thenReturn(0);
        BattleFixture f = neutralMatchup(rng);

        assertThat(f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), rng).damage()).isEqualTo(99);
    }

    @Test
    void criticalHitDoublesTheLevelFactor() {
        when(rng.nextDouble()).thenReturn(0.0);
        BattleFixture f = neutralMatchup(rng);

        DamageResult result = f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), rng);

        assertThat(result.criticalHit()).isTrue();
        assertThat(result.damage()).isEqualTo(231);
    }

    @Test
    void burnHalvesPhysicalDamage() {
        BattleFixture f = neutralMatchup(rng);
        f.a().setStatus(StatusCondition.BURN);

        assertThat(f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), rng).damage()).isEqualTo(58);
    }

    @Test
    void reflectHalvesPhysicalDamage() {
        BattleFixture f = neutralMatchup(rng);
        f.sideB().setScreen(ScreenKind.REFLECT, 5);

        assertThat(f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), rng).damage()).isEqualTo(58);
    }

    @Test
    void sameTypeBonusAndTeraBonusStack() {
        BattleFixture f = BattleFixture.of(rng,
                CombatantSpec.of("pikachu", null, null, "tackle").withStats(Map.of("atk", 130)).withTeraType("electric"),
                CombatantSpec.of("blissey", null, null, "tackle").withStats(Map.of("def", 95)));

        assertThat(f.damage().calculate(f.a(), f.b(), ELECTRIC_HIT, f.state(), rng).damage()).isEqualTo(175);

        f.a().terastallize();
        assertThat(f.damage().calculate(f.a(), f.b(), ELECTRIC_HIT, f.state(), rng).damage()).isEqualTo(233);
    }

    @Test
    void immuneTargetTakesNothingAndConsumesNoDraws() {
        BattleFixture f = BattleFixture.of(untouched,
                CombatantSpec.of("pikachu", null, null, "tackle"),
                CombatantSpec.of("gholdengo", null, null, "tackle"));

        DamageResult result = f.damage().calculate(f.a(), f.b(), NORMAL_HIT, f.state(), untouched);

        assertThat(result.isImmune()).isTrue();
        assertThat(result.damage()).isZero();
        verifyNoInteractions(untouched);
    }

    @Test
    void effectivenessMultipliesAcrossBothTypes() {
        BattleFixture f = neutralMatchup(rng);

        assertThat(f.damage().effectiveness(ElementType.ICE, f.a(), f.b(), f.ctx().field())).isEqualTo(4.0);
        assertThat(f.damage().effectiveness(ElementType.ELECTRIC, f.a(), f.b(), f.ctx().field())).isEqualTo(0.0);
        assertThat(f.damage().effectiveness(ElementType.TYPELESS, f.a(), f.b(), f.ctx().field())).isEqualTo(1.0);
    }

    @Test
    void levitateBlocksGroundUnlessGravityOrMoldBreaker() {
        BattleFixture f = BattleFixture.of(rng,
                CombatantSpec.of("garchomp", null, null, "earthquake"),
                CombatantSpec.of("rotomwash", null, null, "tackle"));
        assertThat(f.damage().effectiveness(ElementType.GROUND, f.a(), f.b(), f.ctx().field())).isEqualTo(0.0);

        f.ctx().field().setCondition(FieldCondition.GRAVITY, 5);
        assertThat(f.damage().effectiveness(ElementType.GROUND, f.a(), f.b(), f.ctx().field())).isEqualTo(2.0);

        BattleFixture moldBreaker = BattleFixture.of(rng,
                CombatantSpec.of("excadrill", null, null, "earthquake"),
                CombatantSpec.of("rotomwash", null, null, "tackle"));
        assertThat(moldBreaker.damage().effectiveness(ElementType.GROUND, moldBreaker.a(), moldBreaker.b(),
                moldBreaker.ctx().field())).isEqualTo(2.0);
    }

    @Test
    void fixedDamageIgnoresStatsButRespectsImmunity() {
        BattleFixture f = BattleFixture.of(rng,
                CombatantSpec.of("blissey", null, null, "seismictoss").withLevel(50),
                CombatantSpec.of("garchomp", null, null, "tackle"));

        DamageResult result = f.damage().calculate(f.a(), f.b(), BattleFixture.move("seismictoss"), f.state(), rng);
        assertThat(result.damage()).isEqualTo(50);

        BattleFixture ghost = BattleFixture.of(rng,
                CombatantSpec.of("blissey", null, null, "seismictoss"),
                CombatantSpec.of("gholdengo", null, null, "tackle"));
        assertThat(ghost.damage().calculate(ghost.a(), ghost.b(), BattleFixture.move("seismictoss"), ghost.state(), rng)
                .isImmune()).isTrue();
    }

    @Test
    void confusionDamageIsATypelessFortyPowerHit() {
        BattleFixture f = BattleFixture.of(rng,
                CombatantSpec.of("blissey", null, null, "tackle").withStats(Map.of("atk", 100, "def", 100)),
                CombatantSpec.of("garchomp", null, null, "tackle"));

        // 0.84 * 100 * 40 / 100 + 2
        assertThat(f.damage().confusionDamage(f.a())).isEqualTo(35);
    }

    @Test
    void statStagesUseTheStandardMultiplierTable() {
        assertThat(StatMath.boostMultiplier(2)).isEqualTo(2.0);
        assertThat(StatMath.boostMultiplier(-1)).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(StatMath.boostMultiplier(-6)).isEqualTo(0.25);
        assertThat(StatMath.boostMultiplier(6)).isEqualTo(4.0);
    }

    @Test
    void fixedDamageDrawsNoRandomness() {
        BattleFixture f = BattleFixture.of(untouched,
                CombatantSpec.of("blissey", null, null, "nightshade"),
                CombatantSpec.of("garchomp", null, null, "tackle"));

        assertThat(f.damage().calculate(f.a(), f.b(), BattleFixture.move("nightshade"), f.state(), untouched).damage())
                .isEqualTo(100);
        verifyNoInteractions(untouched);
    }
}
