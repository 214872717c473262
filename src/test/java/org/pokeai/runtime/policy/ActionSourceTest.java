package org.pokeai.runtime.policy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pokeai.runtime.BattleFixture;
import org.pokeai.runtime.FixedRandom;
import org.pokeai.runtime.internal.services.SeededRandomProvider;
import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IRandomProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class ActionSourceTest {

    private static final List<BattleAction> LEGAL = List.of(
            BattleAction.move(0), BattleAction.move(1), BattleAction.switchTo(1), BattleAction.switchTo(2));

    private static DecisionContext context(List<BattleAction> legal) {
        BattleFixture f = BattleFixture.of(FixedRandom.unlucky(),
                CombatantSpec.of("garchomp", null, null, "earthquake"), CombatantSpec.of("blissey", null, null, "recover"));
        return new DecisionContext(Side.A, f.state(), legal, FormatRules.unrestricted());
    }

    @Test
    void firstLegalTakesTheFirstAction() {
        assertThat(new FirstLegalActionSource().chooseAction(context(LEGAL))).isEqualTo(BattleAction.move(0));
        assertThat(new FirstLegalActionSource().chooseReplacement(context(List.of(BattleAction.switchTo(2)))))
                .isEqualTo(BattleAction.switchTo(2));
    }

    @Test
    void randomPolicyAttacksOnLowDrawsAndSwitchesOtherwise() {
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextDouble()).thenReturn(0.5, 0.9);
        when(random.nextInt(2)).thenReturn(1);
        RandomActionSource source = new RandomActionSource(random);

        assertThat(source.chooseAction(context(LEGAL))).isEqualTo(BattleAction.move(1));
        assertThat(source.chooseAction(context(LEGAL))).isEqualTo(BattleAction.switchTo(2));
    }

    @Test
    void randomPolicyFallsBackToTheNonEmptyGroup() {
        RandomActionSource source = new RandomActionSource(FixedRandom.unlucky());

        assertThat(source.chooseAction(context(List.of(BattleAction.struggle())))).isEqualTo(BattleAction.struggle());
        assertThat(source.chooseAction(context(List.of(BattleAction.switchTo(1))))).isEqualTo(BattleAction.switchTo(1));
    }

    @Test
    void randomPolicyOnlyPicksLegalActions() {
        RandomActionSource source = new RandomActionSource(new SeededRandomProvider(3L));
        DecisionContext context = context(LEGAL);

        for (int i = 0; i < 200; i++) {
            assertThat(context.legalActions()).contains(source.chooseAction(context));
        }
    }

    @Test
    void scriptedSourceReplaysThenRunsDry() {
        ScriptedActionSource source = new ScriptedActionSource(
                List.of(BattleAction.move(1), BattleAction.switchTo(2)), List.of(BattleAction.switchTo(2)));
        DecisionContext context = context(LEGAL);

        assertThat(source.chooseAction(context)).isEqualTo(BattleAction.move(1));
        assertThat(source.remaining()).isEqualTo(1);
        assertThat(source.chooseAction(context)).isEqualTo(BattleAction.switchTo(2));
        assertThat(source.chooseAction(context)).isNull();

        DecisionContext replacement = context(List.of(BattleAction.switchTo(1), BattleAction.switchTo(2)));
        assertThat(source.chooseReplacement(replacement)).isEqualTo(BattleAction.switchTo(2));
        assertThat(source.chooseReplacement(replacement)).isEqualTo(BattleAction.switchTo(1));
    }
}
