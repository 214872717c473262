package org.pokeai.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pokeai.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    private static List<Integer> draws(IRandomProvider random, int count) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(random.nextInt(1000));
        }
        return values;
    }

    @Test
    void sameSeedGivesSameSequence() {
        assertThat(draws(new SeededRandomProvider(42L), 50)).isEqualTo(draws(new SeededRandomProvider(42L), 50));
        assertThat(draws(new SeededRandomProvider(42L), 50)).isNotEqualTo(draws(new SeededRandomProvider(43L), 50));
    }

    @Test
    void derivedStreamsDependOnScopeAndKeyOnly() {
        SeededRandomProvider parent = new SeededRandomProvider(7L);
        IRandomProvider before = parent.deriveFor("battle", 3);
        draws(parent, 10);
        IRandomProvider after = parent.deriveFor("battle", 3);

        assertThat(draws(before, 20)).isEqualTo(draws(after, 20));
        assertThat(draws(parent.deriveFor("battle", 4), 20)).isNotEqualTo(draws(parent.deriveFor("battle", 3), 20));
        assertThat(draws(parent.deriveFor("policy", 3), 20)).isNotEqualTo(draws(parent.deriveFor("battle", 3), 20));
    }

    @Test
    void derivingDoesNotPerturbTheParent() {
        SeededRandomProvider untouched = new SeededRandomProvider(11L);
        SeededRandomProvider deriving = new SeededRandomProvider(11L);
        deriving.deriveFor("policy", 0);

        assertThat(draws(deriving, 20)).isEqualTo(draws(untouched, 20));
    }

    @Test
    void streamSeedSeparatesScopesWithEqualKeys() {
        assertThat(SeededRandomProvider.streamSeed(5L, "battle", 1))
                .isEqualTo(SeededRandomProvider.streamSeed(5L, "battle", 1))
                .isNotEqualTo(SeededRandomProvider.streamSeed(5L, "policy", 1))
                .isNotEqualTo(SeededRandomProvider.streamSeed(6L, "battle", 1));
    }

    @Test
    void doublesStayInTheUnitInterval() {
        SeededRandomProvider random = new SeededRandomProvider(99L);
        for (int i = 0; i < 1000; i++) {
            assertThat(random.nextDouble()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }
}
