package org.pokeai.runtime.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pokeai.runtime.model.CombatantSpec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RosterLoaderTest {

    private final RosterLoader loader = new RosterLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsRosterFromClasspath() throws IOException {
        List<CombatantSpec> roster;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("rosters/team-a.json")) {
            roster = loader.load(in);
        }

        assertThat(roster).hasSize(3);
        CombatantSpec lead = roster.get(0);
        assertThat(lead.species()).isEqualTo("Garchomp");
        assertThat(lead.level()).isEqualTo(100);
        assertThat(lead.moves()).containsExactly("Earthquake", "Dragon Claw", "Stealth Rock", "Swords Dance");
        assertThat(lead.teraType()).isEqualTo("steel");
        assertThat(lead.evs()).containsEntry("atk", 252);
        assertThat(roster.get(2).level()).isEqualTo(90);
        assertThat(roster.get(2).ability()).isNull();
    }

    @Test
    void loadsRosterFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("roster.json");
        Files.writeString(file, "[{\"species\": \"blissey\", \"moves\": [\"recover\"], \"stats\": {\"hp\": 800}}]");

        List<CombatantSpec> roster = loader.load(file);

        assertThat(roster).singleElement().satisfies(spec -> assertThat(spec.statOverrides()).containsEntry("hp", 800));
    }

    @Test
    void emptyRosterIsRejected() {
        assertThatThrownBy(() -> loader.load(json("[]"))).isInstanceOf(IOException.class).hasMessageContaining("empty");
    }

    @Test
    void invalidEntriesAreRejected() {
        assertThatThrownBy(() -> loader.load(json("[{\"species\": \"blissey\", \"level\": 101, \"moves\": [\"recover\"]}]")))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> loader.load(json("[{\"moves\": [\"recover\"]}]")))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> loader.load(json("{\"species\": ")))
                .isInstanceOf(IOException.class);
    }
}
