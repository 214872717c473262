package org.pokeai.runtime.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pokeai.runtime.model.CombatantSpec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads rosters from JSON: an array of combatant entries such as
 * {@code {"species": "garchomp", "moves": ["earthquake"], "item": "choicescarf", "teraType": "ground"}}.
 */
public class RosterLoader {

    private static final TypeReference<List<CombatantSpec>> ROSTER = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<CombatantSpec> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    /**
     * @throws IOException if the JSON is malformed or an entry is invalid
     */
    public List<CombatantSpec> load(InputStream in) throws IOException {
        List<CombatantSpec> roster = objectMapper.readValue(in, ROSTER);
        if (roster == null || roster.isEmpty()) {
            throw new IOException("Roster is empty");
        }
        return roster;
    }
}
