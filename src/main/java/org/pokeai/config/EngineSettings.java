package org.pokeai.config;

import com.typesafe.config.Config;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.RuleTableLoader;
import org.pokeai.runtime.rules.RuleTables;

import java.nio.file.Path;
import java.util.HashSet;

/**
 * Typed view of the {@code pokeai} configuration block. The engine never reads configuration
 * itself; callers convert it here and hand the results to the engine.
 *
 * @param maxTurns           turn cap per battle
 * @param seed               default seed
 * @param format             format gating rules
 * @param ruleTablesPath     classpath prefix of the bundled rule tables
 * @param ruleTablesDirectory directory to load rule tables from instead, or {@code null}
 */
public record EngineSettings(int maxTurns, long seed, FormatRules format, String ruleTablesPath,
                             Path ruleTablesDirectory) {

    private static final String ROOT = "pokeai";

    public EngineSettings {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("pokeai.battle.max-turns must be at least 1, got " + maxTurns);
        }
    }

    public static EngineSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        Config formatConfig = root.getConfig("format");
        FormatRules format = new FormatRules(
                formatConfig.getString("name"),
                formatConfig.getBoolean("tera-allowed"),
                new HashSet<>(formatConfig.getStringList("banned-species")),
                new HashSet<>(formatConfig.getStringList("banned-moves")),
                new HashSet<>(formatConfig.getStringList("banned-items")),
                new HashSet<>(formatConfig.getStringList("banned-abilities")));
        Config tables = root.getConfig("rule-tables");
        Path directory = tables.hasPath("directory") && !tables.getString("directory").isBlank()
                ? Path.of(tables.getString("directory"))
                : null;
        return new EngineSettings(
                root.getInt("battle.max-turns"),
                root.getLong("battle.seed"),
                format,
                tables.getString("path"),
                directory);
    }

    /**
     * Loads the rule tables this configuration points at.
     */
    public RuleTables loadRuleTables() {
        RuleTableLoader loader = new RuleTableLoader();
        return ruleTablesDirectory != null
                ? loader.loadFromDirectory(ruleTablesDirectory)
                : loader.loadFromClasspath(ruleTablesPath);
    }
}
