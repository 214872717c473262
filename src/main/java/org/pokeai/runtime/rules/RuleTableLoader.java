package org.pokeai.runtime.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link RuleTables} from JSON documents, either from the classpath or from a directory.
 * <p>
 * Expected files: {@code species.json}, {@code moves.json}, {@code typechart.json},
 * {@code abilities.json}, {@code items.json}, {@code weather.json} and {@code terrain.json}.
 * Missing or unparsable files raise {@link RuleTableException}. Inside an otherwise valid moves
 * table, a malformed {@code effect} or {@code secondary} block is logged and read as "no effect"
 * so that a single bad entry never prevents battles from running.
 * </p>
 */
public final class RuleTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleTableLoader.class);

    public static final String DEFAULT_CLASSPATH_PREFIX = "data";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads the content bundled under {@value #DEFAULT_CLASSPATH_PREFIX} on the classpath.
     */
    public static RuleTables loadDefaults() {
        return new RuleTableLoader().loadFromClasspath(DEFAULT_CLASSPATH_PREFIX);
    }

    /**
     * Loads all tables from classpath resources below the given prefix.
     *
     * @param prefix resource directory, e.g. "data"
     * @return the loaded tables
     */
    public RuleTables loadFromClasspath(String prefix) {
        String base = prefix.endsWith("/") ? prefix : prefix + "/";
        return load(name -> {
            InputStream in = RuleTableLoader.class.getClassLoader().getResourceAsStream(base + name);
            if (in == null) {
                throw new RuleTableException("Rule table resource not found: " + base + name);
            }
            return in;
        });
    }

    /**
     * Loads all tables from files in the given directory.
     */
    public RuleTables loadFromDirectory(Path directory) {
        return load(name -> {
            Path file = directory.resolve(name);
            if (!Files.isRegularFile(file)) {
                throw new RuleTableException("Rule table file not found: " + file.toAbsolutePath());
            }
            return Files.newInputStream(file);
        });
    }

    @FunctionalInterface
    private interface Source {
        InputStream open(String name) throws IOException;
    }

    private RuleTables load(Source source) {
        List<SpeciesData> species = parseSpecies(read(source, "species.json"));
        List<MoveData> moves = parseMoves(read(source, "moves.json"));
        List<AbilityData> abilities = parseAbilities(read(source, "abilities.json"));
        List<ItemData> items = parseItems(read(source, "items.json"));
        TypeChart chart = parseTypeChart(read(source, "typechart.json"));
        List<WeatherData> weather = parseWeather(read(source, "weather.json"));
        List<TerrainData> terrain = parseTerrain(read(source, "terrain.json"));
        LOG.debug("Loaded rule tables: {} species, {} moves, {} abilities, {} items",
                species.size(), moves.size(), abilities.size(), items.size());
        return new RuleTables(species, moves, abilities, items, chart, weather, terrain);
    }

    private JsonNode read(Source source, String name) {
        try (InputStream in = source.open(name)) {
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new RuleTableException("Failed to read rule table " + name, e);
        }
    }

    private List<SpeciesData> parseSpecies(JsonNode root) {
        List<SpeciesData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "species.json")) {
            try {
                String id = Ids.normalize(node.path("id").asText());
                JsonNode stats = node.path("baseStats");
                StatBlock base = new StatBlock(stats.path("hp").asInt(), stats.path("atk").asInt(),
                        stats.path("def").asInt(), stats.path("spa").asInt(), stats.path("spd").asInt(),
                        stats.path("spe").asInt());
                List<ElementType> types = new ArrayList<>();
                node.path("types").forEach(t -> types.add(ElementType.fromId(t.asText())));
                List<String> abilities = new ArrayList<>();
                node.path("abilities").forEach(a -> abilities.add(Ids.normalize(a.asText())));
                result.add(new SpeciesData(id, node.path("name").asText(id), base, types, abilities));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid species entry " + node, e);
            }
        }
        return result;
    }

    private List<MoveData> parseMoves(JsonNode root) {
        List<MoveData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "moves.json")) {
            String id = Ids.normalize(node.path("id").asText());
            try {
                MoveCategory category = MoveCategory.fromId(node.path("category").asText());
                JsonNode accuracyNode = node.path("accuracy");
                Integer accuracy = accuracyNode.isInt() ? accuracyNode.asInt() : null;
                Set<MoveFlag> flags = EnumSet.noneOf(MoveFlag.class);
                node.path("flags").forEach(f -> flags.add(MoveFlag.fromId(f.asText())));
                int minHits = 1;
                int maxHits = 1;
                JsonNode hits = node.path("hits");
                if (hits.isArray() && hits.size() == 2) {
                    minHits = hits.get(0).asInt();
                    maxHits = hits.get(1).asInt();
                } else if (hits.isInt()) {
                    minHits = hits.asInt();
                    maxHits = minHits;
                }
                MoveEffect effect = parseEffect(id, node.path("effect"));
                SecondaryEffect secondary = parseSecondary(id, node.path("secondary"));
                int power = node.path("power").asInt(0);
                if (category == MoveCategory.STATUS && power != 0 && effect.fixedDamage() == null) {
                    LOG.warn("Status move '{}' declares power {}, using 0", id, power);
                    power = 0;
                }
                result.add(new MoveData(id, node.path("name").asText(id), ElementType.fromId(node.path("type").asText()),
                        category, power, accuracy, node.path("pp").asInt(1), node.path("priority").asInt(0),
                        flags, minHits, maxHits, secondary, effect));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid move entry '" + id + "'", e);
            }
        }
        return result;
    }

    private MoveEffect parseEffect(String moveId, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return MoveEffect.NONE;
        }
        try {
            if (!node.isObject()) {
                throw new IllegalArgumentException("effect must be an object");
            }
            MoveEffect.Builder builder = MoveEffect.builder();
            if (node.hasNonNull("status")) builder.status(StatusCondition.fromId(node.get("status").asText()));
            if (node.hasNonNull("volatile")) builder.volatileKind(VolatileKind.fromId(node.get("volatile").asText()));
            if (node.hasNonNull("hazard")) builder.hazard(HazardKind.fromId(node.get("hazard").asText()));
            if (node.hasNonNull("screen")) builder.screen(ScreenKind.fromId(node.get("screen").asText()));
            if (node.hasNonNull("field")) builder.fieldCondition(FieldCondition.fromId(node.get("field").asText()));
            if (node.hasNonNull("weather")) builder.weather(Weather.fromId(node.get("weather").asText()));
            if (node.hasNonNull("terrain")) builder.terrain(Terrain.fromId(node.get("terrain").asText()));
            if (node.hasNonNull("heal")) builder.heal(requireFraction(node.get("heal")));
            if (node.hasNonNull("weatherHeal")) builder.weatherScaledHeal(node.get("weatherHeal").asBoolean());
            parseBoosts(node.path("selfBoosts")).forEach(builder::selfBoost);
            parseBoosts(node.path("boosts")).forEach(builder::targetBoost);
            if (node.hasNonNull("fixedDamage")) builder.fixedDamage(FixedDamageKind.fromId(node.get("fixedDamage").asText()));
            if (node.hasNonNull("recoil")) builder.recoil(requireFraction(node.get("recoil")));
            if (node.hasNonNull("drain")) builder.drain(requireFraction(node.get("drain")));
            if (node.hasNonNull("clear")) builder.hazardClear(HazardClearKind.fromId(node.get("clear").asText()));
            return builder.build();
        } catch (IllegalArgumentException e) {
            LOG.warn("Malformed effect data for move '{}' treated as no effect: {}", moveId, e.getMessage());
            return MoveEffect.NONE;
        }
    }

    private SecondaryEffect parseSecondary(String moveId, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            if (!node.isObject() || !node.path("chance").isInt()) {
                throw new IllegalArgumentException("secondary requires an integer chance");
            }
            StatusCondition status = node.hasNonNull("status") ? StatusCondition.fromId(node.get("status").asText()) : null;
            VolatileKind volatileKind = node.hasNonNull("volatile") ? VolatileKind.fromId(node.get("volatile").asText()) : null;
            return new SecondaryEffect(node.get("chance").asInt(), status, volatileKind,
                    parseBoosts(node.path("boosts")), parseBoosts(node.path("selfBoosts")));
        } catch (IllegalArgumentException e) {
            LOG.warn("Malformed secondary effect for move '{}' treated as no effect: {}", moveId, e.getMessage());
            return null;
        }
    }

    private Map<Stat, Integer> parseBoosts(JsonNode node) {
        Map<Stat, Integer> boosts = new EnumMap<>(Stat.class);
        if (node.isMissingNode() || node.isNull()) {
            return boosts;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("boosts must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isInt()) {
                throw new IllegalArgumentException("boost for " + field.getKey() + " must be an integer");
            }
            boosts.put(Stat.fromId(field.getKey()), field.getValue().asInt());
        }
        return boosts;
    }

    private double requireFraction(JsonNode node) {
        if (!node.isNumber() || node.asDouble() < 0.0 || node.asDouble() > 1.0) {
            throw new IllegalArgumentException("expected a fraction in [0, 1] but got " + node);
        }
        return node.asDouble();
    }

    private List<AbilityData> parseAbilities(JsonNode root) {
        List<AbilityData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "abilities.json")) {
            try {
                String id = Ids.normalize(node.path("id").asText());
                result.add(new AbilityData(id, node.path("name").asText(id),
                        AbilityKind.fromId(node.path("kind").asText()),
                        node.hasNonNull("type") ? ElementType.fromId(node.get("type").asText()) : null,
                        node.hasNonNull("weather") ? Weather.fromId(node.get("weather").asText()) : null,
                        node.hasNonNull("terrain") ? Terrain.fromId(node.get("terrain").asText()) : null,
                        node.hasNonNull("status") ? StatusCondition.fromId(node.get("status").asText()) : null,
                        node.path("breakable").asBoolean(false)));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid ability entry " + node, e);
            }
        }
        return result;
    }

    private List<ItemData> parseItems(JsonNode root) {
        List<ItemData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "items.json")) {
            try {
                String id = Ids.normalize(node.path("id").asText());
                result.add(new ItemData(id, node.path("name").asText(id), ItemKind.fromId(node.path("kind").asText())));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid item entry " + node, e);
            }
        }
        return result;
    }

    private TypeChart parseTypeChart(JsonNode root) {
        if (!root.isObject()) {
            throw new RuleTableException("typechart.json must be an object keyed by attacking type");
        }
        TypeChart.Builder builder = TypeChart.builder();
        Iterator<Map.Entry<String, JsonNode>> rows = root.fields();
        try {
            while (rows.hasNext()) {
                Map.Entry<String, JsonNode> row = rows.next();
                ElementType attacking = ElementType.fromId(row.getKey());
                row.getValue().path("superEffective").forEach(t -> builder.set(attacking, ElementType.fromId(t.asText()), 2.0));
                row.getValue().path("notVeryEffective").forEach(t -> builder.set(attacking, ElementType.fromId(t.asText()), 0.5));
                row.getValue().path("noEffect").forEach(t -> builder.set(attacking, ElementType.fromId(t.asText()), 0.0));
            }
        } catch (IllegalArgumentException e) {
            throw new RuleTableException("Invalid type chart", e);
        }
        return builder.build();
    }

    private List<WeatherData> parseWeather(JsonNode root) {
        List<WeatherData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "weather.json")) {
            try {
                Set<ElementType> immune = EnumSet.noneOf(ElementType.class);
                node.path("immuneTypes").forEach(t -> immune.add(ElementType.fromId(t.asText())));
                result.add(new WeatherData(Weather.fromId(node.path("weather").asText()),
                        optionalType(node, "boostedType"), optionalType(node, "weakenedType"),
                        node.path("chip").asDouble(0.0), immune, optionalType(node, "defenseBoostType"),
                        node.hasNonNull("defenseBoostStat") ? Stat.fromId(node.get("defenseBoostStat").asText()) : null,
                        node.path("duration").asInt(5)));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid weather entry " + node, e);
            }
        }
        return result;
    }

    private List<TerrainData> parseTerrain(JsonNode root) {
        List<TerrainData> result = new ArrayList<>();
        for (JsonNode node : requireArray(root, "terrain.json")) {
            try {
                result.add(new TerrainData(Terrain.fromId(node.path("terrain").asText()),
                        optionalType(node, "boostedType"), node.path("boost").asDouble(1.0),
                        node.path("heal").asDouble(0.0), node.path("duration").asInt(5)));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException("Invalid terrain entry " + node, e);
            }
        }
        return result;
    }

    private static ElementType optionalType(JsonNode node, String field) {
        return node.hasNonNull(field) ? ElementType.fromId(node.get(field).asText()) : null;
    }

    private static JsonNode requireArray(JsonNode root, String name) {
        if (!root.isArray()) {
            throw new RuleTableException(name + " must contain a JSON array");
        }
        return root;
    }
}
