package org.pokeai.runtime.rules;

/**
 * Six stat values, used both for species base stats and for a combatant's derived stats.
 */
public record StatBlock(int hp, int attack, int defense, int specialAttack, int specialDefense, int speed) {

    public int get(Stat stat) {
        return switch (stat) {
            case HP -> hp;
            case ATTACK -> attack;
            case DEFENSE -> defense;
            case SPECIAL_ATTACK -> specialAttack;
            case SPECIAL_DEFENSE -> specialDefense;
            case SPEED -> speed;
            default -> throw new IllegalArgumentException("No stored value for " + stat);
        };
    }

    public StatBlock with(Stat stat, int value) {
        return switch (stat) {
            case HP -> new StatBlock(value, attack, defense, specialAttack, specialDefense, speed);
            case ATTACK -> new StatBlock(hp, value, defense, specialAttack, specialDefense, speed);
            case DEFENSE -> new StatBlock(hp, attack, value, specialAttack, specialDefense, speed);
            case SPECIAL_ATTACK -> new StatBlock(hp, attack, defense, value, specialDefense, speed);
            case SPECIAL_DEFENSE -> new StatBlock(hp, attack, defense, specialAttack, value, speed);
            case SPEED -> new StatBlock(hp, attack, defense, specialAttack, specialDefense, value);
            default -> throw new IllegalArgumentException("No stored value for " + stat);
        };
    }

    public static StatBlock uniform(int value) {
        return new StatBlock(value, value, value, value, value, value);
    }
}
