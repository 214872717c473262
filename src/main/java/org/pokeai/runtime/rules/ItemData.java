package org.pokeai.runtime.rules;

/**
 * Immutable held-item entry.
 */
public record ItemData(String id, String name, ItemKind kind) {

    public static final ItemData NONE = new ItemData("", "No Item", ItemKind.NONE);

    public boolean is(ItemKind candidate) {
        return kind == candidate;
    }
}
