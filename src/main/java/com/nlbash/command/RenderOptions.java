package com.nlbash.command;

/**
 * @param looseConstraints render structurally invalid trees best-effort instead of failing
 * @param ignoreFlagOrder  order the flags of each utility alphabetically
 * @param argTypeOnly      render arguments as their type tag
 */
public record RenderOptions(boolean looseConstraints, boolean ignoreFlagOrder, boolean argTypeOnly) {

    public static RenderOptions defaults() {
        return new RenderOptions(false, false, false);
    }

    /**
     * Options for templates: flags are always in alphabetical order.
     */
    public static RenderOptions template(boolean looseConstraints, boolean argTypeOnly) {
        return new RenderOptions(looseConstraints, true, argTypeOnly);
    }
}
