package com.localization.generator.codegen.model.tree;

/**
 * Payload carried by a {@link Node}.
 */
public interface TreeValue {

    /**
     * Whether a node holding this value may own children.
     */
    boolean isContainer();
}
