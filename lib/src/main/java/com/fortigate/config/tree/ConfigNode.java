package com.fortigate.config.tree;

/**
 * A node of a parsed FortiGate configuration tree.
 *
 * <p>A node never stores the key it is mapped under; the key lives in the enclosing container.
 * The variant set is closed: leaves are {@link SetNode} and {@link UnsetNode}, containers are
 * {@link ObjectNode} (including {@link RootNode}) and {@link TableNode}.</p>
 */
public sealed abstract class ConfigNode permits SetNode, UnsetNode, ContainerNode {

    ConfigNode() {}

    public boolean isContainer() {
        return false;
    }

    /** Name of the variant, used in lookup error messages. */
    public abstract String getKind();
}
