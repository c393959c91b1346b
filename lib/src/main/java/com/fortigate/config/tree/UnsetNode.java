package com.fortigate.config.tree;

/** An {@code unset <key>} command. */
public final class UnsetNode extends ConfigNode {

    public UnsetNode() {}

    @Override
    public String getKind() {
        return "unset";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnsetNode;
    }

    @Override
    public int hashCode() {
        return UnsetNode.class.hashCode();
    }

    @Override
    public String toString() {
        return "unset";
    }
}
