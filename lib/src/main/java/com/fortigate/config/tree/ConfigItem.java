package com.fortigate.config.tree;

import java.util.Objects;

/** A child node together with the key it is mapped under in its container. */
public final class ConfigItem {
    private final String key;
    private final ConfigNode node;

    public ConfigItem(String key, ConfigNode node) {
        this.key = Objects.requireNonNull(key, "key");
        this.node = Objects.requireNonNull(node, "node");
    }

    public String getKey() {
        return key;
    }

    public ConfigNode getNode() {
        return node;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConfigItem)) {
            return false;
        }
        ConfigItem other = (ConfigItem) obj;
        return key.equals(other.key) && node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, node);
    }

    @Override
    public String toString() {
        return key + "=" + node.getKind();
    }
}
