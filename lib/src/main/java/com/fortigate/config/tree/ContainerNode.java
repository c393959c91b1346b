package com.fortigate.config.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A {@code config} section: an ordered map of uniquely keyed children. Iteration order is the
 * order in which keys first appeared in the source; overwriting a key keeps its position.
 */
public sealed abstract class ContainerNode extends ConfigNode permits ObjectNode, TableNode {
    private final Map<String, ConfigNode> children = new LinkedHashMap<>();

    ContainerNode() {}

    @Override
    public final boolean isContainer() {
        return true;
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public boolean containsKey(String key) {
        return children.containsKey(key);
    }

    /** Returns the child mapped under {@code key}, or throws {@link NodeNotFoundException}. */
    public ConfigNode get(String key) {
        ConfigNode node = children.get(key);
        if (node == null) {
            throw new NodeNotFoundException(key);
        }
        return node;
    }

    public Optional<ConfigNode> find(String key) {
        return Optional.ofNullable(children.get(key));
    }

    /** Live, read-only view of the keys in source order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(children.keySet());
    }

    /** Snapshot of the children in source order. */
    public List<ConfigItem> entries() {
        List<ConfigItem> items = new ArrayList<>(children.size());
        for (Map.Entry<String, ConfigNode> entry : children.entrySet()) {
            items.add(new ConfigItem(entry.getKey(), entry.getValue()));
        }
        return items;
    }

    /** Keys sorted case-insensitively. */
    public List<String> sortedKeys() {
        List<String> sorted = new ArrayList<>(children.keySet());
        sorted.sort(String.CASE_INSENSITIVE_ORDER);
        return sorted;
    }

    /**
     * Removes a child. Must not be called on a container that a traversal is currently
     * iterating.
     *
     * @return true if the key was present
     */
    public boolean remove(String key) {
        return children.remove(key) != null;
    }

    /**
     * Lists this container and all of its descendants breadth-first. Each item is keyed by the
     * path of keys from this container, joined with {@code delimiter} and prefixed by
     * {@code key}.
     */
    public List<ConfigItem> walk(String key, String delimiter) {
        Objects.requireNonNull(delimiter, "delimiter");
        List<ConfigItem> result = new ArrayList<>();
        Deque<ConfigItem> pending = new ArrayDeque<>();
        pending.add(new ConfigItem(key, this));
        while (!pending.isEmpty()) {
            ConfigItem item = pending.removeFirst();
            result.add(item);
            if (item.getNode() instanceof ContainerNode container) {
                for (Map.Entry<String, ConfigNode> child : container.children.entrySet()) {
                    pending.addLast(
                            new ConfigItem(item.getKey() + delimiter + child.getKey(), child.getValue()));
                }
            }
        }
        return result;
    }

    /** Inserts or replaces a child; a replaced key keeps its position. */
    void putChild(String key, ConfigNode node) {
        children.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(node, "node"));
    }

    ConfigNode child(String key) {
        return children.get(key);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        ContainerNode other = (ContainerNode) obj;
        return new ArrayList<>(children.entrySet()).equals(new ArrayList<>(other.children.entrySet()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(children.entrySet()).hashCode();
    }

    @Override
    public String toString() {
        return getKind() + children.keySet();
    }
}
