package com.fortigate.config.traversal;

import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ConfigNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The chain of ancestors of the node being visited, outermost first. The traversal pushes a
 * container before visiting its children and pops it afterwards, so during a visit the context
 * ends with the visited node's parent.
 */
public final class TraversalContext {
    private final List<ConfigItem> ancestors = new ArrayList<>();

    public TraversalContext() {}

    public int depth() {
        return ancestors.size();
    }

    public boolean isEmpty() {
        return ancestors.isEmpty();
    }

    public List<ConfigItem> getAncestors() {
        return Collections.unmodifiableList(ancestors);
    }

    public Optional<ConfigItem> parent() {
        return ancestors.isEmpty() ? Optional.empty() : Optional.of(ancestors.get(ancestors.size() - 1));
    }

    public Optional<ConfigNode> parentNode() {
        return parent().map(ConfigItem::getNode);
    }

    /** True if any ancestor is mapped under {@code key}. */
    public boolean isWithin(String key) {
        for (ConfigItem ancestor : ancestors) {
            if (ancestor.getKey().equals(key)) {
                return true;
            }
        }
        return false;
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(ancestors.size());
        for (ConfigItem ancestor : ancestors) {
            keys.add(ancestor.getKey());
        }
        return keys;
    }

    public String path(String delimiter) {
        return String.join(delimiter, keys());
    }

    public void push(ConfigItem item) {
        ancestors.add(item);
    }

    public ConfigItem pop() {
        if (ancestors.isEmpty()) {
            throw new IllegalStateException("Traversal context is empty");
        }
        return ancestors.remove(ancestors.size() - 1);
    }

    @Override
    public String toString() {
        return path("/");
    }
}
