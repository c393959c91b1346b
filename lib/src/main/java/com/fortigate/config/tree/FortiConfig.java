package com.fortigate.config.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed FortiGate configuration.
 *
 * <p>Without VDOMs, {@link #getRoot()} holds every top-level section and {@link #getVdoms()} is
 * empty. With VDOMs, {@link #getRoot()} holds the {@code config global} section only and each
 * VDOM gets its own {@link RootNode}.</p>
 */
public final class FortiConfig {
    private final HeaderComments comments;
    private final RootNode root;
    private final Map<String, RootNode> vdoms;

    public FortiConfig(HeaderComments comments, RootNode root, Map<String, RootNode> vdoms) {
        this.comments = Objects.requireNonNull(comments, "comments");
        this.root = Objects.requireNonNull(root, "root");
        this.vdoms = Collections.unmodifiableMap(new LinkedHashMap<>(vdoms));
        requireSections(root);
        for (RootNode vdom : this.vdoms.values()) {
            requireSections(vdom);
        }
    }

    public HeaderComments getComments() {
        return comments;
    }

    public boolean isMultiVdom() {
        return !vdoms.isEmpty();
    }

    public RootNode getRoot() {
        return root;
    }

    public Map<String, RootNode> getVdoms() {
        return vdoms;
    }

    public RootNode getVdom(String name) {
        RootNode vdom = vdoms.get(name);
        if (vdom == null) {
            throw new NodeNotFoundException(name, "vdom '" + name + "' not found");
        }
        return vdom;
    }

    private static void requireSections(RootNode root) {
        for (ConfigItem item : root.entries()) {
            if (!item.getNode().isContainer()) {
                throw new IllegalArgumentException(
                        "Top-level item '" + item.getKey() + "' must be a config section, got " + item.getNode().getKind());
            }
        }
    }
}
