package com.fortigate.config.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code config} section holding {@code set}, {@code unset} and nested {@code config}
 * commands, or the body of an {@code edit} block.
 *
 * <p>Typed accessors fail with {@link NodeNotFoundException} when a key is absent and with
 * {@link NodeTypeMismatchException} when it maps to another variant. The {@code find*}
 * variants return an empty {@link Optional} for absent keys instead.</p>
 *
 * <pre>
 * config system interface
 *     edit "port1"
 *         set ip 10.1.1.10 255.255.255.0
 *         set allowaccess ping https
 *         set alias "lan"
 *     next
 * end
 * </pre>
 *
 * For the {@code port1} body, {@code param("alias")} returns {@code "\"lan\""},
 * {@code getSet("ip").getValues()} returns both tokens and {@code getObject("ip")} throws
 * {@link NodeTypeMismatchException}.
 */
public sealed class ObjectNode extends ContainerNode permits RootNode {

    public ObjectNode() {}

    @Override
    public String getKind() {
        return "object";
    }

    public ObjectNode getObject(String key) {
        return as(key, get(key), ObjectNode.class, "object");
    }

    public TableNode getTable(String key) {
        return as(key, get(key), TableNode.class, "table");
    }

    public SetNode getSet(String key) {
        return as(key, get(key), SetNode.class, "set");
    }

    public Optional<ObjectNode> findObject(String key) {
        return find(key).map(node -> as(key, node, ObjectNode.class, "object"));
    }

    public Optional<TableNode> findTable(String key) {
        return find(key).map(node -> as(key, node, TableNode.class, "table"));
    }

    public Optional<SetNode> findSet(String key) {
        return find(key).map(node -> as(key, node, SetNode.class, "set"));
    }

    /** First value token of the {@code set} command mapped under {@code key}. */
    public String param(String key) {
        return getSet(key).first();
    }

    /** Like {@link #param(String)} but returns {@code defaultValue} when the key is absent. */
    public String param(String key, String defaultValue) {
        return findSet(key).map(SetNode::first).orElse(defaultValue);
    }

    /** Compares {@link #param(String)} with {@code value}; an absent key is never the same. */
    public boolean same(String key, String value) {
        return findSet(key).map(set -> set.first().equals(value)).orElse(false);
    }

    /** Follows a path of nested objects, e.g. {@code at("system global")}. */
    public ObjectNode at(String... path) {
        ObjectNode current = this;
        for (String key : path) {
            current = current.getObject(key);
        }
        return current;
    }

    /**
     * Resolves a parameter below nested objects: the last element is the parameter key, the
     * preceding ones name the objects leading to it.
     */
    public String paramAt(String... path) {
        if (path.length == 0) {
            throw new IllegalArgumentException("A parameter path needs at least one key");
        }
        ObjectNode current = this;
        for (int i = 0; i < path.length - 1; i++) {
            current = current.getObject(path[i]);
        }
        return current.param(path[path.length - 1]);
    }

    /**
     * Assigns a {@code set} command. An existing {@link SetNode} under the key is updated in
     * place; any other node under the key is replaced at its position.
     */
    public SetNode assign(String key, List<String> values) {
        if (child(key) instanceof SetNode existing) {
            existing.replaceValues(values);
            return existing;
        }
        SetNode set = new SetNode(values);
        putChild(key, set);
        return set;
    }

    /** Records an {@code unset} command under the key, keeping the key's position. */
    public UnsetNode unassign(String key) {
        UnsetNode unset = new UnsetNode();
        putChild(key, unset);
        return unset;
    }

    /** Inserts or replaces a nested section; a replaced key keeps its position. */
    public void put(String key, ContainerNode section) {
        putChild(key, Objects.requireNonNull(section, "section"));
    }

    static <T extends ConfigNode> T as(String key, ConfigNode node, Class<T> type, String kind) {
        if (!type.isInstance(node)) {
            throw new NodeTypeMismatchException(key, kind, node.getKind());
        }
        return type.cast(node);
    }
}
