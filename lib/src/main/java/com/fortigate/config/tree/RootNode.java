package com.fortigate.config.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The top of a configuration scope. Its direct children are the top-level {@code config}
 * sections, keyed by their full name such as {@code system global} or
 * {@code firewall address}.
 */
public final class RootNode extends ObjectNode {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RootScope scope;
    private final String scopeName;

    public RootNode(RootScope scope, String scopeName) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.scopeName = Objects.requireNonNull(scopeName, "scopeName");
    }

    public static RootNode of(RootScope scope, String scopeName, ObjectNode source) {
        RootNode root = new RootNode(scope, scopeName);
        for (ConfigItem item : source.entries()) {
            root.putChild(item.getKey(), item.getNode());
        }
        return root;
    }

    public RootScope getScope() {
        return scope;
    }

    /** VDOM name for {@link RootScope#VDOM}, {@code global} or empty otherwise. */
    public String getScopeName() {
        return scopeName;
    }

    @Override
    public String getKind() {
        return "root";
    }

    /** All sections (object or table children) in source order. */
    public List<ConfigItem> sections() {
        List<ConfigItem> sections = new ArrayList<>();
        for (ConfigItem item : entries()) {
            if (item.getNode().isContainer()) {
                sections.add(item);
            }
        }
        return sections;
    }

    /**
     * Sections whose name starts with the words of {@code partialKey}. Whole words are
     * compared, so {@code sections("firewall address")} does not return
     * {@code firewall address6}.
     */
    public List<ConfigItem> sections(String partialKey) {
        List<String> prefix = words(partialKey);
        List<ConfigItem> sections = new ArrayList<>();
        for (ConfigItem item : sections()) {
            List<String> name = words(item.getKey());
            if (name.size() >= prefix.size() && name.subList(0, prefix.size()).equals(prefix)) {
                sections.add(item);
            }
        }
        return sections;
    }

    private static List<String> words(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(WHITESPACE.split(trimmed));
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) {
            return false;
        }
        RootNode other = (RootNode) obj;
        return scope == other.scope && scopeName.equals(other.scopeName);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hash(scope, scopeName);
    }

    @Override
    public String toString() {
        return scope + (scopeName.isEmpty() ? "" : " " + scopeName) + keys();
    }
}
