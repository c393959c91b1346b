package com.fortigate.config.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code set <key> <values...>} command. Values are the raw tokens of the line, quoted tokens
 * keep their double quotes.
 */
public final class SetNode extends ConfigNode {
    /** Token that precedes an obfuscated secret, as in {@code set password ENC <ciphertext>}. */
    public static final String ENCRYPTION_MARKER = "ENC";

    private final List<String> values;

    public SetNode(List<String> values) {
        this.values = new ArrayList<>(requireValues(values));
    }

    public SetNode(String first, String... more) {
        this(asList(first, more));
    }

    public List<String> getValues() {
        return Collections.unmodifiableList(values);
    }

    public String getValue(int index) {
        return values.get(index);
    }

    public String first() {
        return values.get(0);
    }

    public int size() {
        return values.size();
    }

    /** Replaces one token in place. */
    public void setValue(int index, String token) {
        values.set(index, Objects.requireNonNull(token, "token"));
    }

    /** Replaces all tokens while keeping this node, and therefore its position, in the tree. */
    public void replaceValues(List<String> tokens) {
        List<String> checked = List.copyOf(requireValues(tokens));
        values.clear();
        values.addAll(checked);
    }

    /** True when the value list is the encryption marker followed by ciphertext. */
    public boolean isEncrypted() {
        return values.size() >= 2 && ENCRYPTION_MARKER.equals(values.get(0));
    }

    @Override
    public String getKind() {
        return "set";
    }

    private static List<String> requireValues(List<String> tokens) {
        Objects.requireNonNull(tokens, "values");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("A set command requires at least one value");
        }
        for (String token : tokens) {
            Objects.requireNonNull(token, "value token");
        }
        return tokens;
    }

    private static List<String> asList(String first, String... more) {
        List<String> list = new ArrayList<>(1 + more.length);
        list.add(first);
        Collections.addAll(list, more);
        return list;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SetNode)) {
            return false;
        }
        return values.equals(((SetNode) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", values);
    }
}
