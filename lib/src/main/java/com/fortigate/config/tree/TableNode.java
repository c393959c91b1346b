package com.fortigate.config.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code config} section made of {@code edit} blocks. Entries are keyed by the raw edit
 * identifier, so {@code edit "port1"} is stored as {@code "port1"} with its quotes and
 * {@code edit 3} as {@code 3}.
 */
public final class TableNode extends ContainerNode {

    public TableNode() {}

    @Override
    public String getKind() {
        return "table";
    }

    /**
     * Resolves an edit block by identifier. The identifier is matched literally first; when
     * that fails its quoted form is tried, so {@code entry("port1")} finds
     * {@code edit "port1"}.
     */
    public ObjectNode entry(String id) {
        return findEntry(id).orElseThrow(() -> new NodeNotFoundException(id, "edit block '" + id + "' not found"));
    }

    public Optional<ObjectNode> findEntry(String id) {
        Objects.requireNonNull(id, "id");
        ConfigNode node = child(id);
        if (node == null) {
            node = child(Quoting.quote(id));
        }
        return Optional.ofNullable((ObjectNode) node);
    }

    /** Resolves an edit block by its 0-based position in source order. */
    public ObjectNode entry(int index) {
        if (index < 0 || index >= size()) {
            throw new NodeNotFoundException(
                    String.valueOf(index), "edit block index " + index + " out of range [0, " + size() + ")");
        }
        return (ObjectNode) entries().get(index).getNode();
    }

    /** Identifiers of all edit blocks with surrounding quotes removed. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(size());
        for (String key : keys()) {
            ids.add(Quoting.unquote(key));
        }
        return ids;
    }

    /** Inserts or replaces an edit block; a replaced identifier keeps its position. */
    public void putEntry(String id, ObjectNode body) {
        putChild(id, Objects.requireNonNull(body, "body"));
    }
}
