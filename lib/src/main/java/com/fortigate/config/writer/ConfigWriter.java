package com.fortigate.config.writer;

import com.fortigate.config.traversal.ConfigTraverser;
import com.fortigate.config.traversal.ConfigVisitor;
import com.fortigate.config.traversal.TraversalContext;
import com.fortigate.config.traversal.VisitResult;
import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ConfigNode;
import com.fortigate.config.tree.ContainerNode;
import com.fortigate.config.tree.FortiConfig;
import com.fortigate.config.tree.RootNode;
import com.fortigate.config.tree.SetNode;
import com.fortigate.config.tree.TableNode;
import com.fortigate.config.tree.UnsetNode;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Serializes a configuration tree back to the FortiGate text format.
 *
 * <p>Keys and values are written exactly as they were parsed, so quoted identifiers stay quoted
 * and bare ones stay bare. Writing a parsed configuration with no filter and parsing the output
 * again yields an equal tree.</p>
 */
public final class ConfigWriter {
    public static final int DEFAULT_INDENT = 4;
    private static final String VDOM_SECTION = "config vdom";
    private static final String GLOBAL_SECTION = "config global";

    private final String indentUnit;

    public ConfigWriter() {
        this(DEFAULT_INDENT);
    }

    public ConfigWriter(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        this.indentUnit = " ".repeat(indent);
    }

    public void write(FortiConfig config, Appendable out, boolean includeComments) throws IOException {
        write(config, out, includeComments, null, null);
    }

    /**
     * Writes the configuration to {@code out}.
     *
     * @param includeComments write the header comment lines first
     * @param filter items rejected by the filter are left out, {@code null} keeps everything
     */
    public <T> void write(
            FortiConfig config, Appendable out, boolean includeComments, ItemFilter<T> filter, T userData)
            throws IOException {
        if (includeComments) {
            appendLines(out, config.getComments().getLines());
        }
        appendLines(out, lines(config, filter, userData));
    }

    /** Writes one section, e.g. {@code writeSection("system global", object, out, null, null)}. */
    public <T> void writeSection(
            String key, ContainerNode section, Appendable out, ItemFilter<T> filter, T userData)
            throws IOException {
        List<String> lines = new ArrayList<>();
        ConfigTraverser.traverse(key, section, new LineCollector<>(lines, filter), new TraversalContext(), userData);
        appendLines(out, lines);
    }

    /** Renders the configuration without header comments. */
    public String toText(FortiConfig config) {
        return String.join("\n", lines(config, null, null));
    }

    /** The configuration as a list of lines, without header comments. */
    public <T> List<String> lines(FortiConfig config, ItemFilter<T> filter, T userData) {
        List<String> lines = new ArrayList<>();
        LineCollector<T> collector = new LineCollector<>(lines, filter);
        if (!config.isMultiVdom()) {
            ConfigTraverser.traverse(config.getRoot(), collector, userData);
            return lines;
        }

        lines.add("");
        lines.add(VDOM_SECTION);
        for (String name : config.getVdoms().keySet()) {
            lines.add("edit " + name);
            lines.add("next");
        }
        lines.add("end");
        lines.add("");
        lines.add(GLOBAL_SECTION);
        ConfigTraverser.traverse(config.getRoot(), collector, userData);
        lines.add("end");
        lines.add("");
        for (Map.Entry<String, RootNode> vdom : config.getVdoms().entrySet()) {
            lines.add(VDOM_SECTION);
            lines.add("edit " + vdom.getKey());
            ConfigTraverser.traverse(vdom.getValue(), collector, userData);
            lines.add("end");
            lines.add("");
        }
        return lines;
    }

    private static void appendLines(Appendable out, List<String> lines) throws IOException {
        for (String line : lines) {
            out.append(line).append('\n');
        }
    }

    private final class LineCollector<T> implements ConfigVisitor<T> {
        private final List<String> lines;
        private final ItemFilter<T> filter;
        // One flag per open container: whether its enter line was written.
        private final Deque<Boolean> openSections = new ArrayDeque<>();

        LineCollector(List<String> lines, ItemFilter<T> filter) {
            this.lines = lines;
            this.filter = filter;
        }

        @Override
        public VisitResult visit(boolean enter, ConfigItem item, TraversalContext context, T userData) {
            ConfigNode node = item.getNode();
            if (!(node instanceof ContainerNode)) {
                if (enter && included(item, context, userData)) {
                    emit(context, leafLine(item.getKey(), node));
                }
                return VisitResult.CONTINUE;
            }

            boolean inTable = context.parentNode().map(parent -> parent instanceof TableNode).orElse(false);
            if (enter) {
                boolean include = included(item, context, userData);
                openSections.push(include);
                if (!include) {
                    return VisitResult.SKIP_SUBTREE;
                }
                emit(context, (inTable ? "edit " : "config ") + item.getKey());
                return VisitResult.CONTINUE;
            }
            if (openSections.pop()) {
                emit(context, inTable ? "next" : "end");
            }
            return VisitResult.CONTINUE;
        }

        private boolean included(ConfigItem item, TraversalContext context, T userData) {
            return filter == null || filter.include(item, context, userData);
        }

        private void emit(TraversalContext context, String line) {
            lines.add(indentUnit.repeat(context.depth()) + line);
        }

        private String leafLine(String key, ConfigNode node) {
            if (node instanceof SetNode set) {
                return "set " + key + " " + String.join(" ", set.getValues());
            }
            if (node instanceof UnsetNode) {
                return "unset " + key;
            }
            throw new IllegalStateException("Unexpected node kind " + node.getKind());
        }
    }
}
