package com.fortigate.config.traversal;

import com.fortigate.config.tree.ConfigItem;
import com.fortigate.config.tree.ConfigNode;
import com.fortigate.config.tree.ContainerNode;
import com.fortigate.config.tree.RootNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Depth-first enter/exit walk over a configuration tree.
 *
 * <p>The keys of a container are copied before its children are visited, so a visitor may edit
 * {@code set} values freely. Adding or removing keys of a container while it is being iterated
 * is not supported; a copied key that has disappeared is skipped.</p>
 */
public final class ConfigTraverser {

    private ConfigTraverser() {}

    /** Visits the children of a root; the root itself is not reported. */
    public static <T> void traverse(RootNode root, ConfigVisitor<T> visitor, T userData) {
        traverseChildren(root, visitor, new TraversalContext(), userData);
    }

    /** Visits {@code node} under {@code key}, then its descendants. */
    public static <T> void traverse(
            String key, ConfigNode node, ConfigVisitor<T> visitor, TraversalContext context, T userData) {
        Objects.requireNonNull(visitor, "visitor");
        Objects.requireNonNull(context, "context");
        visitItem(new ConfigItem(key, node), visitor, context, userData);
    }

    public static <T> void traverseChildren(
            ContainerNode container, ConfigVisitor<T> visitor, TraversalContext context, T userData) {
        Objects.requireNonNull(visitor, "visitor");
        Objects.requireNonNull(context, "context");
        List<String> keys = new ArrayList<>(container.keys());
        for (String key : keys) {
            Optional<ConfigNode> child = container.find(key);
            if (child.isPresent()) {
                visitItem(new ConfigItem(key, child.get()), visitor, context, userData);
            }
        }
    }

    private static <T> void visitItem(
            ConfigItem item, ConfigVisitor<T> visitor, TraversalContext context, T userData) {
        VisitResult result = visitor.visit(true, item, context, userData);
        if (item.getNode() instanceof ContainerNode container && result != VisitResult.SKIP_SUBTREE) {
            context.push(item);
            try {
                traverseChildren(container, visitor, context, userData);
            } finally {
                context.pop();
            }
        }
        visitor.visit(false, item, context, userData);
    }
}
