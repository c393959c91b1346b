package com.fortigate.config.traversal;

import com.fortigate.config.tree.ConfigItem;

/**
 * Callback of {@link ConfigTraverser}. Called once with {@code enter == true} before a node's
 * children are visited and once with {@code enter == false} afterwards; leaves get both calls
 * back to back. The value returned from an exit call is ignored.
 *
 * @param <T> type of the user payload threaded through the walk
 */
@FunctionalInterface
public interface ConfigVisitor<T> {

    VisitResult visit(boolean enter, ConfigItem item, TraversalContext context, T userData);
}
