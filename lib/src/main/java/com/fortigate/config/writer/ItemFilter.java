package com.fortigate.config.writer;

import com.fortigate.config.traversal.TraversalContext;
import com.fortigate.config.tree.ConfigItem;

/**
 * Decides which items {@link ConfigWriter} emits. Rejecting a section drops its whole subtree.
 *
 * @param <T> type of the user payload passed through to the filter
 */
@FunctionalInterface
public interface ItemFilter<T> {

    boolean include(ConfigItem item, TraversalContext context, T userData);

    static <T> ItemFilter<T> all() {
        return (item, context, userData) -> true;
    }
}
