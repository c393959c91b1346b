package com.fortigate.config.traversal;

/** What a {@link ConfigVisitor} asks the traversal to do after an enter call. */
public enum VisitResult {
    CONTINUE,
    /** Do not descend into the current container; its exit call is still delivered. */
    SKIP_SUBTREE
}
