package com.fortigate.config.tree;

/** Which part of a configuration file a {@link RootNode} stands for. */
public enum RootScope {
    /** The whole file of a configuration without VDOMs. */
    CONFIG,
    /** The {@code config global} section of a multi-VDOM configuration. */
    GLOBAL,
    /** The top scope of a single VDOM. */
    VDOM
}
