package com.fortigate.config.tree;

public final class NodeNotFoundException extends ConfigLookupException {

    public NodeNotFoundException(String key) {
        super(key, "'" + key + "' not found");
    }

    public NodeNotFoundException(String key, String message) {
        super(key, message);
    }
}
