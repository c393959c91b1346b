package com.fortigate.config.tree;

/**
 * Raised by the typed accessors of the tree when a caller asks for a key that is absent or that
 * maps to another node variant. Callers decide whether to recover.
 */
public abstract class ConfigLookupException extends RuntimeException {
    private final String key;

    protected ConfigLookupException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
