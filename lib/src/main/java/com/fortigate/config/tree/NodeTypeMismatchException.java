package com.fortigate.config.tree;

public final class NodeTypeMismatchException extends ConfigLookupException {
    private final String expectedKind;
    private final String actualKind;

    public NodeTypeMismatchException(String key, String expectedKind, String actualKind) {
        super(key, "'" + key + "' is a " + actualKind + " node, not a " + expectedKind + " node");
        this.expectedKind = expectedKind;
        this.actualKind = actualKind;
    }

    public String getExpectedKind() {
        return expectedKind;
    }

    public String getActualKind() {
        return actualKind;
    }
}
