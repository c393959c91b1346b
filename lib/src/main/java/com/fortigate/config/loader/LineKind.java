package com.fortigate.config.loader;

/** Classification of a logical configuration line by its leading keyword. */
public enum LineKind {
    CONFIG,
    EDIT,
    SET,
    UNSET,
    NEXT,
    END,
    COMMENT,
    BLANK,
    UNKNOWN;

    /** Comment and blank lines carry no structure. */
    public boolean isStructural() {
        return this != COMMENT && this != BLANK;
    }
}
