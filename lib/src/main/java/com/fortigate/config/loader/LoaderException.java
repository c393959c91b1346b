package com.fortigate.config.loader;

/** Checked exception signalling that a configuration could not be read or parsed. */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
