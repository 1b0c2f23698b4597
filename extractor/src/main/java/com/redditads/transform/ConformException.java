package com.redditads.transform;

/**
 * A record value could not be coerced to any type its schema allows.
 */
public class ConformException extends RuntimeException {

    private final String path;

    public ConformException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
