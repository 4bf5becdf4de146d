package com.dubbi.brandtrail.classify;

public class ClassificationException extends RuntimeException {
    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
