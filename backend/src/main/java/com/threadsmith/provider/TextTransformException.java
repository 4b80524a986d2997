package com.threadsmith.provider;

public class TextTransformException extends RuntimeException {

    public TextTransformException(String message) {
        super(message);
    }

    public TextTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
