package com.gt.flashcard.exception;

public class InvalidConfigException extends RuntimeException {

    public InvalidConfigException(String msg) {
        super(msg);
    }

    public InvalidConfigException(String msg, Exception ex) {
        super(msg, ex);
    }
}
