package com.gt.flashcard.exception;

// Wraps any failure of the backing store. Not retried.
public class StorageException extends RuntimeException {

    public StorageException(String errMsg)  {
        super(errMsg);
    }

    public StorageException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
