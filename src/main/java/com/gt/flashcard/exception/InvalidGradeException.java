package com.gt.flashcard.exception;

// Thrown when a grade is not one of again, hard, good or easy. No card is modified.
public class InvalidGradeException extends RuntimeException {

    public InvalidGradeException(String msg) {
        super(msg);
    }
}
