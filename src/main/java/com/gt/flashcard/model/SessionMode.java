package com.gt.flashcard.model;

public enum SessionMode {
    // Only cards due at session start
    Due,
    // Every card, due cards first
    All
}
