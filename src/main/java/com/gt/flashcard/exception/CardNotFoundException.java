package com.gt.flashcard.exception;

public class CardNotFoundException extends RuntimeException {

    private final String cardId;

    public CardNotFoundException(String cardId) {
        super("Card " + cardId + " does not exist");
        this.cardId = cardId;
    }

    public String getCardId() {
        return cardId;
    }
}
