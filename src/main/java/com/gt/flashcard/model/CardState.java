package com.gt.flashcard.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcard.serialization.CardStateDeserializer;
import com.gt.flashcard.serialization.CardStateSerializer;

import java.time.temporal.ChronoUnit;

@JsonSerialize(using = CardStateSerializer.class)
@JsonDeserialize(using = CardStateDeserializer.class)
public enum CardState {
    New("new", null),
    Learning("learning", ChronoUnit.MINUTES),
    Review("review", ChronoUnit.DAYS),
    Relearning("relearning", ChronoUnit.MINUTES);

    private final String stateName;
    private final ChronoUnit intervalUnit;

    CardState(String stateName, ChronoUnit intervalUnit) {
        this.stateName = stateName;
        this.intervalUnit = intervalUnit;
    }

    public String getStateName() {
        return stateName;
    }

    // Unit of Card.interval while in this state. New cards have no interval yet.
    public ChronoUnit getIntervalUnit() {
        return intervalUnit;
    }

    public boolean isStepped() {
        return this == Learning || this == Relearning;
    }

    public static CardState fromStateName(String stateName) {
        for (CardState cardState : values()) {
            if (cardState.stateName.equalsIgnoreCase(stateName)) {
                return cardState;
            }
        }

        throw new IllegalArgumentException("Unknown card state " + stateName);
    }
}
