package com.gt.flashcard.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.flashcard.model.CardState;

import java.io.IOException;

public class CardStateDeserializer extends JsonDeserializer<CardState> {
    @Override
    public CardState deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String stateName = jsonParser.getValueAsString();

        try {
            return CardState.fromStateName(stateName);
        } catch (IllegalArgumentException ex) {
            return (CardState) deserializationContext.handleWeirdStringValue(CardState.class, stateName, ex.getMessage());
        }
    }
}
