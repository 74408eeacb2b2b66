package com.gt.flashcard.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcard.model.CardState;

import java.io.IOException;

public class CardStateSerializer extends JsonSerializer<CardState> {
    @Override
    public void serialize(CardState cardState, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(cardState.getStateName());
    }
}
