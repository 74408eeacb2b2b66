package com.gt.flashcard.card;

import com.gt.flashcard.model.Card;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface CardDao {

    Card loadCard(String cardId);

    List<Card> loadCards(Collection<String> cardIds);

    List<Card> loadAll();

    List<Card> loadDue(Instant now);

    void saveCard(Card card);

    int deleteCard(String cardId);

    int deleteAll();
}
