package com.gt.flashcard.card;

import com.gt.flashcard.exception.CardNotFoundException;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.Grade;
import com.gt.flashcard.scheduling.CardStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private final CardDao cardDao;
    private final CardStateMachine cardStateMachine;
    private final Clock clock;

    @Autowired
    public CardService(CardDao cardDao, CardStateMachine cardStateMachine, Clock clock) {
        this.cardDao = cardDao;
        this.cardStateMachine = cardStateMachine;
        this.clock = clock;
    }

    public Card addCard(String front, String back) {
        verifyCardText(front, back);

        Card card = Card.newCard(UUID.randomUUID().toString(), front.trim(), back.trim(), clock.instant());
        cardDao.saveCard(card);

        return card;
    }

    public Card loadCard(String cardId) {
        Card card = cardDao.loadCard(cardId);
        if (card == null) {
            throw new CardNotFoundException(cardId);
        }

        return card;
    }

    // Cards that no longer exist are left out; order follows the requested ids.
    public List<Card> loadCards(List<String> cardIds) {
        Map<String, Card> cardsById = cardDao.loadCards(cardIds).stream()
                .collect(Collectors.toMap(Card::id, Function.identity()));

        return cardIds.stream()
                .filter(cardsById::containsKey)
                .map(cardsById::get)
                .toList();
    }

    public List<Card> loadAll() {
        return cardDao.loadAll();
    }

    public List<Card> loadDue(Instant now) {
        List<Card> dueCards = cardDao.loadDue(now);

        if (log.isDebugEnabled()) {
            Map<CardState, Long> breakdown = dueCards.stream().collect(Collectors.groupingBy(Card::state, Collectors.counting()));
            log.debug("{} cards due at {}: {}", dueCards.size(), now, breakdown);
        }

        return dueCards;
    }

    public Card updateCardText(String cardId, String front, String back) {
        verifyCardText(front, back);

        Card updatedCard = loadCard(cardId).withText(front.trim(), back.trim());
        cardDao.saveCard(updatedCard);

        return updatedCard;
    }

    public Card gradeCard(String cardId, Grade grade) {
        Card gradedCard = cardStateMachine.grade(loadCard(cardId), grade);
        cardDao.saveCard(gradedCard);

        return gradedCard;
    }

    public Card saveCard(Card card) {
        cardDao.saveCard(card);

        return card;
    }

    public void deleteCard(String cardId) {
        if (cardDao.deleteCard(cardId) == 0) {
            throw new CardNotFoundException(cardId);
        }
    }

    public int clearAllCards() {
        int deleteCnt = cardDao.deleteAll();
        log.info("Deleted {} cards", deleteCnt);

        return deleteCnt;
    }

    public List<Card> searchCards(String query) {
        if (query == null || query.isBlank()) {
            return cardDao.loadAll();
        }

        String lowerQuery = query.toLowerCase(Locale.ROOT);
        return cardDao.loadAll().stream()
                .filter(card -> containsIgnoreCase(card.front(), lowerQuery) || containsIgnoreCase(card.back(), lowerQuery))
                .toList();
    }

    private static boolean containsIgnoreCase(String text, String lowerQuery) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }

    private static void verifyCardText(String front, String back) {
        if (front == null || front.isBlank() || back == null || back.isBlank()) {
            throw new IllegalArgumentException("Card front and back must not be blank");
        }
    }
}
