package com.gt.flashcard.reviewSession;

import com.gt.flashcard.card.CardService;
import com.gt.flashcard.exception.StorageException;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.Grade;
import com.gt.flashcard.model.SessionMode;
import com.gt.flashcard.scheduling.CardStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * An in-progress review session: an ordered queue of cards and a position within it. After every answer the
 * remaining cards are re-read and re-ordered, and while cards remain a periodic check splices in cards that have
 * become due since the queue was built. New cards are admitted only up to the session's new card limit, both when
 * the queue is built and when the due check adds cards.
 * <p>
 * Answers and due checks are serialized on the session instance.
 */
public class ReviewSession {

    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final String sessionId;
    private final SessionMode mode;
    private final CardService cardService;
    private final CardStateMachine cardStateMachine;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration dueCheckInterval;
    private final int newCardLimit;

    private List<Card> cards = new ArrayList<>();
    private int currentIndex = 0;
    private boolean active = false;
    private int newCardsAdmitted = 0;
    private int newCardsAnswered = 0;
    private ScheduledFuture<?> dueCheck;

    ReviewSession(String sessionId,
                  SessionMode mode,
                  CardService cardService,
                  CardStateMachine cardStateMachine,
                  TaskScheduler taskScheduler,
                  Clock clock,
                  Duration dueCheckInterval,
                  int newCardLimit) {
        this.sessionId = sessionId;
        this.mode = mode;
        this.cardService = cardService;
        this.cardStateMachine = cardStateMachine;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.dueCheckInterval = dueCheckInterval;
        this.newCardLimit = Math.max(0, newCardLimit);
    }

    synchronized void start(List<Card> initialCards) {
        List<Card> prioritized = ReviewQueuePrioritizer.prioritize(initialCards, clock.instant());
        cards = new ArrayList<>(ReviewQueuePrioritizer.limitNewCards(prioritized, newCardLimit));
        newCardsAdmitted = countNewCards(cards);
        currentIndex = 0;
        active = true;

        if (cards.size() < prioritized.size()) {
            log.info("Holding back {} new cards over the limit of {} for review session {}",
                    prioritized.size() - cards.size(), newCardLimit, sessionId);
        }

        log.info("Started {} review session {} with {} cards", mode, sessionId, cards.size());

        if (!cards.isEmpty()) {
            startDueCheck();
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionMode getMode() {
        return mode;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized Optional<Card> current() {
        if (cards.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(cards.get(currentIndex));
    }

    public synchronized List<Card> getRemainingCards() {
        return List.copyOf(cards);
    }

    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    public synchronized int getNewCardsAnswered() {
        return newCardsAnswered;
    }

    public synchronized boolean isDueCheckScheduled() {
        return dueCheck != null;
    }

    /**
     * Grades and persists the current card, then re-orders what is left. The position stays where it was if it still
     * falls inside the shorter queue, and otherwise returns to the start.
     *
     * @return the graded card as persisted
     */
    public synchronized Card answer(Grade grade) {
        if (!active) {
            throw new IllegalStateException("Review session " + sessionId + " has ended");
        }
        if (cards.isEmpty()) {
            throw new IllegalStateException("Review session " + sessionId + " has no cards left to answer");
        }

        Card currentCard = cards.get(currentIndex);
        Card gradedCard = cardStateMachine.grade(currentCard, grade);
        cardService.saveCard(gradedCard);
        if (currentCard.state() == CardState.New) {
            newCardsAnswered++;
        }

        List<Card> remainingCards = new ArrayList<>(cards);
        remainingCards.remove(currentIndex);

        // Reloading can also empty the queue when the remaining cards were deleted elsewhere
        cards = remainingCards.isEmpty() ? remainingCards : reprioritize(remainingCards);
        if (currentIndex >= cards.size()) {
            currentIndex = 0;
        }
        if (cards.isEmpty()) {
            stopDueCheck();
            log.info("Review session {} has no cards left", sessionId);
        }

        return gradedCard;
    }

    public synchronized Card answer(String gradeName) {
        return answer(Grade.fromGradeName(gradeName));
    }

    /**
     * Finds cards that are due now but not queued and places them right after the current card. Cards that were
     * before the current position move to the end of the queue, and the position returns to the start.
     *
     * @return number of cards added
     */
    public synchronized int checkForNewlyDue() {
        if (!active || cards.isEmpty()) {
            return 0;
        }

        Instant now = clock.instant();
        List<Card> candidates = mode == SessionMode.Due ? cardService.loadDue(now) : cardService.loadAll();

        Set<String> queuedIds = cards.stream().map(Card::id).collect(Collectors.toSet());
        List<Card> newlyDue = admitNewCards(ReviewQueuePrioritizer.prioritize(candidates.stream()
                .filter(card -> !queuedIds.contains(card.id()) && card.isDue(now))
                .toList(), now));

        if (newlyDue.isEmpty()) {
            return 0;
        }

        List<Card> updatedCards = new ArrayList<>(cards.size() + newlyDue.size());
        updatedCards.add(cards.get(currentIndex));
        updatedCards.addAll(newlyDue);
        updatedCards.addAll(cards.subList(currentIndex + 1, cards.size()));
        updatedCards.addAll(cards.subList(0, currentIndex));

        log.info("Added {} newly due cards to review session {}, queue size {} -> {}",
                newlyDue.size(), sessionId, cards.size(), updatedCards.size());

        cards = updatedCards;
        currentIndex = 0;

        return newlyDue.size();
    }

    public synchronized void end() {
        if (!active) {
            return;
        }

        active = false;
        stopDueCheck();

        log.info("Ended review session {} with {} cards remaining", sessionId, cards.size());
    }

    // New cards beyond what is left of the limit are dropped; other cards always pass.
    private List<Card> admitNewCards(List<Card> newlyDue) {
        List<Card> admitted = ReviewQueuePrioritizer.limitNewCards(newlyDue, newCardLimit - newCardsAdmitted);
        newCardsAdmitted += countNewCards(admitted);

        return admitted;
    }

    private static int countNewCards(List<Card> cards) {
        return (int) cards.stream().filter(card -> card.state() == CardState.New).count();
    }

    // Re-reads the remaining cards so that changes made outside this queue are reflected in the ordering.
    private List<Card> reprioritize(List<Card> remainingCards) {
        List<Card> currentRemainingCards;
        try {
            currentRemainingCards = cardService.loadCards(remainingCards.stream().map(Card::id).toList());
        } catch (StorageException ex) {
            log.warn("Unable to reload remaining cards of review session {}, ordering cached copies", sessionId, ex);
            currentRemainingCards = remainingCards;
        }

        return new ArrayList<>(ReviewQueuePrioritizer.prioritize(currentRemainingCards, clock.instant()));
    }

    private void startDueCheck() {
        stopDueCheck();

        Instant firstCheck = clock.instant().plus(dueCheckInterval);
        dueCheck = taskScheduler.scheduleWithFixedDelay(this::runDueCheck, firstCheck, dueCheckInterval);
    }

    private void stopDueCheck() {
        if (dueCheck != null) {
            dueCheck.cancel(false);
            dueCheck = null;
        }
    }

    private void runDueCheck() {
        try {
            checkForNewlyDue();
        } catch (RuntimeException ex) {
            log.error("Due check failed for review session {}", sessionId, ex);
        }
    }
}
