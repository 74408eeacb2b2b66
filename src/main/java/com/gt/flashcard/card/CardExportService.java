package com.gt.flashcard.card;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashcard.learningConfig.LearningConfigService;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.LearningConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Moves the whole collection in and out as JSON: {@code {"cards": [...], "config": {...}}}. Import also accepts a
 * bare array of cards.
 */
@Component
public class CardExportService {

    private static final Logger log = LoggerFactory.getLogger(CardExportService.class);

    private final CardDao cardDao;
    private final LearningConfigService learningConfigService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public CardExportService(CardDao cardDao,
                             LearningConfigService learningConfigService,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.cardDao = cardDao;
        this.learningConfigService = learningConfigService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String exportData() {
        ExportedData exportedData = new ExportedData(cardDao.loadAll(), learningConfigService.getLearningConfig());

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(exportedData);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize " + exportedData.cards().size() + " cards", ex);
        }
    }

    public int importData(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON format", ex);
        }
        if (root == null || !(root.isArray() || root.isObject())) {
            throw new IllegalArgumentException("Invalid JSON format");
        }

        JsonNode cardNodes = root.isArray() ? root : root.path("cards");
        Instant now = clock.instant();
        List<Card> cardsToSave = new ArrayList<>();

        for (JsonNode cardNode : cardNodes) {
            Card card = toCard(cardNode, now);

            if (card != null) {
                cardsToSave.add(card);
            } else {
                log.warn("Skipping imported card without front or back: {}", cardNode);
            }
        }

        if (root.hasNonNull("config")) {
            importConfig(root.get("config"));
        }
        for (Card card : cardsToSave) {
            cardDao.saveCard(card);
        }

        log.info("Imported {} cards", cardsToSave.size());
        return cardsToSave.size();
    }

    private void importConfig(JsonNode configNode) {
        LearningConfig learningConfig;
        try {
            learningConfig = objectMapper.treeToValue(configNode, LearningConfig.class);
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable imported learning config: {}", ex.getMessage());
            return;
        }

        if (!LearningConfigService.isValid(learningConfig)) {
            log.warn("Ignoring invalid imported learning config {}", learningConfig);
            return;
        }
        learningConfigService.saveLearningConfig(learningConfig);
    }

    // Missing scheduling fields take the values of a freshly created card. Ease is raised to the minimum ease and
    // negative steps start from the first step.
    private Card toCard(JsonNode cardNode, Instant now) {
        String front = cardNode.path("front").asText("");
        String back = cardNode.path("back").asText("");
        if (front.isBlank() || back.isBlank()) {
            return null;
        }

        try {
            return new Card(
                    textOrDefault(cardNode, "id", UUID.randomUUID().toString()),
                    front,
                    back,
                    cardNode.hasNonNull("state") ? CardState.fromStateName(cardNode.get("state").asText()) : CardState.New,
                    Math.max(0, cardNode.path("currentStep").asInt(0)),
                    cardNode.path("interval").asDouble(0),
                    cardNode.path("ease").asDouble(0) > 0 ? Math.max(Card.MINIMUM_EASE, cardNode.get("ease").asDouble()) : Card.DEFAULT_EASE,
                    cardNode.path("lapses").asInt(0),
                    cardNode.path("reviewCount").asInt(0),
                    instantOrDefault(cardNode, "nextReviewDate", now),
                    instantOrDefault(cardNode, "createdAt", now),
                    instantOrDefault(cardNode, "lastReviewedAt", null));
        } catch (IllegalArgumentException | JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON format", ex);
        }
    }

    private static String textOrDefault(JsonNode node, String fieldName, String defaultValue) {
        String value = node.path(fieldName).asText("");
        return value.isBlank() ? defaultValue : value;
    }

    private Instant instantOrDefault(JsonNode node, String fieldName, Instant defaultValue) throws JsonProcessingException {
        if (!node.hasNonNull(fieldName)) {
            return defaultValue;
        }

        return objectMapper.treeToValue(node.get(fieldName), Instant.class);
    }

    public record ExportedData(List<Card> cards, LearningConfig config) { }
}
