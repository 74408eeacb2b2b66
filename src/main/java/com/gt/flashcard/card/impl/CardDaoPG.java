package com.gt.flashcard.card.impl;

import com.gt.flashcard.card.CardDao;
import com.gt.flashcard.exception.StorageException;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class CardDaoPG implements CardDao {

    private static final Logger log = LoggerFactory.getLogger(CardDaoPG.class);

    private static final String CARD_COLUMNS =
            "id, front, back, card_state, current_step, interval_value, ease, lapses, review_count, next_review_date, created_at, last_reviewed_at ";

    private static final String SAVE_CARD_SQL =
            "INSERT INTO flashcard " +
                    "(id, front, back, card_state, current_step, interval_value, ease, lapses, review_count, next_review_date, created_at, last_reviewed_at) " +
                    "VALUES (:id, :front, :back, :cardState, :currentStep, :intervalValue, :ease, :lapses, :reviewCount, :nextReviewDate, :createdAt, :lastReviewedAt) " +
            "ON CONFLICT (id) DO UPDATE " +
                    "SET front = :front, back = :back, card_state = :cardState, current_step = :currentStep, interval_value = :intervalValue, " +
                    "ease = :ease, lapses = :lapses, review_count = :reviewCount, next_review_date = :nextReviewDate, last_reviewed_at = :lastReviewedAt";

    private static final String LOAD_CARD_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "WHERE id = :id";

    private static final String LOAD_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "WHERE id IN (:ids) " +
            "ORDER BY created_at, id";

    private static final String LOAD_ALL_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "ORDER BY created_at, id";

    private static final String LOAD_DUE_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "WHERE next_review_date <= :now " +
            "ORDER BY next_review_date, id";

    private static final String DELETE_CARD_SQL =
            "DELETE FROM flashcard WHERE id = :id";

    private static final String DELETE_ALL_CARDS_SQL =
            "DELETE FROM flashcard";

    private final NamedParameterJdbcTemplate template;

    public CardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Card loadCard(String cardId) {
        try {
            List<Card> cards = template.query(LOAD_CARD_SQL, Map.of("id", cardId), CardDaoPG::getCardFromResultSet);

            return cards.isEmpty() ? null : cards.get(0);
        } catch (DataAccessException ex) {
            throw storageError("Failed to load card " + cardId, ex);
        }
    }

    @Override
    public List<Card> loadCards(Collection<String> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return List.of();
        }

        try {
            return template.query(LOAD_CARDS_SQL, Map.of("ids", cardIds), CardDaoPG::getCardFromResultSet);
        } catch (DataAccessException ex) {
            throw storageError("Failed to load " + cardIds.size() + " cards", ex);
        }
    }

    @Override
    public List<Card> loadAll() {
        try {
            return template.query(LOAD_ALL_CARDS_SQL, Map.of(), CardDaoPG::getCardFromResultSet);
        } catch (DataAccessException ex) {
            throw storageError("Failed to load cards", ex);
        }
    }

    @Override
    public List<Card> loadDue(Instant now) {
        try {
            return template.query(LOAD_DUE_CARDS_SQL, Map.of("now", Timestamp.from(now)), CardDaoPG::getCardFromResultSet);
        } catch (DataAccessException ex) {
            throw storageError("Failed to load cards due at " + now, ex);
        }
    }

    @Override
    public void saveCard(Card card) {
        try {
            template.update(SAVE_CARD_SQL, toParameterSource(card));
        } catch (DataAccessException ex) {
            throw storageError("Failed to save card " + card.id(), ex);
        }
    }

    @Override
    public int deleteCard(String cardId) {
        try {
            return template.update(DELETE_CARD_SQL, Map.of("id", cardId));
        } catch (DataAccessException ex) {
            throw storageError("Failed to delete card " + cardId, ex);
        }
    }

    @Override
    public int deleteAll() {
        try {
            return template.update(DELETE_ALL_CARDS_SQL, Map.of());
        } catch (DataAccessException ex) {
            throw storageError("Failed to delete cards", ex);
        }
    }

    static MapSqlParameterSource toParameterSource(Card card) {
        MapSqlParameterSource source = new MapSqlParameterSource();

        source.addValue("id", card.id());
        source.addValue("front", card.front());
        source.addValue("back", card.back());
        source.addValue("cardState", card.state().getStateName());
        source.addValue("currentStep", card.currentStep());
        source.addValue("intervalValue", card.interval());
        source.addValue("ease", card.ease());
        source.addValue("lapses", card.lapses());
        source.addValue("reviewCount", card.reviewCount());
        source.addValue("nextReviewDate", Timestamp.from(card.nextReviewDate()));
        source.addValue("createdAt", Timestamp.from(card.createdAt()));
        source.addValue("lastReviewedAt", card.lastReviewedAt() == null ? null : Timestamp.from(card.lastReviewedAt()));

        return source;
    }

    static Card getCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Timestamp lastReviewedAt = rs.getTimestamp("last_reviewed_at");

        return new Card(
                rs.getString("id"),
                rs.getString("front"),
                rs.getString("back"),
                CardState.fromStateName(rs.getString("card_state")),
                rs.getInt("current_step"),
                rs.getDouble("interval_value"),
                rs.getDouble("ease"),
                rs.getInt("lapses"),
                rs.getInt("review_count"),
                rs.getTimestamp("next_review_date").toInstant(),
                rs.getTimestamp("created_at").toInstant(),
                lastReviewedAt == null ? null : lastReviewedAt.toInstant());
    }

    private static StorageException storageError(String errMsg, DataAccessException ex) {
        log.error(errMsg, ex);
        return new StorageException(errMsg, ex);
    }
}
