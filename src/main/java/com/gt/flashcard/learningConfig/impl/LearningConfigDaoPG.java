package com.gt.flashcard.learningConfig.impl;

import com.gt.flashcard.exception.StorageException;
import com.gt.flashcard.learningConfig.LearningConfigDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.HashMap;
import java.util.Map;

public class LearningConfigDaoPG implements LearningConfigDao {

    private static final Logger log = LoggerFactory.getLogger(LearningConfigDaoPG.class);

    private static final String UPSERT_SETTING_SQL =
            "INSERT INTO learning_config (setting_name, setting_value) " +
            "VALUES (:settingName, :settingValue) " +
            "ON CONFLICT (setting_name) DO UPDATE " +
                    "SET setting_value = :settingValue";

    private static final String LOAD_SETTINGS_SQL =
            "SELECT setting_name, setting_value " +
            "FROM learning_config";

    private static final String DELETE_SETTINGS_SQL =
            "DELETE FROM learning_config";

    private final NamedParameterJdbcTemplate template;

    public LearningConfigDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Map<String, String> loadLearningConfig() {
        try {
            return template.query(LOAD_SETTINGS_SQL, Map.of(), (rs) -> {
                Map<String, String> learningConfig = new HashMap<>();

                while (rs.next()) {
                    String settingName = rs.getString("setting_name");
                    String settingValue = rs.getString("setting_value");

                    if (settingName != null && !settingName.isBlank() && settingValue != null && !settingValue.isBlank()) {
                        learningConfig.put(settingName, settingValue);
                    }
                }

                return learningConfig;
            });
        } catch (DataAccessException ex) {
            log.error("Failed to load learning config", ex);
            throw new StorageException("Failed to load learning config", ex);
        }
    }

    @Override
    public void saveLearningConfig(Map<String, String> learningConfig) {
        int index = 0;
        SqlParameterSource[] sources = new SqlParameterSource[learningConfig.size()];

        for (Map.Entry<String, String> setting : learningConfig.entrySet()) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            source.addValue("settingName", setting.getKey());
            source.addValue("settingValue", setting.getValue());

            sources[index++] = source;
        }

        try {
            template.batchUpdate(UPSERT_SETTING_SQL, sources);
        } catch (DataAccessException ex) {
            log.error("Failed to save learning config", ex);
            throw new StorageException("Failed to save learning config", ex);
        }
    }

    @Override
    public void deleteLearningConfig() {
        try {
            template.update(DELETE_SETTINGS_SQL, Map.of());
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to delete learning config", ex);
        }
    }
}
