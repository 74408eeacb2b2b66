package com.gt.flashcard.conf;

import com.gt.flashcard.card.CardDao;
import com.gt.flashcard.card.impl.CardDaoPG;
import com.gt.flashcard.learningConfig.LearningConfigDao;
import com.gt.flashcard.learningConfig.impl.LearningConfigDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${flashcard.datasource.postgres.url}") String url,
                                    @Value("${flashcard.datasource.postgres.username}") String username,
                                    @Value("${flashcard.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public CardDao getCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CardDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public LearningConfigDao getLearningConfigDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new LearningConfigDaoPG(namedParameterJdbcTemplate);
    }
}
