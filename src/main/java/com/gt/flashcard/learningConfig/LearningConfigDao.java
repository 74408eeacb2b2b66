package com.gt.flashcard.learningConfig;

import java.util.Map;

public interface LearningConfigDao {

    Map<String, String> loadLearningConfig();

    void saveLearningConfig(Map<String, String> learningConfig);

    void deleteLearningConfig();
}
