package com.gt.flashcard.learningConfig;

import com.gt.flashcard.conf.CachingConfig;
import com.gt.flashcard.exception.InvalidConfigException;
import com.gt.flashcard.model.LearningConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class LearningConfigService {

    private static final Logger log = LoggerFactory.getLogger(LearningConfigService.class);

    static final String LEARNING_STEPS = "learningSteps";
    static final String RELEARNING_STEPS = "relearningSteps";
    static final String GRADUATING_INTERVAL = "graduatingInterval";
    static final String EASY_INTERVAL = "easyInterval";
    static final String NEW_CARDS_PER_DAY = "newCardsPerDay";

    private final LearningConfigDao learningConfigDao;
    private final LearningConfig defaultConfig;

    @Autowired
    public LearningConfigService(LearningConfigDao learningConfigDao,
                                 @Value("${flashcard.learning.learningSteps:1,10,30}") String learningSteps,
                                 @Value("${flashcard.learning.relearningSteps:10}") String relearningSteps,
                                 @Value("${flashcard.learning.graduatingInterval:1}") int graduatingInterval,
                                 @Value("${flashcard.learning.easyInterval:4}") int easyInterval,
                                 @Value("${flashcard.learning.newCardsPerDay:20}") int newCardsPerDay) {
        this.learningConfigDao = learningConfigDao;
        this.defaultConfig = buildDefaultConfig(learningSteps, relearningSteps, graduatingInterval, easyInterval, newCardsPerDay);
    }

    private static LearningConfig buildDefaultConfig(String learningSteps, String relearningSteps, int graduatingInterval,
                                                     int easyInterval, int newCardsPerDay) {
        try {
            LearningConfig configuredDefault = new LearningConfig(parseSteps(learningSteps), parseSteps(relearningSteps),
                    graduatingInterval, easyInterval, newCardsPerDay);
            validate(configuredDefault);

            return configuredDefault;
        } catch (InvalidConfigException ex) {
            log.warn("Configured learning defaults are invalid, using built-in defaults: {}", ex.getMessage());
            return LearningConfig.DEFAULT;
        }
    }

    @Cacheable(CachingConfig.LEARNING_CONFIG)
    public LearningConfig getLearningConfig() {
        Map<String, String> settings = learningConfigDao.loadLearningConfig();
        if (settings == null || settings.isEmpty()) {
            return defaultConfig;
        }

        try {
            LearningConfig learningConfig = fromSettings(settings);
            validate(learningConfig);

            return learningConfig;
        } catch (InvalidConfigException ex) {
            log.warn("Stored learning config is invalid, falling back to defaults: {}", ex.getMessage());
            return defaultConfig;
        }
    }

    @CacheEvict(value = CachingConfig.LEARNING_CONFIG, allEntries = true)
    public void saveLearningConfig(LearningConfig learningConfig) {
        validate(learningConfig);

        learningConfigDao.saveLearningConfig(toSettings(learningConfig));
        log.info("Saved learning config {}", learningConfig);
    }

    @CacheEvict(value = CachingConfig.LEARNING_CONFIG, allEntries = true)
    public LearningConfig resetLearningConfig() {
        learningConfigDao.deleteLearningConfig();
        log.info("Learning config reset to defaults");

        return defaultConfig;
    }

    public LearningConfig getDefaultConfig() {
        return defaultConfig;
    }

    public static void validate(LearningConfig learningConfig) {
        if (learningConfig == null) {
            throw new InvalidConfigException("Learning config is missing");
        }
        validateSteps(LEARNING_STEPS, learningConfig.learningSteps());
        validateSteps(RELEARNING_STEPS, learningConfig.relearningSteps());
        if (learningConfig.graduatingInterval() < 1) {
            throw new InvalidConfigException(GRADUATING_INTERVAL + " must be at least 1 day, was " + learningConfig.graduatingInterval());
        }
        if (learningConfig.easyInterval() < 1) {
            throw new InvalidConfigException(EASY_INTERVAL + " must be at least 1 day, was " + learningConfig.easyInterval());
        }
        if (learningConfig.newCardsPerDay() < 0) {
            throw new InvalidConfigException(NEW_CARDS_PER_DAY + " cannot be negative, was " + learningConfig.newCardsPerDay());
        }
    }

    public static boolean isValid(LearningConfig learningConfig) {
        try {
            validate(learningConfig);
            return true;
        } catch (InvalidConfigException ex) {
            return false;
        }
    }

    private static void validateSteps(String settingName, List<Integer> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidConfigException(settingName + " must contain at least one step");
        }
        for (Integer step : steps) {
            if (step == null || step <= 0) {
                throw new InvalidConfigException(settingName + " steps must be positive minutes, was " + steps);
            }
        }
    }

    private LearningConfig fromSettings(Map<String, String> settings) {
        return new LearningConfig(
                settings.containsKey(LEARNING_STEPS) ? parseSteps(settings.get(LEARNING_STEPS)) : defaultConfig.learningSteps(),
                settings.containsKey(RELEARNING_STEPS) ? parseSteps(settings.get(RELEARNING_STEPS)) : defaultConfig.relearningSteps(),
                parseInt(settings, GRADUATING_INTERVAL, defaultConfig.graduatingInterval()),
                parseInt(settings, EASY_INTERVAL, defaultConfig.easyInterval()),
                parseInt(settings, NEW_CARDS_PER_DAY, defaultConfig.newCardsPerDay()));
    }

    static Map<String, String> toSettings(LearningConfig learningConfig) {
        Map<String, String> settings = new HashMap<>();

        settings.put(LEARNING_STEPS, joinSteps(learningConfig.learningSteps()));
        settings.put(RELEARNING_STEPS, joinSteps(learningConfig.relearningSteps()));
        settings.put(GRADUATING_INTERVAL, Integer.toString(learningConfig.graduatingInterval()));
        settings.put(EASY_INTERVAL, Integer.toString(learningConfig.easyInterval()));
        settings.put(NEW_CARDS_PER_DAY, Integer.toString(learningConfig.newCardsPerDay()));

        return settings;
    }

    static List<Integer> parseSteps(String steps) {
        if (steps == null || steps.isBlank()) {
            return List.of();
        }

        try {
            return Arrays.stream(steps.split(","))
                    .map(String::trim)
                    .filter(step -> !step.isEmpty())
                    .map(Integer::parseInt)
                    .collect(Collectors.toUnmodifiableList());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigException("Unable to parse steps '" + steps + "'", ex);
        }
    }

    private static String joinSteps(List<Integer> steps) {
        return steps.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static int parseInt(Map<String, String> settings, String settingName, int defaultValue) {
        String value = settings.get(settingName);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigException("Unable to parse " + settingName + " value '" + value + "'", ex);
        }
    }
}
