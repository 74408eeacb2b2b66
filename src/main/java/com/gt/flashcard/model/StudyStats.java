package com.gt.flashcard.model;

import java.time.Instant;
import java.util.Map;

// lastStudyDate is null until a card has been graded
public record StudyStats(int totalCards,
                         int dueToday,
                         int reviewedToday,
                         int masteryPercentage,
                         Instant lastStudyDate,
                         Map<CardState, Integer> dueByState) { }
