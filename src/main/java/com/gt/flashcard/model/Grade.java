package com.gt.flashcard.model;

import com.gt.flashcard.exception.InvalidGradeException;

public enum Grade {
    Again("again"),
    Hard("hard"),
    Good("good"),
    Easy("easy");

    private final String gradeName;

    Grade(String gradeName) {
        this.gradeName = gradeName;
    }

    public String getGradeName() {
        return gradeName;
    }

    public static Grade fromGradeName(String gradeName) {
        if (gradeName != null) {
            for (Grade grade : values()) {
                if (grade.gradeName.equalsIgnoreCase(gradeName.trim())) {
                    return grade;
                }
            }
        }

        throw new InvalidGradeException("Unknown grade " + gradeName + ". Expected one of again, hard, good, easy");
    }
}
