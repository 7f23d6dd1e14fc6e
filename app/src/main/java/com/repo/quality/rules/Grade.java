package com.repo.quality.rules;

/**
 * Letter grade for a total score. Each grade starts at its lower bound, inclusive.
 */
public enum Grade {
    S(90, "Outstanding - excellent code quality and working habits"),
    A(80, "Excellent - good code quality and steady contribution"),
    B(70, "Good - meets team standards, room for improvement"),
    C(60, "Average - commit habits and conventions should be strengthened"),
    D(0, "Needs improvement - guidance and support recommended");

    private final int minTotal;
    private final String description;

    Grade(int minTotal, String description) {
        this.minTotal = minTotal;
        this.description = description;
    }

    public static Grade fromTotal(double total) {
        for (Grade grade : values()) {
            if (total >= grade.minTotal)
                return grade;
        }
        return D;
    }

    public int getMinTotal() {
        return minTotal;
    }

    public String getDescription() {
        return description;
    }
}
