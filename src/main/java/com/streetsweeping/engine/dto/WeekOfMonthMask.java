package com.streetsweeping.engine.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Which occurrences of a weekday within a calendar month a rule is active for.
 *
 * {@code week3 = true} means "the third occurrence of the rule's weekday in the month",
 * not "the third calendar week".
 */
public record WeekOfMonthMask(
    boolean week1,
    boolean week2,
    boolean week3,
    boolean week4,
    boolean week5
) {

    public static final WeekOfMonthMask NONE = new WeekOfMonthMask(false, false, false, false, false);
    public static final WeekOfMonthMask EVERY_WEEK = new WeekOfMonthMask(true, true, true, true, true);

    /**
     * @param ordinal 1-based occurrence of the weekday inside the month
     */
    public boolean isActive(int ordinal) {
        return switch (ordinal) {
            case 1 -> week1;
            case 2 -> week2;
            case 3 -> week3;
            case 4 -> week4;
            case 5 -> week5;
            default -> false;
        };
    }

    public boolean anyActive() {
        return week1 || week2 || week3 || week4 || week5;
    }

    public List<Integer> activeOrdinals() {
        List<Integer> ordinals = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            if (isActive(i)) {
                ordinals.add(i);
            }
        }
        return ordinals;
    }

    public static WeekOfMonthMask of(int... ordinals) {
        boolean[] flags = new boolean[5];
        for (int ordinal : ordinals) {
            if (ordinal < 1 || ordinal > 5) {
                throw new IllegalArgumentException("Week ordinal must be 1-5, got " + ordinal);
            }
            flags[ordinal - 1] = true;
        }
        return new WeekOfMonthMask(flags[0], flags[1], flags[2], flags[3], flags[4]);
    }
}
