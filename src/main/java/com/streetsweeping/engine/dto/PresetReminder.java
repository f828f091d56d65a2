package com.streetsweeping.engine.dto;

/**
 * Built-in reminder timings. Each preset is a named alias of a {@link CustomTiming}.
 */
public enum PresetReminder {

    WEEK_BEFORE("1 Week Before", CustomTiming.before(1, OffsetUnit.WEEKS),
        "Don't forget - street cleaning is coming up!"),
    THREE_DAYS_BEFORE("3 Days Before", CustomTiming.before(3, OffsetUnit.DAYS),
        "Don't forget - street cleaning is coming up!"),
    DAY_BEFORE("1 Day Before", CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(20, 0)),
        "Don't forget - street cleaning is coming up!"),
    MORNING_OF("Day Of", CustomTiming.before(0, OffsetUnit.DAYS, TimeOfDay.of(8, 0)),
        "Street cleaning today - move your car!"),
    TWO_HOURS_BEFORE("2 Hours Before", CustomTiming.before(2, OffsetUnit.HOURS),
        "Street cleaning starts soon - time to move your car!"),
    ONE_HOUR_BEFORE("1 Hour Before", CustomTiming.before(1, OffsetUnit.HOURS),
        "Street cleaning starts soon - time to move your car!"),
    THIRTY_MINUTES_BEFORE("30 Minutes Before", CustomTiming.before(30, OffsetUnit.MINUTES),
        "Move your car now - street cleaning starts soon!"),
    FIFTEEN_MINUTES_BEFORE("15 Minutes Before", CustomTiming.before(15, OffsetUnit.MINUTES),
        "Move your car now - street cleaning starts soon!"),
    FIVE_MINUTES_BEFORE("5 Minutes Before", CustomTiming.before(5, OffsetUnit.MINUTES),
        "Move your car now - street cleaning starts soon!"),
    AT_CLEANING_TIME("When Cleaning Starts", CustomTiming.before(0, OffsetUnit.MINUTES),
        "Street cleaning is starting now!"),
    AFTER_CLEANING("After Cleaning Ends", CustomTiming.after(0, OffsetUnit.MINUTES),
        "Street cleaning is done - you can park again!");

    private final String displayText;
    private final CustomTiming timing;
    private final String defaultMessage;

    PresetReminder(String displayText, CustomTiming timing, String defaultMessage) {
        this.displayText = displayText;
        this.timing = timing;
        this.defaultMessage = defaultMessage;
    }

    public String displayText() {
        return displayText;
    }

    public CustomTiming timing() {
        return timing;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
