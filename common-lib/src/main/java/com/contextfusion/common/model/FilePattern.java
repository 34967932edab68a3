package com.contextfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A learned association between file characteristics and a group.
 *
 * <p>Every non-null criterion must match for {@link #matches} to succeed. {@code dayOfWeek}
 * follows the 0 = Sunday … 6 = Saturday convention of the persisted patterns.
 */
public record FilePattern(
    @JsonProperty("id")              Long id,
    @JsonProperty("extension")       String extension,
    @JsonProperty("namePattern")     String namePattern,
    @JsonProperty("hourOfDay")       Integer hourOfDay,
    @JsonProperty("dayOfWeek")       Integer dayOfWeek,
    @JsonProperty("groupName")       String groupName,
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("timesSeen")       int timesSeen,
    @JsonProperty("timesCorrect")    int timesCorrect,
    @JsonProperty("lastSeen")        LocalDateTime lastSeen
) {

    /** Initial pattern learned from a single piece of user feedback. */
    public static FilePattern learned(String extension, String groupName, boolean wasCorrect, LocalDateTime now) {
        return new FilePattern(null, extension, null, null, null, groupName,
                               wasCorrect ? 0.6 : 0.4, 1, wasCorrect ? 1 : 0, now);
    }

    public boolean matches(String fileName, String fileExtension, LocalDateTime observedAt) {
        if (extension != null && !extension.isEmpty()
                && !extension.equalsIgnoreCase(fileExtension)) {
            return false;
        }
        if (namePattern != null && !namePattern.isEmpty()
                && (fileName == null
                    || !fileName.toLowerCase(Locale.ROOT).contains(namePattern.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (hourOfDay != null && observedAt.getHour() != hourOfDay) {
            return false;
        }
        return dayOfWeek == null || sundayBased(observedAt.getDayOfWeek()) == dayOfWeek;
    }

    public String description() {
        List<String> parts = new ArrayList<>();
        if (extension != null && !extension.isEmpty())     parts.add("Extension: " + extension);
        if (namePattern != null && !namePattern.isEmpty()) parts.add("Name: *" + namePattern + "*");
        if (hourOfDay != null)                             parts.add("Hour: " + hourOfDay + ":00");
        if (dayOfWeek != null)                             parts.add("Day: " + fromSundayBased(dayOfWeek));
        return parts.isEmpty() ? "Any file" : String.join(", ", parts);
    }

    private static int sundayBased(DayOfWeek day) {
        return day.getValue() % 7;
    }

    private static DayOfWeek fromSundayBased(int day) {
        return DayOfWeek.SUNDAY.plus(day);
    }
}
