package at.sv.sunlight.time;

import java.time.ZonedDateTime;
import java.util.Optional;

public interface StartTimeProvider {
    /**
     * @param input    a ISO_LOCAL_TIME formatted string, or a sun keyword with optional offset in minutes
     * @param dateTime the date to use a reference for resolving sun times
     * @return the start time corresponding to the input and dateTime, or empty if the referenced sun event does not
     * happen on that date
     * @throws InvalidStartTimeExpression if the input is neither a valid {@link java.time.format.DateTimeFormatter#ISO_LOCAL_TIME}
     *                                    or a supported sun keyword with optional offset.
     */
    Optional<ZonedDateTime> getStart(String input, ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }

    default void clearCaches() {
    }
}
