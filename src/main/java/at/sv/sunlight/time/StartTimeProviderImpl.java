package at.sv.sunlight.time;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StartTimeProviderImpl implements StartTimeProvider {

    /**
     * A sun keyword, optionally followed by a signed offset in minutes, e.g. {@code sunset}, {@code civil_dusk - 15}.
     */
    private static final Pattern SUN_EXPRESSION = Pattern.compile("\\s*(\\w+)\\s*(?:([+-])\\s*(\\d{1,5}))?\\s*");

    private final SunTimesProvider sunTimesProvider;
    private final Map<String, LocalTime> parsedTimes;

    public StartTimeProviderImpl(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
        parsedTimes = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<ZonedDateTime> getStart(String input, ZonedDateTime dateTime) {
        Optional<LocalTime> time = tryParseTime(input);
        if (time.isPresent()) {
            return Optional.of(dateTime.with(time.get()));
        }
        Matcher matcher = SUN_EXPRESSION.matcher(input);
        if (!matcher.matches()) {
            throw invalid(input, "expected a local time or a sun keyword with an optional offset in minutes");
        }
        SunEvent event = SunEvent.fromKeyword(matcher.group(1))
                                 .orElseThrow(() -> invalid(input, "unknown sun keyword '" + matcher.group(1) + "'"));
        Optional<ZonedDateTime> start = sunTimesProvider.getTime(dateTime, event);
        if (matcher.group(2) == null) {
            return start;
        }
        int minutes = Integer.parseInt(matcher.group(3));
        return start.map(t -> "+".equals(matcher.group(2)) ? t.plusMinutes(minutes) : t.minusMinutes(minutes));
    }

    /**
     * Only successfully parsed times are cached, so arbitrary invalid input does not grow the cache.
     */
    private Optional<LocalTime> tryParseTime(String input) {
        if (input.isEmpty() || !Character.isDigit(input.charAt(0))) {
            return Optional.empty();
        }
        LocalTime cached = parsedTimes.get(input);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            LocalTime time = LocalTime.parse(input);
            parsedTimes.put(input, time);
            return Optional.of(time);
        } catch (DateTimeParseException e) {
            throw invalid(input, e.getMessage());
        }
    }

    int cachedTimeCount() {
        return parsedTimes.size();
    }

    private static InvalidStartTimeExpression invalid(String input, String reason) {
        return new InvalidStartTimeExpression("Failed to parse start time expression '" + input + "': " + reason);
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return sunTimesProvider.toDebugString(dateTime);
    }

    @Override
    public void clearCaches() {
        sunTimesProvider.clearCache();
        parsedTimes.clear();
    }
}
