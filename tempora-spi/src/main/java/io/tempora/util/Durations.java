package io.tempora.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Joiner;

/**
 * Parses and formats durations written as a sequence of amounts with a
 * unit suffix, for example {@code 1d 2h 30m 10s} or {@code 250ms}.
 */
public class Durations
{
    private static final Pattern TERM = Pattern.compile("\\s*(\\d+)\\s*(ms|d|h|m|s)\\s*", Pattern.CASE_INSENSITIVE);

    private Durations()
    { }

    public static Duration parseDuration(CharSequence text)
    {
        Matcher matcher = TERM.matcher(text);
        Duration total = Duration.ZERO;
        int position = 0;
        while (position < text.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new DateTimeParseException("Invalid duration", text, position);
            }
            long amount = Long.parseLong(matcher.group(1));
            total = total.plus(amount, unitOf(matcher.group(2)));
            position = matcher.end();
        }
        if (position == 0) {
            throw new DateTimeParseException("Invalid duration", text, 0);
        }
        return total;
    }

    private static ChronoUnit unitOf(String suffix)
    {
        switch (suffix.toLowerCase(Locale.ENGLISH)) {
        case "d":
            return ChronoUnit.DAYS;
        case "h":
            return ChronoUnit.HOURS;
        case "m":
            return ChronoUnit.MINUTES;
        case "s":
            return ChronoUnit.SECONDS;
        default:
            return ChronoUnit.MILLIS;
        }
    }

    public static String formatDuration(Duration duration)
    {
        if (duration.isZero()) {
            return "0s";
        }
        List<String> terms = new ArrayList<>();
        Duration rest = duration;
        rest = appendTerm(terms, rest, ChronoUnit.DAYS, "d");
        rest = appendTerm(terms, rest, ChronoUnit.HOURS, "h");
        rest = appendTerm(terms, rest, ChronoUnit.MINUTES, "m");
        rest = appendTerm(terms, rest, ChronoUnit.SECONDS, "s");
        appendTerm(terms, rest, ChronoUnit.MILLIS, "ms");
        return Joiner.on(' ').join(terms);
    }

    private static Duration appendTerm(List<String> terms, Duration rest, ChronoUnit unit, String suffix)
    {
        long amount = rest.toMillis() / unit.getDuration().toMillis();
        if (amount > 0) {
            terms.add(amount + suffix);
        }
        return rest.minus(amount, unit);
    }
}
