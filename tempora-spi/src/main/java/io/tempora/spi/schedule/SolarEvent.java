package io.tempora.spi.schedule;

import static java.util.Locale.ENGLISH;

/**
 * Sun-relative events. Dawn and dusk come in three twilight depths.
 */
public enum SolarEvent
{
    SUNRISE,
    SUNSET,
    DAWN_ASTRONOMICAL,
    DAWN_CIVIL,
    DAWN_NAUTICAL,
    DUSK_ASTRONOMICAL,
    DUSK_CIVIL,
    DUSK_NAUTICAL,
    SOLAR_NOON;

    public String getName()
    {
        return name().toLowerCase(ENGLISH);
    }

    public static SolarEvent fromName(String name)
    {
        try {
            return valueOf(name.toUpperCase(ENGLISH));
        }
        catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException("Unknown solar event: " + name);
        }
    }
}
