package io.tempora.spi.schedule;

import org.immutables.value.Value;

@Value.Immutable
public abstract class SolarSchedule
{
    public abstract SolarEvent getEvent();

    public abstract double getLatitude();

    public abstract double getLongitude();

    public static SolarSchedule of(SolarEvent event, double latitude, double longitude)
    {
        return ImmutableSolarSchedule.builder()
            .event(event)
            .latitude(latitude)
            .longitude(longitude)
            .build();
    }

    @Value.Check
    protected void check()
    {
        ScheduleValidator.builder()
            .checkRange("latitude", getLatitude(), -90, 90)
            .checkRange("longitude", getLongitude(), -180, 180)
            .validate("solar schedule", this);
    }

    @Override
    public String toString()
    {
        return getEvent().getName() + " (" + getLatitude() + ", " + getLongitude() + ")";
    }
}
