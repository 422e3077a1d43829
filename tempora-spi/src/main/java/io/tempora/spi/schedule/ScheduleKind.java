package io.tempora.spi.schedule;

public enum ScheduleKind
{
    INTERVAL,
    CRONTAB,
    SOLAR,
    CLOCKED;
}
