package io.tempora.spi.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public interface TemporaMetrics
{
    Logger logger = LoggerFactory.getLogger(TemporaMetrics.class);

    enum Category {
        DEFAULT("default"),
        SCHEDULER("scheduler"),
        DB("db");

        private final String text;
        Category(final String text) { this.text = text; }

        public String getString() { return this.text; }

        public static Category fromString(String text)
        {
            for (Category c : Category.values()) {
                if (c.text.compareToIgnoreCase(text) == 0) {
                    return c;
                }
            }
            logger.error("Invalid category name {}. Fallback to DEFAULT", text);
            return DEFAULT;
        }
    }

    MeterRegistry getRegistry();

    String mkMetricsName(Category category, String metricsName);

    void increment(Category category, String metricName, Tags tags);

    void gauge(Category category, String metricName, Tags tags, double value);

    void summary(Category category, String metricName, Tags tags, double value);

    default void increment(Category category, String metricName)
    {
        increment(category, metricName, Tags.empty());
    }

    default void gauge(Category category, String metricName, double value)
    {
        gauge(category, metricName, Tags.empty(), value);
    }

    default void summary(Category category, String metricName, double value)
    {
        summary(category, metricName, Tags.empty(), value);
    }
}
