package com.agentverse.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.ToDoubleFunction;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are registered lazily; Micrometer returns the existing meter when the same
 * name and tags are requested again, so callers may look meters up per event.
 */
public final class MetricFactory {

    /** Tag key for the emitting service. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the meter registry (Prometheus in production, simple in tests)
     * @param serviceName logical service name added to every meter
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter for the given name and tags.
     *
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    /**
     * Returns the timer for the given name and tags.
     *
     * @param tags additional tags as key-value pairs
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples {@code value} from {@code source} on every scrape.
     * Micrometer holds the source weakly; the caller keeps it alive.
     *
     * @param tags additional tags as key-value pairs
     */
    public <T> void gauge(String name, String description, T source, ToDoubleFunction<T> value,
                          String... tags) {
        Gauge.builder(name, source, value)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    private Tags tagsWith(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}
