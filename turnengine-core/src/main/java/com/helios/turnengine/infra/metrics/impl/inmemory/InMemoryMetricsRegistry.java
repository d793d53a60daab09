package com.helios.turnengine.infra.metrics.impl.inmemory;

import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.Gauge;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps session metrics in maps so they can be read back: by tests, and by
 * the developer console's {@code :metrics} listing.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * TurnEngine engine = TurnEngine.builder(model).metrics(metrics).build();
 * engine.advanceClock();
 * engine.advanceTurn();
 * assertThat(metrics.getCounterValue(MetricNames.SCHEDULED_FIRED)).isEqualTo(1L);
 * }</pre>
 *
 * <p>Tags are ignored; one instrument exists per name.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, n -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, n -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(name, n -> new InMemoryTimer());
    }

    public long getCounterValue(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        Gauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    /** Current count of every counter, sorted by name. */
    public SortedMap<String, Long> getCounterValues() {
        SortedMap<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.count()));
        return values;
    }

    public SortedMap<String, Double> getGaugeValues() {
        SortedMap<String, Double> values = new TreeMap<>();
        gauges.forEach((name, gauge) -> values.put(name, gauge.value()));
        return values;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
