package com.sandy.aiot.rack.control.service;

import com.sandy.aiot.rack.control.model.Metric;
import com.sandy.aiot.rack.control.model.TelemetrySample;
import com.sandy.aiot.rack.control.model.TrendEstimate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling window of recent samples per (rack, metric) with mean and least-squares slope.
 * Windows are bounded by sample count and by age relative to the newest sample. Late
 * samples are slotted in by timestamp.
 */
@Service
@Slf4j
public class TrendEstimatorService {

    private final int maxSamples;
    private final Duration window;
    private final int minSamples;

    private final Map<WindowKey, SampleWindow> windows = new ConcurrentHashMap<>();

    public TrendEstimatorService(@Value("${rack.trend.max-samples:3600}") int maxSamples,
                                 @Value("${rack.trend.window-seconds:3600}") long windowSeconds,
                                 @Value("${rack.trend.min-samples:2}") int minSamples) {
        if (maxSamples < 2) throw new IllegalArgumentException("rack.trend.max-samples must be at least 2");
        if (windowSeconds <= 0) throw new IllegalArgumentException("rack.trend.window-seconds must be positive");
        if (minSamples < 2) throw new IllegalArgumentException("rack.trend.min-samples must be at least 2");
        this.maxSamples = maxSamples;
        this.window = Duration.ofSeconds(windowSeconds);
        this.minSamples = minSamples;
    }

    public void ingest(String rackId, Metric metric, double value, Instant timestamp) {
        if (rackId == null || metric == null || timestamp == null) return;
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.debug("Ignoring non-finite sample rackId={} metric={}", rackId, metric);
            return;
        }
        SampleWindow w = windows.computeIfAbsent(new WindowKey(rackId, metric), k -> new SampleWindow());
        boolean accepted = w.add(new TelemetrySample(rackId, metric, value, timestamp), maxSamples, window);
        if (!accepted) {
            log.debug("Sample outside retention window dropped rackId={} metric={} ts={}", rackId, metric, timestamp);
        }
    }

    /**
     * Current mean and slope for the key, empty while there is not enough data to fit a line.
     */
    public Optional<TrendEstimate> estimate(String rackId, Metric metric) {
        SampleWindow w = windows.get(new WindowKey(rackId, metric));
        if (w == null) return Optional.empty();
        return w.estimate(minSamples);
    }

    public Map<Metric, TrendEstimate> estimates(String rackId) {
        Map<Metric, TrendEstimate> result = new EnumMap<>(Metric.class);
        for (Metric m : Metric.values()) {
            estimate(rackId, m).ifPresent(e -> result.put(m, e));
        }
        return result;
    }

    public int sampleCount(String rackId, Metric metric) {
        SampleWindow w = windows.get(new WindowKey(rackId, metric));
        return w == null ? 0 : w.size();
    }

    private record WindowKey(String rackId, Metric metric) {}

    private static class SampleWindow {
        private final Deque<TelemetrySample> samples = new ArrayDeque<>();
        private Instant newest;

        synchronized boolean add(TelemetrySample sample, int maxSamples, Duration window) {
            if (newest != null && sample.timestamp().isBefore(newest.minus(window))) {
                return false;
            }
            insertOrdered(sample);
            if (newest == null || sample.timestamp().isAfter(newest)) {
                newest = sample.timestamp();
            }
            Instant cutoff = newest.minus(window);
            while (!samples.isEmpty() && samples.peekFirst().timestamp().isBefore(cutoff)) {
                samples.removeFirst();
            }
            while (samples.size() > maxSamples) {
                samples.removeFirst();
            }
            return true;
        }

        // keeps the deque sorted by timestamp so eviction from the head drops the oldest
        private void insertOrdered(TelemetrySample sample) {
            Deque<TelemetrySample> later = new ArrayDeque<>();
            while (!samples.isEmpty() && samples.peekLast().timestamp().isAfter(sample.timestamp())) {
                later.addFirst(samples.removeLast());
            }
            samples.addLast(sample);
            samples.addAll(later);
        }

        synchronized int size() {
            return samples.size();
        }

        synchronized Optional<TrendEstimate> estimate(int minSamples) {
            int n = samples.size();
            if (n < minSamples) return Optional.empty();
            Instant origin = samples.peekFirst().timestamp();
            Instant start = origin;
            Instant end = origin;
            double sumX = 0, sumY = 0;
            for (TelemetrySample s : samples) {
                sumX += seconds(origin, s.timestamp());
                sumY += s.value();
                if (s.timestamp().isBefore(start)) start = s.timestamp();
                if (s.timestamp().isAfter(end)) end = s.timestamp();
            }
            double meanX = sumX / n;
            double meanY = sumY / n;
            double sxy = 0, sxx = 0;
            for (TelemetrySample s : samples) {
                double dx = seconds(origin, s.timestamp()) - meanX;
                sxy += dx * (s.value() - meanY);
                sxx += dx * dx;
            }
            if (sxx == 0) return Optional.empty(); // all samples share one timestamp
            return Optional.of(new TrendEstimate(meanY, sxy / sxx, n, start, end));
        }

        private static double seconds(Instant origin, Instant ts) {
            return Duration.between(origin, ts).toNanos() / 1_000_000_000.0;
        }
    }
}
