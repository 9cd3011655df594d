package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.model.MetricKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-metric cache of trained models. Each key has its own monitor, so training for one metric
 * never blocks another, and concurrent requests for the same key share a single run.
 */
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    public enum State {
        UNTRAINED,
        TRAINED,
        STALE
    }

    private final ConcurrentMap<MetricKey, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final double retrainGrowthRatio;
    private final Clock clock;

    public ModelRegistry(Duration ttl, double retrainGrowthRatio, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (retrainGrowthRatio < 0) {
            throw new IllegalArgumentException("retrainGrowthRatio must not be negative");
        }
        this.ttl = ttl;
        this.retrainGrowthRatio = retrainGrowthRatio;
        this.clock = Objects.requireNonNull(clock);
    }

    public State state(MetricKey key, int seriesLength) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return State.UNTRAINED;
        }
        synchronized (entry) {
            if (entry.model == null) {
                return State.UNTRAINED;
            }
            return isStale(entry.model, seriesLength) ? State.STALE : State.TRAINED;
        }
    }

    public Optional<AutoregressiveModel> cached(MetricKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.ofNullable(entry.model);
        }
    }

    /**
     * Returns the cached model when it is still fresh for a series of {@code seriesLength}
     * points, otherwise trains on the calling thread. A run already in flight is joined.
     */
    public AutoregressiveModel getOrTrain(MetricKey key, int seriesLength, ModelTrainer trainer) {
        Entry entry = entry(key);
        InFlight flight;
        boolean owner = false;
        synchronized (entry) {
            entry.lastAccess = clock.instant();
            if (entry.model != null && !isStale(entry.model, seriesLength)) {
                return entry.model;
            }
            if (entry.inFlight == null) {
                entry.inFlight = new InFlight(new CompletableFuture<>(), new CancellationToken());
                owner = true;
            }
            flight = entry.inFlight;
        }
        TrainingHandle handle = handle(key, entry, flight);
        if (owner) {
            run(key, entry, flight, trainer);
        }
        return handle.await();
    }

    /**
     * Starts training on {@code executor}, or joins the run already in flight for this key.
     */
    public TrainingHandle trainAsync(MetricKey key, ModelTrainer trainer, Executor executor) {
        Entry entry = entry(key);
        InFlight flight;
        synchronized (entry) {
            entry.lastAccess = clock.instant();
            if (entry.inFlight != null) {
                return handle(key, entry, entry.inFlight);
            }
            flight = new InFlight(new CompletableFuture<>(), new CancellationToken());
            entry.inFlight = flight;
        }
        try {
            executor.execute(() -> run(key, entry, flight, trainer));
        } catch (RejectedExecutionException ex) {
            clearInFlight(entry, flight);
            flight.future.completeExceptionally(ex);
        }
        return handle(key, entry, flight);
    }

    public void invalidate(MetricKey key) {
        Entry entry = entries.get(key);
        if (entry != null) {
            synchronized (entry) {
                entry.model = null;
            }
        }
    }

    /**
     * Drops entries not accessed since {@code cutoff}. Entries with a run in flight are kept.
     */
    public int evictIdleSince(Instant cutoff) {
        int before = entries.size();
        entries.entrySet().removeIf(e -> {
            Entry entry = e.getValue();
            synchronized (entry) {
                return entry.inFlight == null && entry.lastAccess.isBefore(cutoff);
            }
        });
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    boolean isStale(AutoregressiveModel model, int seriesLength) {
        if (seriesLength > model.trainingSize() * (1d + retrainGrowthRatio)) {
            return true;
        }
        return model.trainedAt().plus(ttl).isBefore(clock.instant());
    }

    private void run(MetricKey key, Entry entry, InFlight flight, ModelTrainer trainer) {
        try {
            flight.token.throwIfCancelled();
            AutoregressiveModel model = trainer.train(flight.token);
            // install and complete under the lock that cancel() takes
            synchronized (entry) {
                if (entry.inFlight == flight) {
                    entry.inFlight = null;
                }
                if (flight.token.isCancelled()) {
                    return;
                }
                entry.model = model;
                flight.future.complete(model);
            }
            log.debug("Model for {} trained on {} points", key, model.trainingSize());
        } catch (RuntimeException ex) {
            synchronized (entry) {
                if (entry.inFlight == flight) {
                    entry.inFlight = null;
                }
                flight.future.completeExceptionally(ex);
            }
        }
    }

    private TrainingHandle handle(MetricKey key, Entry entry, InFlight flight) {
        return new TrainingHandle(key, flight.future, flight.token, () -> cancel(key, entry, flight));
    }

    /**
     * No-op once the run has finished; otherwise the run is detached and will not install its model.
     */
    private void cancel(MetricKey key, Entry entry, InFlight flight) {
        synchronized (entry) {
            if (flight.future.isDone()) {
                return;
            }
            flight.token.cancel();
            if (entry.inFlight == flight) {
                entry.inFlight = null;
            }
            flight.future.completeExceptionally(new CancellationException("training for " + key + " cancelled"));
        }
        log.info("Cancelled model training for {}", key);
    }

    private void clearInFlight(Entry entry, InFlight flight) {
        synchronized (entry) {
            if (entry.inFlight == flight) {
                entry.inFlight = null;
            }
        }
    }

    private Entry entry(MetricKey key) {
        return entries.computeIfAbsent(key, k -> new Entry(clock.instant()));
    }

    private record InFlight(CompletableFuture<AutoregressiveModel> future, CancellationToken token) {
    }

    private static final class Entry {
        private AutoregressiveModel model;
        private InFlight inFlight;
        private Instant lastAccess;

        Entry(Instant lastAccess) {
            this.lastAccess = lastAccess;
        }
    }
}
