package com.helios.turnengine.service.persistence;

import com.helios.turnengine.api.exceptions.QueueCorruptionException;
import com.helios.turnengine.api.model.EngineSnapshot;
import com.helios.turnengine.infra.config.EngineConfig;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.output.OutputSink;
import com.helios.turnengine.runtime.session.TurnEngine;
import com.helios.turnengine.runtime.session.TurnListener;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.logging.Logger;

/**
 * Named save slots, one {@code <slot>.json} file each, in the configured
 * save directory.
 *
 * <p>Sessions loaded from a slot autosave on the configured interval, like
 * new sessions started by the application.
 */
public class SaveSlotRepository {
    private static final Logger logger = Logger.getLogger(SaveSlotRepository.class.getName());

    private static final Pattern SLOT_NAME = Pattern.compile("[a-z0-9_-]+");
    private static final String EXTENSION = ".json";

    private final EngineConfig config;
    private final SnapshotCodec codec;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public SaveSlotRepository(EngineConfig config, SnapshotCodec codec, Tracer tracer, MetricsRegistry metrics) {
        this.config = config;
        this.codec = codec;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    public Path save(String slot, TurnEngine engine) {
        Path path = pathFor(slot);
        Span span = tracer.spanBuilder("save-snapshot").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("slot", slot);
            EngineSnapshot snapshot = engine.snapshot();
            codec.write(snapshot, path);
            span.setAttribute("pendingEvents", snapshot.scheduler().pending().size());
            logger.info(String.format("Saved slot '%s' at turn %d", slot, snapshot.world().getTurnCount()));
            return path;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Restores the session stored in {@code slot} against {@code model}.
     *
     * @throws SnapshotException        if the slot is missing or unreadable
     * @throws QueueCorruptionException if the stored scheduler state is inconsistent
     */
    public TurnEngine load(String slot, GameModel model, OutputSink sink) {
        Path path = pathFor(slot);
        Span span = tracer.spanBuilder("load-snapshot").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("slot", slot);
            if (!Files.exists(path)) {
                throw new SnapshotException("No save found in slot '" + slot + "'");
            }
            EngineSnapshot snapshot = codec.read(path);
            TurnEngine.Builder builder = TurnEngine.builder(model)
                    .config(config)
                    .tracer(tracer)
                    .metrics(metrics)
                    .outputSink(sink);
            autosaver().ifPresent(builder::turnListener);
            TurnEngine engine = builder.build(snapshot);
            logger.info(String.format("Loaded slot '%s' at turn %d", slot, engine.world().getTurnCount()));
            return engine;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * @return the autosave listener for sessions, or empty when autosave is disabled
     */
    public Optional<TurnListener> autosaver() {
        if (config.getAutosaveTurns() == 0) {
            return Optional.empty();
        }
        return Optional.of(new Autosaver(this, config.getAutosaveTurns(), metrics));
    }

    public boolean delete(String slot) {
        try {
            return Files.deleteIfExists(pathFor(slot));
        } catch (IOException e) {
            throw new SnapshotException("Failed to delete slot '" + slot + "'", e);
        }
    }

    /**
     * Slot names present in the save directory, sorted.
     */
    public List<String> list() {
        Path dir = config.getSaveDirectory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .filter(name -> SLOT_NAME.matcher(name).matches())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SnapshotException("Failed to list saves in " + dir, e);
        }
    }

    Path pathFor(String slot) {
        if (slot == null || !SLOT_NAME.matcher(slot).matches()) {
            throw new IllegalArgumentException(
                    "Invalid slot name '" + slot + "': use lowercase letters, digits, '-' and '_'");
        }
        return config.getSaveDirectory().resolve(slot + EXTENSION);
    }
}
