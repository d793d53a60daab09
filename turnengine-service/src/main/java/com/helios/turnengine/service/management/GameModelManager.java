package com.helios.turnengine.service.management;

import com.helios.turnengine.api.CompilationListener;
import com.helios.turnengine.api.ITriggerCompiler;
import com.helios.turnengine.api.exceptions.CompilationException;
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
import java.util.ServiceLoader;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active compiled {@link GameModel} for a bundle file and opens
 * play sessions on it.
 *
 * <p>The initial load fails fast. Later reloads compile the bundle again and
 * swap the model atomically; when a reload fails the previous model stays
 * active. Sessions that are already running keep the model they were
 * opened with.
 */
public class GameModelManager {
    private static final Logger logger = Logger.getLogger(GameModelManager.class.getName());

    private final Path bundlePath;
    private final ITriggerCompiler compiler;
    private final Tracer tracer;

    private final AtomicReference<GameModel> activeModel = new AtomicReference<>();
    private ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    public GameModelManager(Path bundlePath, Tracer tracer, ITriggerCompiler compiler)
            throws CompilationException, IOException {
        this.bundlePath = bundlePath;
        this.tracer = tracer;
        this.compiler = compiler;
        this.compiler.setTracer(tracer);

        loadModel(); // Initial load, fail fast
    }

    /**
     * Uses the first {@link ITriggerCompiler} registered with {@link ServiceLoader}.
     */
    public GameModelManager(Path bundlePath, Tracer tracer) throws CompilationException, IOException {
        this(bundlePath, tracer, discoverCompiler());
    }

    static ITriggerCompiler discoverCompiler() {
        return ServiceLoader.load(ITriggerCompiler.class).findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No " + ITriggerCompiler.class.getName() + " implementation registered"));
    }

    public GameModel getGameModel() {
        return activeModel.get();
    }

    public Path getBundlePath() {
        return bundlePath;
    }

    /**
     * Opens a new session on the active model.
     */
    public TurnEngine newSession(EngineConfig config, MetricsRegistry metrics, OutputSink sink) {
        return newSession(config, metrics, sink, List.of());
    }

    /**
     * Starts a session on the active model with {@code listeners} run after each command cycle.
     */
    public TurnEngine newSession(EngineConfig config, MetricsRegistry metrics, OutputSink sink,
                                 List<TurnListener> listeners) {
        TurnEngine.Builder builder = TurnEngine.builder(activeModel.get())
                .config(config)
                .tracer(tracer)
                .metrics(metrics)
                .outputSink(sink);
        listeners.forEach(builder::turnListener);
        return builder.build();
    }

    /**
     * Recompiles the bundle, reporting stages to {@code listener}.
     *
     * @throws CompilationException if the bundle no longer compiles; the old model stays active
     * @throws IOException          if the bundle cannot be read; the old model stays active
     */
    public void reload(CompilationListener listener) throws CompilationException, IOException {
        compiler.setCompilationListener(listener);
        try {
            loadModel();
        } finally {
            compiler.setCompilationListener(null);
        }
    }

    /**
     * Polls the bundle file every {@code periodSeconds} and reloads on change.
     */
    public synchronized void start(long periodSeconds) {
        if (monitoringExecutor != null) {
            return;
        }
        monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Bundle-File-Monitor");
            t.setDaemon(true);
            return t;
        });
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, periodSeconds, periodSeconds, TimeUnit.SECONDS);
    }

    public synchronized void shutdown() {
        if (monitoringExecutor != null) {
            monitoringExecutor.shutdown();
            monitoringExecutor = null;
        }
    }

    /**
     * Reloads when the bundle file changed since the last successful load.
     *
     * @return true if a new model was swapped in
     */
    boolean checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-bundle-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("bundleFile", bundlePath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(bundlePath).toMillis();
            if (currentModifiedTime <= lastModifiedTime) {
                return false;
            }
            span.addEvent("Change detected. Triggering reload.");
            logger.info("Change detected in bundle file. Attempting to reload...");
            loadModel();
            return true;
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Failed to reload game bundle. Old model remains active.", e);
            return false;
        } finally {
            span.end();
        }
    }

    private void loadModel() throws CompilationException, IOException {
        Span span = tracer.spanBuilder("load-game-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(bundlePath).toMillis();
            GameModel newModel = compiler.compile(bundlePath);
            activeModel.set(newModel);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("newModel.triggers", newModel.getNumTriggers());
            logger.info(String.format("Loaded game model from %s with %d trigger(s)",
                    bundlePath, newModel.getNumTriggers()));
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
