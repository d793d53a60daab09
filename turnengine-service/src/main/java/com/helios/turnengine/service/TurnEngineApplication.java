/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.service;

import com.helios.turnengine.api.exceptions.CompilationException;
import com.helios.turnengine.infra.config.EngineConfig;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.telemetry.TracingService;
import com.helios.turnengine.runtime.model.ModelStats;
import com.helios.turnengine.runtime.output.OutputSink;
import com.helios.turnengine.runtime.session.TurnEngine;
import com.helios.turnengine.runtime.session.TurnListener;
import com.helios.turnengine.service.dev.DevConsole;
import com.helios.turnengine.service.management.GameModelManager;
import com.helios.turnengine.service.persistence.SaveSlotRepository;
import com.helios.turnengine.service.persistence.SnapshotCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Wires the hosting services around one bundle file: the model manager,
 * save slots and developer console, sharing a tracer, metrics registry and
 * configuration.
 *
 * <p>Run directly, it compiles the bundle named by the first argument (or
 * the {@code bundle.file} system property) and reports its statistics.
 */
public class TurnEngineApplication {
    private static final Logger logger = Logger.getLogger(TurnEngineApplication.class.getName());

    static final String LOGGING_CONFIG = "/logging.properties";

    private final EngineConfig config;
    private final TracingService tracingService;
    private final MetricsRegistry metrics;
    private final GameModelManager modelManager;
    private final SaveSlotRepository saveSlots;

    public TurnEngineApplication(Path bundlePath, EngineConfig config, TracingService tracingService,
                                 MetricsRegistry metrics) throws CompilationException, IOException {
        this.config = config;
        this.tracingService = tracingService;
        this.metrics = metrics;
        this.modelManager = new GameModelManager(bundlePath, tracingService.getTracer());
        this.saveSlots = new SaveSlotRepository(config, new SnapshotCodec(), tracingService.getTracer(), metrics);
    }

    public static void main(String[] args) {
        configureLogging();
        String bundleFile = args.length > 0 ? args[0] : System.getProperty("bundle.file", "world.json");
        TracingService tracingService = TracingService.getInstance();
        try {
            TurnEngineApplication app = new TurnEngineApplication(Paths.get(bundleFile),
                    EngineConfig.loadDefault(), tracingService, MetricsRegistry.getInstance());
            ModelStats stats = app.getModelManager().getGameModel().getStats();
            logger.info(String.format("Bundle %s is playable: %d trigger(s), %d -> %d condition node(s)",
                    bundleFile, stats.triggerCount(), stats.conditionNodesBefore(), stats.conditionNodesAfter()));
            app.shutdown();
        } catch (IOException | CompilationException e) {
            logger.log(Level.SEVERE, "Bundle failed to load: " + e.getMessage(), e);
            tracingService.shutdown();
            System.exit(1);
        }
    }

    /**
     * Applies {@code logging.properties} from the classpath to JUL.
     *
     * @return false when the file is absent or unreadable and the JVM defaults stay in place
     */
    static boolean configureLogging() {
        try (InputStream in = TurnEngineApplication.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in == null) {
                return false;
            }
            LogManager.getLogManager().readConfiguration(in);
            return true;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read " + LOGGING_CONFIG + "; keeping default logging", e);
            return false;
        }
    }

    /**
     * Starts a session on the active model that autosaves on the configured interval.
     */
    public TurnEngine newSession(OutputSink sink) {
        List<TurnListener> listeners = saveSlots.autosaver().map(List::of).orElse(List.of());
        return modelManager.newSession(config, metrics, sink, listeners);
    }

    /**
     * Resumes a saved session against the active model.
     */
    public TurnEngine resume(String slot, OutputSink sink) {
        return saveSlots.load(slot, modelManager.getGameModel(), sink);
    }

    public Path save(String slot, TurnEngine engine) {
        return saveSlots.save(slot, engine);
    }

    public DevConsole devConsole(TurnEngine engine) {
        return new DevConsole(engine, metrics);
    }

    public GameModelManager getModelManager() {
        return modelManager;
    }

    public SaveSlotRepository getSaveSlots() {
        return saveSlots;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public void shutdown() {
        logger.info("Shutting down turn engine services");
        modelManager.shutdown();
        tracingService.shutdown();
    }
}
