package com.helios.turnengine.api;

import com.helios.turnengine.api.exceptions.CompilationException;
import com.helios.turnengine.api.model.BundleDefinition;
import com.helios.turnengine.runtime.model.GameModel;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling a JSON game bundle into an immutable game model.
 */
public interface ITriggerCompiler {

    /**
     * Compiles a bundle from a JSON file.
     *
     * @param bundlePath path to the JSON bundle
     * @return compiled game model
     * @throws IOException if the file cannot be read
     * @throws CompilationException if the bundle is malformed or inconsistent
     */
    GameModel compile(Path bundlePath) throws IOException, CompilationException;

    /**
     * Compiles an already parsed bundle.
     *
     * @param bundle parsed bundle
     * @return compiled game model
     * @throws CompilationException if the bundle is inconsistent
     */
    GameModel compile(BundleDefinition bundle) throws CompilationException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
