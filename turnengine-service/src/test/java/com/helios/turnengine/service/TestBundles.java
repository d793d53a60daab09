package com.helios.turnengine.service;

import com.helios.turnengine.compiler.TriggerCompiler;
import com.helios.turnengine.runtime.model.GameModel;
import io.opentelemetry.api.OpenTelemetry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies the bundled test fixture out of the classpath and compiles it.
 */
public final class TestBundles {

    public static final String CELLAR = "/bundles/cellar.json";

    private TestBundles() {
    }

    public static Path copy(String resource, Path dir) {
        Path target = dir.resolve(Path.of(resource).getFileName().toString());
        try (InputStream in = TestBundles.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + resource);
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GameModel cellar(Path dir) {
        try {
            return new TriggerCompiler(OpenTelemetry.noop().getTracer("test")).compile(copy(CELLAR, dir));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
