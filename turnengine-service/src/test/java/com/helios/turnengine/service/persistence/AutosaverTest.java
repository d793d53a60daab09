package com.helios.turnengine.service.persistence;

import com.helios.turnengine.api.model.DrainReport;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.infra.config.EngineConfig;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.turnengine.runtime.session.TurnEngine;
import com.helios.turnengine.service.TestBundles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutosaverTest {

    @TempDir
    Path tempDir;

    @Mock
    private SaveSlotRepository slots;

    private InMemoryMetricsRegistry metrics;
    private TurnEngine engine;
    private Autosaver autosaver;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        engine = TurnEngine.builder(TestBundles.cellar(tempDir)).config(EngineConfig.forTesting()).build();
        autosaver = new Autosaver(slots, 3, metrics);
    }

    private static TurnReport report(long turn, boolean advanced) {
        return new TurnReport(turn, advanced, DrainReport.empty(turn), List.of(), List.of());
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 4, 5})
    void skipsTurnsOffTheInterval(long turn) {
        autosaver.turnCompleted(engine, report(turn, true));

        verifyNoInteractions(slots);
    }

    @Test
    @DisplayName("A cycle that did not advance the turn never saves")
    void skipsRepeatedCycle() {
        autosaver.turnCompleted(engine, report(3, false));

        verifyNoInteractions(slots);
    }

    @Test
    void savesOnMultiplesOfTheInterval() {
        autosaver.turnCompleted(engine, report(3, true));
        autosaver.turnCompleted(engine, report(6, true));

        verify(slots, times(2)).save(Autosaver.SLOT, engine);
        assertThat(metrics.getCounterValue(MetricNames.AUTOSAVES)).isEqualTo(2);
        assertThat(engine.pendingOutput()).isEmpty();
    }

    @Test
    @DisplayName("A failed save becomes an error line for the next cycle")
    void reportsFailure() {
        when(slots.save(Autosaver.SLOT, engine)).thenThrow(new SnapshotException("disk full"));

        autosaver.turnCompleted(engine, report(3, true));

        assertThat(engine.pendingOutput()).containsExactly(OutputItem.of(OutputTag.ERROR, "Autosave failed: disk full"));
        assertThat(metrics.getCounterValue(MetricNames.AUTOSAVE_FAILURES)).isEqualTo(1);
        assertThat(metrics.getCounterValue(MetricNames.AUTOSAVES)).isZero();
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new Autosaver(slots, 0, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
