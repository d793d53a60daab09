package com.helios.turnengine.api.model;

import java.util.List;

/**
 * Resolutions produced by one scheduler drain, in processing order.
 */
public record DrainReport(long turn, List<Tombstone> resolutions) {

    public DrainReport {
        resolutions = List.copyOf(resolutions);
    }

    public static DrainReport empty(long turn) {
        return new DrainReport(turn, List.of());
    }

    public long count(Tombstone.Status status) {
        return resolutions.stream().filter(t -> t.status() == status).count();
    }
}
