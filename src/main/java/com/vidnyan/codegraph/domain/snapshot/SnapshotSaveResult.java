package com.vidnyan.codegraph.domain.snapshot;

/**
 * Outcome of a snapshot save. A failed save reports zero bytes written.
 */
public record SnapshotSaveResult(boolean success, long size, long durationMs, String error) {

    public static SnapshotSaveResult succeeded(long size, long durationMs) {
        return new SnapshotSaveResult(true, size, durationMs, null);
    }

    public static SnapshotSaveResult failed(long durationMs, String error) {
        return new SnapshotSaveResult(false, 0, durationMs, error);
    }
}
