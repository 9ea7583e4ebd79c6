package com.vidnyan.codegraph.domain.snapshot;

import java.util.Optional;

/**
 * Outcome of loading a snapshot. Anything but {@link Status#VALID} means
 * "no usable snapshot": the caller re-ingests from scratch.
 */
public record SnapshotLoadResult(Status status, SnapshotPayload payload, String detail) {

    public enum Status {
        VALID,
        MISSING,
        INTEGRITY_FAILURE,
        FORMAT_MISMATCH,
        VERSION_MISMATCH,
        CORRUPT
    }

    public static SnapshotLoadResult valid(SnapshotPayload payload) {
        return new SnapshotLoadResult(Status.VALID, payload, "ok");
    }

    public static SnapshotLoadResult invalid(Status status, String detail) {
        return new SnapshotLoadResult(status, null, detail);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Optional<SnapshotPayload> payloadIfValid() {
        return isValid() ? Optional.of(payload) : Optional.empty();
    }
}
