package com.vidnyan.codegraph.domain.snapshot;

/**
 * On-disk layout constants of the snapshot directory.
 */
public final class SnapshotFormat {

    /**
     * Bumped whenever the payload encoding changes. Snapshots written with a
     * different value are discarded, never migrated.
     */
    public static final int FORMAT_VERSION = 1;

    /** Per-project snapshot directory, relative to the project root. */
    public static final String DIRECTORY = ".codegraph";

    public static final String SNAPSHOT_FILE = "snapshot.bin";
    public static final String SNAPSHOT_TMP_FILE = "snapshot.bin.tmp";
    public static final String META_FILE = "meta.json";
    public static final String MANIFEST_FILE = "manifest.json";
    public static final String LOCK_FILE = "lock";

    private SnapshotFormat() {
    }
}
