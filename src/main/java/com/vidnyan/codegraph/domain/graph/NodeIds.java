package com.vidnyan.codegraph.domain.graph;

/**
 * Deterministic identifiers.
 * The same symbol in the same file always gets the same id, which is what keeps
 * node identity stable across incremental rebuilds.
 */
public final class NodeIds {

    private NodeIds() {
    }

    public static String folder(String path) {
        return NodeLabel.FOLDER.displayName() + ":" + path;
    }

    public static String file(String path) {
        return NodeLabel.FILE.displayName() + ":" + path;
    }

    public static String symbol(NodeLabel label, String filePath, String qualifiedName) {
        return label.displayName() + ":" + filePath + ":" + qualifiedName;
    }

    public static String community(int index) {
        return "comm_" + index;
    }

    public static String process(int index, String entryName) {
        return "proc_" + index + "_" + sanitize(entryName);
    }

    public static String relationship(String sourceId, RelationshipType type, String targetId) {
        return sourceId + "_" + type.name() + "_" + targetId;
    }

    public static String membership(String nodeId, String communityId) {
        return nodeId + "_member_of_" + communityId;
    }

    public static String processStep(String nodeId, int step, String processId) {
        return nodeId + "_step_" + step + "_" + processId;
    }

    private static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
