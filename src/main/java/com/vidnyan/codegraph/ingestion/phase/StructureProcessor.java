package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.ingestion.language.SourceLanguage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Folder and File nodes with their CONTAINS hierarchy.
 * Always runs over the complete path list.
 */
@Slf4j
@Component
public class StructureProcessor {

    public void process(KnowledgeGraph graph, Collection<String> paths) {
        int before = graph.nodeCount();
        for (String path : new TreeSet<>(paths)) {
            String[] parts = path.split("/");
            String parentId = null;
            StringBuilder current = new StringBuilder();
            for (int i = 0; i < parts.length - 1; i++) {
                if (current.length() > 0) {
                    current.append('/');
                }
                current.append(parts[i]);
                String folderPath = current.toString();
                String folderId = NodeIds.folder(folderPath);
                graph.addNode(GraphNode.builder(folderId, NodeLabel.FOLDER)
                        .name(parts[i])
                        .filePath(folderPath)
                        .build());
                if (parentId != null) {
                    graph.addRelationship(GraphRelationship.of(RelationshipType.CONTAINS, parentId, folderId, 1.0, ""));
                }
                parentId = folderId;
            }

            String fileId = NodeIds.file(path);
            graph.addNode(GraphNode.builder(fileId, NodeLabel.FILE)
                    .name(parts[parts.length - 1])
                    .filePath(path)
                    .language(SourceLanguage.fromPath(path).map(SourceLanguage::id).orElse(null))
                    .build());
            if (parentId != null) {
                graph.addRelationship(GraphRelationship.of(RelationshipType.CONTAINS, parentId, fileId, 1.0, ""));
            }
        }
        log.debug("Structure: {} paths, {} new nodes", paths.size(), graph.nodeCount() - before);
    }

    /**
     * Removes Folder nodes that no longer lead to any of {@code paths}.
     *
     * @return number of folders removed
     */
    public int pruneEmptyFolders(KnowledgeGraph graph, Collection<String> paths) {
        Set<String> required = new HashSet<>();
        for (String path : paths) {
            int slash = path.lastIndexOf('/');
            while (slash > 0) {
                String folder = path.substring(0, slash);
                if (!required.add(folder)) {
                    break;
                }
                slash = folder.lastIndexOf('/');
            }
        }
        return graph.removeNodesIf(n -> n.label() == NodeLabel.FOLDER && !required.contains(n.filePath()));
    }
}
