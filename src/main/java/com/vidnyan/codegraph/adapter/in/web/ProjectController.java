package com.vidnyan.codegraph.adapter.in.web;

import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.GraphStats;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.OpenResult;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.SnapshotInfo;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase.UpdateResult;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import com.vidnyan.codegraph.exception.ConcurrentOperationException;
import com.vidnyan.codegraph.exception.GraphNotLoadedException;
import com.vidnyan.codegraph.exception.GraphQueryException;
import com.vidnyan.codegraph.exception.ProjectNotOpenException;
import com.vidnyan.codegraph.query.QueryResult;
import com.vidnyan.codegraph.search.HybridSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * REST API over project graphs: open, sync, save, query and search.
 */
@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectGraphUseCase projectGraph;

    public ProjectController(ProjectGraphUseCase projectGraph) {
        this.projectGraph = projectGraph;
    }

    @PostMapping("/open")
    public OpenResult open(@RequestBody OpenRequest request) {
        log.info("Received open request for {}", request.path());
        return projectGraph.open(Path.of(request.path()), ProgressListener.NONE, CancellationToken.create());
    }

    @PostMapping("/save")
    public SnapshotSaveResult save(@RequestBody ProjectRequest request) {
        return projectGraph.save(request.projectId());
    }

    /**
     * Changed paths reported by an external watcher.
     */
    @PostMapping("/changes")
    public UpdateResult changes(@RequestBody ChangesRequest request) {
        log.info("Received {} changed paths for {}", request.paths().size(), request.projectId());
        return projectGraph.applyChanges(request.projectId(), request.paths(), ProgressListener.NONE,
                CancellationToken.create());
    }

    @PostMapping("/refresh")
    public UpdateResult refresh(@RequestBody ProjectRequest request) {
        return projectGraph.refresh(request.projectId(), ProgressListener.NONE, CancellationToken.create());
    }

    @PostMapping("/query")
    public QueryResult query(@RequestBody QueryRequest request) {
        return projectGraph.query(request.projectId(), request.query());
    }

    @GetMapping("/search")
    public List<HybridSearchResult> search(@RequestParam String projectId,
                                           @RequestParam("q") String query,
                                           @RequestParam(defaultValue = "0") int limit) {
        return projectGraph.search(projectId, query, limit);
    }

    @GetMapping("/stats")
    public GraphStats stats(@RequestParam String projectId) {
        return projectGraph.stats(projectId);
    }

    @GetMapping
    public List<String> openProjects() {
        return projectGraph.openProjects();
    }

    @PostMapping("/close")
    public void close(@RequestBody ProjectRequest request) {
        projectGraph.close(request.projectId());
    }

    @GetMapping("/snapshot")
    public SnapshotInfo snapshot(@RequestParam String path) {
        return projectGraph.snapshotInfo(Path.of(path));
    }

    @DeleteMapping("/snapshot")
    public void deleteSnapshot(@RequestParam String path) {
        projectGraph.deleteSnapshot(Path.of(path));
    }

    @GetMapping("/snapshots")
    public List<String> snapshots() {
        return projectGraph.snapshotProjects().stream().map(Path::toString).toList();
    }

    @ExceptionHandler(GraphQueryException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse badQuery(GraphQueryException e) {
        return new ErrorResponse("INVALID_QUERY", e.getMessage());
    }

    @ExceptionHandler(GraphNotLoadedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse notLoaded(GraphNotLoadedException e) {
        return new ErrorResponse("GRAPH_NOT_LOADED", e.getMessage());
    }

    @ExceptionHandler(ProjectNotOpenException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse notOpen(ProjectNotOpenException e) {
        return new ErrorResponse("PROJECT_NOT_OPEN", e.getMessage());
    }

    @ExceptionHandler(ConcurrentOperationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse busy(ConcurrentOperationException e) {
        return new ErrorResponse("OPERATION_IN_FLIGHT", e.getMessage());
    }

    public record OpenRequest(String path) {}

    public record ProjectRequest(String projectId) {}

    public record ChangesRequest(String projectId, List<String> paths) {}

    public record QueryRequest(String projectId, String query) {}

    public record ErrorResponse(String error, String message) {}
}
