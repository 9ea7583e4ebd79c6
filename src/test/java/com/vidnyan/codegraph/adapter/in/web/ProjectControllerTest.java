package com.vidnyan.codegraph.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codegraph.application.port.in.ProjectGraphUseCase;
import com.vidnyan.codegraph.exception.ConcurrentOperationException;
import com.vidnyan.codegraph.exception.GraphNotLoadedException;
import com.vidnyan.codegraph.exception.GraphQueryException;
import com.vidnyan.codegraph.exception.ProjectNotOpenException;
import com.vidnyan.codegraph.query.QueryResult;
import com.vidnyan.codegraph.query.QueryRow;
import com.vidnyan.codegraph.search.HybridSearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ProjectControllerTest {

    private static final String PROJECT = "/work/demo";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProjectGraphUseCase projectGraph;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        projectGraph = mock(ProjectGraphUseCase.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ProjectController(projectGraph)).build();
    }

    private String queryBody(String query) throws Exception {
        return objectMapper.writeValueAsString(Map.of("projectId", PROJECT, "query", query));
    }

    @Test
    void query_shouldReturnRows() throws Exception {
        // Given
        QueryRow row = new QueryRow(QueryRow.Kind.VALUES, null, null, null, null, List.of("foo"));
        when(projectGraph.query(PROJECT, "MATCH (n) RETURN n.name"))
                .thenReturn(new QueryResult(List.of("n.name"), List.of(row), 3L));

        // When
        MvcResult result = mockMvc.perform(post("/api/projects/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(queryBody("MATCH (n) RETURN n.name")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.columns[0]").value("n.name"))
            .andExpect(jsonPath("$.rows[0].kind").value("VALUES"))
            .andExpect(jsonPath("$.rows[0].values[0]").value("foo"))
            .andReturn();

        // Then
        assertThat(result.getResponse().getContentAsString()).doesNotContain("\"node\"");
    }

    @Test
    void query_shouldMapMalformedQueryToBadRequest() throws Exception {
        when(projectGraph.query(eq(PROJECT), anyString()))
                .thenThrow(new GraphQueryException("Expected ')' at position 8"));

        mockMvc.perform(post("/api/projects/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(queryBody("MATCH (n RETURN n")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_QUERY"))
            .andExpect(jsonPath("$.message").value("Expected ')' at position 8"));
    }

    @Test
    void query_shouldMapMissingGraphToConflict() throws Exception {
        when(projectGraph.query(eq(PROJECT), anyString()))
                .thenThrow(new GraphNotLoadedException("No graph loaded for " + PROJECT));

        mockMvc.perform(post("/api/projects/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(queryBody("MATCH (n) RETURN n")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("GRAPH_NOT_LOADED"));
    }

    @Test
    void stats_shouldMapUnknownProjectToNotFound() throws Exception {
        when(projectGraph.stats(PROJECT)).thenThrow(new ProjectNotOpenException(PROJECT));

        mockMvc.perform(get("/api/projects/stats").param("projectId", PROJECT))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("PROJECT_NOT_OPEN"));
    }

    @Test
    void save_shouldMapConcurrentOperationToConflict() throws Exception {
        when(projectGraph.save(PROJECT)).thenThrow(new ConcurrentOperationException(PROJECT, "save"));

        mockMvc.perform(post("/api/projects/save")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("projectId", PROJECT))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("OPERATION_IN_FLIGHT"));
    }

    @Test
    void search_shouldPassLimitThrough() throws Exception {
        // Given
        HybridSearchResult hit = new HybridSearchResult("src/auth.ts", 0.032, 1, List.of("bm25", "semantic"),
                "Function:src/auth.ts:validateToken", "validateToken", "Function", 1, 3);
        when(projectGraph.search(PROJECT, "token", 5)).thenReturn(List.of(hit));

        // When / Then
        mockMvc.perform(get("/api/projects/search")
                .param("projectId", PROJECT)
                .param("q", "token")
                .param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].filePath").value("src/auth.ts"))
            .andExpect(jsonPath("$[0].sources[1]").value("semantic"))
            .andExpect(jsonPath("$[0].nodeName").value("validateToken"));
        verify(projectGraph).search(PROJECT, "token", 5);
    }

    @Test
    void changes_shouldForwardWatcherPaths() throws Exception {
        when(projectGraph.applyChanges(eq(PROJECT), any(), any(), any())).thenReturn(
                new ProjectGraphUseCase.UpdateResult(PROJECT, null, false,
                        new ProjectGraphUseCase.GraphStats(2, 10, 12, 1, 1, 0), 7L));

        mockMvc.perform(post("/api/projects/changes")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("projectId", PROJECT, "paths", List.of("a.ts")))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullReingest").value(false))
            .andExpect(jsonPath("$.stats.nodes").value(10));
        verify(projectGraph).applyChanges(eq(PROJECT), eq(List.of("a.ts")), any(), any());
    }
}
