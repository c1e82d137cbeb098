package io.didacli.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(
        List<JsonNode> results,
        int total,
        int projectsSearched,
        List<ProjectError> errors
) {
    public record ProjectError(String projectId, String error) {
    }
}
