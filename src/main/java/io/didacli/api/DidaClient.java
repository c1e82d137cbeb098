package io.didacli.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.didacli.error.ApiException;
import io.didacli.error.NotFoundException;
import io.didacli.error.ValidationException;
import io.didacli.http.HttpMethod;
import io.didacli.http.TransportClient;
import io.didacli.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Project and task operations of the open API. Arguments are validated before
 * any request is made; validation failures are never sent to the server.
 */
public final class DidaClient {
    private static final Logger log = LoggerFactory.getLogger(DidaClient.class);

    public static final int MAX_QUERY_LENGTH = 1000;
    public static final int MAX_SEARCH_PROJECTS = 100;
    public static final int STATUS_ACTIVE = 0;
    public static final int STATUS_COMPLETED = 2;

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final int SEARCH_PARALLELISM = 8;

    private final TransportClient transport;

    public DidaClient(TransportClient transport) {
        this.transport = transport;
    }

    public JsonNode projectsList() {
        return transport.get("project");
    }

    public JsonNode projectsCreate(ObjectNode body) {
        validateProjectBody(body, true);
        return transport.post("project", body);
    }

    public JsonNode projectsUpdate(String projectId, ObjectNode body) {
        validateId(projectId, "projectId");
        validateProjectBody(body, false);
        return transport.post("project/" + projectId, body);
    }

    public JsonNode projectsDelete(String projectId) {
        validateId(projectId, "projectId");
        return transport.delete("project/" + projectId);
    }

    public JsonNode tasksCreate(String projectId, ObjectNode draft) {
        validateId(projectId, "projectId");
        JsonNode title = draft == null ? null : draft.get("title");
        if (title == null || !title.isTextual() || title.asText().trim().isEmpty()) {
            throw new ValidationException("Task title is required", "title");
        }
        ObjectNode body = draft.deepCopy();
        body.put("projectId", projectId);
        return transport.post("task", body);
    }

    public JsonNode tasksGet(String projectId, String taskId) {
        validateId(projectId, "projectId");
        validateId(taskId, "taskId");
        try {
            return transport.get("project/" + projectId + "/task/" + taskId);
        } catch (ApiException e) {
            if (e.status() == 404) {
                throw new NotFoundException("Task", projectId + "/" + taskId);
            }
            throw e;
        }
    }

    /** The path ids win over any {@code id}/{@code projectId} in the draft. */
    public JsonNode tasksUpdate(String projectId, String taskId, ObjectNode draft) {
        validateId(projectId, "projectId");
        validateId(taskId, "taskId");
        ObjectNode body = Jsons.mapper().createObjectNode();
        if (draft != null) {
            Iterator<Map.Entry<String, JsonNode>> it = draft.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (!"id".equals(entry.getKey()) && !entry.getValue().isNull()) {
                    body.set(entry.getKey(), entry.getValue());
                }
            }
        }
        body.put("projectId", projectId);
        body.put("id", taskId);
        return transport.post("task/" + taskId, body);
    }

    public JsonNode tasksComplete(String projectId, String taskId) {
        validateId(projectId, "projectId");
        validateId(taskId, "taskId");
        return transport.request(HttpMethod.POST, "project/" + projectId + "/task/" + taskId + "/complete", null);
    }

    public JsonNode tasksDelete(String projectId, String taskId) {
        validateId(projectId, "projectId");
        validateId(taskId, "taskId");
        return transport.delete("project/" + projectId + "/task/" + taskId);
    }

    public JsonNode tasksGetAll(String projectId) {
        validateId(projectId, "projectId");
        return transport.get("project/" + projectId + "/data");
    }

    /**
     * Keyword search done client side: each project's task list comes from
     * {@code fetcher} (usually cache-backed), fetched concurrently. A project
     * whose fetch fails is reported in {@link SearchResult#errors()} and does
     * not fail the search.
     */
    public SearchResult tasksSearchLocal(
            String query,
            List<String> projectIds,
            Integer status,
            Function<String, JsonNode> fetcher
    ) {
        validateSearch(query, projectIds, status);
        for (String projectId : projectIds) {
            validateId(projectId, "projectId");
        }
        String needle = query == null || query.trim().isEmpty() ? null : query.trim().toLowerCase(Locale.ROOT);

        int threads = Math.max(1, Math.min(SEARCH_PARALLELISM, projectIds.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<JsonNode>> futures = new ArrayList<>(projectIds.size());
            for (String projectId : projectIds) {
                futures.add(CompletableFuture.supplyAsync(() -> fetcher.apply(projectId), executor));
            }

            List<JsonNode> results = new ArrayList<>();
            List<SearchResult.ProjectError> errors = new ArrayList<>();
            for (int i = 0; i < projectIds.size(); i++) {
                String projectId = projectIds.get(i);
                JsonNode data;
                try {
                    data = futures.get(i).join();
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.debug("search fetch failed: projectId={} error={}", projectId, cause.getMessage());
                    errors.add(new SearchResult.ProjectError(projectId, String.valueOf(cause.getMessage())));
                    continue;
                }
                for (JsonNode task : tasksOf(data)) {
                    if (matches(task, status, needle)) {
                        results.add(task);
                    }
                }
            }
            return new SearchResult(results, results.size(), projectIds.size(), errors.isEmpty() ? null : errors);
        } finally {
            executor.shutdownNow();
        }
    }

    static boolean matches(JsonNode task, Integer status, String needle) {
        if (status != null) {
            JsonNode taskStatus = task.get("status");
            if (taskStatus == null || !taskStatus.isNumber() || taskStatus.asInt() != status) {
                return false;
            }
        }
        if (needle == null) {
            return true;
        }
        StringBuilder hay = new StringBuilder();
        for (String field : new String[]{"title", "content", "desc"}) {
            JsonNode value = task.get(field);
            String text = value == null || value.isNull() ? "" : value.asText("").trim();
            if (!text.isEmpty()) {
                if (hay.length() > 0) {
                    hay.append(' ');
                }
                hay.append(text);
            }
        }
        return hay.toString().toLowerCase(Locale.ROOT).contains(needle);
    }

    /** Accepts either {@code {"tasks":[...]}} or a bare array. */
    public static List<JsonNode> tasksOf(JsonNode data) {
        List<JsonNode> out = new ArrayList<>();
        JsonNode tasks = data == null ? null : (data.isArray() ? data : data.get("tasks"));
        if (tasks != null && tasks.isArray()) {
            tasks.forEach(out::add);
        }
        return out;
    }

    static void validateId(String id, String name) {
        if (id == null || id.isEmpty()) {
            throw new ValidationException(name + " must be a non-empty string", name);
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new ValidationException(
                    name + " contains invalid characters (only alphanumeric, dash, underscore allowed)", name);
        }
    }

    static void validateProjectBody(ObjectNode body, boolean create) {
        JsonNode name = body == null ? null : body.get("name");
        if (create || (name != null && !name.isNull())) {
            if (name == null || !name.isTextual() || name.asText().trim().isEmpty()) {
                throw new ValidationException("Project name must be a non-empty string", "name");
            }
        }
        if (body == null) {
            return;
        }
        JsonNode sortOrder = body.get("sortOrder");
        if (sortOrder != null && !sortOrder.isNull() && (!sortOrder.isNumber() || sortOrder.asDouble() < 0)) {
            throw new ValidationException("sortOrder must be a non-negative number", "sortOrder");
        }
        for (String field : new String[]{"viewMode", "kind", "color"}) {
            JsonNode value = body.get(field);
            if (value != null && !value.isNull() && !value.isTextual()) {
                throw new ValidationException(field + " must be a string", field);
            }
        }
    }

    static void validateSearch(String query, List<String> projectIds, Integer status) {
        if (query != null && query.length() > MAX_QUERY_LENGTH) {
            throw new ValidationException("query must be " + MAX_QUERY_LENGTH + " characters or less", "query");
        }
        if (projectIds != null && projectIds.size() > MAX_SEARCH_PROJECTS) {
            throw new ValidationException("projectIds must be " + MAX_SEARCH_PROJECTS + " or fewer", "projectIds");
        }
        if (status != null && status != STATUS_ACTIVE && status != STATUS_COMPLETED) {
            throw new ValidationException("status must be 0 (active) or 2 (completed)", "status");
        }
        if (projectIds == null || projectIds.isEmpty()) {
            throw new ValidationException("At least one projectId is required for search", "projectIds");
        }
    }
}
