package com.mlorenc.project.board.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlorenc.project.board.core.CallResult;
import com.mlorenc.project.board.core.GraphQlRequest;
import com.mlorenc.project.board.core.RemoteCallExecutor;
import com.mlorenc.project.board.exception.NotFoundException;
import com.mlorenc.project.board.exception.UnsupportedFieldTypeException;
import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.ProjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns human-supplied names into the opaque identifiers the mutation API needs.
 * Every call reads fresh from the remote; use {@link #snapshot()} for a per-run cache.
 */
@Service
public class ProjectFieldResolver implements FieldLookup {

    private static final Logger log = LoggerFactory.getLogger(ProjectFieldResolver.class);

    static final String ORGANIZATION_PROJECT_QUERY = """
            query($login: String!, $number: Int!) {
              organization(login: $login) { projectV2(number: $number) { id title } }
            }
            """;

    static final String USER_PROJECT_QUERY = """
            query($login: String!, $number: Int!) {
              user(login: $login) { projectV2(number: $number) { id title } }
            }
            """;

    static final String VIEWER_PROJECT_QUERY = """
            query($number: Int!) {
              viewer { projectV2(number: $number) { id title } }
            }
            """;

    static final String FIELDS_QUERY = """
            query($projectId: ID!, $cursor: String) {
              node(id: $projectId) {
                ... on ProjectV2 {
                  fields(first: 50, after: $cursor) {
                    pageInfo { hasNextPage endCursor }
                    nodes {
            %s
                    }
                  }
                }
              }
            }
            """.formatted(FieldNodes.FIELD_SELECTION);

    private final RemoteCallExecutor executor;

    public ProjectFieldResolver(RemoteCallExecutor executor) {
        this.executor = executor;
    }

    public String resolveProject(ProjectRef project) {
        GraphQlRequest request = switch (project.ownerKind()) {
            case ORGANIZATION -> GraphQlRequest.of("resolveOrganizationProject", ORGANIZATION_PROJECT_QUERY,
                    Map.of("login", project.login(), "number", project.number()));
            case USER -> GraphQlRequest.of("resolveUserProject", USER_PROJECT_QUERY,
                    Map.of("login", project.login(), "number", project.number()));
            case VIEWER -> GraphQlRequest.of("resolveViewerProject", VIEWER_PROJECT_QUERY,
                    Map.of("number", project.number()));
        };

        CallResult result = executor.execute(request);
        if (result.isNotFound()) {
            throw projectNotFound(project);
        }
        JsonNode data = result.getOrThrow();
        String projectId = FieldNodes.text(data.path(project.ownerKind().rootField()).path("projectV2").path("id"));
        if (projectId == null || projectId.isBlank()) {
            throw projectNotFound(project);
        }

        log.atDebug().addKeyValue("event", "board.project.resolved")
                .addKeyValue("owner", project.owner())
                .addKeyValue("number", project.number())
                .addKeyValue("projectId", projectId)
                .log("Resolved project id");
        return projectId;
    }

    public List<FieldMetadata> listFields(String projectId) {
        List<FieldMetadata> fields = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> variables = new LinkedHashMap<>();
            variables.put("projectId", projectId);
            variables.put("cursor", cursor);

            CallResult result = executor.execute(GraphQlRequest.of("listFields", FIELDS_QUERY, variables));
            if (result.isNotFound()) {
                throw new NotFoundException("Project %s not found", projectId);
            }
            JsonNode connection = result.getOrThrow().path("node").path("fields");
            if (!connection.isObject()) {
                throw new NotFoundException("Project %s not found", projectId);
            }
            for (JsonNode node : connection.path("nodes")) {
                FieldNodes.toFieldMetadata(node).ifPresent(fields::add);
            }

            JsonNode pageInfo = connection.path("pageInfo");
            String next = pageInfo.path("hasNextPage").asBoolean(false) ? FieldNodes.text(pageInfo.path("endCursor")) : null;
            if (next != null && next.equals(cursor)) {
                log.atWarn().addKeyValue("event", "board.fields.cursor_repeated")
                        .addKeyValue("projectId", projectId)
                        .addKeyValue("cursor", next)
                        .log("Field pagination returned the same cursor twice, stopping");
                next = null;
            }
            cursor = next;
        } while (cursor != null);
        return List.copyOf(fields);
    }

    @Override
    public FieldMetadata resolveField(String projectId, String fieldName) {
        return selectField(listFields(projectId), projectId, fieldName);
    }

    /**
     * Per-run lookup that reads the field list of each project once and serves every later
     * resolution from that snapshot.
     */
    public FieldLookup snapshot() {
        return new SnapshotFieldLookup(this);
    }

    public FieldMetadata.Option resolveSelectOption(FieldMetadata field, String optionName) {
        return firstMatch(field.options(), FieldMetadata.Option::name, optionName, "option", field.name())
                .orElseThrow(() -> new NotFoundException("Option '%s' not found in field '%s'", optionName, field.name()));
    }

    public FieldMetadata.Iteration resolveIteration(FieldMetadata field, String title) {
        Optional<FieldMetadata.Iteration> active =
                firstMatch(field.activeIterations(), FieldMetadata.Iteration::title, title, "iteration", field.name());
        if (active.isPresent()) {
            return active.get();
        }
        return firstMatch(field.completedIterations(), FieldMetadata.Iteration::title, title, "iteration", field.name())
                .orElseThrow(() -> new NotFoundException("Iteration '%s' not found in field '%s'", title, field.name()));
    }

    /**
     * Option id for single-select fields, iteration id for iteration fields.
     */
    public String resolveOption(FieldMetadata field, String optionOrIterationName) {
        FieldDataType type = field.dataType()
                .orElseThrow(() -> new UnsupportedFieldTypeException(field.name(), field.rawDataType()));
        return switch (type) {
            case SINGLE_SELECT -> resolveSelectOption(field, optionOrIterationName).id();
            case ITERATION -> resolveIteration(field, optionOrIterationName).id();
            case TEXT, NUMBER, DATE -> throw new ValidationException(
                    "Field '%s' of type %s has no options", field.name(), type);
        };
    }

    static FieldMetadata selectField(List<FieldMetadata> fields, String projectId, String fieldName) {
        return firstMatch(fields, FieldMetadata::name, fieldName, "field", projectId)
                .orElseThrow(() -> new NotFoundException("Field '%s' not found in project", fieldName));
    }

    private static NotFoundException projectNotFound(ProjectRef project) {
        return new NotFoundException("Could not find project %d for owner %s", project.number(), project.owner());
    }

    private static <T> Optional<T> firstMatch(List<T> candidates, Function<T, String> key, String wanted,
                                              String kind, String scope) {
        List<T> matches = candidates.stream()
                .filter(candidate -> wanted != null && wanted.equals(key.apply(candidate)))
                .toList();
        if (matches.size() > 1) {
            log.atWarn().addKeyValue("event", "board.resolve.duplicate_name")
                    .addKeyValue("kind", kind)
                    .addKeyValue("name", wanted)
                    .addKeyValue("scope", scope)
                    .addKeyValue("matches", matches.size())
                    .log("Duplicate {} name, using the first one in server order", kind);
        }
        return matches.stream().findFirst();
    }
}
