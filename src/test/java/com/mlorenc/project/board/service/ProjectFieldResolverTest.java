package com.mlorenc.project.board.service;

import com.mlorenc.project.board.core.FakeGraphQlTransport;
import com.mlorenc.project.board.exception.NotFoundException;
import com.mlorenc.project.board.exception.TransportException;
import com.mlorenc.project.board.exception.UnsupportedFieldTypeException;
import com.mlorenc.project.board.exception.ValidationException;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.ProjectRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mlorenc.project.board.service.BoardFixtures.FIELDS_QUERY;
import static com.mlorenc.project.board.service.BoardFixtures.ORG_PROJECT_QUERY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectFieldResolverTest {

    private final FakeGraphQlTransport transport = BoardFixtures.acmeProject();
    private final ProjectFieldResolver resolver = new ProjectFieldResolver(transport.executor());

    @Test
    void shouldResolveOrganizationProject() {
        String projectId = resolver.resolveProject(new ProjectRef("acme", 1));

        assertThat(projectId).isEqualTo("PVT_1");
        FakeGraphQlTransport.Call call = transport.calls().get(0);
        assertThat(call.variables()).containsEntry("login", "acme").containsEntry("number", 1);
    }

    @Test
    void shouldResolveUserProjectWhenOwnerHasSlash() {
        FakeGraphQlTransport userTransport = new FakeGraphQlTransport()
                .respond("user(login", "{\"data\":{\"user\":{\"projectV2\":{\"id\":\"PVT_user\"}}}}");

        String projectId = new ProjectFieldResolver(userTransport.executor())
                .resolveProject(new ProjectRef("octocat/", 4));

        assertThat(projectId).isEqualTo("PVT_user");
        assertThat(userTransport.calls().get(0).variables()).containsEntry("login", "octocat");
    }

    @Test
    void shouldResolveViewerProject() {
        FakeGraphQlTransport viewerTransport = new FakeGraphQlTransport()
                .respond("viewer {", "{\"data\":{\"viewer\":{\"projectV2\":{\"id\":\"PVT_me\"}}}}");

        String projectId = new ProjectFieldResolver(viewerTransport.executor())
                .resolveProject(new ProjectRef("@me", 2));

        assertThat(projectId).isEqualTo("PVT_me");
        assertThat(viewerTransport.calls().get(0).variables()).containsOnlyKeys("number");
    }

    @Test
    void shouldReportMissingProjectAsNotFound() {
        FakeGraphQlTransport missing = new FakeGraphQlTransport()
                .respond(ORG_PROJECT_QUERY, "{\"data\":{\"organization\":{\"projectV2\":null}}}");

        assertThatThrownBy(() -> new ProjectFieldResolver(missing.executor()).resolveProject(new ProjectRef("acme", 99)))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Could not find project 99 for owner acme");
    }

    @Test
    void shouldReportRemoteNotFoundErrorAsNotFound() {
        FakeGraphQlTransport missing = new FakeGraphQlTransport().respond(ORG_PROJECT_QUERY,
                "{\"data\":{\"organization\":null},\"errors\":[{\"type\":\"NOT_FOUND\",\"message\":\"Could not resolve to an Organization with the login of 'nobody'.\"}]}");

        assertThatThrownBy(() -> new ProjectFieldResolver(missing.executor()).resolveProject(new ProjectRef("nobody", 1)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldPropagateTransportFailures() {
        FakeGraphQlTransport down = new FakeGraphQlTransport().fail(ORG_PROJECT_QUERY, "connection refused");

        assertThatThrownBy(() -> new ProjectFieldResolver(down.executor()).resolveProject(new ProjectRef("acme", 1)))
                .isInstanceOf(TransportException.class)
                .hasMessage("connection refused");
        assertThat(down.calls()).hasSize(3);
    }

    @Test
    void shouldListFieldsSkippingNodesWithoutIdentity() {
        List<FieldMetadata> fields = resolver.listFields("PVT_1");

        assertThat(fields).extracting(FieldMetadata::name)
                .containsExactly("Title", "Notes", "Estimate", "Due", "Status", "Priority", "Sprint", "Assignees");
        assertThat(fields.get(4).options()).extracting(FieldMetadata.Option::id)
                .containsExactly("opt_todo", "opt_progress", "opt_done");
        assertThat(fields.get(6).activeIterations()).extracting(FieldMetadata.Iteration::title).containsExactly("Sprint 5");
    }

    @Test
    void shouldFollowFieldPages() {
        FakeGraphQlTransport paged = new FakeGraphQlTransport()
                .respond(FIELDS_QUERY, """
                        {"data":{"node":{"fields":{"pageInfo":{"hasNextPage":true,"endCursor":"c1"},
                          "nodes":[{"id":"F_a","name":"A","dataType":"TEXT"}]}}}}
                        """)
                .respond(FIELDS_QUERY, """
                        {"data":{"node":{"fields":{"pageInfo":{"hasNextPage":false,"endCursor":"c2"},
                          "nodes":[{"id":"F_b","name":"B","dataType":"NUMBER"}]}}}}
                        """);

        List<FieldMetadata> fields = new ProjectFieldResolver(paged.executor()).listFields("PVT_1");

        assertThat(fields).extracting(FieldMetadata::id).containsExactly("F_a", "F_b");
        assertThat(paged.calls()).hasSize(2);
        assertThat(paged.calls().get(0).variables()).containsEntry("cursor", null);
        assertThat(paged.calls().get(1).variables()).containsEntry("cursor", "c1");
    }

    @Test
    void shouldStopPagingWhenCursorRepeats() {
        FakeGraphQlTransport stuck = new FakeGraphQlTransport()
                .respond(FIELDS_QUERY, """
                        {"data":{"node":{"fields":{"pageInfo":{"hasNextPage":true,"endCursor":"c1"},
                          "nodes":[{"id":"F_a","name":"A","dataType":"TEXT"}]}}}}
                        """)
                .respond(FIELDS_QUERY, """
                        {"data":{"node":{"fields":{"pageInfo":{"hasNextPage":true,"endCursor":"c1"},
                          "nodes":[{"id":"F_b","name":"B","dataType":"TEXT"}]}}}}
                        """);

        List<FieldMetadata> fields = new ProjectFieldResolver(stuck.executor()).listFields("PVT_1");

        assertThat(fields).extracting(FieldMetadata::id).containsExactly("F_a", "F_b");
        assertThat(stuck.calls()).hasSize(2);
    }

    @Test
    void shouldReportUnknownProjectNodeAsNotFound() {
        FakeGraphQlTransport missing = new FakeGraphQlTransport().respond(FIELDS_QUERY, "{\"data\":{\"node\":null}}");

        assertThatThrownBy(() -> new ProjectFieldResolver(missing.executor()).listFields("PVT_gone"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Project PVT_gone not found");
    }

    @Test
    void shouldResolveFieldByExactName() {
        FieldMetadata field = resolver.resolveField("PVT_1", "Estimate");

        assertThat(field.id()).isEqualTo("F_estimate");
        assertThat(field.dataType()).contains(FieldDataType.NUMBER);
        assertThatThrownBy(() -> resolver.resolveField("PVT_1", "estimate"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Field 'estimate' not found in project");
    }

    @Test
    void shouldPickFirstFieldWhenNamesAreDuplicated() {
        FakeGraphQlTransport duplicated = new FakeGraphQlTransport().respond(FIELDS_QUERY, """
                {"data":{"node":{"fields":{"pageInfo":{"hasNextPage":false},
                  "nodes":[
                    {"id":"F_first","name":"Status","dataType":"TEXT"},
                    {"id":"F_second","name":"Status","dataType":"TEXT"}
                  ]}}}}
                """);

        FieldMetadata field = new ProjectFieldResolver(duplicated.executor()).resolveField("PVT_1", "Status");

        assertThat(field.id()).isEqualTo("F_first");
    }

    @Test
    void shouldReturnSameIdentifiersWhenResolvedTwice() {
        FieldMetadata first = resolver.resolveField("PVT_1", "Status");
        String firstOption = resolver.resolveOption(first, "Done");
        FieldMetadata second = resolver.resolveField("PVT_1", "Status");
        String secondOption = resolver.resolveOption(second, "Done");

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(secondOption).isEqualTo(firstOption).isEqualTo("opt_done");
    }

    @Test
    void shouldResolveOptionsAndIterations() {
        FieldMetadata status = resolver.resolveField("PVT_1", "Status");
        FieldMetadata sprint = resolver.resolveField("PVT_1", "Sprint");

        assertThat(resolver.resolveOption(status, "In Progress")).isEqualTo("opt_progress");
        assertThat(resolver.resolveOption(sprint, "Sprint 5")).isEqualTo("it_5");
        assertThat(resolver.resolveOption(sprint, "Sprint 4")).isEqualTo("it_4");
        assertThatThrownBy(() -> resolver.resolveOption(status, "Blocked"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Option 'Blocked' not found in field 'Status'");
        assertThatThrownBy(() -> resolver.resolveOption(sprint, "Sprint 9"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Iteration 'Sprint 9' not found in field 'Sprint'");
    }

    @Test
    void shouldRejectOptionLookupOnFieldsWithoutOptions() {
        FieldMetadata notes = resolver.resolveField("PVT_1", "Notes");
        FieldMetadata assignees = resolver.resolveField("PVT_1", "Assignees");

        assertThatThrownBy(() -> resolver.resolveOption(notes, "x")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resolver.resolveOption(assignees, "x")).isInstanceOf(UnsupportedFieldTypeException.class);
    }

    @Test
    void shouldReadFieldListOncePerSnapshot() {
        FieldLookup snapshot = resolver.snapshot();

        snapshot.resolveField("PVT_1", "Status");
        snapshot.resolveField("PVT_1", "Estimate");
        assertThatThrownBy(() -> snapshot.resolveField("PVT_1", "Missing")).isInstanceOf(NotFoundException.class);

        assertThat(transport.callsMatching(FIELDS_QUERY)).hasSize(1);
    }
}
