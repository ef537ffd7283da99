package com.mlorenc.project.board.service;

import com.mlorenc.project.board.core.FakeGraphQlTransport;

/**
 * Canned GraphQL responses for a project "acme"/1 with id PVT_1.
 */
final class BoardFixtures {

    static final String ORG_PROJECT_QUERY = "organization(login";
    static final String FIELDS_QUERY = "fields(first: 50";
    static final String UPDATE_MUTATION = "updateProjectV2ItemFieldValue";
    static final String CLEAR_MUTATION = "clearProjectV2ItemFieldValue";

    static final String ORG_PROJECT = """
            {"data":{"organization":{"projectV2":{"id":"PVT_1","title":"Roadmap"}}}}
            """;

    static final String FIELDS = """
            {"data":{"node":{"fields":{
              "pageInfo":{"hasNextPage":false,"endCursor":null},
              "nodes":[
                {"id":"F_title","name":"Title","dataType":"TITLE"},
                {"id":"F_notes","name":"Notes","dataType":"TEXT"},
                {"id":"F_estimate","name":"Estimate","dataType":"NUMBER"},
                {"id":"F_due","name":"Due","dataType":"DATE"},
                {"id":"F_status","name":"Status","dataType":"SINGLE_SELECT","options":[
                  {"id":"opt_todo","name":"Todo","color":"GRAY","description":""},
                  {"id":"opt_progress","name":"In Progress","color":"YELLOW","description":""},
                  {"id":"opt_done","name":"Done","color":"GREEN","description":"Finished"}
                ]},
                {"id":"F_priority","name":"Priority","dataType":"SINGLE_SELECT","options":[
                  {"id":"opt_low","name":"Low","color":"BLUE","description":""},
                  {"id":"opt_high","name":"High","color":"RED","description":""}
                ]},
                {"id":"F_sprint","name":"Sprint","dataType":"ITERATION","configuration":{
                  "iterations":[{"id":"it_5","title":"Sprint 5","startDate":"2024-03-04","duration":14}],
                  "completedIterations":[{"id":"it_4","title":"Sprint 4","startDate":"2024-02-19","duration":14}]
                }},
                {"id":"F_assignees","name":"Assignees","dataType":"ASSIGNEES"},
                {}
              ]
            }}}}
            """;

    static final String UPDATED = """
            {"data":{"updateProjectV2ItemFieldValue":{"projectV2Item":{"id":"I_1"}}}}
            """;

    static final String CLEARED = """
            {"data":{"clearProjectV2ItemFieldValue":{"projectV2Item":{"id":"I_1"}}}}
            """;

    static final String ITEM_NOT_FOUND = """
            {"data":{"updateProjectV2ItemFieldValue":null},
             "errors":[{"type":"NOT_FOUND","message":"Could not resolve to ProjectV2Item with the global id of 'I_missing'"}]}
            """;

    private BoardFixtures() {
    }

    static FakeGraphQlTransport acmeProject() {
        return new FakeGraphQlTransport()
                .respond(ORG_PROJECT_QUERY, ORG_PROJECT)
                .respond(FIELDS_QUERY, FIELDS)
                .respond(UPDATE_MUTATION, UPDATED)
                .respond(CLEAR_MUTATION, CLEARED);
    }
}
