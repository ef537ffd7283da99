package com.mlorenc.project.board.service;

import com.mlorenc.project.board.core.FakeGraphQlTransport;
import com.mlorenc.project.board.exception.NotFoundException;
import com.mlorenc.project.board.model.FieldDataType;
import com.mlorenc.project.board.model.FieldValue;
import com.mlorenc.project.board.model.ItemFieldValue;
import com.mlorenc.project.board.model.ItemValues;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemFieldValueServiceTest {

    private static final String ITEM_QUERY = "fieldValues(first";

    private final FakeGraphQlTransport transport = new FakeGraphQlTransport().respond(ITEM_QUERY, """
            {"data":{"node":{
              "id":"PVTI_1",
              "content":{"title":"Fix login redirect"},
              "fieldValues":{"nodes":[
                {"__typename":"ProjectV2ItemFieldTextValue","text":"Fix login redirect","field":{"id":"F_title","name":"Title"}},
                {"__typename":"ProjectV2ItemFieldNumberValue","number":3,"field":{"id":"F_estimate","name":"Estimate"}},
                {"__typename":"ProjectV2ItemFieldDateValue","date":"2024-04-01","field":{"id":"F_due","name":"Due"}},
                {"__typename":"ProjectV2ItemFieldSingleSelectValue","optionId":"opt_done","name":"Done","field":{"id":"F_status","name":"Status"}},
                {"__typename":"ProjectV2ItemFieldIterationValue","iterationId":"it_5","title":"Sprint 5","startDate":"2024-03-04","duration":14,"field":{"id":"F_sprint","name":"Sprint"}},
                {"__typename":"ProjectV2ItemFieldRepositoryValue","field":{"id":"F_repo","name":"Repository"}},
                {}
              ]}
            }}}
            """);

    private final ItemFieldValueService service = new ItemFieldValueService(transport.executor());

    @Test
    void shouldMapEachValueKind() {
        ItemValues values = service.readValues("PVTI_1");

        assertThat(values.title()).isEqualTo("Fix login redirect");
        assertThat(values.values()).extracting(ItemFieldValue::fieldName, ItemFieldValue::dataType, ItemFieldValue::displayValue)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("Title", FieldDataType.TEXT, "Fix login redirect"),
                        org.assertj.core.groups.Tuple.tuple("Estimate", FieldDataType.NUMBER, "3"),
                        org.assertj.core.groups.Tuple.tuple("Due", FieldDataType.DATE, "2024-04-01"),
                        org.assertj.core.groups.Tuple.tuple("Status", FieldDataType.SINGLE_SELECT, "Done"),
                        org.assertj.core.groups.Tuple.tuple("Sprint", FieldDataType.ITERATION, "Sprint 5"));
        assertThat(transport.calls().get(0).variables()).containsEntry("itemId", "PVTI_1");
    }

    @Test
    void shouldKeepIterationDetails() {
        ItemValues values = service.readValues("PVTI_1");

        assertThat(values.values()).extracting(ItemFieldValue::value)
                .contains(new FieldValue.IterationValue("it_5", "Sprint 5", "2024-03-04", 14));
        assertThat(values.values()).extracting(ItemFieldValue::fieldName).doesNotContain("Repository");
    }

    @Test
    void shouldReportUnknownItemAsNotFound() {
        FakeGraphQlTransport missing = new FakeGraphQlTransport().respond(ITEM_QUERY, "{\"data\":{\"node\":null}}");

        assertThatThrownBy(() -> new ItemFieldValueService(missing.executor()).readValues("PVTI_gone"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Item PVTI_gone not found or not accessible");
    }
}
