package com.mlorenc.project.board.controller;

import com.mlorenc.project.board.model.BatchReport;
import com.mlorenc.project.board.model.BulkRow;
import com.mlorenc.project.board.model.FieldMetadata;
import com.mlorenc.project.board.model.FieldUpdate;
import com.mlorenc.project.board.model.ItemValues;
import com.mlorenc.project.board.model.OptionMatch;
import com.mlorenc.project.board.model.ProjectRef;
import com.mlorenc.project.board.service.BulkRowCsvCodec;
import com.mlorenc.project.board.service.ProjectBoardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/projects")
public class ProjectBoardController {

    private static final Logger log = LoggerFactory.getLogger(ProjectBoardController.class);
    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ProjectBoardService boardService;
    private final BulkRowCsvCodec csvCodec;

    public ProjectBoardController(ProjectBoardService boardService, BulkRowCsvCodec csvCodec) {
        this.boardService = boardService;
        this.csvCodec = csvCodec;
    }

    @GetMapping("/fields")
    public List<FieldMetadata> listFields(@RequestParam String owner, @RequestParam int number) {
        return boardService.listFields(new ProjectRef(owner, number));
    }

    @GetMapping("/fields/{fieldName}")
    public FieldMetadata fieldDetails(@RequestParam String owner, @RequestParam int number,
                                      @PathVariable String fieldName) {
        return boardService.fieldDetails(new ProjectRef(owner, number), fieldName);
    }

    @GetMapping("/fields/{fieldName}/options/{optionName}")
    public OptionMatch findOption(@RequestParam String owner, @RequestParam int number,
                                  @PathVariable String fieldName, @PathVariable String optionName) {
        return boardService.findOption(new ProjectRef(owner, number), fieldName, optionName);
    }

    @PostMapping("/fields")
    @ResponseStatus(HttpStatus.CREATED)
    public FieldMetadata createField(@RequestParam String owner, @RequestParam int number,
                                     @RequestBody CreateFieldRequest request) {
        return boardService.createField(new ProjectRef(owner, number), request.name(), request.dataType(), request.options());
    }

    @PostMapping("/fields/{fieldName}/options")
    @ResponseStatus(HttpStatus.CREATED)
    public FieldMetadata.Option addOption(@RequestParam String owner, @RequestParam int number,
                                          @PathVariable String fieldName, @RequestBody AddOptionRequest request) {
        return boardService.addSelectOption(new ProjectRef(owner, number), fieldName, request.name(), request.color());
    }

    @DeleteMapping("/fields/{fieldName}")
    public Map<String, String> deleteField(@RequestParam String owner, @RequestParam int number,
                                           @PathVariable String fieldName) {
        return Map.of("deletedFieldId", boardService.deleteField(new ProjectRef(owner, number), fieldName));
    }

    @GetMapping("/items/{itemId}/values")
    public ItemValues itemValues(@PathVariable String itemId) {
        return boardService.readItemValues(itemId);
    }

    @PutMapping("/items/{itemId}/values/{fieldName}")
    public FieldUpdate setValue(@RequestParam String owner, @RequestParam int number,
                                @RequestParam(defaultValue = "false") boolean dryRun,
                                @PathVariable String itemId, @PathVariable String fieldName,
                                @RequestBody SetValueRequest request) {
        return boardService.setField(new ProjectRef(owner, number), itemId, fieldName, request.value(), dryRun);
    }

    @PutMapping("/items/{itemId}/values/by-id/{fieldId}")
    public FieldUpdate setOptionById(@RequestParam String owner, @RequestParam int number,
                                     @PathVariable String itemId, @PathVariable String fieldId,
                                     @RequestBody SetOptionRequest request) {
        return boardService.setSingleSelectById(new ProjectRef(owner, number), itemId, fieldId, request.optionId());
    }

    @DeleteMapping("/items/{itemId}/values/{fieldName}")
    public FieldUpdate clearValue(@RequestParam String owner, @RequestParam int number,
                                  @RequestParam(defaultValue = "false") boolean dryRun,
                                  @PathVariable String itemId, @PathVariable String fieldName) {
        return boardService.clearField(new ProjectRef(owner, number), itemId, fieldName, dryRun);
    }

    /**
     * Runs a CSV batch. Answers with the JSON report, or with the failed rows as CSV when the
     * caller accepts {@code text/csv}, ready to be fixed and resubmitted.
     */
    @PostMapping(value = "/bulk-update", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<?> bulkUpdate(@RequestParam String owner, @RequestParam int number,
                                        @RequestParam(defaultValue = "false") boolean dryRun,
                                        @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
                                        @RequestBody(required = false) String csv) {
        ProjectRef project = new ProjectRef(owner, number);
        List<BulkRow> rows = csvCodec.read(csv);
        log.atInfo().addKeyValue("event", "board.bulk.request")
                .addKeyValue("owner", project.owner())
                .addKeyValue("number", project.number())
                .addKeyValue("rows", rows.size())
                .addKeyValue("dryRun", dryRun)
                .log("Received bulk update request");

        BatchReport report = boardService.bulkUpdate(project, rows, dryRun);
        if (accept != null && accept.contains(TEXT_CSV.toString())) {
            return ResponseEntity.ok()
                    .contentType(TEXT_CSV)
                    .body(csvCodec.write(report.failedRows()));
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(report);
    }

    public record SetValueRequest(String value) {
    }

    public record SetOptionRequest(String optionId) {
    }

    public record CreateFieldRequest(String name, String dataType, List<String> options) {
    }

    public record AddOptionRequest(String name, String color) {
    }
}
