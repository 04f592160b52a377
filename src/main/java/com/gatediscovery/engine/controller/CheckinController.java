package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.CheckinReceipt;
import com.gatediscovery.engine.dto.CheckinRequest;
import com.gatediscovery.engine.service.CheckinIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Check-in ingestion over REST. Scanners that keep a connection open use
 * {@link CheckinStreamingController} instead.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}/checkins")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Check-ins", description = "Wristband scan ingestion")
public class CheckinController {

    private final CheckinIngestionService ingestionService;

    @Operation(
            summary = "Store a check-in",
            description = "Stores the scan with its GPS quality weight. The gate is the scanner's gate when given, " +
                    "otherwise the nearest active gate within the orphan bound, otherwise none until backfill. " +
                    "A repeated clientEventId returns the stored event with duplicate=true."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Check-in stored"),
            @ApiResponse(responseCode = "200", description = "Duplicate client event, nothing stored"),
            @ApiResponse(responseCode = "404", description = "Unknown session or gate")
    })
    @PostMapping
    public ResponseEntity<CheckinReceipt> ingest(
            @PathVariable Long sessionId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Wristband scan",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = CheckinRequest.class),
                            examples = @ExampleObject(
                                    value = "{\"wristbandId\":\"WB-1001\",\"category\":\"VIP\"," +
                                            "\"timestamp\":\"2024-06-01T18:00:00Z\",\"latitude\":41.0082," +
                                            "\"longitude\":28.9784,\"accuracy\":8.0,\"clientEventId\":\"scan-77\"}"
                            )
                    )
            )
            @Valid @RequestBody CheckinRequest request) {
        log.debug("Check-in for session {}: {}", sessionId, request.toLogString());
        CheckinReceipt receipt = ingestionService.ingest(sessionId, request);
        return ResponseEntity.status(receipt.duplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(receipt);
    }
}
