package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.ValidationRequest;
import com.gatediscovery.engine.dto.ValidationResult;
import com.gatediscovery.engine.service.ValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions/{sessionId}/validate")
@RequiredArgsConstructor
@Tag(name = "Validation", description = "Real-time category checks at a gate")
public class ValidationController {

    private final ValidationService validationService;

    @Operation(
            summary = "Validate a category at a gate",
            description = "Answers ALLOW, FLAG_MISMATCH or DENY_OUT_OF_RANGE from the cached gate snapshot. " +
                    "Nothing is stored."
    )
    @PostMapping
    public ResponseEntity<ValidationResult> validate(@PathVariable Long sessionId,
                                                     @Valid @RequestBody ValidationRequest request) {
        return ResponseEntity.ok(validationService.validate(sessionId, request));
    }
}
