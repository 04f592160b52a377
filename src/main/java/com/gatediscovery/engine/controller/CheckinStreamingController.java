package com.gatediscovery.engine.controller;

import com.gatediscovery.engine.dto.CategoryAlert;
import com.gatediscovery.engine.dto.CheckinDecision;
import com.gatediscovery.engine.dto.CheckinReceipt;
import com.gatediscovery.engine.dto.CheckinRequest;
import com.gatediscovery.engine.dto.CheckinStreamMessage;
import com.gatediscovery.engine.dto.ValidationDecision;
import com.gatediscovery.engine.dto.ValidationRequest;
import com.gatediscovery.engine.dto.ValidationResult;
import com.gatediscovery.engine.dto.ValidationStreamMessage;
import com.gatediscovery.engine.entity.CheckinOutcome;
import com.gatediscovery.engine.exception.BusinessException;
import com.gatediscovery.engine.exception.ErrorCode;
import com.gatediscovery.engine.exception.ErrorResponse;
import com.gatediscovery.engine.service.CheckinIngestionService;
import com.gatediscovery.engine.service.ValidationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.Map;

/**
 * STOMP entry point for scanners that keep a connection open.
 *
 * Message Flow:
 * 1. Scanner sends a check-in to /app/checkin
 * 2. If the scanner names its gate, the scan is validated first; an out-of-range
 *    denial is stored with outcome DENIED
 * 3. The check-in is stored
 * 4. Flagged or denied scans are broadcast to /topic/alerts
 * 5. The sender gets the receipt and decision on /user/queue/decisions
 *
 * Errors go back to the sender on /user/queue/errors.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class CheckinStreamingController {

    static final String ALERTS_TOPIC = "/topic/alerts";

    private final CheckinIngestionService ingestionService;
    private final ValidationService validationService;
    private final SimpMessagingTemplate messagingTemplate;

    @MessageMapping("/checkin")
    @SendToUser("/queue/decisions")
    public CheckinDecision handleCheckin(@Payload @Valid CheckinStreamMessage message) {
        Long sessionId = message.sessionId();
        CheckinRequest checkin = message.checkin();
        log.debug("Streamed check-in for session {}: {}", sessionId, checkin.toLogString());

        ValidationResult validation = null;
        if (checkin.gateId() != null) {
            validation = validationService.validate(sessionId, ValidationRequest.of(checkin.gateId(), checkin));
            if (validation.decision() == ValidationDecision.DENY_OUT_OF_RANGE) {
                checkin = checkin.withOutcome(CheckinOutcome.DENIED);
            }
        }

        CheckinReceipt receipt = ingestionService.ingest(sessionId, checkin);
        if (validation != null && validation.requiresAttention() && !receipt.duplicate()) {
            publishAlert(sessionId, checkin, validation);
        }
        return new CheckinDecision(receipt, validation);
    }

    @MessageMapping("/validate")
    @SendToUser("/queue/decisions")
    public ValidationResult handleValidate(@Payload @Valid ValidationStreamMessage message) {
        return validationService.validate(message.sessionId(), message.validation());
    }

    /**
     * Liveness check: client sends ping, server answers pong.
     */
    @MessageMapping("/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handlePing(Principal principal) {
        log.debug("Ping received from {}", principal != null ? principal.getName() : "anonymous");
        return Map.of(
                "type", "PONG",
                "serverTime", Instant.now().toString(),
                "status", "OK"
        );
    }

    @MessageExceptionHandler(BusinessException.class)
    @SendToUser("/queue/errors")
    public ErrorResponse handleBusinessException(BusinessException e) {
        log.warn("Streamed message rejected: {} - {}", e.getErrorCode().getCode(), e.getMessage());
        return ErrorResponse.of(e.getErrorCode(), e.getMessage());
    }

    @MessageExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    @SendToUser("/queue/errors")
    public ErrorResponse handleInvalidMessage(Exception e) {
        log.warn("Invalid streamed message: {}", e.getMessage());
        return ErrorResponse.of(ErrorCode.INVALID_INPUT, e.getMessage());
    }

    @MessageExceptionHandler(Exception.class)
    @SendToUser("/queue/errors")
    public ErrorResponse handleUnexpected(Exception e) {
        log.error("Error processing streamed message", e);
        return ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private void publishAlert(Long sessionId, CheckinRequest checkin, ValidationResult validation) {
        CategoryAlert alert = new CategoryAlert(
            sessionId,
            validation.gateId(),
            checkin.wristbandId(),
            checkin.category(),
            validation.decision(),
            validation.reason(),
            Instant.now()
        );
        log.info("Category alert at gate {}: {} for {} ({})", validation.gateId(), validation.decision(),
            checkin.category(), validation.reason());
        messagingTemplate.convertAndSend(ALERTS_TOPIC, alert);
    }
}
