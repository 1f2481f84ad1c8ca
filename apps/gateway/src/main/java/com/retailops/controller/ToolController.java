package com.retailops.controller;

import com.retailops.api.dto.ToolCallRequest;
import com.retailops.api.dto.ToolResult;
import com.retailops.config.GatewayProperties;
import com.retailops.ledger.LedgerEntry;
import com.retailops.service.ToolCallService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolController {

    private final ToolCallService toolCalls;
    private final GatewayProperties props;

    @Operation(summary = "Call a tool; writes return a preview until confirmed with its token")
    @PostMapping(value = "/call", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ToolResult>> call(@RequestBody ToolCallRequest body, ServerHttpRequest request) {
        String headerRole = request.getHeaders().getFirst(props.getRoleHeader());
        log.debug("[HTTP][POST]/tools/call tool={} headerRole={}", body.name(), headerRole);
        return toolCalls.call(body, headerRole)
                .map(result -> ResponseEntity.status(statusOf(result)).body(result));
    }

    @Operation(summary = "List tools with classification, allowed roles and parameter schema")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, Object>> catalog() {
        return toolCalls.catalog();
    }

    @Operation(summary = "Look up an idempotency ledger entry")
    @GetMapping(value = "/ledger/{key}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<LedgerEntry>> ledger(@PathVariable String key) {
        return toolCalls.ledgerEntry(key)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    static HttpStatus statusOf(ToolResult result) {
        return result.isError() && result.errorKind() != null ? result.errorKind().httpStatus() : HttpStatus.OK;
    }
}
