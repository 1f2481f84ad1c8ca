package com.retailops.controller;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final String serviceName;

    public HealthController(@Value("${spring.application.name:retailops-gateway}") String serviceName) {
        this.serviceName = serviceName;
    }

    @Operation(summary = "Liveness probe")
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", serviceName);
    }
}
