package com.metadata.adapter.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public liveness check. Does not touch the database.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "Service liveness")
public class HealthController {

    private static final HealthResponse OK = new HealthResponse("ok");

    @GetMapping({"/health", "/health/"})
    @Operation(summary = "Health check", description = "Returns {\"status\": \"ok\"} while the service is up")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(OK);
    }

    public record HealthResponse(String status) {}
}
