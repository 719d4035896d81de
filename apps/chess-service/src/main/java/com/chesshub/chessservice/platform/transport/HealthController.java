package com.chesshub.chessservice.platform.transport;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 存活探针
 */
@RestController
public class HealthController {

    private final String serviceName;

    public HealthController(@Value("${chess.service-name:chess-hub}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", serviceName);
    }
}
