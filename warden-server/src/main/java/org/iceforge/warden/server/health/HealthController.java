package org.iceforge.warden.server.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Plain health endpoint for load balancers that do not speak the actuator format. */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final WardenHealthIndicator indicator;

    public HealthController(WardenHealthIndicator indicator) {
        this.indicator = Objects.requireNonNull(indicator);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health h = indicator.health();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", h.getStatus().getCode());
        out.putAll(h.getDetails());
        out.remove("error");
        HttpStatus code = Status.UP.equals(h.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(out);
    }
}
