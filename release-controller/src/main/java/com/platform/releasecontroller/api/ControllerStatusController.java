package com.platform.releasecontroller.api;

import com.platform.releasecontroller.controller.ControllerStatus;
import com.platform.releasecontroller.controller.ReleaseController;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Controller state for operators and readiness probes.
 */
@RestController
@RequestMapping("/api/controller")
public class ControllerStatusController {
    
    private final ReleaseController controller;
    
    public ControllerStatusController(ReleaseController controller) {
        this.controller = controller;
    }
    
    @GetMapping("/status")
    public ControllerStatus getStatus() {
        return controller.getStatus();
    }
    
    /**
     * 200 once workers are running, 503 otherwise.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> getReady() {
        ControllerStatus status = controller.getStatus();
        Map<String, Object> body = Map.of(
            "ready", status.isReady(),
            "phase", status.phase()
        );
        if (status.isReady()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
