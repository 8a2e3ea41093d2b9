package com.liveclass.server.http;

import com.liveclass.server.dao.ClassRecordNotFoundException;
import com.liveclass.server.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Start / end actions for a class, keyed by access code (the room id).
 */
@RestController
@RequestMapping("/classes")
public class ClassLifecycleController {
    private static final Logger log = LoggerFactory.getLogger(ClassLifecycleController.class);

    private final SessionCoordinator coordinator;

    public ClassLifecycleController(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/start-class/{accessCode}")
    public ResponseEntity<Map<String, Object>> startClass(@PathVariable String accessCode) {
        try {
            coordinator.startClass(accessCode);
            return ResponseEntity.ok(Map.of("success", true, "message", "Class started successfully"));
        } catch (ClassRecordNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", "Class not found"));
        } catch (RuntimeException e) {
            log.error("[ERROR] start class {} failed", accessCode, e);
            return ResponseEntity.status(500).body(Map.of("error", "Failed to start class"));
        }
    }

    @PostMapping("/end-class/{accessCode}")
    public ResponseEntity<Map<String, Object>> endClass(@PathVariable String accessCode) {
        try {
            coordinator.endClass(accessCode);
            return ResponseEntity.ok(Map.of("success", true, "message", "Class ended successfully"));
        } catch (ClassRecordNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", "Class not found"));
        } catch (RuntimeException e) {
            log.error("[ERROR] end class {} failed", accessCode, e);
            return ResponseEntity.status(500).body(Map.of("error", "Failed to end class"));
        }
    }
}
