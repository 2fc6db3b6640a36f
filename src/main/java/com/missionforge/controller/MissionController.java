package com.missionforge.controller;

import com.missionforge.core.schema.SchemaCatalog;
import com.missionforge.orchestrator.VerificationOrchestrator;
import com.missionforge.orchestrator.dto.MissionResult;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/missions")
public class MissionController {

    private final VerificationOrchestrator orchestrator;
    private final SchemaCatalog            schemaCatalog;

    public MissionController(VerificationOrchestrator orchestrator, SchemaCatalog schemaCatalog) {
        this.orchestrator  = orchestrator;
        this.schemaCatalog = schemaCatalog;
    }

    @PostMapping("/verify")
    public ResponseEntity<MissionResult> verify(
            @RequestBody Map<String, String> request
    ) {

        String text = request.get("text");

        if (text == null || text.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        MissionResult result = orchestrator.verify(text.trim());

        return ResponseEntity.ok(result);
    }

    @GetMapping("/schemas")
    public ResponseEntity<List<String>> schemas() {
        return ResponseEntity.ok(schemaCatalog.getSchemaNames());
    }
}
