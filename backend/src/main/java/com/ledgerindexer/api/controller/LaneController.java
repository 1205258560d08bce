package com.ledgerindexer.api.controller;

import com.ledgerindexer.api.dto.LaneStatusResponse;
import com.ledgerindexer.ingestion.pipeline.PipelineSupervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lane admin: GET /api/v1/lanes lists lanes, POST /api/v1/lanes/{name}/restart restarts an unhealthy lane.
 */
@RestController
@RequestMapping("/api/v1/lanes")
@RequiredArgsConstructor
public class LaneController {

    private final PipelineSupervisor pipelineSupervisor;

    @GetMapping
    public List<LaneStatusResponse> lanes() {
        return pipelineSupervisor.snapshots().stream().map(LaneStatusResponse::from).toList();
    }

    @GetMapping("/{name}")
    public LaneStatusResponse lane(@PathVariable String name) {
        return LaneStatusResponse.from(pipelineSupervisor.snapshot(name));
    }

    @PostMapping("/{name}/restart")
    public ResponseEntity<LaneStatusResponse> restart(@PathVariable String name) {
        return ResponseEntity.accepted().body(LaneStatusResponse.from(pipelineSupervisor.restart(name)));
    }
}
