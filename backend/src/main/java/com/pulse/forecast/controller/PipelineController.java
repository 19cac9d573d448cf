package com.pulse.forecast.controller;

import com.pulse.forecast.dto.PhaseSummary;
import com.pulse.forecast.service.phase.EveningPhaseRunner;
import com.pulse.forecast.service.phase.MorningPhaseRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final MorningPhaseRunner morningPhaseRunner;
    private final EveningPhaseRunner eveningPhaseRunner;

    @PostMapping("/morning")
    public ResponseEntity<PhaseSummary> morning(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        return respond(morningPhaseRunner.run(asOf != null ? asOf : Instant.now()));
    }

    @PostMapping("/evening")
    public ResponseEntity<PhaseSummary> evening(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        return respond(eveningPhaseRunner.run(asOf != null ? asOf : Instant.now()));
    }

    private ResponseEntity<PhaseSummary> respond(PhaseSummary summary) {
        HttpStatus status = switch (summary.getExitCode()) {
            case PhaseSummary.EXIT_OK -> HttpStatus.OK;
            case PhaseSummary.EXIT_BLOCKED -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(summary);
    }
}
