package com.pulse.forecast.service.phase;

import com.pulse.forecast.model.PipelinePhase;
import com.pulse.forecast.model.PipelinePhaseState;
import com.pulse.forecast.repository.PipelinePhaseStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One row per cycle date recording the last phase that finished. The evening may only advance a
 * cycle whose morning has completed; a morning rerun never moves a finished evening back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhaseStateService {

    private final PipelinePhaseStateRepository phaseStateRepository;

    @Transactional(readOnly = true)
    public Optional<PipelinePhase> lastCompleted(LocalDate cycleDate) {
        return phaseStateRepository.findByCycleDate(cycleDate).map(PipelinePhaseState::getLastCompletedPhase);
    }

    @Transactional
    public PipelinePhaseState markCompleted(PipelinePhase phase, LocalDate cycleDate, Instant at) {
        Optional<PipelinePhaseState> existing = phaseStateRepository.findByCycleDate(cycleDate);
        if (existing.isEmpty()) {
            if (phase == PipelinePhase.EVENING) {
                throw new IllegalStateException("Evening cannot complete before morning for cycle " + cycleDate);
            }
            PipelinePhaseState created = phaseStateRepository.save(PipelinePhaseState.builder()
                    .cycleDate(cycleDate)
                    .lastCompletedPhase(phase)
                    .phaseTimestamp(at)
                    .build());
            log.info("Phase state advanced cycle={} phase={}", cycleDate, phase);
            return created;
        }
        PipelinePhaseState state = existing.get();
        if (phase == PipelinePhase.MORNING && state.getLastCompletedPhase() == PipelinePhase.EVENING) {
            log.info("Morning rerun after evening leaves phase state unchanged cycle={}", cycleDate);
            return state;
        }
        state.setLastCompletedPhase(phase);
        state.setPhaseTimestamp(at);
        log.info("Phase state advanced cycle={} phase={}", cycleDate, phase);
        return phaseStateRepository.save(state);
    }
}
