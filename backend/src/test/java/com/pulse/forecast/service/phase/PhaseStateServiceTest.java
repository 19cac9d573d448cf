package com.pulse.forecast.service.phase;

import com.pulse.forecast.model.PipelinePhase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(PhaseStateService.class)
class PhaseStateServiceTest {

    private static final LocalDate CYCLE = LocalDate.of(2024, 3, 13);
    private static final Instant MORNING = Instant.parse("2024-03-12T23:00:00Z");
    private static final Instant EVENING = Instant.parse("2024-03-13T07:00:00Z");

    @Autowired
    private PhaseStateService phaseStateService;

    @Test
    void morningThenEveningAdvancesTheCycle() {
        phaseStateService.markCompleted(PipelinePhase.MORNING, CYCLE, MORNING);
        assertThat(phaseStateService.lastCompleted(CYCLE)).contains(PipelinePhase.MORNING);

        phaseStateService.markCompleted(PipelinePhase.EVENING, CYCLE, EVENING);
        assertThat(phaseStateService.lastCompleted(CYCLE)).contains(PipelinePhase.EVENING);
    }

    @Test
    void eveningCannotCompleteFirst() {
        assertThatThrownBy(() -> phaseStateService.markCompleted(PipelinePhase.EVENING, CYCLE, EVENING))
                .isInstanceOf(IllegalStateException.class);
        assertThat(phaseStateService.lastCompleted(CYCLE)).isEmpty();
    }

    @Test
    void morningRerunKeepsFinishedEvening() {
        phaseStateService.markCompleted(PipelinePhase.MORNING, CYCLE, MORNING);
        phaseStateService.markCompleted(PipelinePhase.EVENING, CYCLE, EVENING);

        phaseStateService.markCompleted(PipelinePhase.MORNING, CYCLE, EVENING.plusSeconds(60));

        assertThat(phaseStateService.lastCompleted(CYCLE)).contains(PipelinePhase.EVENING);
    }
}
