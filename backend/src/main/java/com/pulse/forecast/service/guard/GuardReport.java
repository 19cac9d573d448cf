package com.pulse.forecast.service.guard;

import com.pulse.forecast.model.PipelinePhase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public record GuardReport(PipelinePhase phase, Instant checkedAt, List<String> checksRun, List<Violation> violations) {

    public GuardReport {
        checksRun = List.copyOf(checksRun);
        violations = List.copyOf(violations);
    }

    public static GuardReport of(PipelinePhase phase, Instant checkedAt, List<Violation> violations) {
        return new GuardReport(phase, checkedAt,
                violations.stream().map(v -> v.check().checkName()).distinct().toList(), violations);
    }

    public boolean passed() {
        return violations.isEmpty();
    }

    public int passedCount() {
        return (int) checksRun.stream()
                .filter(name -> violations.stream().noneMatch(v -> v.check().checkName().equals(name)))
                .count();
    }

    public int failedCount() {
        return checksRun.size() - passedCount();
    }

    public GuardReport merge(GuardReport other) {
        List<String> checks = new ArrayList<>(checksRun);
        other.checksRun.stream().filter(name -> !checks.contains(name)).forEach(checks::add);
        List<Violation> merged = new ArrayList<>(violations);
        merged.addAll(other.violations);
        return new GuardReport(phase, checkedAt, checks, merged);
    }

    public String describe() {
        if (violations.isEmpty()) {
            return "no violations";
        }
        return violations.stream()
                .map(v -> v.check().checkName() + "(" + v.affectedRows() + "): " + v.detail())
                .collect(Collectors.joining("; "));
    }

    public record Violation(GuardCheck check, long affectedRows, String detail) {}
}
