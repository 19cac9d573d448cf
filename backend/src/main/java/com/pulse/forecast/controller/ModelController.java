package com.pulse.forecast.controller;

import com.pulse.forecast.dto.ModelVersionView;
import com.pulse.forecast.exception.NotFoundException;
import com.pulse.forecast.service.backtest.ModelPerformanceTracker;
import com.pulse.forecast.service.backtest.PerformanceReport;
import com.pulse.forecast.service.prediction.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistry modelRegistry;
    private final ModelPerformanceTracker modelPerformanceTracker;

    @GetMapping
    public List<ModelVersionView> list() {
        return modelRegistry.list().stream().map(ModelVersionView::from).toList();
    }

    @GetMapping("/active")
    public ModelVersionView active() {
        return modelRegistry.active()
                .map(active -> ModelVersionView.from(active.version()))
                .orElseThrow(() -> new NotFoundException("No active model version"));
    }

    /**
     * Re-scores a stored version on the rows recorded after its training cutoff. The stored row is not touched.
     */
    @PostMapping("/{versionId}/evaluate")
    public PerformanceReport evaluate(@PathVariable String versionId) {
        return modelPerformanceTracker.evaluate(versionId);
    }
}
