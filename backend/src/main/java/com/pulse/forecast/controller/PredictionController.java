package com.pulse.forecast.controller;

import com.pulse.forecast.dto.PredictionView;
import com.pulse.forecast.exception.NotFoundException;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.service.feature.MarketCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionRepository predictionRepository;
    private final MarketCalendar marketCalendar;

    @GetMapping
    public List<PredictionView> byDate(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate cycleDate = date != null ? date : marketCalendar.cycleDate(Instant.now());
        return predictionRepository.findByPredictionDateOrderBySymbolAsc(cycleDate).stream()
                .map(PredictionView::from)
                .toList();
    }

    @GetMapping("/{symbol}/latest")
    public PredictionView latest(@PathVariable String symbol) {
        return predictionRepository.findTopBySymbolOrderByPredictionDateDesc(symbol)
                .map(PredictionView::from)
                .orElseThrow(() -> new NotFoundException("No prediction for " + symbol));
    }
}
