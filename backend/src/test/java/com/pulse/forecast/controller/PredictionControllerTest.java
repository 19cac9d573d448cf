package com.pulse.forecast.controller;

import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.FeatureRecord;
import com.pulse.forecast.model.TradingAction;
import com.pulse.forecast.repository.FeatureRecordRepository;
import com.pulse.forecast.repository.ModelVersionRepository;
import com.pulse.forecast.repository.OutcomeRepository;
import com.pulse.forecast.repository.PredictionRepository;
import com.pulse.forecast.util.TestFeatureFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PredictionControllerTest {

    private static final Instant MORNING = Instant.parse("2024-03-12T23:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FeatureRecordRepository featureRecordRepository;

    @Autowired
    private PredictionRepository predictionRepository;

    @Autowired
    private OutcomeRepository outcomeRepository;

    @Autowired
    private ModelVersionRepository modelVersionRepository;

    @BeforeEach
    void seed() {
        predictionRepository.deleteAll();
        outcomeRepository.deleteAll();
        featureRecordRepository.deleteAll();
        modelVersionRepository.deleteAll();
        FeatureRecord feature = featureRecordRepository.save(TestFeatureFactory.feature("CBA.AX", MORNING));
        predictionRepository.save(TestFeatureFactory.prediction(feature, TradingAction.BUY, Direction.UP));
    }

    @Test
    void listsPredictionsForACycleDate() throws Exception {
        mockMvc.perform(get("/api/predictions").param("date", "2024-03-13"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].symbol").value("CBA.AX"))
                .andExpect(jsonPath("$[0].optimalAction").value("BUY"))
                .andExpect(jsonPath("$[0].horizons['1d'].direction").value("UP"));
    }

    @Test
    void latestPredictionIsReturnedPerSymbol() throws Exception {
        mockMvc.perform(get("/api/predictions/CBA.AX/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.predictionDate").value("2024-03-13"));
    }

    @Test
    void unknownSymbolIsNotFound() throws Exception {
        mockMvc.perform(get("/api/predictions/XYZ.AX/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void noActiveModelIsNotFound() throws Exception {
        mockMvc.perform(get("/api/models/active"))
                .andExpect(status().isNotFound());
    }
}
