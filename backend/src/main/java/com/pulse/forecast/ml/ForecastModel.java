package com.pulse.forecast.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pulse.forecast.model.Horizon;

import java.util.Map;

/**
 * A model family that scores a window of raw feature rows for every horizon. The ensemble only
 * talks to families through this interface.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RandomForestModel.class, name = RandomForestModel.FAMILY),
        @JsonSubTypes.Type(value = LstmSequenceModel.class, name = LstmSequenceModel.FAMILY)
})
public interface ForecastModel {

    String family();

    /**
     * @param window feature rows of one symbol, oldest first; the last row is the one forecast
     */
    Map<Horizon, HorizonEstimate> predict(double[][] window);
}
