package com.pulse.forecast.ml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Horizon;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.deeplearning4j.util.ModelSerializer;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.dataset.api.preprocessor.NormalizerStandardize;
import org.nd4j.linalg.dataset.api.preprocessor.serializer.NormalizerSerializer;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * DL4J LSTM over the window of feature rows: one softmax network per horizon for the direction and
 * one regression network emitting the return of every horizon. Inputs are standardised with an
 * ND4J normaliser fit on the training windows. Batches are fed oldest to newest without
 * shuffling, so every epoch ends on the latest regime.
 */
@Slf4j
public final class LstmSequenceModel implements ForecastModel {

    public static final String FAMILY = "sequence";
    private static final double L2 = 1e-4;

    private final int windowLength;
    private final int featureCount;
    private final NormalizerStandardize normalizer;
    private final Map<Horizon, MultiLayerNetwork> directionNetworks;
    private final MultiLayerNetwork magnitudeNetwork;

    private LstmSequenceModel(int windowLength, int featureCount, NormalizerStandardize normalizer,
                              Map<Horizon, MultiLayerNetwork> directionNetworks, MultiLayerNetwork magnitudeNetwork) {
        this.windowLength = windowLength;
        this.featureCount = featureCount;
        this.normalizer = normalizer;
        this.directionNetworks = directionNetworks;
        this.magnitudeNetwork = magnitudeNetwork;
    }

    @JsonCreator
    public static LstmSequenceModel restore(@JsonProperty("windowLength") int windowLength,
                                            @JsonProperty("featureCount") int featureCount,
                                            @JsonProperty("normalizer") byte[] normalizer,
                                            @JsonProperty("directionNetworks") Map<Horizon, byte[]> directionNetworks,
                                            @JsonProperty("magnitudeNetwork") byte[] magnitudeNetwork) {
        Map<Horizon, MultiLayerNetwork> directions = new EnumMap<>(Horizon.class);
        directionNetworks.forEach((horizon, bytes) -> directions.put(horizon, readNetwork(bytes)));
        return new LstmSequenceModel(windowLength, featureCount, readNormalizer(normalizer),
                directions, readNetwork(magnitudeNetwork));
    }

    public static LstmSequenceModel fit(List<TrainingSample> chronological, Settings settings) {
        int windowLength = chronological.stream().mapToInt(sample -> sample.window().length).max().orElse(1);
        int featureCount = chronological.get(0).features().length;
        List<double[][]> windows = chronological.stream()
                .map(sample -> align(sample.window(), windowLength))
                .toList();
        double[][] returns = chronological.stream()
                .map(TrainingSample::returns)
                .toArray(double[][]::new);

        NormalizerStandardize normalizer = new NormalizerStandardize();
        normalizer.fit(new DataSet(tensor(windows, featureCount, windowLength), Nd4j.create(returns)));

        Map<Horizon, MultiLayerNetwork> directions = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            double[][] oneHot = new double[chronological.size()][Direction.CLASS_COUNT];
            for (int i = 0; i < chronological.size(); i++) {
                oneHot[i][chronological.get(i).direction(horizon)] = 1.0;
            }
            MultiLayerNetwork network = network(featureCount, Direction.CLASS_COUNT, true, settings);
            train(network, batches(windows, oneHot, featureCount, windowLength, normalizer, settings.batchSize()), settings);
            directions.put(horizon, network);
        }
        MultiLayerNetwork magnitude = network(featureCount, Horizon.values().length, false, settings);
        train(magnitude, batches(windows, returns, featureCount, windowLength, normalizer, settings.batchSize()), settings);
        log.debug("Sequence family fitted samples={} window={} features={}", windows.size(), windowLength, featureCount);
        return new LstmSequenceModel(windowLength, featureCount, normalizer, directions, magnitude);
    }

    private static MultiLayerNetwork network(int featureCount, int outputs, boolean classifier, Settings settings) {
        MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                .seed(settings.seed())
                .dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER)
                .updater(new Adam(settings.learningRate()))
                .l2(L2)
                .list()
                .layer(new LastTimeStep(new LSTM.Builder()
                        .nIn(featureCount)
                        .nOut(settings.hiddenUnits())
                        .activation(Activation.TANH)
                        .build()))
                .layer(new OutputLayer.Builder(classifier ? LossFunctions.LossFunction.MCXENT : LossFunctions.LossFunction.MSE)
                        .nIn(settings.hiddenUnits())
                        .nOut(outputs)
                        .activation(classifier ? Activation.SOFTMAX : Activation.IDENTITY)
                        .build())
                .setInputType(InputType.recurrent(featureCount))
                .build();
        MultiLayerNetwork network = new MultiLayerNetwork(conf);
        network.init();
        return network;
    }

    private static void train(MultiLayerNetwork network, List<DataSet> batches, Settings settings) {
        for (int epoch = 0; epoch < settings.epochs(); epoch++) {
            for (DataSet batch : batches) {
                network.fit(batch);
            }
        }
    }

    private static List<DataSet> batches(List<double[][]> windows, double[][] labels, int featureCount,
                                         int windowLength, NormalizerStandardize normalizer, int batchSize) {
        List<DataSet> batches = new ArrayList<>();
        for (int from = 0; from < windows.size(); from += batchSize) {
            int to = Math.min(windows.size(), from + batchSize);
            INDArray features = tensor(windows.subList(from, to), featureCount, windowLength);
            normalizer.transform(features);
            batches.add(new DataSet(features, Nd4j.create(Arrays.copyOfRange(labels, from, to))));
        }
        return batches;
    }

    /**
     * Shapes windows as [batch, features, time], the layout DL4J recurrent layers read.
     */
    private static INDArray tensor(List<double[][]> windows, int featureCount, int windowLength) {
        double[][][] values = new double[windows.size()][featureCount][windowLength];
        for (int i = 0; i < windows.size(); i++) {
            double[][] window = windows.get(i);
            for (int t = 0; t < windowLength; t++) {
                for (int f = 0; f < featureCount; f++) {
                    values[i][f][t] = window[t][f];
                }
            }
        }
        return Nd4j.create(values);
    }

    /**
     * Keeps the newest {@code length} rows, repeating the oldest row in front of short windows.
     */
    static double[][] align(double[][] window, int length) {
        double[][] aligned = new double[length][];
        int offset = length - window.length;
        for (int t = 0; t < length; t++) {
            aligned[t] = window[Math.max(0, t - offset)];
        }
        return aligned;
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public synchronized Map<Horizon, HorizonEstimate> predict(double[][] window) {
        if (window[window.length - 1].length != featureCount) {
            throw new IllegalArgumentException("Expected " + featureCount + " features, got "
                    + window[window.length - 1].length);
        }
        INDArray input = tensor(List.<double[][]>of(align(window, windowLength)), featureCount, windowLength);
        normalizer.transform(input);
        INDArray returns = magnitudeNetwork.output(input);
        Map<Horizon, HorizonEstimate> estimates = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            INDArray output = directionNetworks.get(horizon).output(input);
            double[] probabilities = new double[Direction.CLASS_COUNT];
            for (int k = 0; k < probabilities.length; k++) {
                probabilities[k] = output.getDouble(0, k);
            }
            estimates.put(horizon, new HorizonEstimate(probabilities, returns.getDouble(0, horizon.ordinal())));
        }
        return estimates;
    }

    @JsonProperty
    public int getWindowLength() {
        return windowLength;
    }

    @JsonProperty
    public int getFeatureCount() {
        return featureCount;
    }

    @JsonProperty
    public byte[] getNormalizer() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            NormalizerSerializer.getDefault().write(normalizer, buffer);
        } catch (IOException ex) {
            throw new UncheckedIOException("Normaliser could not be serialised", ex);
        }
        return buffer.toByteArray();
    }

    @JsonProperty
    public Map<Horizon, byte[]> getDirectionNetworks() {
        Map<Horizon, byte[]> bytes = new EnumMap<>(Horizon.class);
        directionNetworks.forEach((horizon, network) -> bytes.put(horizon, writeNetwork(network)));
        return bytes;
    }

    @JsonProperty
    public byte[] getMagnitudeNetwork() {
        return writeNetwork(magnitudeNetwork);
    }

    private static byte[] writeNetwork(MultiLayerNetwork network) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            ModelSerializer.writeModel(network, buffer, false);
        } catch (IOException ex) {
            throw new UncheckedIOException("Network could not be serialised", ex);
        }
        return buffer.toByteArray();
    }

    private static MultiLayerNetwork readNetwork(byte[] bytes) {
        try {
            return ModelSerializer.restoreMultiLayerNetwork(new ByteArrayInputStream(bytes), false);
        } catch (IOException ex) {
            throw new UncheckedIOException("Network could not be read", ex);
        }
    }

    private static NormalizerStandardize readNormalizer(byte[] bytes) {
        try {
            return NormalizerSerializer.getDefault().restore(new ByteArrayInputStream(bytes));
        } catch (Exception ex) {
            throw new IllegalStateException("Normaliser could not be read", ex);
        }
    }

    public record Settings(int epochs, double learningRate, int hiddenUnits, int batchSize, long seed) {}
}
