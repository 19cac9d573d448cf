package com.pulse.forecast.ml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulse.forecast.model.Direction;
import com.pulse.forecast.model.Horizon;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.Output;
import org.tribuo.Prediction;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.classification.dtree.CARTClassificationTrainer;
import org.tribuo.classification.dtree.impurity.GiniIndex;
import org.tribuo.classification.ensemble.FullyWeightedVotingCombiner;
import org.tribuo.common.tree.RandomForestTrainer;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.ensemble.AveragingCombiner;
import org.tribuo.regression.rtree.CARTRegressionTrainer;
import org.tribuo.regression.rtree.impurity.MeanSquaredError;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Tribuo random forests on the newest row of the window: a CART classification forest for the
 * direction and a CART regression forest for the return, one pair per horizon. The forests are
 * stored as gzipped Java-serialised Tribuo models.
 */
public final class RandomForestModel implements ForecastModel {

    public static final String FAMILY = "tree-ensemble";
    private static final String RETURN_DIMENSION = "return_pct";
    private static final float FEATURE_FRACTION = 0.6f;

    private final List<String> featureNames;
    private final String[] names;
    private final Map<Horizon, Model<Label>> directionForests;
    private final Map<Horizon, Model<Regressor>> magnitudeForests;

    private RandomForestModel(List<String> featureNames, Map<Horizon, Model<Label>> directionForests,
                              Map<Horizon, Model<Regressor>> magnitudeForests) {
        this.featureNames = List.copyOf(featureNames);
        this.names = featureNames.toArray(String[]::new);
        this.directionForests = directionForests;
        this.magnitudeForests = magnitudeForests;
    }

    @JsonCreator
    public static RandomForestModel restore(@JsonProperty("featureNames") List<String> featureNames,
                                            @JsonProperty("directionForests") Map<Horizon, byte[]> directionForests,
                                            @JsonProperty("magnitudeForests") Map<Horizon, byte[]> magnitudeForests) {
        Map<Horizon, Model<Label>> directions = new EnumMap<>(Horizon.class);
        Map<Horizon, Model<Regressor>> magnitudes = new EnumMap<>(Horizon.class);
        directionForests.forEach((horizon, bytes) -> directions.put(horizon, read(bytes)));
        magnitudeForests.forEach((horizon, bytes) -> magnitudes.put(horizon, read(bytes)));
        return new RandomForestModel(featureNames, directions, magnitudes);
    }

    public static RandomForestModel fit(List<TrainingSample> samples, List<String> featureNames, Settings settings) {
        String[] names = featureNames.toArray(String[]::new);
        Map<Horizon, Model<Label>> directions = new EnumMap<>(Horizon.class);
        Map<Horizon, Model<Regressor>> magnitudes = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            LabelFactory labelFactory = new LabelFactory();
            MutableDataset<Label> labelled = new MutableDataset<>(
                    new SimpleDataSourceProvenance("direction-" + horizon.label(), labelFactory), labelFactory);
            RegressionFactory regressionFactory = new RegressionFactory();
            MutableDataset<Regressor> returns = new MutableDataset<>(
                    new SimpleDataSourceProvenance("return-" + horizon.label(), regressionFactory), regressionFactory);
            for (TrainingSample sample : samples) {
                double[] row = sample.features();
                Label label = new Label(Direction.fromIndex(sample.direction(horizon)).name());
                labelled.add(new ArrayExample<>(label, names, row));
                returns.add(new ArrayExample<>(new Regressor(RETURN_DIMENSION, sample.returnPct(horizon)), names, row));
            }
            directions.put(horizon, directionTrainer(settings).train(labelled));
            magnitudes.put(horizon, magnitudeTrainer(settings).train(returns));
        }
        return new RandomForestModel(featureNames, directions, magnitudes);
    }

    private static RandomForestTrainer<Label> directionTrainer(Settings settings) {
        CARTClassificationTrainer tree = new CARTClassificationTrainer(settings.maxDepth(),
                settings.minSamplesLeaf(), 0.0f, FEATURE_FRACTION, new GiniIndex(), settings.seed());
        return new RandomForestTrainer<>(tree, new FullyWeightedVotingCombiner(), settings.trees(), settings.seed());
    }

    private static RandomForestTrainer<Regressor> magnitudeTrainer(Settings settings) {
        CARTRegressionTrainer tree = new CARTRegressionTrainer(settings.maxDepth(),
                settings.minSamplesLeaf(), 0.0f, FEATURE_FRACTION, new MeanSquaredError(), settings.seed());
        return new RandomForestTrainer<>(tree, new AveragingCombiner(), settings.trees(), settings.seed());
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public Map<Horizon, HorizonEstimate> predict(double[][] window) {
        double[] row = window[window.length - 1];
        if (row.length != names.length) {
            throw new IllegalArgumentException("Expected " + names.length + " features, got " + row.length);
        }
        Map<Horizon, HorizonEstimate> estimates = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            Prediction<Label> direction = directionForests.get(horizon)
                    .predict(new ArrayExample<>(LabelFactory.UNKNOWN_LABEL, names, row));
            Prediction<Regressor> magnitude = magnitudeForests.get(horizon)
                    .predict(new ArrayExample<>(RegressionFactory.UNKNOWN_REGRESSOR, names, row));
            estimates.put(horizon, new HorizonEstimate(probabilities(direction), magnitude.getOutput().getValues()[0]));
        }
        return estimates;
    }

    private static double[] probabilities(Prediction<Label> prediction) {
        double[] probabilities = new double[Direction.CLASS_COUNT];
        double total = 0.0;
        for (Map.Entry<String, Label> score : prediction.getOutputScores().entrySet()) {
            double value = Math.max(0.0, score.getValue().getScore());
            probabilities[Direction.valueOf(score.getKey()).index()] = value;
            total += value;
        }
        if (total <= 0.0) {
            probabilities[Direction.valueOf(prediction.getOutput().getLabel()).index()] = 1.0;
            return probabilities;
        }
        for (int k = 0; k < probabilities.length; k++) {
            probabilities[k] /= total;
        }
        return probabilities;
    }

    @JsonProperty
    public List<String> getFeatureNames() {
        return featureNames;
    }

    @JsonProperty
    public Map<Horizon, byte[]> getDirectionForests() {
        Map<Horizon, byte[]> bytes = new EnumMap<>(Horizon.class);
        directionForests.forEach((horizon, model) -> bytes.put(horizon, write(model)));
        return bytes;
    }

    @JsonProperty
    public Map<Horizon, byte[]> getMagnitudeForests() {
        Map<Horizon, byte[]> bytes = new EnumMap<>(Horizon.class);
        magnitudeForests.forEach((horizon, model) -> bytes.put(horizon, write(model)));
        return bytes;
    }

    private static byte[] write(Model<?> model) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(new GZIPOutputStream(buffer))) {
            out.writeObject(model);
        } catch (IOException ex) {
            throw new UncheckedIOException("Forest could not be serialised", ex);
        }
        return buffer.toByteArray();
    }

    @SuppressWarnings("unchecked")
    private static <T extends Output<T>> Model<T> read(byte[] bytes) {
        try (ObjectInputStream in = new ObjectInputStream(new GZIPInputStream(new ByteArrayInputStream(bytes)))) {
            return (Model<T>) in.readObject();
        } catch (IOException ex) {
            throw new UncheckedIOException("Forest could not be read", ex);
        } catch (ClassNotFoundException ex) {
            throw new IllegalStateException("Forest payload references an unknown class", ex);
        }
    }

    public record Settings(int trees, int maxDepth, int minSamplesLeaf, long seed) {}
}
