package org.l3.morpho.cascade;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.l3.morpho.cascade.fs.FeatureStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Frequencies read from JSON:
 *
 * <pre>
 *   {
 *     "roots":    { "sbr": 120, "lbs": 35 },
 *     "features": { "+def": 0.2, "num=pl": 0.4 }
 *   }
 * </pre>
 *
 * Feature keys are flattened attributes as printed by {@link FeatureStructure#attributes()}; the feature frequency of
 * a structure is the product of the entries for its attributes.
 */
@Immutable
public final class JsonFrequencyTable implements FrequencySource {

    private static final Logger log = LoggerFactory.getLogger(JsonFrequencyTable.class);

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final Map<String, Double> roots;
    private final Map<String, Double> features;

    public JsonFrequencyTable(final Map<String, Double> roots, final Map<String, Double> features) {
        this.roots = Collections.unmodifiableMap(new HashMap<>(roots));
        this.features = Collections.unmodifiableMap(new HashMap<>(features));
    }

    public static JsonFrequencyTable load(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonFrequencyTable table = parse(JSON_FACTORY.createParser(reader));
            log.info("Loaded {} root and {} feature frequencies from {}", table.roots.size(), table.features.size(),
                    path);
            return table;
        }
    }

    public static JsonFrequencyTable parse(final String json) throws IOException {
        return parse(JSON_FACTORY.createParser(json));
    }

    private static JsonFrequencyTable parse(final JsonParser parser) throws IOException {
        Map<String, Double> roots = new HashMap<>();
        Map<String, Double> features = new HashMap<>();
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Frequency table must be a JSON object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String section = parser.getCurrentName();
            parser.nextToken();
            if ("roots".equals(section)) {
                readCounts(parser, roots);
            } else if ("features".equals(section)) {
                readCounts(parser, features);
            } else {
                barf(parser, "Unknown section \"" + section + "\"");
            }
        }
        return new JsonFrequencyTable(roots, features);
    }

    private static void readCounts(final JsonParser parser, final Map<String, Double> into) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            barf(parser, "Section \"" + parser.getCurrentName() + "\" must be a JSON object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String key = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if (value != JsonToken.VALUE_NUMBER_INT && value != JsonToken.VALUE_NUMBER_FLOAT) {
                barf(parser, "Frequency of \"" + key + "\" must be a number");
            }
            double frequency = parser.getDoubleValue();
            if (frequency < 0) {
                barf(parser, "Frequency of \"" + key + "\" is negative");
            }
            into.put(key, frequency);
        }
    }

    private static void barf(final JsonParser parser, final String msg) throws JsonParseException {
        throw new JsonParseException(parser, msg, parser.getCurrentLocation());
    }

    @Override
    public double rootFrequency(final String root, final FeatureStructure features) {
        Double count = roots.get(root);
        return count == null ? 0 : count;
    }

    @Override
    public double featureFrequency(final FeatureStructure structure) {
        double product = 1;
        for (String attribute : structure.attributes()) {
            Double frequency = features.get(attribute);
            if (frequency != null) {
                product *= frequency;
            }
        }
        return product;
    }
}
