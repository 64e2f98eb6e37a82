package org.l3.morpho.cascade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.l3.morpho.cascade.fs.FeatureStructure;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One analysis of a word: the root produced by the cascade, its grammatical features, and its ranking score.
 */
@Immutable
public final class AnalysisResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String cascade;
    private final List<String> symbols;
    private final String pos;
    private final FeatureStructure features;
    private final double score;

    AnalysisResult(final String cascade, final List<String> symbols, final FeatureStructure features,
                   final double score) {
        this.cascade = cascade;
        this.symbols = Collections.unmodifiableList(symbols);
        String tagged = features.getAtom("pos");
        this.pos = tagged == null ? cascade : tagged;
        this.features = features;
        this.score = score;
    }

    static <W> AnalysisResult of(final Cascade<W> cascade, final Candidate<W> candidate) {
        return new AnalysisResult(cascade.getName(), candidate.getSymbols(),
                cascade.getWeighting().features(candidate.getWeight()), candidate.getScore());
    }

    /**
     * The name of the cascade that produced this analysis.
     */
    public String getCascade() {
        return cascade;
    }

    public String getRoot() {
        return String.join("", symbols);
    }

    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * The {@code pos} feature if the analysis has one, otherwise the cascade name.
     */
    public String getPos() {
        return pos;
    }

    /**
     * Always null; citation forms are produced by language-specific code outside the cascade.
     */
    @Nullable
    public String getCitation() {
        return null;
    }

    public FeatureStructure getFeatures() {
        return features;
    }

    public List<String> getAttributes() {
        return features.attributes();
    }

    public double getScore() {
        return score;
    }

    public String toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("root", getRoot());
        node.put("pos", pos);
        node.putNull("citation");
        node.put("features", features.toString());
        ArrayNode attributes = node.putArray("attributes");
        for (String attribute : getAttributes()) {
            attributes.add(attribute);
        }
        node.put("score", score);
        node.put("cascade", cascade);
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render analysis of " + getRoot(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AnalysisResult that = (AnalysisResult) o;
        return Double.compare(that.score, score) == 0 &&
                cascade.equals(that.cascade) &&
                symbols.equals(that.symbols) &&
                features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cascade, symbols, features, score);
    }

    @Override
    public String toString() {
        return getRoot() + " " + pos + " " + features + (score == 0 ? "" : " " + score);
    }
}
