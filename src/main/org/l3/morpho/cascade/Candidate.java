package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A complete output of a cascade with its accumulated weight. Equality ignores the score, which is only assigned
 * when ranking.
 *
 * @param <W> the weight type
 */
@Immutable
public final class Candidate<W> {

    private final List<String> symbols;
    private final W weight;
    private final double score;

    Candidate(final List<String> symbols, final W weight) {
        this(symbols, weight, 0);
    }

    private Candidate(final List<String> symbols, final W weight, final double score) {
        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        this.weight = weight;
        this.score = score;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * The symbols joined into one string.
     */
    public String form() {
        return String.join("", symbols);
    }

    public W getWeight() {
        return weight;
    }

    public double getScore() {
        return score;
    }

    Candidate<W> withScore(final double newScore) {
        return new Candidate<>(symbols, weight, newScore);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Candidate<?> that = (Candidate<?>) o;
        return symbols.equals(that.symbols) && weight.equals(that.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, weight);
    }

    @Override
    public String toString() {
        return form() + " " + weight;
    }
}
