package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The output and weight of a path from some Step to acceptance.
 */
@Immutable
final class Suffix<W> {
    final List<String> symbols;
    final W weight;

    Suffix(final List<String> symbols, final W weight) {
        this.symbols = symbols;
        this.weight = weight;
    }

    /**
     * @return this suffix behind the given outputs, carrying the combined weight
     */
    Suffix<W> prepend(final List<String> outputs, final W combined) {
        if (outputs.isEmpty()) {
            return new Suffix<>(symbols, combined);
        }
        List<String> longer = new ArrayList<>(outputs.size() + symbols.size());
        longer.addAll(outputs);
        longer.addAll(symbols);
        return new Suffix<>(Collections.unmodifiableList(longer), combined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Suffix<?> suffix = (Suffix<?>) o;
        return symbols.equals(suffix.symbols) && weight.equals(suffix.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, weight);
    }
}
