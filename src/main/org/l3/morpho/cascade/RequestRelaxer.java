package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generation that guesses when a request is over-specified: if nothing can be generated, top-level features are
 * dropped from the request one at a time and generation is retried after each drop.
 *
 * Features are dropped in the order given to the constructor; features not named there are dropped afterwards in
 * reverse alphabetical order.
 */
@ThreadSafe
public final class RequestRelaxer {

    private static final Logger log = LoggerFactory.getLogger(RequestRelaxer.class);

    private final Cascade<FeatureStructure> cascade;
    private final List<String> dropOrder;

    public RequestRelaxer(final Cascade<FeatureStructure> cascade) {
        this(cascade, Collections.emptyList());
    }

    public RequestRelaxer(final Cascade<FeatureStructure> cascade, final List<String> dropOrder) {
        this.cascade = cascade;
        this.dropOrder = Collections.unmodifiableList(new ArrayList<>(dropOrder));
    }

    public Outcome generate(final String root, final FeatureStructure request) {
        return generate(root, request, Cascade.ALL);
    }

    /**
     * Generate forms of root for the request, relaxing the request until something is generated.
     *
     * @return the forms and the request that produced them, or an empty outcome
     */
    public Outcome generate(final String root, final FeatureStructure request, final int nbest) {
        FeatureStructure current = request;
        List<String> forms = cascade.generate(root, current, nbest);
        if (!forms.isEmpty()) {
            return new Outcome(forms, current, false);
        }
        for (String feature : dropSequence(request)) {
            current = current.without(feature);
            forms = cascade.generate(root, current, nbest);
            if (!forms.isEmpty()) {
                log.info("Generated {} by relaxing {} to {}", root, request, current);
                return new Outcome(forms, current, true);
            }
        }
        log.debug("Nothing generated for {} {} even when relaxed", root, request);
        return Outcome.EMPTY;
    }

    List<String> dropSequence(final FeatureStructure request) {
        List<String> sequence = new ArrayList<>();
        for (String feature : dropOrder) {
            if (request.contains(feature) && !sequence.contains(feature)) {
                sequence.add(feature);
            }
        }
        List<String> rest = new ArrayList<>(request.names());
        rest.removeAll(sequence);
        rest.sort(Collections.reverseOrder());
        sequence.addAll(rest);
        return sequence;
    }

    /**
     * The result of a relaxed generation.
     */
    @Immutable
    public static final class Outcome {

        static final Outcome EMPTY = new Outcome(Collections.emptyList(), null, false);

        private final List<String> forms;
        private final FeatureStructure request;
        private final boolean relaxed;

        Outcome(final List<String> forms, @Nullable final FeatureStructure request, final boolean relaxed) {
            this.forms = Collections.unmodifiableList(forms);
            this.request = request;
            this.relaxed = relaxed;
        }

        public List<String> getForms() {
            return forms;
        }

        /**
         * The request the forms were generated for, or null if nothing was generated.
         */
        @Nullable
        public FeatureStructure getRequest() {
            return request;
        }

        /**
         * True if features had to be dropped from the original request.
         */
        public boolean isRelaxed() {
            return relaxed;
        }

        public boolean isEmpty() {
            return forms.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Outcome outcome = (Outcome) o;
            return relaxed == outcome.relaxed && forms.equals(outcome.forms) &&
                    Objects.equals(request, outcome.request);
        }

        @Override
        public int hashCode() {
            return Objects.hash(forms, request, relaxed);
        }

        @Override
        public String toString() {
            return forms + (request == null ? "" : " for " + request) + (relaxed ? " (relaxed)" : "");
        }
    }
}
