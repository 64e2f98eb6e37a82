package org.l3.morpho.cascade;

import org.l3.morpho.cascade.input.ClassDeclaration;
import org.l3.morpho.cascade.input.Grammar;
import org.l3.morpho.cascade.input.GrammarItem;
import org.l3.morpho.cascade.input.LabelPattern;
import org.l3.morpho.cascade.input.LabelSpec;
import org.l3.morpho.cascade.input.PathRule;
import org.l3.morpho.cascade.input.StartDeclaration;
import org.l3.morpho.cascade.input.TransitionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a Transducer from a parsed rule file. Items are processed in source order, so a class is visible from the
 * line after its declaration on. Each label alternative is expanded into concrete transitions, and each alternative
 * of a weight into a parallel transition.
 *
 * Problems are added to a shared error list instead of being thrown, so that one compilation reports all of them.
 */
class TransducerBuilder<W> {

    private static final Logger log = LoggerFactory.getLogger(TransducerBuilder.class);

    private final String source;
    private final Weighting<W> weighting;
    private final SymbolTable symbols;
    private final List<CompileException> errors;

    private final Map<String, Integer> stateIndex = new HashMap<>();
    private final List<String> stateNames = new ArrayList<>();
    private final Set<Integer> finals = new LinkedHashSet<>();
    private final List<Set<Transition<W>>> transitions = new ArrayList<>();
    private Integer explicitStart = null;

    TransducerBuilder(final String source, final Weighting<W> weighting, @Nullable final SymbolTable parent,
                      final List<CompileException> errors) {
        this.source = source;
        this.weighting = weighting;
        this.symbols = new SymbolTable(parent);
        this.errors = errors;
    }

    /**
     * @return the transducer, or null if problems were added to the error list
     */
    @Nullable
    Transducer<W> build(final Grammar grammar) {
        int errorsBefore = errors.size();
        for (GrammarItem item : grammar.getItems()) {
            try {
                if (item instanceof ClassDeclaration) {
                    declareClass((ClassDeclaration) item);
                } else if (item instanceof StartDeclaration) {
                    declareStart((StartDeclaration) item);
                } else if (item instanceof TransitionRule) {
                    addRule((TransitionRule) item);
                } else if (item instanceof PathRule) {
                    addPath((PathRule) item);
                } else {
                    errors.add(new SyntaxException(source, item.getLine(), "Unexpected " +
                            item.getClass().getSimpleName() + " in a rule file"));
                }
            } catch (CompileException e) {
                errors.add(e);
            }
        }
        if (errors.size() > errorsBefore) {
            return null;
        }
        if (finals.isEmpty()) {
            log.warn("Transducer {} has no final state and accepts nothing", source);
        }

        Transducer<W> transducer = new Transducer<>(source, weighting, stateNames, finals, transitions,
                explicitStart == null ? 0 : explicitStart);
        log.debug("Built {} with {} states and {} transitions", source, transducer.getStateCount(),
                transducer.getTransitionCount());
        return transducer;
    }

    private void declareClass(final ClassDeclaration declaration) throws UndefinedClassException {
        if (declaration.isSubtraction()) {
            symbols.defineDifference(source, declaration.getLine(), declaration.getName(), declaration.getBase(),
                    declaration.getMembers());
        } else {
            symbols.define(declaration.getName(), declaration.getMembers());
        }
    }

    private void declareStart(final StartDeclaration declaration) throws MalformedAutomatonException {
        if (explicitStart != null) {
            throw new MalformedAutomatonException(source, declaration.getLine(), "Start state declared twice");
        }
        explicitStart = state(declaration.getState());
    }

    private void addRule(final TransitionRule rule) throws CompileException {
        int from = state(rule.getSource());
        if (rule.isFinalMarker()) {
            finals.add(from);
            return;
        }
        int to = state(rule.getTarget());
        List<W> weights = weights(rule.getLine(), rule.getWeight());
        for (LabelSpec label : rule.getLabels()) {
            for (String[] pair : expand(rule.getLine(), label)) {
                for (W weight : weights) {
                    transitions.get(from).add(new Transition<>(from, to, pair[0], pair[1], weight));
                }
            }
        }
    }

    /**
     * A morphotactic path: a class reads one of its members and writes it back; {@code --} reads nothing; any other
     * string is split into symbols that are read without output, through states of their own.
     */
    private void addPath(final PathRule path) throws CompileException {
        int from = state(path.getSource());
        int to = state(path.getTarget());
        List<W> weights = weights(path.getLine(), path.getWeight());
        if (path.getInherited() != null) {
            List<W> combined = new ArrayList<>();
            for (W inherited : weights(path.getLine(), path.getInherited())) {
                for (W weight : weights) {
                    W both = weighting.combine(inherited, weight);
                    if (both != null) {
                        combined.add(both);
                    }
                }
            }
            if (combined.isEmpty()) {
                log.warn("{}:{}: path {} conflicts with the features above it and is dropped", source,
                        path.getLine(), path.getInput());
            }
            weights = combined;
        }

        if (path.readsNothing()) {
            for (W weight : weights) {
                transitions.get(from).add(new Transition<>(from, to, null, null, weight));
            }
            return;
        }
        StringSet set = symbols.lookup(path.getInput());
        if (set != null) {
            for (String member : set.getMembers()) {
                for (W weight : weights) {
                    transitions.get(from).add(new Transition<>(from, to, member, member, weight));
                }
            }
            return;
        }

        List<String> segments = new Segmenter(symbols.members()).segment(path.getInput());
        int previous = from;
        for (int i = 0; i < segments.size(); i++) {
            int next = i == segments.size() - 1 ? to :
                    state(stateNames.get(from) + " " + path.getLine() + "." + (i + 1));
            if (i == 0) {
                for (W weight : weights) {
                    transitions.get(previous).add(new Transition<>(previous, next, segments.get(i), null, weight));
                }
            } else {
                transitions.get(previous).add(new Transition<>(previous, next, segments.get(i), null,
                        weighting.one()));
            }
            previous = next;
        }
    }

    private List<W> weights(final int line, @Nullable final String text) throws SyntaxException {
        if (text == null) {
            return Collections.singletonList(weighting.one());
        }
        try {
            return weighting.parse(text);
        } catch (IllegalArgumentException e) {
            throw new SyntaxException(source, line, "Bad weight " + text + ": " + e.getMessage(), e);
        }
    }

    /**
     * The (input, output) pairs a label denotes. Null stands for epsilon.
     */
    private List<String[]> expand(final int line, final LabelSpec label) throws MalformedAutomatonException {
        List<String> in = resolve(line, label.getInput());
        List<String> out = label.isIdentity() ? in : resolve(line, label.getOutput());
        boolean inClass = denotesClass(label.getInput());
        boolean outClass = denotesClass(label.getOutput());

        List<String[]> pairs = new ArrayList<>();
        if (label.isIdentity() || (inClass && outClass)) {
            if (in.size() != out.size()) {
                throw new MalformedAutomatonException(source, line, "Cannot map " + label.getInput() + " (" +
                        in.size() + " symbols) onto " + label.getOutput() + " (" + out.size() + " symbols)");
            }
            for (int i = 0; i < in.size(); i++) {
                pairs.add(new String[] {in.get(i), out.get(i)});
            }
        } else {
            // at most one side is a class; the other has exactly one symbol
            for (String i : in) {
                for (String o : out) {
                    pairs.add(new String[] {i, o});
                }
            }
        }
        return pairs;
    }

    private boolean denotesClass(final LabelPattern pattern) {
        return pattern.getKind() == LabelPattern.Kind.DIFFERENCE ||
                pattern.getKind() == LabelPattern.Kind.INTERSECTION ||
                (pattern.getKind() == LabelPattern.Kind.NAME && symbols.isClass(pattern.getName()));
    }

    private List<String> resolve(final int line, final LabelPattern pattern) throws MalformedAutomatonException {
        switch (pattern.getKind()) {
            case EPSILON:
                return Collections.singletonList(null);
            case DIFFERENCE:
                StringSet base = symbols.lookup(pattern.getName());
                if (base == null) {
                    throw new MalformedAutomatonException(source, line, "Cannot subtract from " +
                            pattern.getName() + ", which is not a class");
                }
                List<String> members = new ArrayList<>(base.getMembers());
                members.removeAll(symbols.expand(pattern.getSubtracted()));
                return members;
            case INTERSECTION:
                List<String> common = null;
                for (LabelPattern part : pattern.getParts()) {
                    List<String> these = resolve(line, part);
                    if (common == null) {
                        common = new ArrayList<>(these);
                    } else {
                        common.retainAll(these);
                    }
                }
                if (common == null || common.isEmpty()) {
                    log.warn("{}:{}: {} has no common members", source, line, pattern);
                    return Collections.emptyList();
                }
                return common;
            default:
                StringSet set = symbols.lookup(pattern.getName());
                return set == null ? Collections.singletonList(pattern.getName()) : set.getMembers();
        }
    }

    private int state(final String name) {
        Integer index = stateIndex.get(name);
        if (index == null) {
            index = stateNames.size();
            stateIndex.put(name, index);
            stateNames.add(name);
            transitions.add(new LinkedHashSet<>());
        }
        return index;
    }
}
