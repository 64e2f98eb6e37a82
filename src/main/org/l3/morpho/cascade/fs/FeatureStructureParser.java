package org.l3.morpho.cascade.fs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the text form of feature structures as written in rule files and requests.
 *
 * <pre>
 *   [+def,-pl,num=sg,poss=[p=1,n=2]]
 * </pre>
 *
 * Disjunctions are expanded into alternatives: {@code num=sg|pl} yields two structures, {@code +-def} yields
 * {@code [+def]} and {@code [-def]}, and several structures separated by {@code ;} are a union of alternatives.
 * {@code []} is the empty structure.
 */
public final class FeatureStructureParser {

    private static final String RESERVED = "[]=,;|+-";

    private final String text;
    private int pos;

    private FeatureStructureParser(final String text) {
        this.text = text;
    }

    /**
     * Parse text that may denote several alternative structures.
     *
     * @param text the structures as text
     * @return the alternatives in order of appearance, without duplicates; never empty
     * @throws FeatureStructureParseException if the text is malformed
     */
    public static List<FeatureStructure> parseAlternatives(final String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new FeatureStructureParseException("Empty feature structure");
        }
        FeatureStructureParser parser = new FeatureStructureParser(text);
        Set<FeatureStructure> result = new LinkedHashSet<>();
        while (true) {
            parser.skipSpace();
            result.addAll(parser.parseStructure());
            parser.skipSpace();
            if (parser.atEnd()) {
                break;
            }
            parser.expect(';');
        }
        return Collections.unmodifiableList(new ArrayList<>(result));
    }

    private List<FeatureStructure> parseStructure() {
        expect('[');
        List<List<Binding>> features = new ArrayList<>();
        skipSpace();
        if (peek() == ']') {
            pos++;
            return Collections.singletonList(FeatureStructure.EMPTY);
        }
        while (true) {
            skipSpace();
            features.add(parseFeature());
            skipSpace();
            if (peek() == ']') {
                pos++;
                break;
            }
            expect(',');
        }

        // cross product of the alternatives of each feature
        List<List<Binding>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>());
        for (List<Binding> options : features) {
            List<List<Binding>> extended = new ArrayList<>();
            for (List<Binding> combination : combinations) {
                for (Binding option : options) {
                    List<Binding> copy = new ArrayList<>(combination);
                    copy.add(option);
                    extended.add(copy);
                }
            }
            combinations = extended;
        }

        List<FeatureStructure> result = new ArrayList<>(combinations.size());
        for (List<Binding> combination : combinations) {
            FeatureStructure.Builder builder = FeatureStructure.builder();
            for (Binding binding : combination) {
                if (builder.has(binding.name)) {
                    throw error("Duplicate feature " + binding.name, binding.position);
                }
                builder.put(binding.name, binding.value);
            }
            result.add(builder.build());
        }
        return result;
    }

    private List<Binding> parseFeature() {
        int start = pos;
        if (text.startsWith("+-", pos)) {
            pos += 2;
            String name = parseName();
            List<Binding> both = new ArrayList<>(2);
            both.add(new Binding(name, FlagValue.PLUS, start));
            both.add(new Binding(name, FlagValue.MINUS, start));
            return both;
        }
        if (peek() == '+' || peek() == '-') {
            FlagValue flag = FlagValue.of(peek() == '+');
            pos++;
            return Collections.singletonList(new Binding(parseName(), flag, start));
        }

        String name = parseName();
        skipSpace();
        expect('=');
        List<Binding> options = new ArrayList<>();
        while (true) {
            skipSpace();
            if (peek() == '[') {
                for (FeatureStructure nested : parseStructure()) {
                    options.add(new Binding(name, nested, start));
                }
            } else {
                options.add(new Binding(name, parseAtom(), start));
            }
            skipSpace();
            if (peek() != '|') {
                return options;
            }
            pos++;
        }
    }

    private FeatureValue parseAtom() {
        String atom = parseName();
        // values written as True/False are flags
        if ("True".equals(atom)) {
            return FlagValue.PLUS;
        }
        if ("False".equals(atom)) {
            return FlagValue.MINUS;
        }
        return AtomValue.of(atom);
    }

    private String parseName() {
        int start = pos;
        while (!atEnd()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || RESERVED.indexOf(c) >= 0) {
                break;
            }
            pos++;
        }
        if (start == pos) {
            throw error("Expected a name", pos);
        }
        return text.substring(start, pos);
    }

    private void expect(final char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'", pos);
        }
        pos++;
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private void skipSpace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private FeatureStructureParseException error(final String message, final int position) {
        return new FeatureStructureParseException(message + " at pos " + position + " in " + text);
    }

    private static final class Binding {
        final String name;
        final FeatureValue value;
        final int position;

        Binding(final String name, final FeatureValue value, final int position) {
            this.name = name;
            this.value = value;
            this.position = position;
        }
    }
}
