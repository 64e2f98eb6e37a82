package org.l3.morpho.cascade.input;

import org.l3.morpho.cascade.SyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of a rule file ({@code .fst}) or a cascade file ({@code .cas}) into a Grammar. Only the shape of
 * each line is checked here; class references, weights and stage names are resolved when the Grammar is built.
 *
 * <pre>
 *   # a rule file
 *   C = {b, s, t, r}
 *   V = C - {r}
 *   -> start
 *   start -> stem [y:] [sb=3]
 *   stem -> stem [C;V]
 *   stem -> end [u:;]
 *   end ->
 * </pre>
 *
 * A rule file may instead be written as morphotactics: a sequence of {@code $} states, each listing the inputs that
 * lead to the next state. The last state leads to a final state named {@code fin}.
 *
 * <pre>
 *   $ start
 *   [tam=imf]
 *       y   [sb=3]
 *   --  [tam=prf]
 *   $ stem
 *   C
 *   -> start
 * </pre>
 *
 * Paths indented under a feature line carry its features too, {@code --} reads nothing, {@code -> state} jumps to
 * another state without input, and a line ending in {@code ;} continues on the next.
 */
public final class GrammarParser {

    private static final Pattern WEIGHTING = Pattern.compile("^weighting\\s*=\\s*(\\S+)$");
    private static final Pattern SUBCASCADE = Pattern.compile("^cascade\\s+(\\S+)\\s*=\\s*\\{(.*)\\}$");
    private static final Pattern STAGE = Pattern.compile("^>(.+?)<$");
    private static final Pattern START = Pattern.compile("^->\\s*(\\S+)$");
    private static final Pattern RULE = Pattern.compile(
            "^([^\\s\\[\\]]+?)\\s*->\\s*([^\\s\\[\\]]+)?\\s*(\\[[^\\]]*\\])?\\s*(\\[.*\\])?$");
    private static final Pattern CLASS = Pattern.compile("^(\\S+)\\s*=\\s*\\{(.*)\\}$");
    private static final Pattern CLASS_DIFF = Pattern.compile("^(\\S+)\\s*=\\s*(\\S+?)\\s*-\\s*(\\{(.*)\\}|\\S+)$");

    // morphotactics; matched against lines that keep their indentation
    private static final Pattern TRAILING_SPACE = Pattern.compile("\\s+$");
    private static final Pattern MTAX_STATE = Pattern.compile("\\s*\\$\\s+(\\S+)");
    private static final Pattern MTAX_FEATURES = Pattern.compile("(\\s*)(\\[.+?\\])");
    private static final Pattern MTAX_SHORTCUT = Pattern.compile("\\s*->\\s*([^\\s\\[\\]]+)\\s*(\\[.*\\])?");
    private static final Pattern MTAX_PATH = Pattern.compile("(\\s*?)(\\S+)\\s+(\\[.*?\\])");
    private static final Pattern MTAX_PATH_BARE = Pattern.compile("(\\s*?)(\\S+)");

    static final String FINAL_STATE = "fin";

    private final String source;
    private final Grammar.Kind kind;
    private final List<GrammarItem> items = new ArrayList<>();
    private int lineNumber;

    private GrammarParser(final String source, final Grammar.Kind kind) {
        this.source = source;
        this.kind = kind;
    }

    /**
     * Parse the text of a rule file.
     *
     * @param source name used in error messages
     * @param text the file contents
     * @return the items of the file in order
     * @throws SyntaxException if a line is malformed, a cascade directive appears, or the file has no rules
     */
    public static Grammar parseTransducer(final String source, final String text) throws SyntaxException {
        GrammarParser parser = new GrammarParser(source, Grammar.Kind.TRANSDUCER);
        parser.parse(text);
        boolean hasRule = false;
        for (GrammarItem item : parser.items) {
            if (item instanceof TransitionRule) {
                hasRule = true;
                break;
            }
        }
        if (!hasRule) {
            throw new SyntaxException(source, 0, "No transition rules");
        }
        return new Grammar(source, Grammar.Kind.TRANSDUCER, parser.items);
    }

    /**
     * Parse a stage's rule file, written either as rules or as morphotactics. A file with any {@code $ state} line is
     * read as morphotactics.
     */
    public static Grammar parseStage(final String source, final String text) throws SyntaxException {
        for (String line : text.split("\r?\n", -1)) {
            if (MTAX_STATE.matcher(stripComment(line).trim()).matches()) {
                return parseMorphotactics(source, text);
            }
        }
        return parseTransducer(source, text);
    }

    /**
     * Parse the text of a morphotactic rule file.
     *
     * @param source name used in error messages
     * @param text the file contents
     * @return the items in file order, the first state declared as start, then the final state
     * @throws SyntaxException if a line is malformed, a path comes before the first state, or there are no states
     */
    public static Grammar parseMorphotactics(final String source, final String text) throws SyntaxException {
        GrammarParser parser = new GrammarParser(source, Grammar.Kind.MORPHOTACTICS);
        parser.parseStates(text);
        return new Grammar(source, Grammar.Kind.MORPHOTACTICS, parser.items);
    }

    /**
     * Parse the text of a cascade file.
     *
     * @param source name used in error messages
     * @param text the file contents
     * @return the items of the file in order
     * @throws SyntaxException if a line is malformed, a transition rule appears, or the file names no stages
     */
    public static Grammar parseCascade(final String source, final String text) throws SyntaxException {
        GrammarParser parser = new GrammarParser(source, Grammar.Kind.CASCADE);
        parser.parse(text);
        boolean hasStage = false;
        for (GrammarItem item : parser.items) {
            if (item instanceof StageReference) {
                hasStage = true;
                break;
            }
        }
        if (!hasStage) {
            throw new SyntaxException(source, 0, "No stages");
        }
        return new Grammar(source, Grammar.Kind.CASCADE, parser.items);
    }

    private void parse(final String text) throws SyntaxException {
        String[] lines = text.split("\r?\n", -1);
        boolean weightingSeen = false;
        for (int i = 0; i < lines.length; i++) {
            lineNumber = i + 1;
            String line = stripComment(lines[i]).trim();
            if (line.isEmpty()) {
                continue;
            }

            Matcher m = WEIGHTING.matcher(line);
            if (m.matches()) {
                cascadeOnly("weighting");
                if (weightingSeen) {
                    throw barf("Weighting declared more than once");
                }
                weightingSeen = true;
                items.add(new WeightingDeclaration(lineNumber, m.group(1)));
                continue;
            }
            m = SUBCASCADE.matcher(line);
            if (m.matches()) {
                cascadeOnly("cascade");
                items.add(new SubcascadeDeclaration(lineNumber, m.group(1), parseIndices(m.group(2))));
                continue;
            }
            m = STAGE.matcher(line);
            if (m.matches()) {
                cascadeOnly("stage");
                String name = m.group(1).trim();
                if (name.isEmpty()) {
                    throw barf("Empty stage name");
                }
                items.add(new StageReference(lineNumber, name));
                continue;
            }
            m = START.matcher(line);
            if (m.matches()) {
                transducerOnly("start state");
                items.add(new StartDeclaration(lineNumber, m.group(1)));
                continue;
            }
            m = RULE.matcher(line);
            if (m.matches()) {
                transducerOnly("transition rule");
                items.add(parseRule(m));
                continue;
            }
            m = CLASS.matcher(line);
            if (m.matches()) {
                items.add(new ClassDeclaration(lineNumber, m.group(1), null, splitMembers(m.group(2))));
                continue;
            }
            m = CLASS_DIFF.matcher(line);
            if (m.matches()) {
                items.add(classDifference(m));
                continue;
            }
            throw barf("Unrecognized line: " + line);
        }
    }

    private void parseStates(final String text) throws SyntaxException {
        // join continued lines, remembering where each joined line started
        List<String> lines = new ArrayList<>();
        List<Integer> numbers = new ArrayList<>();
        String[] raw = text.split("\r?\n", -1);
        StringBuilder pending = new StringBuilder();
        int pendingStart = 0;
        for (int i = 0; i < raw.length; i++) {
            String line = TRAILING_SPACE.matcher(stripComment(raw[i])).replaceFirst("");
            if (line.trim().isEmpty()) {
                continue;
            }
            if (line.endsWith(";")) {
                if (pending.length() == 0) {
                    pendingStart = i + 1;
                }
                pending.append(line);
                continue;
            }
            if (pending.length() > 0) {
                lines.add(pending.append(line).toString());
                numbers.add(pendingStart);
                pending.setLength(0);
            } else {
                lines.add(line);
                numbers.add(i + 1);
            }
        }
        if (pending.length() > 0) {
            lineNumber = pendingStart;
            throw barf("Line continues past the end of the file");
        }

        List<String> states = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = MTAX_STATE.matcher(lines.get(i));
            if (m.matches()) {
                lineNumber = numbers.get(i);
                String name = m.group(1);
                if (name.equals(FINAL_STATE)) {
                    throw barf("State " + FINAL_STATE + " is reserved for the final state");
                }
                if (states.contains(name)) {
                    throw barf("State " + name + " declared twice");
                }
                states.add(name);
            }
        }
        if (states.isEmpty()) {
            throw new SyntaxException(source, 0, "No states");
        }
        states.add(FINAL_STATE);

        int current = -1;
        String features = null;
        int indent = 0;
        for (int i = 0; i < lines.size(); i++) {
            lineNumber = numbers.get(i);
            String line = lines.get(i);
            if (MTAX_STATE.matcher(line).matches()) {
                if (current < 0) {
                    items.add(new StartDeclaration(lineNumber, states.get(0)));
                }
                current++;
                features = null;
                indent = 0;
                continue;
            }
            String trimmed = line.trim();
            Matcher m = MTAX_FEATURES.matcher(line);
            boolean featureLine = m.matches();
            if (!featureLine) {
                m = CLASS.matcher(trimmed);
                if (m.matches()) {
                    items.add(new ClassDeclaration(lineNumber, m.group(1), null, splitMembers(m.group(2))));
                    continue;
                }
                m = CLASS_DIFF.matcher(trimmed);
                if (m.matches()) {
                    items.add(classDifference(m));
                    continue;
                }
            }
            if (current < 0) {
                throw barf("Expected a $ state before " + trimmed);
            }
            String from = states.get(current);
            if (featureLine) {
                features = m.group(2);
                indent = m.group(1).length();
                continue;
            }
            m = MTAX_SHORTCUT.matcher(line);
            if (m.matches()) {
                if (!states.contains(m.group(1))) {
                    throw barf("Shortcut to unknown state " + m.group(1));
                }
                List<LabelSpec> none = new ArrayList<>();
                none.add(LabelSpec.identity(LabelPattern.EPSILON));
                items.add(new TransitionRule(lineNumber, from, m.group(1), none, m.group(2)));
                continue;
            }
            m = MTAX_PATH.matcher(line);
            if (!m.matches()) {
                m = MTAX_PATH_BARE.matcher(line);
            }
            if (m.matches()) {
                String weight = m.groupCount() > 2 ? m.group(3) : null;
                String inherited = m.group(1).length() > indent ? features : null;
                items.add(new PathRule(lineNumber, from, states.get(current + 1), m.group(2), weight, inherited));
                continue;
            }
            throw barf("Unrecognized line: " + trimmed);
        }
        items.add(new TransitionRule(lineNumber, FINAL_STATE, null, new ArrayList<>(), null));
    }

    private ClassDeclaration classDifference(final Matcher m) {
        List<String> removed;
        if (m.group(4) != null) {
            removed = splitMembers(m.group(4));
        } else {
            removed = new ArrayList<>();
            removed.add(m.group(3));
        }
        return new ClassDeclaration(lineNumber, m.group(1), m.group(2), removed);
    }

    private TransitionRule parseRule(final Matcher m) throws SyntaxException {
        String from = m.group(1);
        String to = m.group(2);
        String labels = m.group(3);
        String weight = m.group(4);
        if (to == null) {
            if (labels != null || weight != null) {
                throw barf("Labels without a target state");
            }
            return new TransitionRule(lineNumber, from, null, new ArrayList<>(), null);
        }
        List<LabelSpec> specs = new ArrayList<>();
        if (labels == null || labels.substring(1, labels.length() - 1).trim().isEmpty()) {
            specs.add(LabelSpec.identity(LabelPattern.EPSILON));
        } else {
            String inner = labels.substring(1, labels.length() - 1);
            for (String alternative : inner.split(";", -1)) {
                specs.add(parseLabel(alternative.trim()));
            }
        }
        String weightText = weight == null ? null : weight.trim();
        return new TransitionRule(lineNumber, from, to, specs, weightText);
    }

    private LabelSpec parseLabel(final String label) throws SyntaxException {
        if (label.isEmpty()) {
            return LabelSpec.identity(LabelPattern.EPSILON);
        }
        int colon = label.indexOf(':');
        if (colon < 0) {
            return LabelSpec.identity(parsePattern(label));
        }
        if (label.indexOf(':', colon + 1) >= 0) {
            throw barf("Label " + label + " has more than one ':'");
        }
        return LabelSpec.pair(parsePattern(label.substring(0, colon).trim()),
                parsePattern(label.substring(colon + 1).trim()));
    }

    private LabelPattern parsePattern(final String side) throws SyntaxException {
        if (side.isEmpty()) {
            return LabelPattern.EPSILON;
        }
        int amp = side.indexOf('&');
        if (amp <= 0 || side.lastIndexOf('&') == side.length() - 1) {
            return parseOperand(side);
        }
        List<LabelPattern> parts = new ArrayList<>();
        for (String part : side.split("&", -1)) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                throw barf("Empty class in " + side);
            }
            parts.add(parseOperand(trimmed));
        }
        return LabelPattern.intersection(parts);
    }

    private LabelPattern parseOperand(final String side) throws SyntaxException {
        int dash = side.indexOf('-');
        if (dash <= 0 || dash == side.length() - 1) {
            return LabelPattern.name(side);
        }
        List<String> removed = new ArrayList<>();
        for (String symbol : side.substring(dash + 1).split(",", -1)) {
            String trimmed = symbol.trim();
            if (trimmed.isEmpty()) {
                throw barf("Empty symbol in " + side);
            }
            removed.add(trimmed);
        }
        return LabelPattern.difference(side.substring(0, dash).trim(), removed);
    }

    private List<Integer> parseIndices(final String text) throws SyntaxException {
        List<Integer> indices = new ArrayList<>();
        for (String member : splitMembers(text)) {
            try {
                indices.add(Integer.parseInt(member));
            } catch (NumberFormatException e) {
                throw new SyntaxException(source, lineNumber, "Stage index " + member + " is not a number", e);
            }
        }
        if (indices.isEmpty()) {
            throw barf("Cascade selects no stages");
        }
        return indices;
    }

    private static List<String> splitMembers(final String text) {
        List<String> members = new ArrayList<>();
        for (String member : text.split(",")) {
            String trimmed = member.trim();
            if (!trimmed.isEmpty()) {
                members.add(trimmed);
            }
        }
        return members;
    }

    private static String stripComment(final String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private void cascadeOnly(final String what) throws SyntaxException {
        if (kind != Grammar.Kind.CASCADE) {
            throw barf("A " + what + " directive is only allowed in a cascade file");
        }
    }

    private void transducerOnly(final String what) throws SyntaxException {
        if (kind != Grammar.Kind.TRANSDUCER) {
            throw barf("A " + what + " is only allowed in a rule file");
        }
    }

    private SyntaxException barf(final String reason) {
        return new SyntaxException(source, lineNumber, reason);
    }
}
