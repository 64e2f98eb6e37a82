package org.l3.morpho.cascade;

import org.l3.morpho.cascade.input.ClassDeclaration;
import org.l3.morpho.cascade.input.Grammar;
import org.l3.morpho.cascade.input.GrammarItem;
import org.l3.morpho.cascade.input.GrammarParser;
import org.l3.morpho.cascade.input.StageReference;
import org.l3.morpho.cascade.input.SubcascadeDeclaration;
import org.l3.morpho.cascade.input.WeightingDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles cascade files ({@code .cas}) and the rule files ({@code .fst}) they name into a Cascade.
 *
 * A cascade file lists its stages, one per line as {@code >name<}, and may declare the weighting mode, symbol
 * classes shared by all stages, and named subcascades:
 *
 * <pre>
 *   weighting = UNIFICATION
 *   C = {b, s, t, r}
 *   >mtax<
 *   >phon<
 *   cascade morph = {0}
 * </pre>
 *
 * Compilation reports every problem it finds in one go: the first is thrown and the others are attached to it as
 * suppressed exceptions. There is a "check" variant of each entry point that only reports whether the sources are
 * valid.
 */
public final class CascadeCompiler {

    private static final Logger log = LoggerFactory.getLogger(CascadeCompiler.class);

    private static final String CASCADE_SUFFIX = ".cas";
    private static final String RULE_SUFFIX = ".fst";

    private CascadeCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Verify a cascade file and the rule files next to it.
     *
     * @param casFile the cascade file
     * @return null if the cascade compiles, otherwise an error message
     */
    public static String check(final Path casFile) {
        try {
            compile(casFile);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify a cascade given as text.
     *
     * @param name the cascade name
     * @param casSource the cascade file contents
     * @param fstSources the rule file contents, keyed by stage name
     * @return null if the cascade compiles, otherwise an error message
     */
    public static String check(final String name, final String casSource, final Map<String, String> fstSources) {
        try {
            compile(name, casSource, fstSources);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a cascade file. Each stage {@code >name<} is read from {@code name.fst} in the same directory; the
     * cascade is named after the file.
     *
     * @param casFile the cascade file
     * @return the compiled cascade
     * @throws IOException if a file cannot be read
     * @throws CompileException if the files are not valid
     */
    public static Cascade<?> compile(final Path casFile) throws IOException, CompileException {
        return compile(casFile, Configuration.defaults());
    }

    public static Cascade<?> compile(final Path casFile, final Configuration configuration)
            throws IOException, CompileException {
        String fileName = casFile.getFileName().toString();
        String name = stem(fileName, CASCADE_SUFFIX);
        Grammar grammar = GrammarParser.parseCascade(fileName, read(casFile));

        Path dir = casFile.toAbsolutePath().getParent();
        Map<String, String> fstSources = new HashMap<>();
        for (StageReference stage : grammar.getStages()) {
            Path fst = dir.resolve(stage.getName() + RULE_SUFFIX);
            if (!fstSources.containsKey(stage.getName()) && Files.isRegularFile(fst)) {
                fstSources.put(stage.getName(), read(fst));
            }
        }
        return doCompile(name, grammar, fstSources, configuration);
    }

    /**
     * Compile rule files into a cascade that runs them in the given order, with the default weighting mode. The
     * cascade is named after the first file.
     *
     * @param ruleFiles the rule files, in stage order
     * @return the compiled cascade
     * @throws IOException if a file cannot be read
     * @throws CompileException if the files are not valid
     */
    public static Cascade<?> compile(final List<Path> ruleFiles) throws IOException, CompileException {
        return compile(ruleFiles, Configuration.defaults());
    }

    public static Cascade<?> compile(final List<Path> ruleFiles, final Configuration configuration)
            throws IOException, CompileException {
        if (ruleFiles.isEmpty()) {
            throw new IllegalArgumentException("No rule files to compile");
        }
        StringBuilder casSource = new StringBuilder();
        Map<String, String> fstSources = new HashMap<>();
        for (Path file : ruleFiles) {
            String stage = stem(file.getFileName().toString(), RULE_SUFFIX);
            casSource.append('>').append(stage).append("<\n");
            fstSources.put(stage, read(file));
        }
        String name = stem(ruleFiles.get(0).getFileName().toString(), RULE_SUFFIX);
        return compile(name, casSource.toString(), fstSources, configuration);
    }

    /**
     * Compile a cascade given as text.
     *
     * @param name the cascade name
     * @param casSource the cascade file contents
     * @param fstSources the rule file contents, keyed by stage name
     * @return the compiled cascade
     * @throws CompileException if the sources are not valid
     */
    public static Cascade<?> compile(final String name, final String casSource, final Map<String, String> fstSources)
            throws CompileException {
        return compile(name, casSource, fstSources, Configuration.defaults());
    }

    public static Cascade<?> compile(final String name, final String casSource, final Map<String, String> fstSources,
                                     final Configuration configuration) throws CompileException {
        return doCompile(name, GrammarParser.parseCascade(name + CASCADE_SUFFIX, casSource), fstSources,
                configuration);
    }

    private static Cascade<?> doCompile(final String name, final Grammar grammar,
                                        final Map<String, String> fstSources, final Configuration configuration)
            throws CompileException {
        Weighting<?> weighting = UnificationWeighting.INSTANCE;
        for (GrammarItem item : grammar.getItems()) {
            if (item instanceof WeightingDeclaration) {
                String mode = ((WeightingDeclaration) item).getMode();
                weighting = configuration.getWeighting(mode);
                if (weighting == null) {
                    throw new UnknownWeightModeException(grammar.getSource(), item.getLine(), mode);
                }
            }
        }
        return build(name, grammar, fstSources, configuration, weighting);
    }

    private static <W> Cascade<W> build(final String name, final Grammar grammar,
                                        final Map<String, String> fstSources, final Configuration configuration,
                                        final Weighting<W> weighting) throws CompileException {
        String source = grammar.getSource();
        List<CompileException> errors = new ArrayList<>();
        SymbolTable shared = new SymbolTable();
        List<Transducer<W>> stages = new ArrayList<>();
        List<SubcascadeDeclaration> declarations = new ArrayList<>();
        int stageCount = 0;

        for (GrammarItem item : grammar.getItems()) {
            if (item instanceof ClassDeclaration) {
                ClassDeclaration declaration = (ClassDeclaration) item;
                if (declaration.isSubtraction()) {
                    try {
                        shared.defineDifference(source, declaration.getLine(), declaration.getName(),
                                declaration.getBase(), declaration.getMembers());
                    } catch (UndefinedClassException e) {
                        errors.add(e);
                    }
                } else {
                    shared.define(declaration.getName(), declaration.getMembers());
                }
            } else if (item instanceof StageReference) {
                stageCount++;
                Transducer<W> stage = buildStage((StageReference) item, source, fstSources, weighting, shared,
                        errors);
                if (stage != null) {
                    stages.add(stage);
                }
            } else if (item instanceof SubcascadeDeclaration) {
                declarations.add((SubcascadeDeclaration) item);
            }
        }

        Map<String, List<Integer>> subcascades = new LinkedHashMap<>();
        for (SubcascadeDeclaration declaration : declarations) {
            if (subcascades.containsKey(declaration.getName())) {
                errors.add(new SyntaxException(source, declaration.getLine(), "Cascade " + declaration.getName() +
                        " declared twice"));
                continue;
            }
            for (int index : declaration.getIndices()) {
                if (index < 0 || index >= stageCount) {
                    errors.add(new SyntaxException(source, declaration.getLine(), "Stage index " + index +
                            " out of range in cascade " + declaration.getName() + "; there are " + stageCount +
                            " stages"));
                }
            }
            subcascades.put(declaration.getName(), declaration.getIndices());
        }

        if (!errors.isEmpty()) {
            CompileException first = errors.get(0);
            for (int i = 1; i < errors.size(); i++) {
                first.addSuppressed(errors.get(i));
            }
            log.debug("Compiling {} failed with {} errors", name, errors.size());
            throw first;
        }

        Cascade<W> cascade = new Cascade<>(name, weighting, stages, subcascades, configuration);
        log.info("Compiled cascade {} with {} stages and weighting {}", name, stages.size(), weighting.name());
        return cascade;
    }

    @Nullable
    private static <W> Transducer<W> buildStage(final StageReference reference, final String source,
                                                final Map<String, String> fstSources, final Weighting<W> weighting,
                                                final SymbolTable shared, final List<CompileException> errors) {
        String text = fstSources.get(reference.getName());
        if (text == null) {
            errors.add(new SyntaxException(source, reference.getLine(), "No rule file for stage " +
                    reference.getName()));
            return null;
        }
        String stageSource = reference.getName() + RULE_SUFFIX;
        try {
            Grammar stageGrammar = GrammarParser.parseStage(stageSource, text);
            return new TransducerBuilder<>(stageSource, weighting, shared, errors).build(stageGrammar);
        } catch (SyntaxException e) {
            errors.add(e);
            return null;
        }
    }

    private static String read(final Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private static String stem(final String fileName, final String suffix) {
        return fileName.endsWith(suffix) ? fileName.substring(0, fileName.length() - suffix.length()) : fileName;
    }
}
