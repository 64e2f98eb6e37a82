package org.l3.morpho.cascade.input;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parsed form of one rule or cascade file: its items in source order.
 */
@Immutable
public final class Grammar {

    public enum Kind {
        TRANSDUCER,  // .fst
        MORPHOTACTICS,  // .fst made of $ state blocks
        CASCADE,     // .cas
    }

    private final String source;
    private final Kind kind;
    private final List<GrammarItem> items;

    Grammar(final String source, final Kind kind, final List<GrammarItem> items) {
        this.source = source;
        this.kind = kind;
        this.items = Collections.unmodifiableList(items);
    }

    public String getSource() {
        return source;
    }

    public Kind getKind() {
        return kind;
    }

    public List<GrammarItem> getItems() {
        return items;
    }

    public List<TransitionRule> getRules() {
        return itemsOf(TransitionRule.class);
    }

    public List<StageReference> getStages() {
        return itemsOf(StageReference.class);
    }

    public List<ClassDeclaration> getClassDeclarations() {
        return itemsOf(ClassDeclaration.class);
    }

    private <T extends GrammarItem> List<T> itemsOf(final Class<T> type) {
        List<T> result = new ArrayList<>();
        for (GrammarItem item : items) {
            if (type.isInstance(item)) {
                result.add(type.cast(item));
            }
        }
        return result;
    }
}
