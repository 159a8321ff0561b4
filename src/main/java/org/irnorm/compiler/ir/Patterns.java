package org.irnorm.compiler.ir;

import org.irnorm.compiler.ir.IrPattern.AliasPat;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.PinPat;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Static helpers for reading and rewriting patterns.
 */
public final class Patterns {

    private Patterns() {}

    /**
     * Visits every pattern node, pre-order.
     * @param pattern The root pattern.
     * @param visitor The visitor.
     */
    public static void forEach(IrPattern pattern, Consumer<IrPattern> visitor) {
        if (pattern == null) {
            return;
        }
        visitor.accept(pattern);
        for (IrPattern sub : pattern.subPatterns()) {
            forEach(sub, visitor);
        }
    }

    /**
     * Rewrites a pattern bottom-up, copying only along changed spines.
     * @param pattern The root pattern.
     * @param rewriter Returns its argument when it has nothing to do.
     * @return The rewritten pattern.
     */
    public static IrPattern rewrite(IrPattern pattern, UnaryOperator<IrPattern> rewriter) {
        List<IrPattern> subs = pattern.subPatterns();
        IrPattern rebuilt = pattern;
        if (!subs.isEmpty()) {
            List<IrPattern> newSubs = new ArrayList<>(subs.size());
            boolean changed = false;
            for (IrPattern sub : subs) {
                IrPattern newSub = rewrite(sub, rewriter);
                changed |= newSub != sub;
                newSubs.add(newSub);
            }
            if (changed) {
                rebuilt = pattern.withSubPatterns(newSubs);
            }
        }
        return rewriter.apply(rebuilt);
    }

    /**
     * Renames binders (plain and alias) through {@code renamer}; pins are left alone.
     * @param pattern The pattern.
     * @param renamer Maps a binder name to its new name, or returns it unchanged.
     * @return The rewritten pattern.
     */
    public static IrPattern mapBinders(IrPattern pattern, UnaryOperator<String> renamer) {
        return rewrite(pattern, p -> {
            if (p instanceof BindPat bind) {
                String renamed = renamer.apply(bind.name());
                return renamed.equals(bind.name()) ? p : new BindPat(renamed);
            }
            if (p instanceof AliasPat alias) {
                String renamed = renamer.apply(alias.name());
                return renamed.equals(alias.name()) ? p : new AliasPat(alias.pattern(), renamed);
            }
            return p;
        });
    }

    /**
     * Renames binders called {@code from}.
     * @param pattern The pattern.
     * @param from The old binder name.
     * @param to The new binder name.
     * @return The rewritten pattern.
     */
    public static IrPattern renameBinder(IrPattern pattern, String from, String to) {
        return mapBinders(pattern, name -> name.equals(from) ? to : name);
    }

    /**
     * Renames pinned reads of {@code from}.
     * @param pattern The pattern.
     * @param from The old name.
     * @param to The new name.
     * @return The rewritten pattern.
     */
    public static IrPattern renamePins(IrPattern pattern, String from, String to) {
        return rewrite(pattern, p -> p instanceof PinPat pin && pin.name().equals(from) ? new PinPat(to) : p);
    }

    /**
     * Applies {@code renamer} to pinned names.
     * @param pattern The pattern.
     * @param renamer Maps a pinned name to its new name.
     * @return The rewritten pattern.
     */
    public static IrPattern mapPins(IrPattern pattern, UnaryOperator<String> renamer) {
        return rewrite(pattern, p -> {
            if (p instanceof PinPat pin) {
                String renamed = renamer.apply(pin.name());
                return renamed.equals(pin.name()) ? p : new PinPat(renamed);
            }
            return p;
        });
    }

    /**
     * Lists binder names in left-to-right order, duplicates kept, the {@code _} wildcard included.
     * @param pattern The pattern.
     * @return The binder names.
     */
    public static List<String> binderOccurrences(IrPattern pattern) {
        List<String> out = new ArrayList<>();
        forEach(pattern, p -> {
            if (p instanceof BindPat bind) {
                out.add(bind.name());
            } else if (p instanceof AliasPat alias) {
                out.add(alias.name());
            }
        });
        return out;
    }

    /**
     * @param name A binder name.
     * @return The name with a leading underscore; unchanged if it already has one.
     */
    public static String underscore(String name) {
        return name.startsWith("_") ? name : "_" + name;
    }

    /**
     * @param pattern A pattern.
     * @return {@code true} if the pattern is a single plain binder.
     */
    public static boolean isSimpleBinder(IrPattern pattern) {
        return pattern instanceof BindPat;
    }

    /**
     * Rewrites the patterns a node carries itself (match, clause heads, parameters, generators).
     * @param node The node.
     * @param rewriter The pattern rewrite.
     * @return The node with rewritten patterns; the same instance if none changed.
     */
    public static IrNode mapNodePatterns(IrNode node, UnaryOperator<IrPattern> rewriter) {
        if (node instanceof Match match) {
            IrPattern p = rewriter.apply(match.pattern());
            return p.equals(match.pattern()) ? match : match.withPattern(p);
        }
        if (node instanceof CaseClause clause) {
            IrPattern p = rewriter.apply(clause.pattern());
            return p.equals(clause.pattern()) ? clause : clause.withPatternAndBody(p, clause.guard(), clause.body());
        }
        if (node instanceof WithClause clause) {
            IrPattern p = rewriter.apply(clause.pattern());
            return p.equals(clause.pattern()) ? clause : clause.withPattern(p);
        }
        if (node instanceof ForGenerator generator) {
            IrPattern p = rewriter.apply(generator.pattern());
            return p.equals(generator.pattern()) ? generator : generator.withPattern(p);
        }
        if (node instanceof FnClause clause) {
            List<IrPattern> params = clause.params().stream().map(rewriter).toList();
            return params.equals(clause.params()) ? clause : clause.withParamsAndBody(params, clause.guard(), clause.body());
        }
        if (node instanceof Def def) {
            List<IrPattern> params = def.params().stream().map(rewriter).toList();
            return params.equals(def.params()) ? def : def.withParamsAndBody(params, def.guard(), def.body());
        }
        return node;
    }
}
