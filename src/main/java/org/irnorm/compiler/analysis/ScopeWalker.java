package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.MapPat;
import org.irnorm.compiler.ir.IrPattern.MapPatEntry;
import org.irnorm.compiler.ir.IrPattern.PinPat;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Answers binding questions about IR subtrees: which names a pattern binds, which names a subtree
 * declares or reads, and which reads escape it.
 * <p>
 * Scoping follows the target language: a block threads its bindings to later statements (nested
 * bare blocks included), while branches, clauses and function bodies keep theirs. Instances count
 * node visits for instrumentation and are otherwise stateless.
 */
public class ScopeWalker {

    private long visits;

    /**
     * @return The number of nodes visited by {@link #freeNames} calls on this instance.
     */
    public long visits() {
        return visits;
    }

    /**
     * Collects all names a pattern binds: plain and alias binders, underscore-prefixed ones
     * included. Pins and the {@code _} wildcard bind nothing.
     * @param pattern The pattern; {@code null} binds nothing.
     * @return The bound names in left-to-right order.
     */
    public Set<String> boundNames(IrPattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        for (String name : Patterns.binderOccurrences(pattern)) {
            if (!"_".equals(name)) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * @param patterns Several patterns, e.g. function parameters.
     * @return The union of their bound names.
     */
    public Set<String> boundNames(Collection<? extends IrPattern> patterns) {
        Set<String> names = new LinkedHashSet<>();
        for (IrPattern pattern : patterns) {
            names.addAll(boundNames(pattern));
        }
        return names;
    }

    /**
     * Collects names bound anywhere inside the node: match patterns, clause heads, generators,
     * function and definition parameters.
     * @param node The subtree.
     * @return The declared names.
     */
    public Set<String> declaredInSubtree(IrNode node) {
        Set<String> names = new LinkedHashSet<>();
        Consumer<IrNode> collect = n -> patternsOf(n).forEach(p -> names.addAll(boundNames(p)));
        new TreeWalker(patternHandlers(collect)).walk(node);
        return names;
    }

    /**
     * Collects every variable read inside the node regardless of scope: variables, pinned names,
     * names used in map-pattern keys and identifiers in raw text.
     * @param node The subtree.
     * @return The referenced names in order of first occurrence.
     */
    public Set<String> referencedNames(IrNode node) {
        Set<String> names = new LinkedHashSet<>();
        collectReferences(node, names);
        return names;
    }

    /**
     * @param nodes Several subtrees.
     * @return The union of their referenced names.
     */
    public Set<String> referencedNames(List<? extends IrNode> nodes) {
        Set<String> names = new LinkedHashSet<>();
        for (IrNode node : nodes) {
            collectReferences(node, names);
        }
        return names;
    }

    /**
     * Collects reads that are not bound within the node itself.
     * @param node The subtree.
     * @return The free names in order of first occurrence.
     */
    public Set<String> freeNames(IrNode node) {
        Set<String> out = new LinkedHashSet<>();
        collectFree(node, Set.of(), out);
        return out;
    }

    /**
     * Names a block statement binds for the statements after it. A match binds its pattern
     * (and whatever its value binds at block level); a nested bare block binds what its statements
     * bind; everything else binds nothing outside itself.
     * @param statement The statement.
     * @return The names.
     */
    public Set<String> statementBindings(IrNode statement) {
        if (statement instanceof Match match) {
            Set<String> names = boundNames(match.pattern());
            names.addAll(statementBindings(match.value()));
            return names;
        }
        if (statement instanceof Block block) {
            Set<String> names = new LinkedHashSet<>();
            for (IrNode inner : block.statements()) {
                names.addAll(statementBindings(inner));
            }
            return names;
        }
        return new LinkedHashSet<>();
    }

    /**
     * @param node A node.
     * @return The patterns the node itself carries (not those of its children).
     */
    public static List<IrPattern> patternsOf(IrNode node) {
        if (node instanceof Match match) {
            return List.of(match.pattern());
        }
        if (node instanceof CaseClause clause) {
            return List.of(clause.pattern());
        }
        if (node instanceof FnClause clause) {
            return clause.params();
        }
        if (node instanceof Def def) {
            return def.params();
        }
        if (node instanceof WithClause clause) {
            return List.of(clause.pattern());
        }
        if (node instanceof ForGenerator generator) {
            return List.of(generator.pattern());
        }
        return List.of();
    }

    private void collectReferences(IrNode node, Set<String> names) {
        Map<Class<? extends IrNode>, Consumer<IrNode>> handlers =
                new HashMap<>(patternHandlers(n -> patternsOf(n).forEach(p -> collectPatternReads(p, Set.of(), names))));
        handlers.put(Var.class, n -> names.add(((Var) n).name()));
        handlers.put(Opaque.class, n -> names.addAll(IdentifierScanner.identifiers(((Opaque) n).text())));
        new TreeWalker(handlers).walk(node);
    }

    private static Map<Class<? extends IrNode>, Consumer<IrNode>> patternHandlers(Consumer<IrNode> handler) {
        Map<Class<? extends IrNode>, Consumer<IrNode>> handlers = new HashMap<>();
        handlers.put(Match.class, handler);
        handlers.put(CaseClause.class, handler);
        handlers.put(FnClause.class, handler);
        handlers.put(Def.class, handler);
        handlers.put(WithClause.class, handler);
        handlers.put(ForGenerator.class, handler);
        return handlers;
    }

    private void collectPatternReads(IrPattern pattern, Set<String> bound, Set<String> out) {
        Patterns.forEach(pattern, p -> {
            if (p instanceof PinPat pin) {
                if (!bound.contains(pin.name())) {
                    out.add(pin.name());
                }
            } else if (p instanceof MapPat map) {
                for (MapPatEntry entry : map.entries()) {
                    collectFree(entry.key(), bound, out);
                }
            }
        });
    }

    private void collectFree(IrNode node, Set<String> bound, Set<String> out) {
        if (node == null) {
            return;
        }
        visits++;
        if (node instanceof Var v) {
            if (!bound.contains(v.name())) {
                out.add(v.name());
            }
        } else if (node instanceof Opaque opaque) {
            for (String name : IdentifierScanner.identifiers(opaque.text())) {
                if (!bound.contains(name)) {
                    out.add(name);
                }
            }
        } else if (node instanceof Block block) {
            Set<String> scope = null;
            for (IrNode statement : block.statements()) {
                collectFree(statement, scope == null ? bound : scope, out);
                Set<String> introduced = statementBindings(statement);
                if (!introduced.isEmpty()) {
                    if (scope == null) {
                        scope = new HashSet<>(bound);
                    }
                    scope.addAll(introduced);
                }
            }
        } else if (node instanceof Match match) {
            collectFree(match.value(), bound, out);
            collectPatternReads(match.pattern(), bound, out);
        } else if (node instanceof CaseClause clause) {
            collectPatternReads(clause.pattern(), bound, out);
            Set<String> scope = extend(bound, boundNames(clause.pattern()));
            collectFree(clause.guard(), scope, out);
            collectFree(clause.body(), scope, out);
        } else if (node instanceof FnClause clause) {
            clause.params().forEach(p -> collectPatternReads(p, bound, out));
            Set<String> scope = extend(bound, boundNames(clause.params()));
            collectFree(clause.guard(), scope, out);
            collectFree(clause.body(), scope, out);
        } else if (node instanceof Def def) {
            Set<String> scope = extend(bound, boundNames(def.params()));
            collectFree(def.guard(), scope, out);
            collectFree(def.body(), scope, out);
        } else if (node instanceof With with) {
            Set<String> scope = new HashSet<>(bound);
            for (WithClause clause : with.clauses()) {
                visits++;
                collectFree(clause.value(), scope, out);
                collectPatternReads(clause.pattern(), scope, out);
                scope.addAll(boundNames(clause.pattern()));
            }
            collectFree(with.body(), scope, out);
            for (CaseClause clause : with.elseClauses()) {
                collectFree(clause, bound, out);
            }
        } else if (node instanceof For comprehension) {
            Set<String> scope = new HashSet<>(bound);
            for (ForGenerator generator : comprehension.generators()) {
                visits++;
                collectFree(generator.enumerable(), scope, out);
                collectPatternReads(generator.pattern(), scope, out);
                scope.addAll(boundNames(generator.pattern()));
            }
            for (IrNode filter : comprehension.filters()) {
                collectFree(filter, scope, out);
            }
            collectFree(comprehension.into(), bound, out);
            collectFree(comprehension.body(), scope, out);
        } else {
            for (IrNode child : node.getChildren()) {
                collectFree(child, bound, out);
            }
        }
    }

    private static Set<String> extend(Set<String> bound, Set<String> more) {
        if (more.isEmpty()) {
            return bound;
        }
        Set<String> scope = new HashSet<>(bound);
        scope.addAll(more);
        return scope;
    }
}
