package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.analysis.IdentifierScanner;
import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.ModuleDef;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renames variables that collide with target keywords by appending the configured suffix,
 * repeatedly if the result is itself taken. Each definition of a module is renamed on its own,
 * so the fresh names only have to be unique within one definition.
 */
public class ReservedWordSanitizationPass implements INormalizationPass {

    public static final String NAME = "reserved-word-sanitization";

    private final ScopeWalker walker = new ScopeWalker();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.CLEANUP;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        Set<String> reserved = context.config().reservedWords();
        String suffix = context.config().reservedWordSuffix();
        return sanitize(root, reserved, suffix);
    }

    private IrNode sanitize(IrNode node, Set<String> reserved, String suffix) {
        if (node instanceof ModuleDef module) {
            List<IrNode> items = new ArrayList<>(module.body().size());
            boolean changed = false;
            for (IrNode item : module.body()) {
                IrNode rewritten = sanitize(item, reserved, suffix);
                changed |= rewritten != item;
                items.add(rewritten);
            }
            return changed ? new ModuleDef(module.name(), items, module.meta()) : module;
        }
        return sanitizeUnit(node, reserved, suffix);
    }

    private IrNode sanitizeUnit(IrNode unit, Set<String> reserved, String suffix) {
        Set<String> taken = new HashSet<>(walker.declaredInSubtree(unit));
        taken.addAll(walker.referencedNames(unit));
        Map<String, String> renames = new LinkedHashMap<>();
        for (String name : taken) {
            if (reserved.contains(name)) {
                renames.put(name, null);
            }
        }
        if (renames.isEmpty()) {
            return unit;
        }
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            String fresh = entry.getKey() + suffix;
            while (taken.contains(fresh) || reserved.contains(fresh)) {
                fresh = fresh + suffix;
            }
            taken.add(fresh);
            entry.setValue(fresh);
            CompilerLogger.debug(NAME + ": " + entry.getKey() + " -> " + fresh);
        }
        return new TreeWalker().rewriteBottomUp(unit, n -> rename(n, renames));
    }

    private static IrNode rename(IrNode node, Map<String, String> renames) {
        if (node instanceof Var v) {
            String to = renames.get(v.name());
            return to == null ? v : v.withName(to);
        }
        if (node instanceof Opaque opaque) {
            String text = IdentifierScanner.replace(opaque.text(), n -> renames.getOrDefault(n, n));
            return text.equals(opaque.text()) ? opaque : new Opaque(text, opaque.meta());
        }
        return Patterns.mapNodePatterns(node, p -> Patterns.mapPins(
                Patterns.mapBinders(p, n -> renames.getOrDefault(n, n)),
                n -> renames.getOrDefault(n, n)));
    }
}
