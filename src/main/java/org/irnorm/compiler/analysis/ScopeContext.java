package org.irnorm.compiler.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable lexical context threaded through scoped rewrites. Each binding step adds a link that
 * holds only the names it introduces, so extending the context costs the size of the step and not
 * the size of everything already visible.
 *
 * @param names Names bound by this link.
 * @param outer The enclosing link within the same definition, or {@code null}.
 * @param functionName The enclosing definition's name, or {@code null} outside definitions.
 * @param parameters The enclosing definition's parameter names.
 */
public record ScopeContext(Set<String> names, ScopeContext outer, String functionName, List<String> parameters) {

    public ScopeContext {
        names = Set.copyOf(names);
        parameters = List.copyOf(parameters);
    }

    /**
     * @return The context at module level: nothing visible, no function.
     */
    public static ScopeContext root() {
        return new ScopeContext(Set.of(), null, null, List.of());
    }

    /**
     * Enters a definition; outer bindings are not visible inside it.
     * @param name The definition name.
     * @param params The parameter names.
     * @return The function-level context.
     */
    public ScopeContext enterFunction(String name, Collection<String> params) {
        return new ScopeContext(Set.copyOf(params), null, name, List.copyOf(params));
    }

    /**
     * @param bound Names bound at the current point.
     * @return A context where they are visible as well; this instance if there are none.
     */
    public ScopeContext bind(Collection<String> bound) {
        if (bound.isEmpty()) {
            return this;
        }
        return new ScopeContext(Set.copyOf(bound), this, functionName, parameters);
    }

    public boolean isVisible(String name) {
        for (ScopeContext link = this; link != null; link = link.outer) {
            if (link.names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return Every name visible at this point, innermost links first.
     */
    public Set<String> visible() {
        Set<String> all = new LinkedHashSet<>();
        for (ScopeContext link = this; link != null; link = link.outer) {
            all.addAll(link.names);
        }
        return Collections.unmodifiableSet(all);
    }
}
