package org.irnorm.compiler.ir;

import org.irnorm.compiler.api.SourceInfo;

import java.util.EnumSet;
import java.util.Set;

/**
 * Metadata attached to every IR node: lowering flags and the host source position.
 *
 * @param flags The side-channel flags; never null.
 * @param source The position token, opaque to the normalizer; never null.
 */
public record NodeMeta(Set<MetaFlag> flags, SourceInfo source) {

    /** Metadata without flags or position. */
    public static final NodeMeta EMPTY = new NodeMeta(Set.of(), SourceInfo.UNKNOWN);

    public NodeMeta {
        flags = flags == null ? Set.of() : Set.copyOf(flags);
        source = source == null ? SourceInfo.UNKNOWN : source;
    }

    /**
     * Creates metadata with the given flags and no position.
     * @param first The first flag.
     * @param rest Further flags.
     * @return The metadata.
     */
    public static NodeMeta of(MetaFlag first, MetaFlag... rest) {
        return new NodeMeta(EnumSet.of(first, rest), SourceInfo.UNKNOWN);
    }

    /**
     * Creates metadata carrying only a source position.
     * @param source The position.
     * @return The metadata.
     */
    public static NodeMeta at(SourceInfo source) {
        return new NodeMeta(Set.of(), source);
    }

    public boolean has(MetaFlag flag) {
        return flags.contains(flag);
    }

    public NodeMeta with(MetaFlag flag) {
        if (has(flag)) {
            return this;
        }
        EnumSet<MetaFlag> copy = EnumSet.noneOf(MetaFlag.class);
        copy.addAll(flags);
        copy.add(flag);
        return new NodeMeta(copy, source);
    }

    public NodeMeta without(MetaFlag flag) {
        if (!has(flag)) {
            return this;
        }
        EnumSet<MetaFlag> copy = EnumSet.noneOf(MetaFlag.class);
        copy.addAll(flags);
        copy.remove(flag);
        return new NodeMeta(copy, source);
    }
}
