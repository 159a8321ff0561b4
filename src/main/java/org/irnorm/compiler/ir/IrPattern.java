package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Patterns on the left of {@code =}, in clause heads, parameters and generators.
 * <p>
 * Like {@link IrNode}, patterns expose their sub-patterns generically through
 * {@link #subPatterns()} and {@link #withSubPatterns(List)} so binder rewrites need no
 * per-variant code.
 */
public sealed interface IrPattern {

    /**
     * @return The direct sub-patterns, in a fixed order.
     */
    default List<IrPattern> subPatterns() {
        return Collections.emptyList();
    }

    /**
     * @param newSubPatterns Replacement sub-patterns in {@link #subPatterns()} order.
     * @return A pattern of the same variant with the given sub-patterns.
     */
    default IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
        return this;
    }

    /**
     * A variable binder. Names starting with {@code _} bind nothing observable.
     *
     * @param name The binder name.
     */
    record BindPat(String name) implements IrPattern {
        /** @return {@code true} for the bare {@code _} wildcard. */
        public boolean isDiscard() {
            return "_".equals(name);
        }

        /** @return {@code true} for {@code _} and every underscore-prefixed name. */
        public boolean isUnderscored() {
            return name.startsWith("_");
        }
    }

    /**
     * A literal pattern.
     *
     * @param kind The literal kind.
     * @param value The boxed value, as in {@link Literal}.
     */
    record LitPat(LiteralKind kind, Object value) implements IrPattern {}

    /** A tuple pattern. */
    record TuplePat(List<IrPattern> elements) implements IrPattern {
        public TuplePat {
            elements = List.copyOf(elements);
        }

        @Override
        public List<IrPattern> subPatterns() {
            return elements;
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            return new TuplePat(newSubPatterns);
        }
    }

    /** A proper list pattern. */
    record ListPat(List<IrPattern> elements) implements IrPattern {
        public ListPat {
            elements = List.copyOf(elements);
        }

        @Override
        public List<IrPattern> subPatterns() {
            return elements;
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            return new ListPat(newSubPatterns);
        }
    }

    /** A {@code [head | tail]} pattern. */
    record ConsPat(IrPattern head, IrPattern tail) implements IrPattern {
        @Override
        public List<IrPattern> subPatterns() {
            return List.of(head, tail);
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            return new ConsPat(newSubPatterns.get(0), newSubPatterns.get(1));
        }
    }

    /**
     * One {@code key => pattern} entry of a {@link MapPat}. Keys are expressions, usually literals.
     */
    record MapPatEntry(IrNode key, IrPattern value) {}

    /** A map pattern. */
    record MapPat(List<MapPatEntry> entries) implements IrPattern {
        public MapPat {
            entries = List.copyOf(entries);
        }

        @Override
        public List<IrPattern> subPatterns() {
            return entries.stream().map(MapPatEntry::value).toList();
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            List<MapPatEntry> rebuilt = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                rebuilt.add(new MapPatEntry(entries.get(i).key(), newSubPatterns.get(i)));
            }
            return new MapPat(rebuilt);
        }
    }

    /** One {@code field: pattern} entry of a {@link StructPat}. */
    record FieldPat(String field, IrPattern value) {}

    /** A struct pattern, {@code %Module{field: pattern}}. */
    record StructPat(String module, List<FieldPat> fields) implements IrPattern {
        public StructPat {
            fields = List.copyOf(fields);
        }

        @Override
        public List<IrPattern> subPatterns() {
            return fields.stream().map(FieldPat::value).toList();
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            List<FieldPat> rebuilt = new ArrayList<>(fields.size());
            for (int i = 0; i < fields.size(); i++) {
                rebuilt.add(new FieldPat(fields.get(i).field(), newSubPatterns.get(i)));
            }
            return new StructPat(module, rebuilt);
        }
    }

    /** A pinned variable, {@code ^name}: a read, not a binding. */
    record PinPat(String name) implements IrPattern {}

    /** {@code pattern = name}: matches the pattern and also binds the whole value. */
    record AliasPat(IrPattern pattern, String name) implements IrPattern {
        @Override
        public List<IrPattern> subPatterns() {
            return List.of(pattern);
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            return new AliasPat(newSubPatterns.get(0), name);
        }
    }

    /**
     * One bit-string segment.
     *
     * @param value The segment value pattern.
     * @param spec The raw segment specification ({@code binary}, {@code size(4)}, ...); may be empty.
     */
    record Segment(IrPattern value, String spec) {}

    /** A bit-string pattern. */
    record BinaryPat(List<Segment> segments) implements IrPattern {
        public BinaryPat {
            segments = List.copyOf(segments);
        }

        @Override
        public List<IrPattern> subPatterns() {
            return segments.stream().map(Segment::value).toList();
        }

        @Override
        public IrPattern withSubPatterns(List<IrPattern> newSubPatterns) {
            List<Segment> rebuilt = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i++) {
                rebuilt.add(new Segment(newSubPatterns.get(i), segments.get(i).spec()));
            }
            return new BinaryPat(rebuilt);
        }
    }
}
