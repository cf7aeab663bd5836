package io.github.eutro.restruct.ext;

import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.IRPass;
import io.github.eutro.restruct.passes.meta.ComputeDoms;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of which computed analyses of a {@link RegionGraph} are still valid.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be checked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that also knows the passes that compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass " + pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<RegionGraph>
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            POST_DOMS = new ComputableMetaKind<>("POST_DOMS", ComputeDoms.POST_INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not currently valid.
     *
     * @param t     The thing the computing passes run on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that depends on the shape of the graph.
     */
    public void graphChanged() {
        invalidate(DOMS, POST_DOMS);
    }
}
