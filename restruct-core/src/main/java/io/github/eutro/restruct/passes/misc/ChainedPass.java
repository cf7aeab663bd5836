package io.github.eutro.restruct.passes.misc;

import io.github.eutro.restruct.passes.IRPass;

/**
 * A pass which runs one pass and gives its result to another.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @Override
    public C run(A a) {
        B b = runStage(firstPass, a);
        return runStage(nextPass, b);
    }

    private static <X, Y> Y runStage(IRPass<X, Y> pass, X x) {
        try {
            return pass.run(x);
        } catch (RuntimeException e) {
            if (!(pass instanceof ChainedPass)) {
                e.addSuppressed(new RuntimeException("running pass " + pass.getClass().getSimpleName() + " in chain"));
            }
            throw e;
        }
    }
}
