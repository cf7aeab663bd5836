package io.github.eutro.restruct.passes;

import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.convert.BuildAst;
import io.github.eutro.restruct.passes.form.Inflate;
import io.github.eutro.restruct.passes.opts.PurgeDummies;
import io.github.eutro.restruct.passes.tree.DropEmptyLeaves;
import io.github.eutro.restruct.passes.tree.FlattenAtomicSequences;
import io.github.eutro.restruct.passes.tree.InsertSequences;

/**
 * Commonly used pipelines.
 */
public class Passes {
    /**
     * The simplifications run on a freshly built tree.
     */
    public static final IRPass<AstTree, AstTree> SIMPLIFY_AST = InsertSequences.INSTANCE
            .then(DropEmptyLeaves.INSTANCE)
            .then(FlattenAtomicSequences.INSTANCE);

    /**
     * Inflate a region and clean up the dummies left behind, without building an AST.
     */
    public static final IRPass<RegionGraph, RegionGraph> COMB = comb(RestructureOptions.DEFAULT);

    /**
     * Restructure a region into an AST with the default options.
     */
    public static final IRPass<RegionGraph, AstTree> RESTRUCTURE = restructure(RestructureOptions.DEFAULT);

    public static IRPass<RegionGraph, RegionGraph> comb(RestructureOptions options) {
        return new Inflate(options).then(PurgeDummies.INSTANCE);
    }

    /**
     * Get a pass restructuring a region into an AST.
     *
     * @param options The options to restructure with.
     * @return The pass.
     */
    public static IRPass<RegionGraph, AstTree> restructure(RestructureOptions options) {
        return new BuildAst(options);
    }
}
