package io.github.eutro.restruct.passes.convert;

import io.github.eutro.restruct.ast.AstNode;
import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.ast.AtomicExpr;
import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.conf.TraceSink;
import io.github.eutro.restruct.ext.CommonExts;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.IRPass;
import io.github.eutro.restruct.passes.form.Inflate;
import io.github.eutro.restruct.passes.meta.DomTree;
import io.github.eutro.restruct.passes.opts.EliminateDanglingNodes;
import io.github.eutro.restruct.passes.opts.PurgeDummies;
import io.github.eutro.restruct.passes.tree.DropEmptyLeaves;
import io.github.eutro.restruct.passes.tree.FlattenAtomicSequences;
import io.github.eutro.restruct.passes.tree.InsertSequences;
import io.github.eutro.restruct.util.RegionUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the AST of a region from its dominator tree, inflating the region first if that is still pending.
 * <p>
 * Each node becomes one AST node whose children are built from its dominator tree children:
 * a loop for collapsed nodes, whose body is built recursively; an if for nodes with two or three children,
 * matched against the node's two targets with any third child as the follow;
 * and otherwise a plain node wrapping its only child, if any.
 * When one target of a two-child if always runs into the other, the other target becomes the follow.
 * <p>
 * A code node with two successors but a single dominator tree child is wrapped as plain code.
 * Inflate only leaves such nodes when they are blacklisted conditionals, whose edge to the
 * undominated target is dropped from the tree.
 * <p>
 * The tree is attached to the graph as {@link CommonExts#AST}.
 */
public class BuildAst implements IRPass<RegionGraph, AstTree> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildAst.class);

    /**
     * An instance of this pass with the default options.
     */
    public static final BuildAst INSTANCE = new BuildAst(RestructureOptions.DEFAULT);

    private final RestructureOptions options;
    private final Inflate inflate;

    public BuildAst(RestructureOptions options) {
        this.options = options;
        inflate = new Inflate(options);
    }

    @Override
    public AstTree run(RegionGraph graph) {
        TraceSink trace = options.getTraceSink();
        if (graph.isToInflate()) {
            if (trace.isEnabled()) trace.dumpGraph(graph, "restructure", "before-inflate");
            inflate.runInPlace(graph);
            graph.setToInflate(false);
            if (trace.isEnabled()) trace.dumpGraph(graph, "restructure", "after-inflate");
        }

        DomTree doms = DomTree.dominators(graph);
        AstTree tree = new AstTree();
        for (Node node : doms.finishOrder()) {
            List<Node> children = doms.getChildren(node);
            List<AstNode> astChildren = new ArrayList<>(children.size());
            for (Node child : children) {
                AstNode astChild = tree.findASTNode(child);
                if (astChild == null) throw new IllegalStateException("no AST node built yet for " + child);
                astChildren.add(astChild);
            }
            AstNode built = node.isCollapsed()
                    ? buildLoop(tree, node, astChildren)
                    : buildNode(tree, node, children, astChildren);
            tree.addASTNode(node, built);
        }
        Node root = doms.getRoot();
        if (root == null) throw new IllegalStateException("dominator tree of " + graph + " has no root");
        tree.setRoot(tree.findASTNode(root));
        if (trace.isEnabled()) trace.dumpAst(tree, graph, "ast", "first-draft");

        InsertSequences.INSTANCE.runInPlace(tree);
        if (trace.isEnabled()) trace.dumpAst(tree, graph, "ast", "after-sequence");
        DropEmptyLeaves.INSTANCE.runInPlace(tree);
        if (trace.isEnabled()) trace.dumpAst(tree, graph, "ast", "after-dummies-removal");
        FlattenAtomicSequences.INSTANCE.runInPlace(tree);
        if (trace.isEnabled()) trace.dumpAst(tree, graph, "ast", "final");

        for (Node removed : EliminateDanglingNodes.eliminate(graph)) {
            tree.removeASTNode(removed);
        }
        for (Node removed : PurgeDummies.purge(graph)) {
            tree.removeASTNode(removed);
        }

        graph.attachExt(CommonExts.AST, tree);
        return tree;
    }

    private AstNode buildLoop(AstTree tree, Node node, List<AstNode> astChildren) {
        RegionGraph body = node.getCollapsedGraph();
        if (body == null) throw new IllegalStateException("collapsed node " + node + " has no body");
        if (astChildren.size() > 1) {
            throw new IllegalStateException("collapsed node " + node + " dominates "
                    + astChildren.size() + " nodes, expected at most 1");
        }
        LOGGER.debug("Building the body of loop {}", node);
        AstTree bodyTree = run(body);
        return tree.addScsNode(node, bodyTree, astChildren.isEmpty() ? null : astChildren.get(0));
    }

    private static AstNode buildNode(AstTree tree, Node node, List<Node> children, List<AstNode> astChildren) {
        switch (children.size()) {
            case 3:
            case 2:
                return buildIf(tree, node, children, astChildren);
            case 1: {
                Node child = children.get(0);
                AstNode astChild = astChildren.get(0);
                switch (node.getKind()) {
                    case SET:
                        return tree.addSetNode(node, astChild);
                    case CHECK:
                        if (child == node.getTrue()) return tree.addIfCheckNode(node, astChild, null, null);
                        if (child == node.getFalse()) return tree.addIfCheckNode(node, null, astChild, null);
                        throw new IllegalStateException("only child " + child + " of check " + node
                                + " is neither of its targets");
                    case CODE:
                    case ARTIFICIAL_DUMMY:
                        return tree.addCodeNode(node, astChild);
                    default:
                        throw new IllegalStateException(node.getKind() + " node " + node + " cannot dominate " + child);
                }
            }
            case 0:
                switch (node.getKind()) {
                    case BREAK:
                        return tree.addBreakNode(node);
                    case CONTINUE:
                        return tree.addContinueNode(node);
                    case SET:
                        return tree.addSetNode(node, null);
                    case CODE:
                    case ARTIFICIAL_DUMMY:
                        return tree.addCodeNode(node, null);
                    default:
                        throw new IllegalStateException(node.getKind() + " node " + node + " dominates nothing");
                }
            default:
                throw new IllegalStateException("node " + node + " has " + children.size()
                        + " dominator tree children, expected at most 3");
        }
    }

    private static AstNode buildIf(AstTree tree, Node node, List<Node> children, List<AstNode> astChildren) {
        if (node.getSuccessorCount() != 2 || !(node.isCheck() || node.isCode())) {
            throw new IllegalStateException(node.getKind() + " node " + node + " with "
                    + node.getSuccessorCount() + " successors has " + children.size() + " dominator tree children");
        }
        Node thenTarget = node.isCheck() ? node.getTrue() : node.getSuccessor(0);
        Node elseTarget = node.isCheck() ? node.getFalse() : node.getSuccessor(1);
        AstNode thenBranch = null;
        AstNode elseBranch = null;
        AstNode follow = null;
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child == thenTarget) {
                thenBranch = astChildren.get(i);
            } else if (child == elseTarget) {
                elseBranch = astChildren.get(i);
            } else if (follow == null) {
                follow = astChildren.get(i);
            } else {
                throw new IllegalStateException("then and else branches of " + node + " cannot be matched");
            }
        }
        if (thenBranch == null && elseBranch == null
                || children.size() == 3 && (thenBranch == null || elseBranch == null)) {
            throw new IllegalStateException("then and else branches of " + node + " cannot be matched");
        }
        if (follow == null && thenBranch != null && elseBranch != null) {
            // a triangle: one arm runs into the other target, which is then the follow
            if (fallsInto(thenTarget, elseTarget)) {
                follow = elseBranch;
                elseBranch = null;
            } else if (fallsInto(elseTarget, thenTarget)) {
                follow = thenBranch;
                thenBranch = null;
            }
        }
        return ifNode(tree, node, thenBranch, elseBranch, follow);
    }

    /**
     * Check whether every path from {@code arm} reaches {@code join}, never leaving the region on the way.
     */
    private static boolean fallsInto(Node arm, Node join) {
        Set<Node> reached = RegionUtils.findReachableNodes(arm, join);
        if (!reached.contains(join)) return false;
        for (Node node : reached) {
            if (node != join && node.getSuccessorCount() == 0) return false;
        }
        return true;
    }

    private static AstNode ifNode(AstTree tree,
                                  Node node,
                                  @Nullable AstNode thenBranch,
                                  @Nullable AstNode elseBranch,
                                  @Nullable AstNode follow) {
        if (node.isCheck()) return tree.addIfCheckNode(node, thenBranch, elseBranch, follow);
        AtomicExpr condition = tree.addCondExpr(new AtomicExpr(node.getOriginal()));
        return tree.addIfNode(node, condition, thenBranch, elseBranch, follow);
    }
}
