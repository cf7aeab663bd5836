package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.display.AstDisplay;
import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The AST of one region.
 * <p>
 * The tree owns every AST node and condition expression created through it, and maps
 * each graph node to the AST node built from it. Nodes of one tree can never be linked
 * into another; the body of a loop is a separate tree referenced by its {@link ScsNode}.
 */
public final class AstTree implements Iterable<AstNode> {
    private final List<AstNode> nodes = new ArrayList<>();
    private final List<ExprNode> condExprs = new ArrayList<>();
    private final Map<Node, AstNode> nodeMap = new LinkedHashMap<>();
    @Nullable
    private AstNode root;

    @Nullable
    AstNode checkOwned(@Nullable AstNode node) {
        if (node != null && node.tree != this) {
            throw new IllegalArgumentException("AST node " + node + " belongs to another tree");
        }
        return node;
    }

    private <T extends AstNode> T register(T node) {
        nodes.add(node);
        return node;
    }

    public CodeNode addCodeNode(Node node, @Nullable AstNode next) {
        return register(new CodeNode(this, node, checkOwned(next)));
    }

    public IfNode addIfNode(Node node,
                            ExprNode condition,
                            @Nullable AstNode thenBranch,
                            @Nullable AstNode elseBranch,
                            @Nullable AstNode follow) {
        if (condition.owner != this) {
            throw new IllegalArgumentException("condition " + condition + " is not owned by this tree");
        }
        return register(new IfNode(this, node, condition, checkOwned(thenBranch), checkOwned(elseBranch), checkOwned(follow)));
    }

    public IfCheckNode addIfCheckNode(Node node,
                                      @Nullable AstNode thenBranch,
                                      @Nullable AstNode elseBranch,
                                      @Nullable AstNode follow) {
        return register(new IfCheckNode(this, node, checkOwned(thenBranch), checkOwned(elseBranch), checkOwned(follow)));
    }

    public ScsNode addScsNode(Node node, AstTree body, @Nullable AstNode follow) {
        if (body == this) throw new IllegalArgumentException("a loop body cannot be its own tree");
        return register(new ScsNode(this, node, body, checkOwned(follow)));
    }

    public SequenceNode addSequenceNode() {
        return register(new SequenceNode(this));
    }

    public SetNode addSetNode(Node node, @Nullable AstNode next) {
        return register(new SetNode(this, node, checkOwned(next)));
    }

    public BreakNode addBreakNode(@Nullable Node node) {
        return register(new BreakNode(this, node));
    }

    public ContinueNode addContinueNode(@Nullable Node node) {
        return register(new ContinueNode(this, node));
    }

    /**
     * Take ownership of a condition expression.
     *
     * @param expr The expression.
     * @param <E>  The type of the expression.
     * @return The expression.
     */
    public <E extends ExprNode> E addCondExpr(E expr) {
        if (expr.owner != null && expr.owner != this) {
            throw new IllegalArgumentException("condition " + expr + " belongs to another tree");
        }
        if (expr.owner == null) {
            expr.owner = this;
            condExprs.add(expr);
        }
        return expr;
    }

    /**
     * Record that {@code astNode} was built from {@code node}.
     *
     * @param node    The graph node.
     * @param astNode The AST node.
     */
    public void addASTNode(Node node, AstNode astNode) {
        checkOwned(astNode);
        if (nodeMap.containsKey(node)) {
            throw new IllegalStateException("an AST node was already built for " + node);
        }
        nodeMap.put(node, astNode);
    }

    @Nullable
    public AstNode findASTNode(Node node) {
        return nodeMap.get(node);
    }

    /**
     * Forget the AST node of a graph node that has been removed.
     *
     * @param node The graph node.
     */
    public void removeASTNode(Node node) {
        nodeMap.remove(node);
    }

    /**
     * Get the map from graph nodes to the AST nodes built from them.
     *
     * @return An unmodifiable view of the map.
     */
    public Map<Node, AstNode> getNodeMap() {
        return Collections.unmodifiableMap(nodeMap);
    }

    @Nullable
    public AstNode getRoot() {
        return root;
    }

    public void setRoot(@Nullable AstNode root) {
        this.root = checkOwned(root);
    }

    public List<ExprNode> getCondExprs() {
        return Collections.unmodifiableList(condExprs);
    }

    /**
     * Get the number of nodes this tree has created, including ones no longer reachable from the root.
     *
     * @return The number of nodes.
     */
    public int size() {
        return nodes.size();
    }

    @NotNull
    @Override
    public Iterator<AstNode> iterator() {
        return Collections.unmodifiableList(nodes).iterator();
    }

    @Override
    public String toString() {
        return AstDisplay.toText(this);
    }
}
