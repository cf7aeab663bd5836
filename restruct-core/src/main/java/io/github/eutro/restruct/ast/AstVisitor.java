package io.github.eutro.restruct.ast;

/**
 * A visitor over the AST node variants.
 *
 * @param <R> The result type.
 */
public interface AstVisitor<R> {
    R visitCode(CodeNode node);

    R visitIf(IfNode node);

    R visitIfCheck(IfCheckNode node);

    R visitScs(ScsNode node);

    R visitSequence(SequenceNode node);

    R visitSet(SetNode node);

    R visitBreak(BreakNode node);

    R visitContinue(ContinueNode node);
}
