package io.github.eutro.restruct.display;

import io.github.eutro.restruct.ast.*;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders AST trees as indented pseudo-code, or as GraphViz dot.
 */
public class AstDisplay {
    /**
     * Render a tree as pseudo-code, two spaces per level of nesting.
     *
     * @param tree The tree.
     * @return The pseudo-code.
     */
    public static String toText(AstTree tree) {
        TextPrinter printer = new TextPrinter();
        printer.print(tree.getRoot());
        return printer.sb.toString();
    }

    private static class TextPrinter implements AstVisitor<Void> {
        final StringBuilder sb = new StringBuilder();
        int depth = 0;

        void print(@Nullable AstNode node) {
            while (node != null) {
                node.accept(this);
                node = node.getSuccessor();
            }
        }

        void line(String text) {
            for (int i = 0; i < depth; i++) sb.append("  ");
            sb.append(text).append('\n');
        }

        void nested(@Nullable AstNode node) {
            depth++;
            print(node);
            depth--;
        }

        @Override
        public Void visitCode(CodeNode node) {
            if (!node.isEmpty()) line(node.getName() + ";");
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            line(node.getName() + ";");
            printBranches("if (" + node.getCondition() + ") {", node);
            return null;
        }

        @Override
        public Void visitIfCheck(IfCheckNode node) {
            printBranches("if (" + node.getName() + ") {", node);
            return null;
        }

        private void printBranches(String header, IfNode node) {
            line(header);
            nested(node.getThen());
            if (node.getElse() != null) {
                line("} else {");
                nested(node.getElse());
            }
            line("}");
        }

        @Override
        public Void visitScs(ScsNode node) {
            line("while (true) {");
            nested(node.getBody().getRoot());
            line("}");
            return null;
        }

        @Override
        public Void visitSequence(SequenceNode node) {
            for (AstNode child : node.getChildren()) {
                print(child);
            }
            return null;
        }

        @Override
        public Void visitSet(SetNode node) {
            line("state = " + node.getStateVariableValue() + ";");
            return null;
        }

        @Override
        public Void visitBreak(BreakNode node) {
            line("break;");
            return null;
        }

        @Override
        public Void visitContinue(ContinueNode node) {
            line("continue;");
            return null;
        }
    }

    /**
     * Render the nodes reachable from the root of a tree as dot.
     *
     * @param tree The tree.
     * @return The dot source.
     */
    public static String toDot(AstTree tree) {
        DotPrinter printer = new DotPrinter();
        printer.sb.append("digraph AST {\n");
        if (tree.getRoot() != null) printer.id(tree.getRoot());
        return printer.sb.append("}\n").toString();
    }

    private static class DotPrinter implements AstVisitor<Void> {
        final StringBuilder sb = new StringBuilder();
        final Map<AstNode, Integer> ids = new HashMap<>();
        int current;

        int id(AstNode node) {
            Integer id = ids.get(node);
            if (id != null) return id;
            id = ids.size();
            ids.put(node, id);
            sb.append("  node_").append(id).append(" [label=\"")
                    .append(GraphDisplay.escape(node.toString())).append("\"];\n");
            int saved = current;
            current = id;
            node.accept(this);
            AstNode successor = node.getSuccessor();
            if (successor != null) edge(successor, "successor");
            current = saved;
            return id;
        }

        void edge(@Nullable AstNode to, String label) {
            if (to == null) return;
            int from = current;
            int target = id(to);
            sb.append("  node_").append(from).append(" -> node_").append(target)
                    .append(" [label=\"").append(label).append("\"];\n");
        }

        @Override
        public Void visitCode(CodeNode node) {
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            edge(node.getThen(), "then");
            edge(node.getElse(), "else");
            return null;
        }

        @Override
        public Void visitIfCheck(IfCheckNode node) {
            return visitIf(node);
        }

        @Override
        public Void visitScs(ScsNode node) {
            return null;
        }

        @Override
        public Void visitSequence(SequenceNode node) {
            int i = 0;
            for (AstNode child : node.getChildren()) {
                edge(child, Integer.toString(i++));
            }
            return null;
        }

        @Override
        public Void visitSet(SetNode node) {
            return null;
        }

        @Override
        public Void visitBreak(BreakNode node) {
            return null;
        }

        @Override
        public Void visitContinue(ContinueNode node) {
            return null;
        }
    }
}
