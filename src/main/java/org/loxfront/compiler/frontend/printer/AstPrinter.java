package org.loxfront.compiler.frontend.printer;

import org.loxfront.compiler.frontend.lexer.Token;
import org.loxfront.compiler.frontend.parser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST in a canonical, fully parenthesized prefix form, e.g.
 * {@code 1 + 2 * 3} becomes {@code (+ 1.0 (* 2.0 3.0))}.
 * <p>
 * The output is deterministic, which makes it suitable for golden-output tests.
 * Rendering uses an explicit stack, so the left-deep trees of long operator chains
 * do not grow the Java call stack.
 */
public final class AstPrinter {

    /**
     * Renders a whole program, one top-level statement per line.
     * @param program The program.
     * @return The rendering; empty for an empty program.
     */
    public String print(Program program) {
        return render(program);
    }

    /**
     * Renders a single statement.
     * @param stmt The statement.
     * @return The rendering.
     */
    public String print(Stmt stmt) {
        return render(stmt);
    }

    /**
     * Renders a single expression.
     * @param expr The expression.
     * @return The rendering.
     */
    public String print(Expr expr) {
        return render(expr);
    }

    private String render(AstNode root) {
        StringBuilder out = new StringBuilder();
        // Holds text fragments and nodes still to expand, next item on top.
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof String text) {
                out.append(text);
                continue;
            }
            List<Object> parts = parts((AstNode) item);
            for (int i = parts.size() - 1; i >= 0; i--) {
                stack.push(parts.get(i));
            }
        }
        return out.toString();
    }

    /**
     * Splits a node into its rendering: literal text interleaved with child nodes.
     */
    private List<Object> parts(AstNode node) {
        List<Object> parts = new ArrayList<>();
        if (node instanceof Program p) {
            for (int i = 0; i < p.statements().size(); i++) {
                if (i > 0) parts.add("\n");
                parts.add(p.statements().get(i));
            }
        } else if (node instanceof Stmt stmt) {
            statementParts(stmt, parts);
        } else if (node instanceof Expr expr) {
            expressionParts(expr, parts);
        } else {
            throw new IllegalArgumentException("Unknown node type: " + node.getClass().getSimpleName());
        }
        return parts;
    }

    private void statementParts(Stmt stmt, List<Object> parts) {
        if (stmt instanceof ExpressionStmt s) {
            wrap(parts, "(; ", s.expression());
        } else if (stmt instanceof PrintStmt s) {
            wrap(parts, "(print ", s.expression());
        } else if (stmt instanceof VarStmt s) {
            if (s.initializer() == null) {
                parts.add("(var " + s.name().text() + ")");
            } else {
                wrap(parts, "(var " + s.name().text() + " = ", s.initializer());
            }
        } else if (stmt instanceof BlockStmt s) {
            parts.add("(block");
            spaced(parts, s.statements());
            parts.add(")");
        } else if (stmt instanceof IfStmt s) {
            parts.add(s.elseBranch() == null ? "(if " : "(if-else ");
            parts.add(s.condition());
            parts.add(" ");
            parts.add(s.thenBranch());
            if (s.elseBranch() != null) {
                parts.add(" ");
                parts.add(s.elseBranch());
            }
            parts.add(")");
        } else if (stmt instanceof WhileStmt s) {
            parts.add("(while ");
            parts.add(s.condition());
            parts.add(" ");
            parts.add(s.body());
            parts.add(")");
        } else if (stmt instanceof FunctionStmt s) {
            String params = s.params().stream()
                    .map(Token::text)
                    .collect(Collectors.joining(" "));
            parts.add("(fun " + s.name().text() + "(" + params + ")");
            spaced(parts, s.body());
            parts.add(")");
        } else if (stmt instanceof ReturnStmt s) {
            if (s.value() == null) {
                parts.add("(return)");
            } else {
                wrap(parts, "(return ", s.value());
            }
        } else if (stmt instanceof ClassStmt s) {
            parts.add("(class " + s.name().text());
            if (s.superclass() != null) {
                parts.add(" < " + s.superclass().name().text());
            }
            spaced(parts, s.methods());
            parts.add(")");
        } else {
            throw new IllegalArgumentException("Unknown statement type: " + stmt.getClass().getSimpleName());
        }
    }

    private void expressionParts(Expr expr, List<Object> parts) {
        if (expr instanceof LiteralExpr e) {
            parts.add(Token.formatLiteral(e.value()));
        } else if (expr instanceof GroupingExpr e) {
            wrap(parts, "(group ", e.expression());
        } else if (expr instanceof UnaryExpr e) {
            wrap(parts, "(" + e.operator().text() + " ", e.right());
        } else if (expr instanceof BinaryExpr e) {
            operands(parts, e.operator(), e.left(), e.right());
        } else if (expr instanceof LogicalExpr e) {
            operands(parts, e.operator(), e.left(), e.right());
        } else if (expr instanceof VariableExpr e) {
            parts.add(e.name().text());
        } else if (expr instanceof AssignExpr e) {
            wrap(parts, "(= " + e.name().text() + " ", e.value());
        } else if (expr instanceof CallExpr e) {
            parts.add("(call ");
            parts.add(e.callee());
            spaced(parts, e.arguments());
            parts.add(")");
        } else if (expr instanceof GetExpr e) {
            parts.add("(. ");
            parts.add(e.object());
            parts.add(" " + e.name().text() + ")");
        } else if (expr instanceof SetExpr e) {
            parts.add("(= ");
            parts.add(e.object());
            parts.add(" " + e.name().text() + " ");
            parts.add(e.value());
            parts.add(")");
        } else if (expr instanceof ThisExpr) {
            parts.add("this");
        } else if (expr instanceof SuperExpr e) {
            parts.add("(super " + e.method().text() + ")");
        } else {
            throw new IllegalArgumentException("Unknown expression type: " + expr.getClass().getSimpleName());
        }
    }

    private static void wrap(List<Object> parts, String open, AstNode child) {
        parts.add(open);
        parts.add(child);
        parts.add(")");
    }

    private static void operands(List<Object> parts, Token operator, Expr left, Expr right) {
        parts.add("(" + operator.text() + " ");
        parts.add(left);
        parts.add(" ");
        parts.add(right);
        parts.add(")");
    }

    private static void spaced(List<Object> parts, List<? extends AstNode> children) {
        for (AstNode child : children) {
            parts.add(" ");
            parts.add(child);
        }
    }
}
