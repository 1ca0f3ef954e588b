package org.loxfront.compiler.frontend.parser.ast;

/**
 * Base type of all expression nodes. The set of expression kinds is closed,
 * so consumers can dispatch exhaustively over the permitted records.
 */
public sealed interface Expr extends AstNode
        permits LiteralExpr, UnaryExpr, BinaryExpr, GroupingExpr, VariableExpr, AssignExpr,
                LogicalExpr, CallExpr, GetExpr, SetExpr, ThisExpr, SuperExpr {
}
