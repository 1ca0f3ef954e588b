package org.loxfront.compiler.frontend.parser.ast;

/**
 * Base type of all statement nodes. The set of statement kinds is closed.
 */
public sealed interface Stmt extends AstNode
        permits ExpressionStmt, PrintStmt, VarStmt, BlockStmt, IfStmt, WhileStmt,
                FunctionStmt, ReturnStmt, ClassStmt {
}
