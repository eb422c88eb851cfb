package com.lox.script.parser;

import java.util.List;

import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.PrintStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.VarStmt;

/** Parenthesized prefix rendering of a tree, e.g. {@code (* (- 123) (group 45.67))}. */
public class AstPrinter implements Expr.ExprVisitor<String>, Statement.StmtVisitor<String> {

    public String print(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    /** One line per statement. */
    public String print(List<Stmt> program) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : program) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(print(s));
        }
        return sb.toString();
    }

    public String visitExprStmt(ExprStmt stmt) {
        return parenthesize(";", stmt.expression);
    }

    public String visitPrintStmt(PrintStmt stmt) {
        return parenthesize("print", stmt.expression);
    }

    public String visitVarStmt(VarStmt stmt) {
        if (stmt.initializer == null) return "(var " + stmt.name.lexeme + ")";
        return parenthesize("var " + stmt.name.lexeme, stmt.initializer);
    }

    public String visitBinaryExpr(Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    public String visitUnaryExpr(Unary expr) {
        return parenthesize(expr.operator.lexeme, expr.right);
    }

    public String visitGroupingExpr(Grouping expr) {
        return parenthesize("group", expr.inner);
    }

    public String visitLiteralExpr(Literal expr) {
        return expr.value.display();
    }

    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    public String visitAssignExpr(Assign expr) {
        return parenthesize("= " + expr.name.lexeme, expr.value);
    }

    private String parenthesize(String name, Expr.ExprInterface... exprs) {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(name);
        for (Expr.ExprInterface e : exprs) {
            sb.append(' ').append(e.accept(this));
        }
        sb.append(')');
        return sb.toString();
    }
}
