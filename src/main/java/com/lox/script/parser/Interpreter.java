package com.lox.script.parser;

import java.io.PrintStream;
import java.util.List;

import com.lox.debug.Debug;
import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.ExprVisitor;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.PrintStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.StmtVisitor;
import com.lox.script.parser.Statement.VarStmt;

/**
 * Tree-walking evaluator. Statements run top to bottom against one environment;
 * the first {@link RuntimeError} stops the run.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Void> {
    private static final String TAG = "lox.interpreter";

    private final Environment env;
    private final PrintStream out;

    public Interpreter(Environment env, PrintStream out) {
        this.env = (env == null) ? new Environment() : env;
        this.out = (out == null) ? System.out : out;
    }

    public Environment environment() { return env; }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) stmt.accept(this);
    }

    public Value eval(Expr.ExprInterface expr) { return expr.accept(this); }

    // -------------------------
    // Statements
    // -------------------------

    public Void visitExprStmt(ExprStmt stmt) {
        Debug.get().t(TAG, "expr statement");
        eval(stmt.expression);
        return null;
    }

    public Void visitPrintStmt(PrintStmt stmt) {
        Debug.get().t(TAG, "print at line " + stmt.keyword.line);
        Value value = eval(stmt.expression);
        out.println(value.display());
        return null;
    }

    public Void visitVarStmt(VarStmt stmt) {
        Debug.get().t(TAG, "var " + stmt.name.lexeme + " at line " + stmt.name.line);
        Value value = (stmt.initializer == null) ? Value.nil() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS: {
                Value.Type lt = left.getType();
                Value.Type rt = right.getType();
                if (lt == Value.Type.NUMBER && rt == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (lt == Value.Type.STRING && rt == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (lt == Value.Type.NUMBER) throw invalidOperands(left, right, "Expected a number", op);
                if (lt == Value.Type.STRING) throw invalidOperands(left, right, "Expected a string", op);
                throw invalidOperands(left, right, "Expected a number or string", op);
            }
            case MINUS:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                // IEEE division: x / 0 is Infinity or NaN, never an error
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                requireComparable(left, right, op);
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                requireComparable(left, right, op);
                return Value.bool(!left.equals(right));

            default:
                throw new RuntimeError(op, "Invalid operator: " + op.lexeme);
        }
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw new RuntimeError(expr.operator, "Invalid operand: " + right + ". Expected a number");
                }
                return Value.number(-right.asNumber());
            default:
                throw new RuntimeError(expr.operator, "Invalid operator: " + expr.operator.lexeme);
        }
    }

    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.inner);
    }

    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        Value value = env.get(name);
        if (value == null) {
            throw new RuntimeError(expr.name, "Undefined variable: " + name);
        }
        return value;
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        // no declare-before-assign check: an unknown name is created
        if (!env.exists(expr.name.lexeme)) {
            Debug.get().d(TAG, "assignment creates undeclared variable '" + expr.name.lexeme + "'");
        }
        env.define(expr.name.lexeme, value);
        return value;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void requireNumbers(Value a, Value b, Token op) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw invalidOperands(a, b, "Expected numbers", op);
        }
    }

    /** Equality is only defined between two numbers, two strings or two booleans. */
    private void requireComparable(Value a, Value b, Token op) {
        boolean comparable = a.getType() == b.getType() && a.getType() != Value.Type.NIL;
        if (!comparable) {
            throw invalidOperands(a, b, "Expected comparable types", op);
        }
    }

    private static RuntimeError invalidOperands(Value left, Value right, String expected, Token op) {
        return new RuntimeError(op, "Invalid operands: " + left + " and " + right + ". " + expected);
    }
}
