package com.lox.script;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lox.script.parser.Expr;
import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.PrintStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.VarStmt;
import com.lox.script.parser.Token;
import com.lox.script.parser.Value;

/**
 * JSON dumps of token streams and syntax trees for tooling.
 *
 * Every node is an object with a "type" field; operator-bearing nodes keep the
 * operator lexeme and its source line.
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nf = JsonNodeFactory.instance;

    private AstJson() {}

    public static ArrayNode tokens(List<Token> tokens) {
        ArrayNode arr = nf.arrayNode();
        for (Token t : tokens) {
            ObjectNode o = arr.addObject();
            o.put("type", t.type.name());
            o.put("lexeme", t.lexeme);
            if (t.literal != null) o.set("literal", value(t.literal));
            o.put("line", t.line);
        }
        return arr;
    }

    public static ArrayNode program(List<Stmt> program) {
        ArrayNode arr = nf.arrayNode();
        for (Stmt s : program) arr.add(statement(s));
        return arr;
    }

    public static JsonNode statement(Stmt stmt) {
        return stmt.accept(NODES);
    }

    public static JsonNode expression(Expr.ExprInterface expr) {
        return expr.accept(NODES);
    }

    public static JsonNode value(Value v) {
        switch (v.getType()) {
            case NUMBER: return nf.numberNode(v.asNumber());
            case BOOL: return nf.booleanNode(v.asBool());
            case STRING: return nf.textNode(v.asString());
            default: return nf.nullNode();
        }
    }

    public static String toJson(JsonNode node, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(node) : om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize syntax tree", e);
        }
    }

    private static final Visitor NODES = new Visitor();

    private static final class Visitor implements Expr.ExprVisitor<JsonNode>, Statement.StmtVisitor<JsonNode> {

        public JsonNode visitExprStmt(ExprStmt stmt) {
            ObjectNode o = node("ExpressionStatement");
            o.set("expression", stmt.expression.accept(this));
            return o;
        }

        public JsonNode visitPrintStmt(PrintStmt stmt) {
            ObjectNode o = node("PrintStatement");
            o.put("line", stmt.keyword.line);
            o.set("expression", stmt.expression.accept(this));
            return o;
        }

        public JsonNode visitVarStmt(VarStmt stmt) {
            ObjectNode o = node("VariableDeclaration");
            o.put("name", stmt.name.lexeme);
            o.put("line", stmt.name.line);
            o.set("initializer", stmt.initializer == null ? nf.nullNode() : stmt.initializer.accept(this));
            return o;
        }

        public JsonNode visitBinaryExpr(Binary expr) {
            ObjectNode o = node("Binary");
            o.put("operator", expr.operator.lexeme);
            o.put("line", expr.operator.line);
            o.set("left", expr.left.accept(this));
            o.set("right", expr.right.accept(this));
            return o;
        }

        public JsonNode visitUnaryExpr(Unary expr) {
            ObjectNode o = node("Unary");
            o.put("operator", expr.operator.lexeme);
            o.put("line", expr.operator.line);
            o.set("right", expr.right.accept(this));
            return o;
        }

        public JsonNode visitGroupingExpr(Grouping expr) {
            ObjectNode o = node("Grouping");
            o.set("inner", expr.inner.accept(this));
            return o;
        }

        public JsonNode visitLiteralExpr(Literal expr) {
            ObjectNode o = node("Literal");
            o.set("value", value(expr.value));
            return o;
        }

        public JsonNode visitVariableExpr(Variable expr) {
            ObjectNode o = node("Variable");
            o.put("name", expr.name.lexeme);
            o.put("line", expr.name.line);
            return o;
        }

        public JsonNode visitAssignExpr(Assign expr) {
            ObjectNode o = node("Assign");
            o.put("name", expr.name.lexeme);
            o.put("line", expr.name.line);
            o.set("value", expr.value.accept(this));
            return o;
        }

        private static ObjectNode node(String type) {
            ObjectNode o = nf.objectNode();
            o.put("type", type);
            return o;
        }
    }
}
