package com.vela.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vela.script.parser.Ast.AssignmentExpr;
import com.vela.script.parser.Ast.BinaryExpr;
import com.vela.script.parser.Ast.CallExpr;
import com.vela.script.parser.Ast.Comment;
import com.vela.script.parser.Ast.FnDeclaration;
import com.vela.script.parser.Ast.Identifier;
import com.vela.script.parser.Ast.MemberExpr;
import com.vela.script.parser.Ast.Node;
import com.vela.script.parser.Ast.NumericLiteral;
import com.vela.script.parser.Ast.ObjectLiteral;
import com.vela.script.parser.Ast.Program;
import com.vela.script.parser.Ast.Property;
import com.vela.script.parser.Ast.VarDeclaration;
import com.vela.script.parser.EvalException.Kind;

/**
 * Tree-walking evaluator. Every node produces a {@link Value}; the first failure
 * aborts the evaluation in progress.
 *
 * Not thread-safe: one interpreter evaluates one tree at a time and mutates the
 * environments it is handed in place.
 */
public class Interpreter implements Ast.Visitor<Value> {
    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    public static final int DEFAULT_MAX_CALL_DEPTH = 64;

    private final int maxDepth;
    private int callDepth = 0;
    private Environment env;

    public Interpreter() { this(DEFAULT_MAX_CALL_DEPTH); }

    public Interpreter(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public Value evaluate(Node node, Environment environment) {
        Environment previous = env;
        env = environment;
        try {
            return node.accept(this);
        } finally {
            env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Value visitProgram(Program node) {
        return evalSequence(node.body);
    }

    // Comments never replace the last value.
    private Value evalSequence(List<Node> statements) {
        Value last = Value.nil();
        for (Node stmt : statements) {
            if (stmt instanceof Comment) continue;
            last = stmt.accept(this);
        }
        return last;
    }

    @Override
    public Value visitComment(Comment node) {
        return Value.nil();
    }

    @Override
    public Value visitVarDeclaration(VarDeclaration node) {
        Value value = (node.value == null) ? Value.nil() : node.value.accept(this);
        return env.declare(node.identifier, value, node.constant);
    }

    @Override
    public Value visitFnDeclaration(FnDeclaration node) {
        UserFunction fn = new UserFunction(node.name, node.parameters, node.body, env);
        return env.declare(node.name, Value.func(fn), true);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitNumericLiteral(NumericLiteral node) {
        try {
            return Value.number(Long.parseLong(node.text));
        } catch (NumberFormatException e) {
            throw new EvalException(Kind.INVALID_NUMBER,
                    "Numeric literal " + node.text + " does not fit a 64-bit integer", e);
        }
    }

    @Override
    public Value visitIdentifier(Identifier node) {
        return env.lookup(node.name);
    }

    @Override
    public Value visitObjectLiteral(ObjectLiteral node) {
        Map<String, Value> properties = new LinkedHashMap<>();
        for (Property p : node.properties) {
            Value value = p.isShorthand() ? env.lookup(p.key) : p.value.accept(this);
            properties.put(p.key, value);
        }
        return Value.object(properties);
    }

    @Override
    public Value visitAssignmentExpr(AssignmentExpr node) {
        if (!(node.assignee instanceof Identifier)) {
            throw new EvalException(Kind.INVALID_ASSIGNMENT,
                    "Invalid assignment target " + node.assignee + ", only identifiers can be assigned");
        }
        Value value = node.value.accept(this);
        return env.assign(((Identifier) node.assignee).name, value);
    }

    @Override
    public Value visitMemberExpr(MemberExpr node) {
        return unexpected(node);
    }

    @Override
    public Value visitCallExpr(CallExpr node) {
        List<Value> args = new ArrayList<>(node.args.size());
        for (Node arg : node.args) args.add(arg.accept(this));

        Value callee = node.caller.accept(this);
        switch (callee.type) {
            case NATIVE: {
                NativeFunction fn = callee.asNative();
                log.trace("native call {}({} args)", fn.name, args.size());
                Value result = fn.function.call(args, env);
                return (result == null) ? Value.nil() : result;
            }
            case FUNC:
                return callUser(callee.asFunc(), args);
            default:
                throw new EvalException(Kind.VALUE_NOT_A_FUNCTION,
                        node.caller + " evaluated to " + callee.type + ", which is not a function");
        }
    }

    private Value callUser(UserFunction fn, List<Value> args) {
        if (args.size() != fn.parameters.size()) {
            throw new EvalException(Kind.ARITY_MISMATCH,
                    fn.name + "() expects " + fn.parameters.size() + " arguments, got " + args.size());
        }
        if (callDepth >= maxDepth) {
            log.debug("call depth {} exceeded entering {}()", maxDepth, fn.name);
            throw new EvalException(Kind.CALL_DEPTH_EXCEEDED,
                    "Max call depth " + maxDepth + " exceeded calling " + fn.name + "()");
        }

        Environment previous = env;
        // Call frame is a child of the declaring scope, not of the caller.
        env = fn.closure.childScope();
        callDepth++;
        try {
            for (int i = 0; i < fn.parameters.size(); i++) {
                env.declare(fn.parameters.get(i), args.get(i), false);
            }
            return evalSequence(fn.body);
        } finally {
            callDepth--;
            env = previous;
        }
    }

    @Override
    public Value visitBinaryExpr(BinaryExpr node) {
        Value left = node.left.accept(this);
        Value right = node.right.accept(this);

        if (left.type != Value.Type.NUMBER || right.type != Value.Type.NUMBER) {
            return Value.nil();
        }
        return Value.number(arithmetic(left.asNumber(), right.asNumber(), node.operator));
    }

    static long arithmetic(long lhs, long rhs, String operator) {
        try {
            switch (operator) {
                case "+": return Math.addExact(lhs, rhs);
                case "-": return Math.subtractExact(lhs, rhs);
                case "*": return Math.multiplyExact(lhs, rhs);
                case "/":
                    requireNonZero(rhs, lhs, operator);
                    if (lhs == Long.MIN_VALUE && rhs == -1) throw new ArithmeticException("long overflow");
                    return lhs / rhs;
                case "%":
                    requireNonZero(rhs, lhs, operator);
                    return lhs % rhs;
                default:
                    throw new EvalException(Kind.INVALID_OPERATOR, "Unsupported binary operator " + operator);
            }
        } catch (ArithmeticException e) {
            throw new EvalException(Kind.NUMERIC_OVERFLOW,
                    lhs + " " + operator + " " + rhs + " overflows a 64-bit integer", e);
        }
    }

    private static void requireNonZero(long rhs, long lhs, String operator) {
        if (rhs == 0) {
            throw new EvalException(Kind.DIVISION_BY_ZERO, "Division by zero: " + lhs + " " + operator + " 0");
        }
    }

    private Value unexpected(Node node) {
        throw new EvalException(Kind.UNEXPECTED_STATEMENT, "Unexpected statement " + node);
    }
}
