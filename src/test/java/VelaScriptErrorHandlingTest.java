import org.junit.jupiter.api.Test;

import com.vela.script.VelaScript;
import com.vela.script.parser.Ast;
import com.vela.script.parser.BuiltinRegistry;
import com.vela.script.parser.Environment;
import com.vela.script.parser.EnvironmentException;
import com.vela.script.parser.EvalException;
import com.vela.script.parser.Interpreter;
import com.vela.script.parser.ParseException;
import com.vela.script.parser.Parser;
import com.vela.script.parser.ScriptException;
import com.vela.script.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VelaScriptErrorHandlingTest {

    private static EvalException.Kind evalFailure(String src) {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());
        return assertThrows(EvalException.class, () -> vs.run(src)).kind;
    }

    @Test
    void divisionByZero() {
        assertEquals(EvalException.Kind.DIVISION_BY_ZERO, evalFailure("10 / 0"));
        assertEquals(EvalException.Kind.DIVISION_BY_ZERO, evalFailure("10 % (5 - 5)"));
    }

    @Test
    void overflow_isReportedNotWrapped() {
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW, evalFailure("9223372036854775807 + 1"));
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW, evalFailure("0 - 9223372036854775807 - 2"));
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW, evalFailure("4611686018427387904 * 2"));
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW,
                evalFailure("let min = 0 - 9223372036854775807 - 1; min / (0 - 1)"));
    }

    @Test
    void minValueRemainderByMinusOne_isZero() {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());
        assertEquals(Value.number(0), vs.run("let min = 0 - 9223372036854775807 - 1; min % (0 - 1)"));
    }

    @Test
    void literalTooLarge_isInvalidNumber() {
        assertEquals(EvalException.Kind.INVALID_NUMBER, evalFailure("let big = 99999999999999999999;"));
    }

    @Test
    void assignmentToNonIdentifier_failsBeforeEvaluatingValue() {
        // the right-hand side names an unbound variable; the target check comes first
        assertEquals(EvalException.Kind.INVALID_ASSIGNMENT, evalFailure("1 = missing"));
        assertEquals(EvalException.Kind.INVALID_ASSIGNMENT, evalFailure("(1 + 2) = 3"));
    }

    @Test
    void callingNonFunction() {
        assertEquals(EvalException.Kind.VALUE_NOT_A_FUNCTION, evalFailure("let n = 1; n()"));
        assertEquals(EvalException.Kind.VALUE_NOT_A_FUNCTION, evalFailure("let o = { a: 1 }; o(1)"));
    }

    @Test
    void arityMismatch() {
        assertEquals(EvalException.Kind.ARITY_MISMATCH, evalFailure("fn f(a) { a } f()"));
        assertEquals(EvalException.Kind.ARITY_MISMATCH, evalFailure("fn f(a) { a } f(1, 2)"));
    }

    @Test
    void memberAccess_isNotEvaluable() {
        assertEquals(EvalException.Kind.UNEXPECTED_STATEMENT, evalFailure("let o = { a: 1 }; o.a"));
        assertEquals(EvalException.Kind.UNEXPECTED_STATEMENT, evalFailure("let o = { a: 1 }; o[0]"));
    }

    @Test
    void unknownOperator_inHandBuiltTree() {
        Ast.Node expr = new Ast.BinaryExpr(new Ast.NumericLiteral("1"), new Ast.NumericLiteral("2"), "^");
        Environment env = Environment.global(BuiltinRegistry.empty());

        EvalException ex = assertThrows(EvalException.class, () -> new Interpreter().evaluate(expr, env));
        assertEquals(EvalException.Kind.INVALID_OPERATOR, ex.kind);
    }

    @Test
    void interpreter_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new Interpreter(0));
    }

    @Test
    void firstFailingStatement_abortsTheRest() {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());
        Environment env = vs.newGlobalEnvironment();

        assertThrows(EvalException.class, () -> vs.eval("let a = 1; a = a / 0; let b = 2;", env));

        assertEquals(Value.number(1), env.lookup("a"));
        assertFalse(env.exists("b"));
    }

    @Test
    void environmentErrors_surfaceUnchanged() {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());

        EnvironmentException redeclare = assertThrows(EnvironmentException.class, () -> vs.run("let a = 1; let a = 2;"));
        assertEquals(EnvironmentException.Kind.REDECLARE_VARIABLE, redeclare.kind);

        EnvironmentException constant = assertThrows(EnvironmentException.class, () -> vs.run("const c = 1; c = 2;"));
        assertEquals(EnvironmentException.Kind.REASSIGN_CONSTANT, constant.kind);

        EnvironmentException builtin = assertThrows(EnvironmentException.class, () -> vs.run("true = false"));
        assertEquals(EnvironmentException.Kind.REASSIGN_CONSTANT, builtin.kind);

        EnvironmentException fn = assertThrows(EnvironmentException.class, () -> vs.run("fn f() { 1 } f = 2"));
        assertEquals(EnvironmentException.Kind.REASSIGN_CONSTANT, fn.kind);

        EnvironmentException missing = assertThrows(EnvironmentException.class, () -> vs.run("ghost + 1"));
        assertEquals(EnvironmentException.Kind.VARIABLE_NOT_FOUND, missing.kind);
        assertEquals("ghost", missing.name);
    }

    @Test
    void errorReporter_seesEveryFailureWithItsPhase() {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());
        List<String> phases = new ArrayList<>();
        List<ScriptException> errors = new ArrayList<>();
        vs.setErrorReporter((phase, error) -> {
            phases.add(phase);
            errors.add(error);
        });

        assertThrows(ParseException.class, () -> vs.run("let = 1;"));
        assertThrows(EvalException.class, () -> vs.run("1 / 0"));
        assertEquals(Value.number(3), vs.run("1 + 2"));

        assertEquals(List.of("parse", "eval"), phases);
        assertTrue(errors.get(0) instanceof ParseException);
        assertEquals(EvalException.Kind.DIVISION_BY_ZERO, ((EvalException) errors.get(1)).kind);
    }

    @Test
    void parseNull_isRejected() {
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());
        assertThrows(IllegalArgumentException.class, () -> vs.parse(null));
    }

    @Test
    void callDepth_countsNestedUserCalls() {
        String src = "fn a() { 1 } fn b() { a() } fn c() { b() } c()";
        VelaScript vs = new VelaScript(BuiltinRegistry.empty());

        vs.setMaxCallDepth(3);
        assertEquals(Value.number(1), vs.run(src));

        vs.setMaxCallDepth(2);
        EvalException ex = assertThrows(EvalException.class, () -> vs.run(src));
        assertEquals(EvalException.Kind.CALL_DEPTH_EXCEEDED, ex.kind);
        assertEquals("Max call depth 2 exceeded calling a()", ex.getMessage());
    }

    @Test
    void callDepth_isReleasedAfterAbortedCall() {
        Interpreter interpreter = new Interpreter(2);
        Environment env = Environment.global(BuiltinRegistry.empty());
        interpreter.evaluate(new Parser().produceAst("fn a() { 1 } fn b() { a() } fn c() { b() }"), env);

        assertThrows(EvalException.class, () -> interpreter.evaluate(new Parser().produceAst("c()"), env));
        assertEquals(Value.number(1), interpreter.evaluate(new Parser().produceAst("b()"), env));
    }
}
