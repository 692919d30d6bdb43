import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vela.script.VelaScript;
import com.vela.script.parser.BuiltinRegistry;
import com.vela.script.parser.EvalException;
import com.vela.script.parser.Value;
import com.vela.script.plugins.VelaMathPlugin;

import static org.junit.jupiter.api.Assertions.*;

public class VelaMathPluginTest {

    private VelaScript vs;

    @BeforeEach
    void setUp() {
        vs = new VelaScript(BuiltinRegistry.empty());
        VelaMathPlugin.register(vs);
    }

    private long num(String src) {
        return vs.run(src).asNumber();
    }

    private EvalException.Kind failure(String src) {
        return assertThrows(EvalException.class, () -> vs.run(src)).kind;
    }

    @Test
    void absAndSign() {
        assertEquals(5L, num("abs(0 - 5)"));
        assertEquals(5L, num("abs(5)"));
        assertEquals(-1L, num("sign(0 - 3)"));
        assertEquals(0L, num("sign(0)"));
        assertEquals(1L, num("sign(42)"));
    }

    @Test
    void minMaxClamp() {
        assertEquals(2L, num("min(2, 9)"));
        assertEquals(9L, num("max(2, 9)"));
        assertEquals(10L, num("clamp(15, 0, 10)"));
        assertEquals(0L, num("clamp(0 - 15, 0, 10)"));
        assertEquals(7L, num("clamp(7, 0, 10)"));
    }

    @Test
    void pow_bySquaring() {
        assertEquals(256L, num("pow(2, 8)"));
        assertEquals(1L, num("pow(7, 0)"));
        assertEquals(-27L, num("pow(0 - 3, 3)"));
        assertEquals(4611686018427387904L, num("pow(2, 62)"));
    }

    @Test
    void pow_overflowAndNegativeExponent() {
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW, failure("pow(2, 63)"));
        assertEquals(EvalException.Kind.INVALID_ARGUMENT, failure("pow(2, 0 - 1)"));
    }

    @Test
    void abs_ofMinValue_overflows() {
        assertEquals(EvalException.Kind.NUMERIC_OVERFLOW, failure("abs(0 - 9223372036854775807 - 1)"));
    }

    @Test
    void argumentChecks() {
        assertEquals(EvalException.Kind.ARITY_MISMATCH, failure("min(1)"));
        assertEquals(EvalException.Kind.ARITY_MISMATCH, failure("clamp(1, 2)"));
        assertEquals(EvalException.Kind.INVALID_ARGUMENT, failure("abs(true)"));
        assertEquals(EvalException.Kind.INVALID_ARGUMENT, failure("max(1, { a: 1 })"));
    }

    @Test
    void composesWithUserFunctions() {
        Value v = vs.run("fn sumsq(a, b) { pow(a, 2) + pow(b, 2) } sumsq(3, 4)");
        assertEquals(Value.number(25), v);
    }
}
