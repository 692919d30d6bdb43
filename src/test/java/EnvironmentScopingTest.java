import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.vela.script.parser.BuiltinRegistry;
import com.vela.script.parser.Environment;
import com.vela.script.parser.EnvironmentException;
import com.vela.script.parser.Value;

public class EnvironmentScopingTest {

    @Test
    void global_isSeededWithConstants() {
        Environment global = Environment.global(BuiltinRegistry.empty());

        assertEquals(Value.bool(true), global.lookup("true"));
        assertEquals(Value.bool(false), global.lookup("false"));
        assertEquals(Value.nil(), global.lookup("null"));
        assertTrue(global.isConstant("true"));
        assertTrue(global.isConstant("null"));
        assertNull(global.parent);
    }

    @Test
    void global_registersBuiltinsAsConstants() {
        Environment global = Environment.global(BuiltinRegistry.standard(System.out));

        assertEquals(Value.Type.NATIVE, global.lookup("print").type);
        assertEquals(Value.Type.NATIVE, global.lookup("time").type);
        assertTrue(global.isConstant("print"));
    }

    @Test
    void lookupMissing_failsWithVariableNotFound() {
        Environment global = Environment.global(BuiltinRegistry.empty());

        EnvironmentException ex = assertThrows(EnvironmentException.class, () -> global.lookup("foo"));
        assertEquals(EnvironmentException.Kind.VARIABLE_NOT_FOUND, ex.kind);
        assertEquals("foo", ex.name);
        assertEquals("Cannot resolve foo since it doesn't exist", ex.getMessage());
    }

    @Test
    void redeclareInSameScope_fails() {
        Environment root = new Environment(null);
        root.declare("x", Value.number(1), false);

        EnvironmentException ex = assertThrows(EnvironmentException.class,
                () -> root.declare("x", Value.number(2), false));
        assertEquals(EnvironmentException.Kind.REDECLARE_VARIABLE, ex.kind);
        assertEquals(Value.number(1), root.lookup("x"));
    }

    @Test
    void shadowingInChild_resolvesToChildBinding() {
        Environment root = new Environment(null);
        root.declare("shadow", Value.number(10), true);

        Environment child = root.childScope();
        assertEquals(Value.number(20), child.declare("shadow", Value.number(20), false));

        assertEquals(Value.number(20), child.lookup("shadow"));
        assertEquals(Value.number(10), root.lookup("shadow"));
        assertSame(child, child.resolve("shadow"));
        // the child's binding is not constant even though the outer one is
        child.assign("shadow", Value.number(21));
        assertEquals(Value.number(21), child.lookup("shadow"));
    }

    @Test
    void assign_updatesNearestDeclaringScope_notLocalCopy() {
        Environment root = new Environment(null);
        root.declare("i", Value.number(0), false);
        Environment child = root.childScope().childScope();

        assertEquals(Value.number(5), child.assign("i", Value.number(5)));

        assertEquals(Value.number(5), root.lookup("i"));
        assertFalse(child.existsInCurrentScope("i"));
        assertSame(root, child.resolve("i"));
    }

    @Test
    void assignUndeclared_failsWithVariableNotFound() {
        Environment child = new Environment(null).childScope();

        EnvironmentException ex = assertThrows(EnvironmentException.class,
                () -> child.assign("missing", Value.number(9)));
        assertEquals(EnvironmentException.Kind.VARIABLE_NOT_FOUND, ex.kind);
        assertFalse(child.exists("missing"));
    }

    @Test
    void assignConstant_failsAtAnyDepth() {
        Environment root = new Environment(null);
        root.declare("k", Value.number(1), true);

        Environment deep = root;
        for (int depth = 0; depth < 5; depth++) {
            Environment scope = deep;
            EnvironmentException ex = assertThrows(EnvironmentException.class,
                    () -> scope.assign("k", Value.number(2)));
            assertEquals(EnvironmentException.Kind.REASSIGN_CONSTANT, ex.kind);
            assertEquals("Cannot reassign to constant k", ex.getMessage());
            deep = deep.childScope();
        }
        assertEquals(Value.number(1), root.lookup("k"));
    }

    @Test
    void variables_viewIsOrderedAndReadOnly() {
        Environment root = new Environment(null);
        root.declare("b", Value.number(2), false);
        root.declare("a", Value.number(1), false);

        assertEquals(List.of("b", "a"), new ArrayList<>(root.variables().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> root.variables().put("c", Value.nil()));
    }
}
