package com.vela.script.plugins;

import java.util.List;

import com.vela.script.VelaScript;
import com.vela.script.parser.EvalException;
import com.vela.script.parser.EvalException.Kind;
import com.vela.script.parser.Value;

/**
 * VelaMathPlugin
 *
 * Integer math functions for Vela scripts. Kept out of the core builtins so the
 * default global scope stays minimal.
 *
 * Usage:
 *   VelaMathPlugin.register(engine);
 *
 * Then in scripts:
 *   let x = pow(2, 8);
 *   let y = clamp(a, 0, 10);
 *
 * All arithmetic is exact: results that do not fit a 64-bit integer fail with
 * NUMERIC_OVERFLOW, like the binary operators.
 */
public final class VelaMathPlugin {

    private VelaMathPlugin() {}

    public static void register(VelaScript engine) {

        engine.registerFunction("abs", (args, env) -> {
            requireArgs("abs", args, 1);
            return exact("abs", () -> Math.absExact(num("abs", args, 0)));
        });

        engine.registerFunction("sign", (args, env) -> {
            requireArgs("sign", args, 1);
            return Value.number(Long.signum(num("sign", args, 0)));
        });

        engine.registerFunction("min", (args, env) -> {
            requireArgs("min", args, 2);
            return Value.number(Math.min(num("min", args, 0), num("min", args, 1)));
        });

        engine.registerFunction("max", (args, env) -> {
            requireArgs("max", args, 2);
            return Value.number(Math.max(num("max", args, 0), num("max", args, 1)));
        });

        engine.registerFunction("clamp", (args, env) -> {
            requireArgs("clamp", args, 3);
            long v = num("clamp", args, 0);
            long lo = num("clamp", args, 1);
            long hi = num("clamp", args, 2);
            return Value.number(Math.max(lo, Math.min(hi, v)));
        });

        engine.registerFunction("pow", (args, env) -> {
            requireArgs("pow", args, 2);
            long base = num("pow", args, 0);
            long exponent = num("pow", args, 1);
            if (exponent < 0) {
                throw new EvalException(Kind.INVALID_ARGUMENT, "pow() exponent must not be negative, got " + exponent);
            }
            return exact("pow", () -> {
                long result = 1;
                long b = base;
                long e = exponent;
                while (true) {
                    if ((e & 1) == 1) result = Math.multiplyExact(result, b);
                    e >>= 1;
                    if (e == 0) return result;
                    b = Math.multiplyExact(b, b);
                }
            });
        });
    }

    // ===================== HELPERS =====================

    private interface LongOp {
        long apply();
    }

    private static Value exact(String fn, LongOp op) {
        try {
            return Value.number(op.apply());
        } catch (ArithmeticException e) {
            throw new EvalException(Kind.NUMERIC_OVERFLOW, fn + "() result overflows a 64-bit integer", e);
        }
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new EvalException(Kind.ARITY_MISMATCH, fn + "() expects " + n + " arguments, got " + args.size());
        }
    }

    private static long num(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.NUMBER) {
            throw new EvalException(Kind.INVALID_ARGUMENT,
                    fn + "() argument " + idx + " must be a number, got " + v.getType());
        }
        return v.asNumber();
    }
}
