package org.symjl.evaluate;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Registry of the single-argument functions that can be folded at compile
 * time, keyed by their name in generated code.
 */
public final class ScalarFunctions {

    private static final Map<String, DoubleUnaryOperator> FUNCTIONS;

    static {
        Map<String, DoubleUnaryOperator> functions = new HashMap<>();
        functions.put("exp", Math::exp);
        functions.put("log", Math::log);
        functions.put("sin", Math::sin);
        functions.put("cos", Math::cos);
        functions.put("tan", Math::tan);
        functions.put("sqrt", Math::sqrt);
        functions.put("tanh", Math::tanh);
        functions.put("sinh", Math::sinh);
        functions.put("cosh", Math::cosh);
        functions.put("abs", Math::abs);
        functions.put("sign", Math::signum);
        functions.put("asinh", x -> Math.log(x + Math.sqrt(x * x + 1.0)));
        functions.put("atan", Math::atan);
        FUNCTIONS = Map.copyOf(functions);
    }

    private ScalarFunctions() {
    }

    public static Optional<DoubleUnaryOperator> lookup(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }
}
