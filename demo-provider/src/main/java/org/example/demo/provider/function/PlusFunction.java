package org.example.demo.provider.function;

import org.example.remotefn.api.ScalarFunction;

/**
 * a + b，整数溢出时报错而不是回绕
 */
public class PlusFunction implements ScalarFunction {

    @Override
    public Object call(Object[] arguments) {
        Object a = arguments[0];
        Object b = arguments[1];
        if (a instanceof Double || b instanceof Double) {
            return ((Number) a).doubleValue() + ((Number) b).doubleValue();
        }
        if (a instanceof Long || b instanceof Long) {
            return Math.addExact(((Number) a).longValue(), ((Number) b).longValue());
        }
        return Math.addExact(((Number) a).intValue(), ((Number) b).intValue());
    }
}
