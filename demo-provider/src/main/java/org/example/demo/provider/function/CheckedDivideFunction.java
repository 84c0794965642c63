package org.example.demo.provider.function;

import org.example.remotefn.api.ScalarFunction;

/**
 * a / b，除数为 0 时抛出 "division by zero"
 */
public class CheckedDivideFunction implements ScalarFunction {

    @Override
    public Object call(Object[] arguments) {
        double dividend = ((Number) arguments[0]).doubleValue();
        double divisor = ((Number) arguments[1]).doubleValue();
        if (divisor == 0) {
            throw new ArithmeticException("division by zero");
        }
        return dividend / divisor;
    }
}
