package org.example.demo.provider.function;

import org.example.remotefn.api.ScalarFunction;

/**
 * substr(string, start[, length])，按 SQL 习惯从 1 开始计数。
 * start 为负数时从末尾往前数；start 为 0 或超出长度时返回空串。
 * 按 code point 计算位置，不会把代理对拆开。
 */
public class SubstrFunction implements ScalarFunction {

    @Override
    public String call(Object[] arguments) {
        String value = (String) arguments[0];
        long start = ((Number) arguments[1]).longValue();
        long length = arguments.length > 2 ? ((Number) arguments[2]).longValue() : Long.MAX_VALUE;

        int codePoints = value.codePointCount(0, value.length());
        if (start == 0 || length <= 0 || Math.abs(start) > codePoints) {
            return "";
        }
        long from = start > 0 ? start - 1 : codePoints + start;
        long to = Math.min(codePoints, from + Math.min(length, codePoints));

        int begin = value.offsetByCodePoints(0, (int) from);
        int end = value.offsetByCodePoints(0, (int) to);
        return value.substring(begin, end);
    }
}
