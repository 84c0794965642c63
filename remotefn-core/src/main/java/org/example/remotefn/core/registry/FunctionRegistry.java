package org.example.remotefn.core.registry;

import org.example.remotefn.api.VectorFunction;
import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.vector.ColumnType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 服务端的函数分发表
 * 作用：保存 函数名 -> (签名, 实现) 的映射。
 * 启动时用 {@link Builder} 一次性建好，之后只读，所以查找不需要加锁。
 */
public final class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, List<Entry>> functions;

    private FunctionRegistry(Map<String, List<Entry>> functions) {
        this.functions = functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 按函数名 + 实际参数类型查找实现，找不到返回 null
     */
    public Entry lookup(String name, List<ColumnType> argumentTypes) {
        List<Entry> overloads = functions.get(name);
        if (overloads == null) {
            return null;
        }
        for (Entry entry : overloads) {
            if (entry.getSignature().matches(argumentTypes)) {
                return entry;
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public List<FunctionSignature> signatures(String name) {
        List<Entry> overloads = functions.getOrDefault(name, List.of());
        List<FunctionSignature> signatures = new ArrayList<>(overloads.size());
        for (Entry entry : overloads) {
            signatures.add(entry.getSignature());
        }
        return signatures;
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * 分发表里的一项：签名和对应的实现，启动时就绑定好
     */
    public static final class Entry {
        private final String name;
        private final FunctionSignature signature;
        private final VectorFunction function;

        private Entry(String name, FunctionSignature signature, VectorFunction function) {
            this.name = name;
            this.signature = signature;
            this.function = function;
        }

        public String getName() {
            return name;
        }

        public FunctionSignature getSignature() {
            return signature;
        }

        public VectorFunction getFunction() {
            return function;
        }
    }

    public static final class Builder {
        private final Map<String, List<Entry>> functions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, FunctionSignature signature, VectorFunction function) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Function name must not be empty");
            }
            List<Entry> overloads = functions.computeIfAbsent(name, k -> new ArrayList<>());
            for (Entry existing : overloads) {
                if (existing.signature.getArgumentTypes().equals(signature.getArgumentTypes())) {
                    throw new IllegalArgumentException("Function " + name + signature
                            + " is already registered as " + name + existing.signature);
                }
            }
            overloads.add(new Entry(name, signature, function));
            log.debug("函数已注册: {}{}", name, signature);
            return this;
        }

        public FunctionRegistry build() {
            Map<String, List<Entry>> copy = new HashMap<>();
            functions.forEach((name, overloads) -> copy.put(name, List.copyOf(overloads)));
            return new FunctionRegistry(Collections.unmodifiableMap(copy));
        }
    }
}
