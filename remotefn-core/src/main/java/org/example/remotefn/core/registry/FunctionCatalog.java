package org.example.remotefn.core.registry;

import org.example.remotefn.api.VectorFunction;
import org.example.remotefn.common.entity.FunctionSignature;
import org.example.remotefn.common.entity.RegisteredRemoteFunction;
import org.example.remotefn.common.entity.RemoteEndpoint;
import org.example.remotefn.common.vector.ColumnBatch;
import org.example.remotefn.common.vector.ColumnType;
import org.example.remotefn.common.vector.ColumnVector;
import org.example.remotefn.core.config.RemoteCallOptions;
import org.example.remotefn.core.proxy.RemoteFunctionAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 调用方（引擎）的函数目录：别名 -> 若干重载。
 * 本地函数和远程函数登记在同一个目录里，求值时按参数列类型选出重载再调用，调用方不用关心函数在哪里执行。
 */
public class FunctionCatalog {

    private static final Logger log = LoggerFactory.getLogger(FunctionCatalog.class);

    private final Map<String, List<Binding>> functions = new ConcurrentHashMap<>();
    private final Map<String, List<RegisteredRemoteFunction>> remoteFunctions = new ConcurrentHashMap<>();

    /**
     * 登记一个本地函数
     */
    public void registerFunction(String alias, FunctionSignature signature, VectorFunction function) {
        bind(alias, signature, function);
    }

    public void registerRemoteFunction(String alias, List<FunctionSignature> signatures, RemoteEndpoint endpoint) {
        registerRemoteFunction(alias, signatures, endpoint, RemoteCallOptions.DEFAULT);
    }

    /**
     * 登记一个远程函数：每个签名绑定一个指向 endpoint 的 {@link RemoteFunctionAdapter}。
     * 不检查远端是否可达，第一次调用时才会发现连不上。
     */
    public void registerRemoteFunction(String alias, List<FunctionSignature> signatures,
                                       RemoteEndpoint endpoint, RemoteCallOptions options) {
        if (signatures.isEmpty()) {
            throw new IllegalArgumentException("Remote function " + alias + " needs at least one signature");
        }
        // 整组签名先检查一遍，避免登记到一半失败，留下半个别名
        Set<List<ColumnType>> seen = new HashSet<>();
        for (Binding existing : functions.getOrDefault(alias, List.of())) {
            seen.add(existing.signature.getArgumentTypes());
        }
        for (FunctionSignature signature : signatures) {
            if (!seen.add(signature.getArgumentTypes())) {
                throw new IllegalArgumentException("Function " + alias + signature + " is already registered");
            }
        }
        for (FunctionSignature signature : signatures) {
            bind(alias, signature, new RemoteFunctionAdapter(alias, signature, endpoint, options));
            remoteFunctions.computeIfAbsent(alias, k -> new CopyOnWriteArrayList<>())
                    .add(new RegisteredRemoteFunction(alias, signature, endpoint));
        }
        log.info("远程函数已登记: {} {} @ {}", alias, signatures, endpoint);
    }

    /**
     * 按参数列的类型选出重载并求值
     *
     * @throws IllegalArgumentException 别名不存在，或者没有匹配参数类型的重载
     */
    public ColumnVector evaluate(String alias, ColumnBatch arguments) {
        Binding binding = resolve(alias, arguments.columnTypes());
        return binding.function.apply(arguments, binding.signature.getReturnType());
    }

    public FunctionSignature resolveSignature(String alias, List<ColumnType> argumentTypes) {
        return resolve(alias, argumentTypes).signature;
    }

    public List<RegisteredRemoteFunction> remoteFunctions(String alias) {
        return List.copyOf(remoteFunctions.getOrDefault(alias, List.of()));
    }

    public boolean isRemote(String alias) {
        return remoteFunctions.containsKey(alias);
    }

    public Set<String> aliases() {
        return new TreeSet<>(functions.keySet());
    }

    public List<FunctionSignature> signatures(String alias) {
        List<FunctionSignature> signatures = new ArrayList<>();
        for (Binding binding : functions.getOrDefault(alias, List.of())) {
            signatures.add(binding.signature);
        }
        return signatures;
    }

    private void bind(String alias, FunctionSignature signature, VectorFunction function) {
        if (alias == null || alias.isEmpty()) {
            throw new IllegalArgumentException("Function alias must not be empty");
        }
        List<Binding> overloads = functions.computeIfAbsent(alias, k -> new CopyOnWriteArrayList<>());
        synchronized (overloads) {
            for (Binding existing : overloads) {
                if (existing.signature.getArgumentTypes().equals(signature.getArgumentTypes())) {
                    throw new IllegalArgumentException("Function " + alias + signature + " is already registered");
                }
            }
            overloads.add(new Binding(signature, function));
        }
    }

    private Binding resolve(String alias, List<ColumnType> argumentTypes) {
        List<Binding> overloads = functions.get(alias);
        if (overloads == null) {
            throw new IllegalArgumentException("Unknown function: " + alias);
        }
        for (Binding binding : overloads) {
            if (binding.signature.matches(argumentTypes)) {
                return binding;
            }
        }
        throw new IllegalArgumentException("No overload of " + alias + " accepts " + argumentTypes
                + ", available: " + signatures(alias));
    }

    private static final class Binding {
        private final FunctionSignature signature;
        private final VectorFunction function;

        private Binding(FunctionSignature signature, VectorFunction function) {
            this.signature = signature;
            this.function = function;
        }
    }
}
