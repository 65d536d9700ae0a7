package io.github.eutro.jvmjit;

import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.classfile.ClassFileException;
import io.github.eutro.jvmjit.classfile.Method;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A cache of compiled methods, for a host that interprets methods it cannot compile.
 * <p>
 * Each method is compiled at most once. Methods that fail to compile are remembered as such,
 * and the caller is expected to fall back to interpreting them.
 * <p>
 * Methods are keyed by the {@link ClassFile} instance that declares them, so classes of the same
 * name from different loaders are cached separately. Compilation happens outside the map, so a slow
 * compilation only holds up callers waiting for the same method.
 */
public final class JitCache {
    private static final Logger LOGGER = Logger.getLogger(JitCache.class.getName());

    private final Compiler compiler;
    private final ConcurrentMap<MethodKey, CompletableFuture<Optional<Function>>> functions = new ConcurrentHashMap<>();
    private volatile boolean enabled = true;

    public JitCache(Compiler compiler) {
        this.compiler = compiler;
    }

    public Compiler getCompiler() {
        return compiler;
    }

    /**
     * Enable or disable compilation. While disabled, lookups of methods not yet compiled return empty
     * without compiling or caching anything.
     *
     * @param enabled Whether to compile methods.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Get the compiled form of a method, compiling it on this thread if it has not been yet.
     * If another thread is already compiling it, wait for that instead.
     *
     * @param classFile The class file declaring the method.
     * @param method    The method.
     * @return The compiled function, or empty if the method cannot be compiled.
     * @throws JitException.ClassFileFailure If the method's name cannot be resolved.
     */
    public Optional<Function> get(ClassFile classFile, Method method) {
        MethodKey key = key(classFile, method);
        if (!enabled) {
            return completed(key);
        }
        try {
            return lookup(key, classFile, method, Runnable::run).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            if (e.getCause() instanceof Error) throw (Error) e.getCause();
            throw e;
        }
    }

    /**
     * Get the compiled form of a method, compiling it on an executor if it has not been yet.
     * Requests for a method already being compiled share its future.
     *
     * @param classFile The class file declaring the method.
     * @param method    The method.
     * @param executor  The executor to compile on.
     * @return A future of the compiled function.
     * @throws JitException.ClassFileFailure If the method's name cannot be resolved.
     */
    public CompletableFuture<Optional<Function>> getAsync(ClassFile classFile, Method method, Executor executor) {
        MethodKey key = key(classFile, method);
        if (!enabled) {
            return CompletableFuture.completedFuture(completed(key));
        }
        return lookup(key, classFile, method, executor);
    }

    /**
     * Get the number of methods compilation has been attempted for.
     *
     * @return The size of this cache.
     */
    public int size() {
        return functions.size();
    }

    public void clear() {
        functions.clear();
    }

    private Optional<Function> completed(MethodKey key) {
        CompletableFuture<Optional<Function>> future = functions.get(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return future.join();
    }

    private CompletableFuture<Optional<Function>> lookup(MethodKey key, ClassFile classFile, Method method,
                                                         Executor executor) {
        CompletableFuture<Optional<Function>> existing = functions.get(key);
        if (existing != null) return existing;
        CompletableFuture<Optional<Function>> created = new CompletableFuture<>();
        existing = functions.putIfAbsent(key, created);
        if (existing != null) return existing;
        executor.execute(() -> {
            try {
                created.complete(tryCompile(key, classFile, method));
            } catch (RuntimeException | Error e) {
                // let a later request retry
                functions.remove(key, created);
                created.completeExceptionally(e);
            }
        });
        return created;
    }

    private Optional<Function> tryCompile(MethodKey key, ClassFile classFile, Method method) {
        try {
            return Optional.of(compiler.compile(classFile, method));
        } catch (JitException e) {
            if (e.isUnsupported()) {
                LOGGER.log(Level.FINE, "not compiling {0}: {1}", new Object[]{key, e.getMessage()});
            } else {
                LOGGER.log(Level.WARNING, "failed to compile " + key, e);
            }
            return Optional.empty();
        }
    }

    private static MethodKey key(ClassFile classFile, Method method) {
        try {
            return new MethodKey(classFile, classFile.getClassName() + "." + method.getName(classFile.getConstantPool())
                    + method.getDescriptor(classFile.getConstantPool()));
        } catch (ClassFileException e) {
            throw new JitException.ClassFileFailure(e);
        }
    }

    private static final class MethodKey {
        private final ClassFile classFile;
        private final String name;

        MethodKey(ClassFile classFile, String name) {
            this.classFile = classFile;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MethodKey)) return false;
            MethodKey that = (MethodKey) o;
            return classFile == that.classFile && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(classFile) + name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
