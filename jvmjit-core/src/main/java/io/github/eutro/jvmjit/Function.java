package io.github.eutro.jvmjit;

import java.lang.invoke.MethodHandle;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A compiled method.
 * <p>
 * Functions hold no mutable state, so they may be executed any number of times, from any number of threads.
 */
public final class Function {
    private final String name;
    private final Signature signature;
    private final MethodHandle handle;

    Function(String name, Signature signature, MethodHandle handle) {
        this.name = name;
        this.signature = signature;
        this.handle = handle;
    }

    /**
     * Get the name of the compiled method, as {@code class.namedescriptor}.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    public Signature getSignature() {
        return signature;
    }

    /**
     * Execute the function.
     *
     * @param args The arguments, which must match the signature.
     * @return The returned value, or empty if the method returns void.
     * @throws JitException.InvalidArgumentCount If the number of arguments is wrong.
     * @throws JitException.InvalidValue         If an argument is of the wrong kind.
     * @throws JitException.Trap                 If the compiled code trapped.
     */
    public Optional<Value> execute(List<Value> args) {
        List<Kind> kinds = signature.getParameterKinds();
        if (args.size() != kinds.size()) {
            throw new JitException.InvalidArgumentCount(kinds.size(), args.size());
        }
        Object[] javaArgs = new Object[args.size()];
        for (int i = 0; i < javaArgs.length; i++) {
            Value arg = args.get(i);
            if (arg.getKind() != kinds.get(i)) {
                throw new JitException.InvalidValue(kinds.get(i).toString(), arg.getKind().toString());
            }
            javaArgs[i] = arg.toJava();
        }

        Object result;
        try {
            result = handle.invokeWithArguments(javaArgs);
        } catch (RuntimeException e) {
            throw new JitException.Trap(e);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new JitException.Trap(t);
        }

        Kind returnKind = signature.getReturnKind();
        return returnKind == null
                ? Optional.empty()
                : Optional.of(Value.fromJava(returnKind, result));
    }

    public Optional<Value> execute(Value... args) {
        return execute(Arrays.asList(args));
    }

    @Override
    public String toString() {
        return "Function(" + name + ")";
    }
}
