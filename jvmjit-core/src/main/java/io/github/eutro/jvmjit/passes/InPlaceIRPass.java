package io.github.eutro.jvmjit.passes;

/**
 * A pass that checks or mutates its input and hands the same object on.
 *
 * @param <T> The type of the input.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }
}
