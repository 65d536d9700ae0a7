package io.github.eutro.jvmjit;

import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.test.Utils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.objectweb.asm.Opcodes.*;

public class JitCacheTest {
    private static ClassFile square() {
        return Utils.staticMethod("(I)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(DUP);
            mv.visitInsn(IMUL);
            mv.visitInsn(IRETURN);
        });
    }

    @Test
    void compilesOnce() {
        Compiler compiler = Utils.newCompiler();
        JitCache cache = new JitCache(compiler);
        assertSame(compiler, cache.getCompiler());
        ClassFile cf = square();
        Optional<Function> first = cache.get(cf, cf.getMethods().get(0));
        Optional<Function> second = cache.get(cf, cf.getMethods().get(0));
        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        assertEquals(1, cache.size());
        assertEquals(Optional.of(Value.i32(81)), first.get().execute(Value.i32(9)));
    }

    @Test
    void failuresAreRemembered() {
        JitCache cache = new JitCache(Utils.newCompiler());
        ClassFile unsupported = Utils.staticMethod("()V", mv -> {
            mv.visitMethodInsn(INVOKESTATIC, "java/lang/System", "gc", "()V", false);
            mv.visitInsn(RETURN);
        });
        ClassFile broken = Utils.staticMethod("()I", mv -> {
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.empty(), cache.get(unsupported, unsupported.getMethods().get(0)));
        assertEquals(Optional.empty(), cache.get(broken, broken.getMethods().get(0)));
        assertEquals(Optional.empty(), cache.get(broken, broken.getMethods().get(0)));
        // both classes are named Test and their methods test, but the descriptors differ
        assertEquals(2, cache.size());
    }

    @Test
    void disabled() {
        JitCache cache = new JitCache(Utils.newCompiler());
        ClassFile cf = square();
        cache.setEnabled(false);
        assertFalse(cache.isEnabled());
        assertEquals(Optional.empty(), cache.get(cf, cf.getMethods().get(0)));
        assertEquals(0, cache.size());

        cache.setEnabled(true);
        assertTrue(cache.get(cf, cf.getMethods().get(0)).isPresent());
        cache.setEnabled(false);
        assertTrue(cache.get(cf, cf.getMethods().get(0)).isPresent());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void asyncCompilation() throws Exception {
        JitCache cache = new JitCache(Utils.newCompiler());
        ClassFile cf = square();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<?>[] futures = new CompletableFuture<?>[16];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = cache.getAsync(cf, cf.getMethods().get(0), executor);
            }
            CompletableFuture.allOf(futures).get();
            Function first = cache.get(cf, cf.getMethods().get(0)).orElseThrow(AssertionError::new);
            for (CompletableFuture<?> future : futures) {
                assertSame(first, ((Optional<?>) future.get()).orElseThrow(AssertionError::new));
            }
        } finally {
            executor.shutdown();
        }
        assertEquals(1, cache.size());
    }

    @Test
    void classFilesOfTheSameNameAreCachedSeparately() {
        JitCache cache = new JitCache(Utils.newCompiler());
        ClassFile square = square();
        ClassFile negate = Utils.staticMethod("(I)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(INEG);
            mv.visitInsn(IRETURN);
        });
        Function f = cache.get(square, square.getMethods().get(0)).orElseThrow(AssertionError::new);
        Function g = cache.get(negate, negate.getMethods().get(0)).orElseThrow(AssertionError::new);
        assertEquals(f.getName(), g.getName());
        assertEquals(Optional.of(Value.i32(16)), f.execute(Value.i32(4)));
        assertEquals(Optional.of(Value.i32(-4)), g.execute(Value.i32(4)));
        assertEquals(2, cache.size());
    }

    @Test
    void pendingCompilationDoesNotBlockOtherMethods() throws Exception {
        JitCache cache = new JitCache(Utils.newCompiler());
        List<Runnable> queued = new ArrayList<>();
        ClassFile slow = square();
        CompletableFuture<Optional<Function>> pending = cache.getAsync(slow, slow.getMethods().get(0), queued::add);
        assertSame(pending, cache.getAsync(slow, slow.getMethods().get(0), queued::add));
        assertEquals(1, queued.size());
        assertFalse(pending.isDone());

        ClassFile other = Utils.staticMethod("()I", mv -> {
            mv.visitInsn(ICONST_5);
            mv.visitInsn(IRETURN);
        });
        Function f = cache.get(other, other.getMethods().get(0)).orElseThrow(AssertionError::new);
        assertEquals(Optional.of(Value.i32(5)), f.execute());
        assertFalse(pending.isDone());

        queued.get(0).run();
        Function g = pending.get().orElseThrow(AssertionError::new);
        assertEquals(Optional.of(Value.i32(49)), g.execute(Value.i32(7)));
        assertSame(g, cache.get(slow, slow.getMethods().get(0)).orElseThrow(AssertionError::new));
    }

    @Test
    void disabledLookupsIgnorePendingCompilations() {
        JitCache cache = new JitCache(Utils.newCompiler());
        List<Runnable> queued = new ArrayList<>();
        ClassFile cf = square();
        cache.getAsync(cf, cf.getMethods().get(0), queued::add);
        cache.setEnabled(false);
        assertEquals(Optional.empty(), cache.get(cf, cf.getMethods().get(0)));
        queued.get(0).run();
        assertTrue(cache.get(cf, cf.getMethods().get(0)).isPresent());
    }
}
