package io.github.eutro.jvmjit.backend;

import io.github.eutro.jvmjit.JitException;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.ClassTooLargeException;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.tree.ClassNode;

import java.io.File;
import java.io.IOException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes generated classes and defines them as hidden classes in this package, using
 * {@code defineHiddenClass} of {@link MethodHandles.Lookup}.
 * <p>
 * Hidden classes are unloaded once they, and the method handles into them, become unreachable.
 */
public final class ClassDefiner {
    private static final Logger LOGGER = Logger.getLogger(ClassDefiner.class.getName());
    private static final String PACKAGE = ClassDefiner.class.getPackage().getName().replace('.', '/');

    private static ClassDefiner instance;
    private static boolean cachedFailure = false;

    private final MethodHandle defineHiddenClass;

    private ClassDefiner(MethodHandle defineHiddenClass) {
        this.defineHiddenClass = defineHiddenClass;
    }

    /**
     * Get the class definer, if the host JVM supports hidden classes.
     *
     * @return The definer, or null if hidden classes are not supported.
     */
    public static @Nullable ClassDefiner tryGet() {
        if (cachedFailure) return null;
        if (instance != null) return instance;
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            Class<?> classOptionClass = Class.forName("java.lang.invoke.MethodHandles$Lookup$ClassOption");
            Object emptyClassOptions = Array.newInstance(classOptionClass, 0);
            MethodHandle defineHiddenClass = lookup.findVirtual(MethodHandles.Lookup.class, "defineHiddenClass",
                    MethodType.methodType(
                            MethodHandles.Lookup.class,
                            byte[].class,
                            boolean.class,
                            emptyClassOptions.getClass()
                    ));
            defineHiddenClass = defineHiddenClass.bindTo(lookup);
            defineHiddenClass = MethodHandles.insertArguments(defineHiddenClass, 1,
                    false, emptyClassOptions);
            return instance = new ClassDefiner(defineHiddenClass);
        } catch (ClassNotFoundException | NoSuchMethodException | IllegalAccessException e) {
            LOGGER.log(Level.FINE, "hidden classes are not available", e);
            cachedFailure = true;
            return null;
        }
    }

    /**
     * Get the internal name for a class to be defined by this definer.
     *
     * @param simpleName The simple name of the class.
     * @return The internal name.
     */
    public static String className(String simpleName) {
        return PACKAGE + "/" + simpleName;
    }

    /**
     * Write a class, computing its frames.
     *
     * @param node The class.
     * @return The class file bytes.
     * @throws JitException.CodegenFailure If the class cannot be written.
     */
    public static byte[] toBytes(ClassNode node) {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        try {
            node.accept(cw);
            return cw.toByteArray();
        } catch (MethodTooLargeException | ClassTooLargeException e) {
            throw new JitException.CodegenFailure("generated code is too large", e);
        } catch (RuntimeException e) {
            throw new JitException.CodegenFailure("failed to write class " + node.name, e);
        }
    }

    /**
     * Write class file bytes to a debug directory.
     * Failing to write them is logged, and does not stop compilation.
     *
     * @param debugOutput The directory.
     * @param fileName    The name of the file, without extension.
     * @param bytes       The class file bytes.
     */
    public static void dump(File debugOutput, String fileName, byte[] bytes) {
        File file = new File(debugOutput, fileName.replaceAll("[^A-Za-z0-9_$.-]", "_") + ".class");
        try {
            Files.createDirectories(debugOutput.toPath());
            Files.write(file.toPath(), bytes);
            LOGGER.log(Level.FINER, "wrote {0}", file);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "failed to write " + file, e);
        }
    }

    /**
     * Define a hidden class.
     *
     * @param bytes The class file bytes.
     * @return A lookup with full access to the class.
     * @throws JitException.ModuleFailure If the class cannot be defined.
     */
    public MethodHandles.Lookup define(byte[] bytes) {
        try {
            return (MethodHandles.Lookup) defineHiddenClass.invokeExact(bytes);
        } catch (LinkageError | IllegalAccessException | IllegalArgumentException e) {
            throw new JitException.ModuleFailure("failed to define generated class", e);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new JitException.ModuleFailure("failed to define generated class", t);
        }
    }
}
