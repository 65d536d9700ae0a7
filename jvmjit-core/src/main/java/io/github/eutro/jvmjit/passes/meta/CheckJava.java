package io.github.eutro.jvmjit.passes.meta;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.passes.InPlaceIRPass;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicVerifier;
import org.objectweb.asm.util.CheckClassAdapter;

/**
 * A pass which checks the validity of generated Java code
 * using {@link CheckClassAdapter}, including its data flow.
 * <p>
 * The maximum stack size and locals of each method are computed first,
 * since generated methods leave them for the class writer.
 *
 * @see CheckClassAdapter
 */
public class CheckJava implements InPlaceIRPass<ClassNode> {
    /**
     * A singleton instance of this class.
     */
    public static final CheckJava INSTANCE = new CheckJava();

    @Override
    public void runInPlace(ClassNode classNode) {
        for (MethodNode method : classNode.methods) {
            try {
                new Analyzer<>(new BasicVerifier()).analyzeAndComputeMaxs(classNode.name, method);
            } catch (AnalyzerException e) {
                throw new JitException.CodegenFailure("generated method " + method.name + " does not verify", e);
            }
        }
        classNode.accept(new CheckClassAdapter(null));
    }
}
