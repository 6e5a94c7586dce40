package eu.okaeri.owsql.provenance;

import lombok.NonNull;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * String constants compiled into a class: every {@code ldc} operand of its methods
 * and every constant value of its fields. Constant expressions ({@code "a" + "b"},
 * text blocks, {@code static final} constants of other classes) are folded by
 * javac and show up here; values concatenated at runtime do not.
 */
final class ClassConstants {

    private static final Logger LOGGER = Logger.getLogger(ClassConstants.class.getSimpleName());

    private static final ClassValue<Set<String>> CACHE = new ClassValue<Set<String>>() {
        @Override
        protected Set<String> computeValue(Class<?> type) {
            return read(type);
        }
    };

    private ClassConstants() {
    }

    static Set<String> of(@NonNull Class<?> type) {
        return CACHE.get(type);
    }

    private static Set<String> read(Class<?> type) {

        String resource = type.getName().replace('.', '/') + ".class";
        ClassLoader loader = (type.getClassLoader() == null) ? ClassLoader.getSystemClassLoader() : type.getClassLoader();

        try (InputStream stream = loader.getResourceAsStream(resource)) {
            if (stream == null) {
                LOGGER.warning("Class file of " + type.getName() + " is not readable, its string constants are unknown");
                return Collections.emptySet();
            }
            Set<String> constants = new HashSet<>();
            new ClassReader(stream).accept(new Collector(constants), ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
            return Collections.unmodifiableSet(constants);
        } catch (IOException | RuntimeException exception) {
            LOGGER.log(Level.WARNING, "Cannot read class file of " + type.getName(), exception);
            return Collections.emptySet();
        }
    }

    private static final class Collector extends ClassVisitor {

        private final Set<String> constants;

        private Collector(Set<String> constants) {
            super(Opcodes.ASM9);
            this.constants = constants;
        }

        @Override
        public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
            if (value instanceof String) {
                this.constants.add((String) value);
            }
            return null;
        }

        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
            return new MethodVisitor(Opcodes.ASM9) {
                @Override
                public void visitLdcInsn(Object value) {
                    if (value instanceof String) {
                        Collector.this.constants.add((String) value);
                    }
                }
            };
        }
    }
}
