package de.upb.sse.casegen.analysis;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.LocalVariableNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.ParameterNode;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recovers source-level parameter names from class files. Reflection only reports real
 * names for code compiled with {@code -parameters}; the bytecode usually still carries them
 * in the {@code LocalVariableTable}.
 */
public class ParameterNameReader {
    private static final Logger logger = Logger.getLogger(ParameterNameReader.class.getName());

    private final Map<Class<?>, ClassNode> nodes = new HashMap<>();

    public List<String> parameterNames(Executable executable) {
        Parameter[] parameters = executable.getParameters();
        List<String> reflective = new ArrayList<>(parameters.length);
        boolean allPresent = true;
        for (Parameter p : parameters) {
            reflective.add(p.getName());
            allPresent &= p.isNamePresent();
        }
        if (allPresent || parameters.length == 0) return reflective;

        List<String> fromBytecode = readFromBytecode(executable, parameters.length);
        return fromBytecode != null ? fromBytecode : reflective;
    }

    private List<String> readFromBytecode(Executable executable, int count) {
        ClassNode node = classNode(executable.getDeclaringClass());
        if (node == null) return null;

        String name = executable instanceof Constructor<?> ? "<init>" : executable.getName();
        String descriptor = executable instanceof Constructor<?>
                ? Type.getConstructorDescriptor((Constructor<?>) executable)
                : Type.getMethodDescriptor((Method) executable);

        for (MethodNode method : node.methods) {
            if (!method.name.equals(name) || !method.desc.equals(descriptor)) continue;

            if (method.parameters != null && method.parameters.size() == count) {
                List<String> names = new ArrayList<>(count);
                for (ParameterNode p : method.parameters) names.add(p.name);
                if (!names.contains(null)) return names;
            }
            return fromLocalVariables(method, Modifier.isStatic(executable.getModifiers()), count);
        }
        return null;
    }

    private List<String> fromLocalVariables(MethodNode method, boolean isStatic, int count) {
        if (method.localVariables == null || method.localVariables.isEmpty()) return null;

        Type[] argumentTypes = Type.getArgumentTypes(method.desc);
        if (argumentTypes.length != count) return null;

        List<String> names = new ArrayList<>(count);
        int slot = isStatic ? 0 : 1;
        for (Type argumentType : argumentTypes) {
            String found = null;
            for (LocalVariableNode local : method.localVariables) {
                if (local.index == slot) {
                    found = local.name;
                    break;
                }
            }
            if (found == null) return null;
            names.add(found);
            slot += argumentType.getSize();
        }
        return names;
    }

    private ClassNode classNode(Class<?> cls) {
        if (nodes.containsKey(cls)) return nodes.get(cls);

        ClassNode node = null;
        String resource = cls.getName().substring(cls.getName().lastIndexOf('.') + 1) + ".class";
        try (InputStream in = cls.getResourceAsStream(resource)) {
            if (in != null) {
                node = new ClassNode();
                new ClassReader(in).accept(node, ClassReader.SKIP_FRAMES);
            }
        } catch (IOException | RuntimeException e) {
            logger.log(Level.FINE, "No bytecode for " + cls.getName() + ", keeping reflective parameter names", e);
            node = null;
        }
        nodes.put(cls, node);
        return node;
    }
}
