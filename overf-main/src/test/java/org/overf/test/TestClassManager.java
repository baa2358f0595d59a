package org.overf.test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Defines classes compiled from transformer output and invokes their static methods.
 * Each generated class gets a unique name so tests stay independent.
 */
public class TestClassManager {

    private static final String PACKAGE = "org.overf.generated";
    private static final AtomicInteger COUNTER = new AtomicInteger();

    /**
     * Compiles a class whose body is {@code members}, with {@code java.util.*} imported.
     */
    public Class<?> defineMembers(String members) {
        String simpleName = "Generated" + COUNTER.incrementAndGet();
        String source = "package " + PACKAGE + ";\n\n"
                        + "import java.util.*;\n\n"
                        + "public class " + simpleName + " {\n\n"
                        + members + "\n"
                        + "}\n";
        return define(PACKAGE + "." + simpleName, source);
    }

    /**
     * Compiles a complete source file declaring {@code className}.
     */
    public Class<?> define(String className, String source) {
        Map<String, byte[]> byteCode = InMemoryJavaCompiler.compile(className, source);
        GeneratedClassLoader loader = new GeneratedClassLoader(byteCode, getClass().getClassLoader());
        try {
            return loader.loadClass(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Compiled class " + className + " not found", e);
        }
    }

    /**
     * Invokes the public static method {@code name} of {@code type}. Exceptions thrown by the
     * method are rethrown unwrapped.
     */
    @SuppressWarnings("unchecked")
    public static <T> T invoke(Class<?> type, String name, Object... args) {
        Method method = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(name) && Modifier.isStatic(m.getModifiers()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No static method " + name + " on " + type));
        try {
            return (T) method.invoke(null, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException(e);
        }
    }

    private static final class GeneratedClassLoader extends ClassLoader {

        private final Map<String, byte[]> byteCode;

        GeneratedClassLoader(Map<String, byte[]> byteCode, ClassLoader parent) {
            super(parent);
            this.byteCode = byteCode;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = byteCode.get(name);
            if (bytes == null) {
                throw new ClassNotFoundException(name);
            }
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
