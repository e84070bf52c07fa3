package io.github.eutro.exprgen.core.runtime;

/**
 * A class loader which defines generated classes from their bytes.
 */
public class DefiningClassLoader extends ClassLoader {
    public DefiningClassLoader(ClassLoader parent) {
        super(parent);
    }

    /**
     * Define a class.
     *
     * @param internalName The internal name of the class.
     * @param bytes        The class file.
     * @return The defined class.
     */
    public Class<?> define(String internalName, byte[] bytes) {
        return defineClass(internalName.replace('/', '.'), bytes, 0, bytes.length);
    }
}
