package org.tapline.compiler;

/**
 * Argument of the {@code childCompiler} compilation hook.
 *
 * @param childCompiler the freshly created child.
 * @param name          the name it was created with.
 * @param index         its spawn index among siblings of the same name.
 */
public record ChildCompilerEvent(Compiler childCompiler, String name, int index) {
}
