package org.subby.args;

/** Something that can be declared among a {@link CommandSpec command's} parameters: a {@link ParameterSpec} or a {@link GroupSpec} */
public interface ParameterElement {
}
