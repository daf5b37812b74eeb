package com.quire.parameterize.translate;

/**
 * A parameter declared in a notebook's parameters cell.
 *
 * @param name         variable name
 * @param inferredType type annotation or type comment, or null when none was written
 * @param defaultValue default value literal as written
 * @param help         trailing comment text, empty when none
 */
public record ParameterDeclaration(String name, String inferredType, String defaultValue, String help) {
}
