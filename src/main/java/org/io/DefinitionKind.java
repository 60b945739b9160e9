package org.io;

/**
 * The kinds of named objects a {@link DefinitionSource} can build.
 */
public enum DefinitionKind {
    LATTICE,
    FILTERED_LATTICE,
    MANY_LATTICE,
    WORLD,
    MODEL
}
