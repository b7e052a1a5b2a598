package org.bipascal.compiler.frontend;

/**
 * The phases of the frontend. Every diagnostic records the phase that raised it.
 */
public enum CompilerPhase {
    /**
     * Phase 1: Turns source text into tokens.
     */
    LEXING,

    /**
     * Phase 2: Builds the syntax tree from the tokens.
     */
    PARSING
}
