package org.bipascal.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the Pascal-S frontend: lexing and parsing of one source text.
 */
public interface IFrontend {

    /**
     * Tokenizes and parses the given source code. Source errors are returned as
     * diagnostics, never thrown.
     *
     * @param source The complete source text.
     * @param fileName A logical file name, used in diagnostics.
     * @return The tokens, the parse result and all diagnostics.
     */
    FrontendResult analyze(String source, String fileName);

    /**
     * Analyzes a UTF-8 source file.
     * @param sourceFile The path to the source file.
     * @return The tokens, the parse result and all diagnostics.
     * @throws IOException if the file cannot be read.
     */
    default FrontendResult analyze(Path sourceFile) throws IOException {
        return analyze(Files.readString(sourceFile, StandardCharsets.UTF_8), sourceFile.toString());
    }
}
