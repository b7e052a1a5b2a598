package org.bipascal.compiler.frontend.parser;

import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SyntaxTreePrinter}.
 */
@Tag("unit")
class SyntaxTreePrinterTest {

    private static String printed(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ParseResult result = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
        return new SyntaxTreePrinter().print(result.program());
    }

    @Test
    void printsOneNodePerLineIndentedByDepth() {
        String tree = printed("program demo; var n: integer; begin n := -n + 1 end.");

        assertThat(tree).isEqualTo(String.join("\n",
                "Program demo",
                "  Var n",
                "    NamedType integer",
                "  Block",
                "    Assign",
                "      Variable n",
                "      Binary ADD",
                "        Unary NEGATE",
                "          Variable n",
                "        Literal 1",
                ""));
    }

    @Test
    void printsEnglishAndIndonesianProgramsIdentically() {
        String english = printed("program p; begin if a and not b then x := 1 else while x > 0 do x := x div 2 end.");
        String indonesian = printed("program p; mulai jika a dan tidak b maka x := 1 selain_itu selama x > 0 lakukan x := x bagi 2 selesai.");

        assertThat(indonesian).isEqualTo(english);
        assertThat(english).contains("If (else)", "Binary AND", "Unary NOT", "While", "Binary INT_DIVIDE");
    }

    @Test
    void marksMissingNamesInBestEffortTrees() {
        String tree = printed("begin end.");

        assertThat(tree).startsWith("Program <missing>\n  Block");
    }
}
