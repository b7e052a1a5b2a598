package org.bipascal.compiler;

import org.bipascal.compiler.api.FrontendResult;
import org.bipascal.compiler.diagnostics.Diagnostic;
import org.bipascal.compiler.frontend.CompilerPhase;
import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.lexer.TokenType;
import org.bipascal.compiler.frontend.parser.SyntaxErrorKind;
import org.bipascal.compiler.frontend.parser.SyntaxTreePrinter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the whole frontend over the programs under {@code src/test/resources/programs}.
 */
@Tag("unit")
class FrontendTest {

    private final Frontend frontend = new Frontend();

    private static String resource(String name) throws IOException {
        try (InputStream in = FrontendTest.class.getResourceAsStream("/programs/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void wellFormedProgramsHaveNoDiagnostics() throws IOException {
        for (String name : List.of("inventory_en.pas", "inventory_id.pas")) {
            FrontendResult result = frontend.analyze(resource(name), name);

            assertThat(result.diagnostics()).as(name).isEmpty();
            assertThat(result.tokens()).as(name).noneMatch(t -> t.type() == TokenType.INVALID);
            assertThat(result.tokens()).as(name).filteredOn(t -> t.type() == TokenType.END_OF_FILE).hasSize(1);
            assertThat(result.tokens().get(result.tokens().size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
            assertThat(result.parse().program().declarations()).as(name).hasSize(10);
        }
    }

    @Test
    void bothLanguagesProduceTheSameTree() throws IOException {
        SyntaxTreePrinter printer = new SyntaxTreePrinter();

        String english = printer.print(frontend.analyze(resource("inventory_en.pas"), "en").parse().program());
        String indonesian = printer.print(frontend.analyze(resource("inventory_id.pas"), "id").parse().program());

        assertThat(indonesian).isEqualTo(english);
    }

    @Test
    void tokenPositionsPointBackIntoTheSource() throws IOException {
        String source = resource("inventory_id.pas");

        FrontendResult result = frontend.analyze(source, "inventory_id.pas");

        for (Token token : result.tokens()) {
            int offset = token.position().offset();
            assertThat(source.substring(offset, offset + token.text().length())).isEqualTo(token.text());
        }
    }

    @Test
    void reportsEveryIndependentSyntaxError() throws IOException {
        FrontendResult result = frontend.analyze(resource("syntax_errors.pas"), "syntax_errors.pas");

        assertThat(result.parse().errors()).extracting(e -> e.kind()).containsExactly(
                SyntaxErrorKind.MALFORMED_DECLARATION, SyntaxErrorKind.UNEXPECTED_TOKEN, SyntaxErrorKind.UNEXPECTED_TOKEN);
        assertThat(result.parse().errors()).extracting(e -> e.position().line()).containsExactly(5, 8, 10);
        assertThat(result.diagnostics()).allSatisfy(d -> {
            assertThat(d.phase()).isEqualTo(CompilerPhase.PARSING);
            assertThat(d.fileName()).isEqualTo("syntax_errors.pas");
        });
        assertThat(result.parse().program().block().statements()).hasSize(4);
    }

    @Test
    void lexicalAndSyntaxErrorsAreReportedTogether() throws IOException {
        FrontendResult result = frontend.analyze(resource("unterminated_comment.pas"), "open.pas");

        assertThat(result.tokens()).filteredOn(t -> t.type() == TokenType.INVALID).hasSize(1);
        assertThat(result.diagnostics()).extracting(Diagnostic::phase)
                .containsExactly(CompilerPhase.LEXING, CompilerPhase.PARSING);
        assertThat(result.parse().errors()).singleElement()
                .extracting(e -> e.kind()).isEqualTo(SyntaxErrorKind.UNCLOSED_BLOCK);
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.errorCount()).isEqualTo(2);
    }

    @Test
    void analyzingAMissingFileThrows() {
        assertThatThrownBy(() -> frontend.analyze(Path.of("does-not-exist.pas")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void eachAnalysisStartsWithFreshDiagnostics() {
        frontend.analyze("x", "first.pas");

        FrontendResult second = frontend.analyze("program ok; begin end.", "second.pas");

        assertThat(second.diagnostics()).isEmpty();
    }
}
