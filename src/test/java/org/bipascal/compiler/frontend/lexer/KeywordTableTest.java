package org.bipascal.compiler.frontend.lexer;

import org.bipascal.compiler.api.KeywordDialect;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeywordTable}.
 */
@Tag("unit")
class KeywordTableTest {

    @Test
    void bilingualTableMapsBothSpellingsToTheSameKeyword() {
        KeywordTable table = KeywordTable.bilingual();

        assertThat(table.lookup("if")).isEqualTo(Keyword.IF);
        assertThat(table.lookup("jika")).isEqualTo(Keyword.IF);
        assertThat(table.lookup("selain_itu")).isEqualTo(Keyword.ELSE);
        assertThat(table.lookup("turun_ke")).isEqualTo(Keyword.DOWNTO);
        assertThat(table.lookup("variabel")).isEqualTo(Keyword.VAR);
    }

    @Test
    void bilingualTableHoldsEverySpellingOnce() {
        // "mod" is spelled the same in both languages.
        assertThat(KeywordTable.bilingual().size()).isEqualTo(Keyword.values().length * 2 - 1);
    }

    @Test
    void lookupIgnoresCaseByDefault() {
        KeywordTable table = KeywordTable.bilingual();

        assertThat(table.lookup("BEGIN")).isEqualTo(Keyword.BEGIN);
        assertThat(table.lookup("Mulai")).isEqualTo(Keyword.BEGIN);
    }

    @Test
    void caseSensitiveTableOnlyMatchesLowerCase() {
        KeywordTable table = KeywordTable.forDialect(KeywordDialect.BILINGUAL, true);

        assertThat(table.lookup("begin")).isEqualTo(Keyword.BEGIN);
        assertThat(table.lookup("BEGIN")).isNull();
    }

    @Test
    void singleLanguageDialectsRejectTheOtherLanguage() {
        KeywordTable english = KeywordTable.forDialect(KeywordDialect.ENGLISH, false);
        KeywordTable indonesian = KeywordTable.forDialect(KeywordDialect.INDONESIAN, false);

        assertThat(english.isKeyword("while")).isTrue();
        assertThat(english.isKeyword("selama")).isFalse();
        assertThat(indonesian.isKeyword("selama")).isTrue();
        assertThat(indonesian.isKeyword("while")).isFalse();
        assertThat(indonesian.isKeyword("mod")).isTrue();
    }

    @Test
    void typeNamesAndBuiltinsAreNotKeywords() {
        KeywordTable table = KeywordTable.bilingual();

        assertThat(table.isKeyword("integer")).isFalse();
        assertThat(table.isKeyword("writeln")).isFalse();
        assertThat(table.isKeyword("true")).isFalse();
        assertThat(table.isKeyword("ifx")).isFalse();
    }
}
