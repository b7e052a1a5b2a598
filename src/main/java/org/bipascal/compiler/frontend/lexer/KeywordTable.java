package org.bipascal.compiler.frontend.lexer;

import org.bipascal.compiler.api.KeywordDialect;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps reserved-word spellings to {@link Keyword} constants. Consulted after the
 * DFA accepts a word, to reclassify identifiers that are actually keywords.
 * Instances are immutable; the shared tables for each dialect are built once.
 */
public final class KeywordTable {

    private static final Map<KeywordDialect, KeywordTable> INSENSITIVE = build(false);
    private static final Map<KeywordDialect, KeywordTable> SENSITIVE = build(true);

    private final Map<String, Keyword> spellings;
    private final boolean caseSensitive;

    private KeywordTable(Map<String, Keyword> spellings, boolean caseSensitive) {
        this.spellings = Map.copyOf(spellings);
        this.caseSensitive = caseSensitive;
    }

    /**
     * @param dialect The spellings to recognize.
     * @param caseSensitive Whether lookups respect letter case.
     * @return The shared table.
     */
    public static KeywordTable forDialect(KeywordDialect dialect, boolean caseSensitive) {
        return (caseSensitive ? SENSITIVE : INSENSITIVE).get(dialect);
    }

    /**
     * @return The case-insensitive bilingual table.
     */
    public static KeywordTable bilingual() {
        return forDialect(KeywordDialect.BILINGUAL, false);
    }

    /**
     * Looks up a word.
     * @param word The lexeme accepted as a word by the DFA.
     * @return The keyword, or null if the word is an identifier.
     */
    public Keyword lookup(String word) {
        return spellings.get(caseSensitive ? word : word.toLowerCase(Locale.ROOT));
    }

    public boolean isKeyword(String word) {
        return lookup(word) != null;
    }

    public int size() {
        return spellings.size();
    }

    private static Map<KeywordDialect, KeywordTable> build(boolean caseSensitive) {
        Map<KeywordDialect, KeywordTable> tables = new EnumMap<>(KeywordDialect.class);
        for (KeywordDialect dialect : KeywordDialect.values()) {
            Map<String, Keyword> spellings = new HashMap<>();
            for (Keyword keyword : Keyword.values()) {
                if (dialect != KeywordDialect.INDONESIAN) {
                    spellings.put(keyword.english(), keyword);
                }
                if (dialect != KeywordDialect.ENGLISH) {
                    spellings.put(keyword.indonesian(), keyword);
                }
            }
            tables.put(dialect, new KeywordTable(spellings, caseSensitive));
        }
        return Map.copyOf(tables);
    }
}
