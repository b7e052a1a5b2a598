package org.bipascal.compiler.frontend.lexer;

/**
 * The reserved words of the dialect. Each keyword has an English and an
 * Indonesian spelling; both lex to the same constant.
 */
public enum Keyword {
    PROGRAM("program", "program"),
    VAR("var", "variabel"),
    CONST("const", "konstanta"),
    TYPE("type", "tipe"),
    BEGIN("begin", "mulai"),
    END("end", "selesai"),
    IF("if", "jika"),
    THEN("then", "maka"),
    ELSE("else", "selain_itu"),
    WHILE("while", "selama"),
    DO("do", "lakukan"),
    FOR("for", "untuk"),
    TO("to", "ke"),
    DOWNTO("downto", "turun_ke"),
    ARRAY("array", "larik"),
    OF("of", "dari"),
    PROCEDURE("procedure", "prosedur"),
    FUNCTION("function", "fungsi"),
    AND("and", "dan"),
    OR("or", "atau"),
    NOT("not", "tidak"),
    DIV("div", "bagi"),
    MOD("mod", "mod");

    private final String english;
    private final String indonesian;

    Keyword(String english, String indonesian) {
        this.english = english;
        this.indonesian = indonesian;
    }

    /**
     * @return The English spelling, used as the canonical form.
     */
    public String english() {
        return english;
    }

    public String indonesian() {
        return indonesian;
    }

    @Override
    public String toString() {
        return english.equals(indonesian) ? english : english + "/" + indonesian;
    }
}
