package com.telemetra.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SqlTokenizerTest {

    @Test
    void literalsAndCommentsHideKeywords() {
        List<SqlToken> tokens = SqlTokenizer.tokenize(
                "SELECT 'it''s; DROP' AS s, E'\\' DELETE', $$ INSERT $$, $x$ ; $x$ -- UPDATE\n/* a /* nested */ TRUNCATE */ FROM t");

        assertThat(tokens)
                .filteredOn(t -> t.type() == SqlToken.Type.WORD)
                .extracting(SqlToken::text)
                .containsExactly("SELECT", "AS", "s", "FROM", "t");
        assertThat(tokens).filteredOn(t -> t.type() == SqlToken.Type.STRING).hasSize(4);
        assertThat(tokens).noneMatch(t -> t.isSymbol(";"));
    }

    @Test
    void quotedIdentifiersAreUnescaped() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT \"Org \"\"Id\"\" \" FROM t");

        assertThat(tokens.get(1).type()).isEqualTo(SqlToken.Type.QUOTED_IDENTIFIER);
        assertThat(tokens.get(1).text()).isEqualTo("Org \"Id\" ");
    }

    @Test
    void bindMarkersAreParameters() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT * FROM t WHERE a = ? AND b = $12");

        assertThat(tokens)
                .filteredOn(t -> t.type() == SqlToken.Type.PARAMETER)
                .extracting(SqlToken::text)
                .containsExactly("?", "$12");
    }

    @Test
    void numbersAndPositionsAreTracked() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT 1.5e3;");

        assertThat(tokens.get(1)).isEqualTo(new SqlToken(SqlToken.Type.NUMBER, "1.5e3", 7));
        assertThat(tokens.get(2)).isEqualTo(new SqlToken(SqlToken.Type.SYMBOL, ";", 12));
    }

    @Test
    void unterminatedConstructsAreRejected() {
        assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT 'open")).isInstanceOf(QueryRejectedException.class);
        assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT 1 /* open")).isInstanceOf(QueryRejectedException.class);
        assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT \"open")).isInstanceOf(QueryRejectedException.class);
        assertThatThrownBy(() -> SqlTokenizer.tokenize("SELECT $a$ open")).isInstanceOf(QueryRejectedException.class);
    }
}
