package org.carball.querycollector.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlPatternNormalizerTest {

    @Test
    void shouldProduceSameShapeForDifferentIntegerLiterals() {
        String first = SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id = 1");
        String second = SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id = 2");

        assertThat(first).isEqualTo(second);
        assertThat(first).isEqualTo("SELECT * FROM t WHERE id = ?");
    }

    @Test
    void shouldCollapseWhitespace() {
        String normalized = SqlPatternNormalizer.normalize("  SELECT *\n\tFROM   t\r\nWHERE x = ?  ");

        assertThat(normalized).isEqualTo("SELECT * FROM t WHERE x = ?");
    }

    @Test
    void shouldReplaceInLists() {
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id IN (1, 2, 3)"))
                .isEqualTo("SELECT * FROM t WHERE id IN (?)");
        assertThat(SqlPatternNormalizer.normalize("select * from t where id in(4,5)"))
                .isEqualTo("select * from t where id IN (?)");
    }

    @Test
    void shouldNotTreatJoinAsInList() {
        String sql = "SELECT * FROM a JOIN (SELECT 1) b ON 1 = 1";

        assertThat(SqlPatternNormalizer.normalize(sql)).isEqualTo("SELECT * FROM a JOIN (SELECT 1) b ON 1 = ?");
    }

    @Test
    void shouldReplaceStringLiteralsAndParameterMarkers() {
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE name = 'alice'"))
                .isEqualTo(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE name = 'bob'"));
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE name = 'o''brien'"))
                .isEqualTo("SELECT * FROM t WHERE name = ?");
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE a = %s AND b = $2"))
                .isEqualTo("SELECT * FROM t WHERE a = ? AND b = ?");
    }

    @Test
    void shouldKeepLiteralsOutsideEqualityComparisons() {
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE x > 5 LIMIT 10"))
                .isEqualTo("SELECT * FROM t WHERE x > 5 LIMIT 10");
    }

    @Test
    void shouldDistinguishDifferentStructures() {
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id = 1"))
                .isNotEqualTo(SqlPatternNormalizer.normalize("SELECT * FROM u WHERE id = 1"));
    }

    @Test
    void shouldNormalizeNullToEmpty() {
        assertThat(SqlPatternNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldReplaceVeryLongStringLiterals() {
        String document = "{\"body\": \"" + "x".repeat(50_000) + "\"}";

        String normalized = SqlPatternNormalizer.normalize("UPDATE docs SET body = '" + document + "' WHERE id = 1");

        assertThat(normalized).isEqualTo("UPDATE docs SET body = ? WHERE id = ?");
    }

    @Test
    void shouldReplaceLongLiteralsWithManyEscapedQuotes() {
        String text = "it''s ".repeat(2_000);

        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM notes WHERE text = '" + text + "'"))
                .isEqualTo("SELECT * FROM notes WHERE text = ?");
    }

    @Test
    void shouldReplaceLargeInLists() {
        StringBuilder ids = new StringBuilder("1");
        for (int i = 2; i <= 20_000; i++) {
            ids.append(", ").append(i);
        }

        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id IN (" + ids + ")"))
                .isEqualTo("SELECT * FROM t WHERE id IN (?)");
    }

    @Test
    void shouldLeaveMalformedLiteralsInPlace() {
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE name = 'unterminated"))
                .isEqualTo("SELECT * FROM t WHERE name = 'unterminated");
        assertThat(SqlPatternNormalizer.normalize("SELECT * FROM t WHERE id IN ( AND x = = ="))
                .isEqualTo("SELECT * FROM t WHERE id IN ( AND x = = =");
        assertThat(SqlPatternNormalizer.normalize("\u0000 = '\u0001' \uFFFF"))
                .isEqualTo("\u0000 = ? \uFFFF");
    }

    @Test
    void shouldCollapseLargeWhitespaceRuns() {
        String sql = "SELECT" + " \n\t".repeat(100_000) + "1";

        assertThat(SqlPatternNormalizer.normalize(sql)).isEqualTo("SELECT 1");
        assertThat(SqlPatternNormalizer.normalize(" \n\t ")).isEmpty();
    }
}
