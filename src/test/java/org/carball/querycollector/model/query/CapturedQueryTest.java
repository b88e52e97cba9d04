package org.carball.querycollector.model.query;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CapturedQueryTest {

    @Test
    void shouldExposeErrorOnlyForFailures() {
        SQLException error = new SQLException("boom");

        CapturedQuery failed = CapturedQuery.builder()
                .sql("SELECT 1")
                .timestamp(Instant.now())
                .outcome(QueryOutcome.failure(error))
                .build();
        CapturedQuery succeeded = CapturedQuery.builder()
                .sql("SELECT 1")
                .timestamp(Instant.now())
                .outcome(QueryOutcome.success())
                .build();

        assertThat(failed.status()).isEqualTo(QueryStatus.ERROR);
        assertThat(failed.isError()).isTrue();
        assertThat(failed.exception()).containsSame(error);

        assertThat(succeeded.status()).isEqualTo(QueryStatus.OK);
        assertThat(succeeded.exception()).isEmpty();
    }

    @Test
    void shouldKeepNullParametersAndCopyDefensively() {
        List<Object> params = new ArrayList<>(Arrays.asList(1, null, "x"));

        CapturedQuery query = CapturedQuery.builder()
                .sql("INSERT INTO t VALUES (?, ?, ?)")
                .params(params)
                .timestamp(Instant.now())
                .build();
        params.clear();

        assertThat(query.params()).containsExactly(1, null, "x");
    }

    @Test
    void shouldApplyDefaultsForMissingFields() {
        CapturedQuery query = CapturedQuery.builder()
                .sql("VACUUM")
                .timestamp(Instant.now())
                .duration(Duration.ofMillis(-5))
                .build();

        assertThat(query.params()).isEmpty();
        assertThat(query.stackTrace()).isEmpty();
        assertThat(query.tableNames()).isEmpty();
        assertThat(query.duration()).isEqualTo(Duration.ZERO);
        assertThat(query.queryType()).isEqualTo(QueryType.OTHER);
        assertThat(query.status()).isEqualTo(QueryStatus.OK);
    }

    @Test
    void shouldFindFirstApplicationFrame() {
        CapturedQuery query = CapturedQuery.builder()
                .sql("SELECT 1")
                .timestamp(Instant.now())
                .stackTrace(List.of(
                        new CallSiteFrame("org.hibernate.loader.Loader", "load", "Loader.java", 10),
                        new CallSiteFrame("com.example.OrderService", "loadLines", "OrderService.java", 42),
                        new CallSiteFrame("com.example.Main", "main", "Main.java", 7)))
                .build();

        assertThat(query.applicationCallSite(List.of("org.hibernate.")).map(CallSiteFrame::methodName))
                .contains("loadLines");
        assertThat(query.applicationCallSite(List.of("org.", "com.")))
                .isEmpty();
    }

    @Test
    void shouldNormalizeItsOwnSql() {
        CapturedQuery query = CapturedQuery.builder()
                .sql("SELECT *   FROM t WHERE id = 7")
                .timestamp(Instant.now())
                .build();

        assertThat(query.normalizedPattern()).isEqualTo("SELECT * FROM t WHERE id = ?");
    }

    @Test
    void shouldFormatCallSiteFrames() {
        CallSiteFrame frame = new CallSiteFrame("com.example.Repo", "find", "Repo.java", 12);

        assertThat(frame.location()).isEqualTo("Repo.java:12");
        assertThat(frame.toString()).isEqualTo("Repo.java:12 in com.example.Repo.find");
    }
}
