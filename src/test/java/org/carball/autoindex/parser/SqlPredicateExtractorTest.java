package org.carball.autoindex.parser;

import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlPredicateExtractorTest {

    private SqlPredicateExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SqlPredicateExtractor("tenant_id");
    }

    @Test
    void shouldExtractEqualityPredicate() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT * FROM orders WHERE status = 'shipped'");

        // Then
        assertThat(predicates).containsExactly(new ExtractedPredicate("orders", "status", PredicateKind.EQUALITY));
    }

    @Test
    void shouldExcludeTenantColumn() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT * FROM orders WHERE tenant_id = 'acme' AND customer_id = 42");

        // Then
        assertThat(predicates).containsExactly(new ExtractedPredicate("orders", "customer_id", PredicateKind.EQUALITY));
    }

    @Test
    void shouldClassifyRangeAndInPredicates() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT id FROM orders WHERE created_at >= '2024-01-01' AND total BETWEEN 10 AND 20 AND region IN ('eu', 'us')");

        // Then
        assertThat(predicates).containsExactlyInAnyOrder(
                new ExtractedPredicate("orders", "created_at", PredicateKind.RANGE),
                new ExtractedPredicate("orders", "total", PredicateKind.RANGE),
                new ExtractedPredicate("orders", "region", PredicateKind.EQUALITY));
    }

    @Test
    void shouldTreatTrailingWildcardLikeAsPrefix() {
        // When
        List<ExtractedPredicate> prefix = extractor.extract("SELECT * FROM customers WHERE email LIKE 'bob%'");
        List<ExtractedPredicate> contains = extractor.extract("SELECT * FROM customers WHERE email LIKE '%bob%'");

        // Then
        assertThat(prefix).containsExactly(new ExtractedPredicate("customers", "email", PredicateKind.PREFIX));
        assertThat(contains).isEmpty();
    }

    @Test
    void shouldReportJoinKeysOnBothSides() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT o.id FROM orders o JOIN customers c ON o.customer_id = c.id WHERE c.country = 'NL'");

        // Then
        assertThat(predicates).containsExactlyInAnyOrder(
                new ExtractedPredicate("orders", "customer_id", PredicateKind.JOIN),
                new ExtractedPredicate("customers", "id", PredicateKind.JOIN),
                new ExtractedPredicate("customers", "country", PredicateKind.EQUALITY));
    }

    @Test
    void shouldSkipUnqualifiedColumnsWhenSeveralTablesAreInScope() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT * FROM orders o JOIN customers c ON o.customer_id = c.id WHERE country = 'NL'");

        // Then
        assertThat(predicates).extracting(ExtractedPredicate::field).doesNotContain("country");
    }

    @Test
    void shouldExtractFromUpdateAndDelete() {
        // When
        List<ExtractedPredicate> update = extractor.extract("UPDATE invoices SET paid = true WHERE invoice_no = 'A-1'");
        List<ExtractedPredicate> delete = extractor.extract("DELETE FROM sessions WHERE expires_at < now()");

        // Then
        assertThat(update).containsExactly(new ExtractedPredicate("invoices", "invoice_no", PredicateKind.EQUALITY));
        assertThat(delete).containsExactly(new ExtractedPredicate("sessions", "expires_at", PredicateKind.RANGE));
    }

    @Test
    void shouldIgnoreNegatedPredicates() {
        // When
        List<ExtractedPredicate> predicates = extractor.extract(
                "SELECT * FROM orders WHERE status NOT IN ('void') AND note NOT LIKE 'x%'");

        // Then
        assertThat(predicates).isEmpty();
    }

    @Test
    void shouldReturnEmptyListForUnparseableSql() {
        assertThat(extractor.extract("SELEKT nonsense FROM")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void shouldGroupRecordsByTableAndKind() {
        // Given
        Instant ts = Instant.parse("2024-03-01T10:00:00Z");

        // When
        List<QueryRecord> records = extractor.toRecords("acme",
                "SELECT * FROM orders WHERE status = 'open' AND region = 'eu' AND created_at > '2024-01-01'",
                12.5, ts);

        // Then
        assertThat(records).hasSize(2);
        assertThat(records.get(0).fields()).containsExactly("status", "region");
        assertThat(records.get(0).predicateKind()).isEqualTo(PredicateKind.EQUALITY);
        assertThat(records.get(1).fields()).containsExactly("created_at");
        assertThat(records.get(1).predicateKind()).isEqualTo(PredicateKind.RANGE);
        assertThat(records).allSatisfy(r -> {
            assertThat(r.tenantId()).isEqualTo("acme");
            assertThat(r.durationMs()).isEqualTo(12.5);
            assertThat(r.timestamp()).isEqualTo(ts);
        });
    }
}
