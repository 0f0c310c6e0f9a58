package org.carball.autoindex.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.update.Update;
import org.carball.autoindex.model.telemetry.PredicateKind;
import org.carball.autoindex.model.telemetry.QueryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns captured SQL text into the predicates an index could serve.
 * <p>
 * Handles single-block SELECT, UPDATE and DELETE statements. {@code =} and
 * {@code IN} are equality lookups, comparisons and {@code BETWEEN} are range
 * scans, {@code LIKE 'abc%'} is a prefix match and {@code a.x = b.y} in a
 * WHERE or ON clause is a join key. The tenant column is never reported:
 * it is part of every query and gets its own handling in the index definition.
 */
@Slf4j
public class SqlPredicateExtractor {

    private final String tenantColumn;

    public SqlPredicateExtractor(String tenantColumn) {
        this.tenantColumn = tenantColumn == null ? null : tenantColumn.toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts predicates from a statement. Unparseable or unsupported SQL
     * yields an empty list; telemetry is best effort.
     */
    public List<ExtractedPredicate> extract(String sql) {
        if (sql == null || sql.isBlank()) {
            return List.of();
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            log.debug("Skipping unparseable SQL: {}", e.getMessage());
            return List.of();
        }

        TableScope scope = new TableScope();
        List<Expression> conditions = new ArrayList<>();

        if (statement instanceof PlainSelect select) {
            register(scope, select.getFromItem());
            if (select.getJoins() != null) {
                for (Join join : select.getJoins()) {
                    register(scope, join.getRightItem());
                    if (join.getOnExpressions() != null) {
                        conditions.addAll(join.getOnExpressions());
                    }
                }
            }
            conditions.add(select.getWhere());
        } else if (statement instanceof Update update) {
            scope.register(update.getTable());
            conditions.add(update.getWhere());
        } else if (statement instanceof Delete delete) {
            scope.register(delete.getTable());
            conditions.add(delete.getWhere());
        } else {
            log.debug("Ignoring unsupported statement type: {}", statement.getClass().getSimpleName());
            return List.of();
        }

        PredicateCollector collector = new PredicateCollector(scope);
        for (Expression condition : conditions) {
            if (condition != null) {
                condition.accept(collector);
            }
        }
        return new ArrayList<>(collector.predicates);
    }

    /**
     * Converts one captured execution into query records, one per
     * (table, predicate kind) with every field of that kind.
     */
    public List<QueryRecord> toRecords(String tenantId, String sql, double durationMs, Instant timestamp) {
        Map<String, List<String>> fieldsByTableAndKind = new LinkedHashMap<>();
        Map<String, ExtractedPredicate> firstByGroup = new HashMap<>();

        for (ExtractedPredicate predicate : extract(sql)) {
            String group = predicate.table() + "|" + predicate.kind();
            fieldsByTableAndKind.computeIfAbsent(group, g -> new ArrayList<>()).add(predicate.field());
            firstByGroup.putIfAbsent(group, predicate);
        }

        List<QueryRecord> records = new ArrayList<>();
        fieldsByTableAndKind.forEach((group, fields) -> {
            ExtractedPredicate first = firstByGroup.get(group);
            records.add(new QueryRecord(tenantId, first.table(), fields, first.kind(), durationMs, timestamp));
        });
        return records;
    }

    private static void register(TableScope scope, FromItem item) {
        if (item instanceof Table table) {
            scope.register(table);
        }
    }

    private final class PredicateCollector extends ExpressionVisitorAdapter {

        private final TableScope scope;
        private final Set<ExtractedPredicate> predicates = new LinkedHashSet<>();

        PredicateCollector(TableScope scope) {
            this.scope = scope;
        }

        @Override
        public void visit(EqualsTo expr) {
            Expression left = expr.getLeftExpression();
            Expression right = expr.getRightExpression();
            if (left instanceof Column l && right instanceof Column r) {
                add(l, PredicateKind.JOIN);
                add(r, PredicateKind.JOIN);
            } else {
                addColumnSide(left, right, PredicateKind.EQUALITY);
            }
        }

        @Override
        public void visit(InExpression expr) {
            if (expr.getLeftExpression() instanceof Column column && !expr.isNot()) {
                add(column, PredicateKind.EQUALITY);
            }
        }

        @Override
        public void visit(GreaterThan expr) {
            addColumnSide(expr.getLeftExpression(), expr.getRightExpression(), PredicateKind.RANGE);
        }

        @Override
        public void visit(GreaterThanEquals expr) {
            addColumnSide(expr.getLeftExpression(), expr.getRightExpression(), PredicateKind.RANGE);
        }

        @Override
        public void visit(MinorThan expr) {
            addColumnSide(expr.getLeftExpression(), expr.getRightExpression(), PredicateKind.RANGE);
        }

        @Override
        public void visit(MinorThanEquals expr) {
            addColumnSide(expr.getLeftExpression(), expr.getRightExpression(), PredicateKind.RANGE);
        }

        @Override
        public void visit(Between expr) {
            if (expr.getLeftExpression() instanceof Column column && !expr.isNot()) {
                add(column, PredicateKind.RANGE);
            }
        }

        @Override
        public void visit(LikeExpression expr) {
            if (!(expr.getLeftExpression() instanceof Column column) || expr.isNot()) {
                return;
            }
            // a leading wildcard cannot use a btree index
            if (expr.getRightExpression() instanceof StringValue pattern
                    && (pattern.getValue().startsWith("%") || pattern.getValue().startsWith("_"))) {
                return;
            }
            add(column, PredicateKind.PREFIX);
        }

        private void addColumnSide(Expression left, Expression right, PredicateKind kind) {
            if (left instanceof Column column && !(right instanceof Column)) {
                add(column, kind);
            } else if (right instanceof Column column && !(left instanceof Column)) {
                add(column, kind);
            }
        }

        private void add(Column column, PredicateKind kind) {
            String field = clean(column.getColumnName());
            if (field == null || field.equalsIgnoreCase(tenantColumn)) {
                return;
            }
            String table = scope.resolve(column.getTable());
            if (table == null) {
                log.debug("Cannot resolve table for column {}", column.getFullyQualifiedName());
                return;
            }
            predicates.add(new ExtractedPredicate(table, field, kind));
        }
    }

    private static final class TableScope {
        private final Map<String, String> tablesByAlias = new HashMap<>();
        private final Set<String> tables = new LinkedHashSet<>();

        void register(Table table) {
            if (table == null || table.getName() == null) {
                return;
            }
            String name = clean(table.getName());
            tables.add(name);
            tablesByAlias.put(name.toLowerCase(Locale.ROOT), name);
            if (table.getAlias() != null && table.getAlias().getName() != null) {
                tablesByAlias.put(clean(table.getAlias().getName()).toLowerCase(Locale.ROOT), name);
            }
        }

        String resolve(Table qualifier) {
            if (qualifier == null || qualifier.getName() == null) {
                // unqualified columns are only unambiguous with a single table in scope
                return tables.size() == 1 ? tables.iterator().next() : null;
            }
            return tablesByAlias.get(clean(qualifier.getName()).toLowerCase(Locale.ROOT));
        }
    }

    private static String clean(String identifier) {
        if (identifier == null) return null;
        return identifier.replaceAll("[\\[\\]`\"]", "");
    }
}
