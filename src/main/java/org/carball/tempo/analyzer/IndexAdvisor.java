package org.carball.tempo.analyzer;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.carball.tempo.model.recommendation.IndexSuggestion;
import org.carball.tempo.model.recommendation.IndexType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives index suggestions from the WHERE clause of a query. Real SQL is parsed with JSqlParser;
 * the pseudo-SQL descriptions many callers record fall back to regex extraction.
 */
@Slf4j
public class IndexAdvisor {

    private static final int WHERE_CLAUSE_IMPACT = 65;

    private static final Pattern WHERE_CLAUSE = Pattern.compile(
            "WHERE\\s+(.+?)(?:\\s+ORDER|\\s+GROUP|\\s+LIMIT|$)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern COMPARED_COLUMN = Pattern.compile("(\\w+)\\s*[=<>!]");

    private static final Pattern FROM_TABLE = Pattern.compile("FROM\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Set<String> LITERAL_NAMES = Set.of("true", "false", "null");

    public List<IndexSuggestion> suggestIndexes(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        TableColumns target = parseWithJSqlParser(query);
        if (target == null) {
            target = parseWithRegex(query);
        }
        if (target == null || target.columns().isEmpty()) {
            return List.of();
        }

        return List.of(IndexSuggestion.builder()
                .table(target.table())
                .columns(target.columns())
                .type(target.columns().size() > 1 ? IndexType.COMPOSITE : IndexType.BTREE)
                .reason("Optimize WHERE clause performance")
                .estimatedImpact(WHERE_CLAUSE_IMPACT)
                .createStatement(createStatement(target.table(), target.columns()))
                .build());
    }

    /**
     * Composite indexes for the access paths every subscription-platform deployment exercises.
     */
    public List<IndexSuggestion> recommendedIndexes() {
        return List.of(
                common("content", List.of("artistId", "visibility", "createdAt"),
                        "Optimize content listing by artist with visibility filter", 70),
                common("content", List.of("type", "createdAt", "visibility"),
                        "Optimize content type filtering with date sorting", 65),
                common("users", List.of("role", "lastSeenAt"),
                        "Optimize user activity queries by role", 60),
                common("subscriptions", List.of("fanId", "artistId", "status"),
                        "Optimize subscription lookups", 75),
                common("messages", List.of("senderId", "recipientId", "createdAt"),
                        "Optimize message thread queries", 80),
                common("live_streams", List.of("artistId", "isPublic", "status"),
                        "Optimize live stream discovery", 70));
    }

    private TableColumns parseWithJSqlParser(String query) {
        try {
            Statement statement = CCJSqlParserUtil.parse(query);
            if (!(statement instanceof PlainSelect select) || select.getWhere() == null) {
                return null;
            }

            String table = select.getFromItem() instanceof Table from ? from.getName() : "unknown_table";
            List<String> columns = new ArrayList<>();
            Expression where = select.getWhere();
            where.accept(new ExpressionVisitorAdapter() {
                @Override
                public void visit(Column column) {
                    addColumn(columns, column.getColumnName());
                }
            });
            return new TableColumns(table, columns);
        } catch (JSQLParserException e) {
            log.debug("Query is not parseable SQL, using pattern extraction: {}", e.getMessage());
            return null;
        }
    }

    private TableColumns parseWithRegex(String query) {
        Matcher whereMatcher = WHERE_CLAUSE.matcher(query);
        if (!whereMatcher.find()) {
            return null;
        }

        List<String> columns = new ArrayList<>();
        Matcher columnMatcher = COMPARED_COLUMN.matcher(whereMatcher.group(1));
        while (columnMatcher.find()) {
            addColumn(columns, columnMatcher.group(1));
        }

        Matcher tableMatcher = FROM_TABLE.matcher(query);
        String table = tableMatcher.find() ? tableMatcher.group(1) : "unknown_table";
        return new TableColumns(table, columns);
    }

    private static void addColumn(List<String> columns, String name) {
        if (!LITERAL_NAMES.contains(name.toLowerCase(Locale.ROOT)) && !columns.contains(name)) {
            columns.add(name);
        }
    }

    private static IndexSuggestion common(String table, List<String> columns, String reason, int impact) {
        return IndexSuggestion.builder()
                .table(table)
                .columns(columns)
                .type(IndexType.COMPOSITE)
                .reason(reason)
                .estimatedImpact(impact)
                .createStatement(createStatement(table, columns))
                .build();
    }

    private static String createStatement(String table, List<String> columns) {
        return String.format("CREATE INDEX CONCURRENTLY idx_%s_%s ON %s (%s);",
                table, String.join("_", columns).toLowerCase(Locale.ROOT), table, String.join(", ", columns));
    }

    private record TableColumns(String table, List<String> columns) {}
}
