package org.carball.tempo.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed catalog of text-based rewrite rules. Rules are tried in declaration order and at most one
 * applies to a query. Matching is regex based, works on pseudo-SQL too, and is line-oriented:
 * {@code .} does not cross line breaks, so a clause split over several lines does not match.
 * <p>
 * The unbounded-SELECT rule matches any single-line {@code SELECT ... FROM ... WHERE}, bounded or
 * not; for a query that already has a limit its rewrite returns the text unchanged, and it still
 * takes precedence over the later rules.
 */
@Slf4j
public class OptimizationRuleEngine {

    private static final Pattern UNBOUNDED_SELECT = Pattern.compile(
            "SELECT.*FROM.*WHERE", Pattern.CASE_INSENSITIVE);

    private static final Pattern WILDCARD_LIKE = Pattern.compile(
            "LIKE\\s+'%.*%'", Pattern.CASE_INSENSITIVE);

    private static final Pattern WILDCARD_LIKE_REWRITE = Pattern.compile(
            "LIKE\\s+'%(.*)%'", Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_WITH_WHERE = Pattern.compile(
            "SELECT.*FROM.*JOIN.*WHERE", Pattern.CASE_INSENSITIVE);

    private static final Pattern FROM_TABLE = Pattern.compile(
            "FROM\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern COUNT_STAR = Pattern.compile(
            "SELECT\\s+COUNT\\(\\*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ORDER_BY = Pattern.compile(
            "ORDER\\s+BY\\s+(\\w+)(?:\\s+DESC)?", Pattern.CASE_INSENSITIVE);

    private static final List<OptimizationRule> CATALOG = List.of(
            new OptimizationRule(
                    "add_limit_to_unbounded_queries",
                    "Add LIMIT to Unbounded Queries",
                    "Add LIMIT clause to queries without explicit limits",
                    query -> UNBOUNDED_SELECT.matcher(query).find(),
                    query -> hasLimit(query) ? query : query + " LIMIT 1000",
                    60),
            new OptimizationRule(
                    "optimize_like_queries",
                    "Optimize LIKE Queries",
                    "Convert leading-wildcard LIKE to a regex match that can use a trigram index",
                    query -> WILDCARD_LIKE.matcher(query).find(),
                    query -> WILDCARD_LIKE_REWRITE.matcher(query).replaceAll("~ '$1'"),
                    40),
            new OptimizationRule(
                    "add_index_hints",
                    "Add Index Hints",
                    "Add index hints for join queries",
                    query -> JOIN_WITH_WHERE.matcher(query).find(),
                    query -> FROM_TABLE.matcher(query).replaceAll("FROM $1 USE INDEX (PRIMARY)"),
                    25),
            new OptimizationRule(
                    "optimize_count_queries",
                    "Optimize COUNT Queries",
                    "Count the primary key instead of whole rows on large tables",
                    query -> COUNT_STAR.matcher(query).find(),
                    query -> query.contains("content") || query.contains("users")
                            ? query.replaceFirst("COUNT\\(\\*\\)", "COUNT(id)")
                            : query,
                    35),
            new OptimizationRule(
                    "optimize_order_by",
                    "Optimize ORDER BY Clauses",
                    "Ensure ORDER BY columns are covered by an index",
                    query -> ORDER_BY.matcher(query).find(),
                    query -> query,
                    30)
    );

    public List<OptimizationRule> rules() {
        return CATALOG;
    }

    /**
     * Returns the first matching rule's rewrite, or empty when no rule matches.
     */
    public Optional<OptimizationSuggestion> suggest(String rawQueryText) {
        if (rawQueryText == null || rawQueryText.isBlank()) {
            return Optional.empty();
        }

        for (OptimizationRule rule : CATALOG) {
            if (rule.matches(rawQueryText)) {
                String rewritten = rule.apply(rawQueryText);
                log.debug("Rule {} matched query: {}", rule.id(), rawQueryText);
                return Optional.of(new OptimizationSuggestion(
                        rule.id(), rule.name(), rule.description(), rewritten, rule.estimatedImprovementPercent()));
            }
        }
        return Optional.empty();
    }

    public Optional<OptimizationRule> firstMatch(String rawQueryText) {
        if (rawQueryText == null) {
            return Optional.empty();
        }
        return CATALOG.stream().filter(rule -> rule.matches(rawQueryText)).findFirst();
    }

    private static boolean hasLimit(String query) {
        return query.toLowerCase(Locale.ROOT).contains("limit");
    }
}
