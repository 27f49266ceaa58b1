package org.carball.tempo.analyzer;

import org.carball.tempo.model.recommendation.IndexSuggestion;
import org.carball.tempo.model.recommendation.IndexType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class IndexAdvisorTest {

    private final IndexAdvisor advisor = new IndexAdvisor();

    @Test
    void shouldSuggestCompositeIndexFromParsedWhereClause() {
        // When
        List<IndexSuggestion> suggestions = advisor.suggestIndexes(
                "SELECT * FROM content WHERE artistId = 7 AND visibility = 'public' ORDER BY createdAt DESC");

        // Then
        assertThat(suggestions).hasSize(1);
        IndexSuggestion suggestion = suggestions.get(0);
        assertThat(suggestion.getTable()).isEqualTo("content");
        assertThat(suggestion.getColumns()).containsExactly("artistId", "visibility");
        assertThat(suggestion.getType()).isEqualTo(IndexType.COMPOSITE);
        assertThat(suggestion.getEstimatedImpact()).isEqualTo(65);
        assertThat(suggestion.getReason()).isEqualTo("Optimize WHERE clause performance");
        assertThat(suggestion.getCreateStatement())
                .isEqualTo("CREATE INDEX CONCURRENTLY idx_content_artistid_visibility ON content (artistId, visibility);");
    }

    @Test
    void shouldSuggestSingleColumnBtreeIndex() {
        List<IndexSuggestion> suggestions = advisor.suggestIndexes("SELECT id FROM users WHERE email = 'a@b.c'");

        assertThat(suggestions).singleElement()
                .satisfies(s -> {
                    assertThat(s.getColumns()).containsExactly("email");
                    assertThat(s.getType()).isEqualTo(IndexType.BTREE);
                });
    }

    @Test
    void shouldFallBackToPatternsForPseudoSql() {
        // When
        List<IndexSuggestion> suggestions =
                advisor.suggestIndexes("find users where role = admin and lastSeenAt > yesterday");

        // Then
        assertThat(suggestions).hasSize(1);
        assertThat(suggestions.get(0).getTable()).isEqualTo("unknown_table");
        assertThat(suggestions.get(0).getColumns()).containsExactly("role", "lastSeenAt");
    }

    @Test
    void shouldReturnNothingWithoutWhereClause() {
        assertThat(advisor.suggestIndexes("SELECT * FROM users")).isEmpty();
        assertThat(advisor.suggestIndexes("")).isEmpty();
        assertThat(advisor.suggestIndexes(null)).isEmpty();
    }

    @Test
    void shouldProvideRecommendedCompositeIndexes() {
        // When
        List<IndexSuggestion> recommended = advisor.recommendedIndexes();

        // Then
        assertThat(recommended).hasSize(6);
        assertThat(recommended).allSatisfy(s -> assertThat(s.getType()).isEqualTo(IndexType.COMPOSITE));
        assertThat(recommended.get(0).getCreateStatement()).isEqualTo(
                "CREATE INDEX CONCURRENTLY idx_content_artistid_visibility_createdat ON content (artistId, visibility, createdAt);");
        assertThat(recommended)
                .extracting(IndexSuggestion::getTable)
                .containsExactly("content", "content", "users", "subscriptions", "messages", "live_streams");
    }
}
