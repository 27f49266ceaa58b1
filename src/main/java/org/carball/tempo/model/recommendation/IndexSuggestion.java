package org.carball.tempo.model.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexSuggestion {
    private String table;
    private List<String> columns;
    private IndexType type;
    private String reason;
    private int estimatedImpact;
    private String createStatement;
}
