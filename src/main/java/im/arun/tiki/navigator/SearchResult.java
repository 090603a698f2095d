package im.arun.tiki.navigator;

import im.arun.tiki.model.ConceptNode;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Matches for one search query, in document pre-order.
 */
@Value
public class SearchResult {
    String query;
    List<ConceptNode> matches;

    public int getCount() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public Optional<ConceptNode> first() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}
