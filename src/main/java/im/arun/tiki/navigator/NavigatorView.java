package im.arun.tiki.navigator;

import im.arun.tiki.model.ConceptNode;

import java.util.List;

/**
 * Display side of a navigation session. {@link TreeNavigator} owns the selection state and calls
 * back into the view; implementations decide how things look and where they go.
 */
public interface NavigatorView {

    /**
     * Renders the visible tree with {@code selected} highlighted and returns the lines shown.
     */
    List<String> render(ConceptNode root, ConceptNode selected);

    void onSelect(ConceptNode node);

    void onSearch(SearchResult result);

    void onToggleExpand(ConceptNode node, boolean expanded);

    /**
     * Informational or error text for the user. Never fatal to the session.
     */
    void onMessage(String message);
}
