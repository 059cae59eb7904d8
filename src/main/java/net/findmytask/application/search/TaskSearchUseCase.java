package net.findmytask.application.search;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.domain.search.SearchHighlight;
import net.findmytask.domain.search.SearchResult;
import net.findmytask.dto.SearchHit;
import net.findmytask.dto.TaskSearchResponse;
import net.findmytask.model.Task;
import net.findmytask.service.RecentSearchService;
import net.findmytask.service.TaskSource;
import net.findmytask.service.search.SearchableField;
import net.findmytask.service.search.TaskSearchService;
import net.findmytask.util.SearchQueryUtils;
import net.findmytask.util.SearchSnippetUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application entry point for the search box.
 *
 * <p>Loads tasks from the {@link TaskSource}, ranks them and records the query in the
 * recent-search history. History persistence is best effort: a failing store is logged and
 * the search result is still returned.</p>
 */
@Service
@Slf4j
public class TaskSearchUseCase {

    private final TaskSource taskSource;
    private final TaskSearchService taskSearchService;
    private final RecentSearchService recentSearchService;

    public TaskSearchUseCase(TaskSource taskSource,
                             TaskSearchService taskSearchService,
                             RecentSearchService recentSearchService) {
        this.taskSource = taskSource;
        this.taskSearchService = taskSearchService;
        this.recentSearchService = recentSearchService;
    }

    /**
     * Runs a search over all tasks and remembers the query.
     *
     * @param queryString raw search box input
     * @return ranked results, highest relevance first
     */
    public List<SearchResult> search(String queryString) {
        List<SearchResult> results = taskSearchService.search(taskSource.findAll(), queryString);
        rememberQuery(queryString);
        return results;
    }

    /**
     * Runs a search and attaches a context snippet to every highlight.
     *
     * @param queryString raw search box input
     * @param contextChars characters of context on each side of a match
     * @return ranked responses with snippets
     */
    public List<TaskSearchResponse> searchWithSnippets(String queryString, int contextChars) {
        return search(queryString).stream()
            .map(result -> new TaskSearchResponse(result, buildHits(result, contextChars)))
            .toList();
    }

    public List<String> recentSearches() {
        try {
            return recentSearchService.list();
        } catch (RuntimeException ex) {
            log.warn("Failed to load recent searches: {}", ex.getMessage(), ex);
            return List.of();
        }
    }

    public void clearRecentSearches() {
        recentSearchService.clear();
    }

    private void rememberQuery(String queryString) {
        try {
            recentSearchService.save(queryString);
        } catch (RuntimeException ex) {
            log.warn("Failed to record recent search '{}': {}",
                SearchQueryUtils.logPreview(queryString), ex.getMessage(), ex);
        }
    }

    private static List<SearchHit> buildHits(SearchResult result, int contextChars) {
        return result.highlights().stream()
            .map(highlight -> new SearchHit(highlight, snippetFor(result.task(), highlight, contextChars)))
            .toList();
    }

    private static String snippetFor(Task task, SearchHighlight highlight, int contextChars) {
        String text = SearchableField.fromFieldName(highlight.fieldName())
            .map(field -> field.textOf(task))
            .orElse(null);
        if (text == null) {
            return highlight.matchedText();
        }
        return SearchSnippetUtils.extractContext(text, highlight.offset(), highlight.length(), contextChars);
    }
}
