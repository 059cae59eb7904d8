package net.findmytask.service.search;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.config.SearchProperties;
import net.findmytask.domain.search.FieldMatch;
import net.findmytask.domain.search.SearchHighlight;
import net.findmytask.domain.search.SearchOperator;
import net.findmytask.domain.search.SearchQuery;
import net.findmytask.domain.search.SearchResult;
import net.findmytask.model.Priority;
import net.findmytask.model.Task;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Scores one task against a query.
 *
 * <p>Runs {@link FieldMatcher} over every present {@link SearchableField}, sums the weighted
 * field scores and then applies the metadata boosts once each: flagged, priority and recency.
 * Holds no mutable state; {@code now} is passed in so a whole ranking pass shares one clock reading.</p>
 */
@Component
@Slf4j
public class TaskScoringStrategy {

    static final double FLAGGED_BOOST = 1.2;
    static final double HIGH_PRIORITY_BOOST = 1.3;
    static final double MEDIUM_PRIORITY_BOOST = 1.0;
    static final double LOW_PRIORITY_BOOST = 0.9;
    static final double RECENCY_BOOST = 1.1;
    static final Duration RECENCY_WINDOW = Duration.ofDays(7);

    private final FieldMatcher fieldMatcher;
    private final AndSemantics andSemantics;

    @Autowired
    public TaskScoringStrategy(FieldMatcher fieldMatcher, SearchProperties searchProperties) {
        this(fieldMatcher, searchProperties.getAndSemantics());
    }

    public TaskScoringStrategy(FieldMatcher fieldMatcher, AndSemantics andSemantics) {
        this.fieldMatcher = fieldMatcher;
        this.andSemantics = andSemantics == null ? AndSemantics.PER_FIELD : andSemantics;
    }

    /**
     * @param task task to score; {@code null} never matches
     * @param query parsed query
     * @param now reference time for the recency boost
     * @return the scored result, or empty when no field matched
     */
    public Optional<SearchResult> scoreTask(Task task, SearchQuery query, Instant now) {
        if (task == null || query == null || query.isEmpty()) {
            return Optional.empty();
        }

        double totalScore = 0;
        List<SearchHighlight> highlights = new ArrayList<>();
        Set<String> matchedFields = new LinkedHashSet<>();
        Set<Integer> matchedTerms = new HashSet<>();

        for (SearchableField field : SearchableField.values()) {
            String text = field.textOf(task);
            if (text == null) {
                continue;
            }
            Optional<FieldMatch> match = fieldMatcher.matchField(text, query, field.weight(), field.fieldName());
            if (match.isEmpty()) {
                continue;
            }
            FieldMatch fieldMatch = match.get();
            totalScore += fieldMatch.score();
            highlights.addAll(fieldMatch.highlights());
            matchedFields.add(field.fieldName());
            matchedTerms.addAll(fieldMatch.matchedTermIndexes());
        }

        if (totalScore == 0) {
            return Optional.empty();
        }
        if (!satisfiesItemLevelAnd(query, matchedTerms)) {
            log.trace("Task {} matched fields {} but not every AND term", task.getId(), matchedFields);
            return Optional.empty();
        }

        double boosted = applyBoostFactors(totalScore, task, now);
        if (!(boosted > 0)) {
            return Optional.empty();
        }
        return Optional.of(new SearchResult(task.getId(), task, boosted, highlights, matchedFields));
    }

    /**
     * Multiplies a raw field score by the flagged, priority and recency boosts.
     */
    public double applyBoostFactors(double score, Task task, Instant now) {
        double boosted = score;
        if (task.isFlagged()) {
            boosted *= FLAGGED_BOOST;
        }
        boosted *= priorityBoost(task.getPriority());
        if (isRecent(task.getModified(), now)) {
            boosted *= RECENCY_BOOST;
        }
        return boosted;
    }

    public double priorityBoost(Priority priority) {
        if (priority == null) {
            return MEDIUM_PRIORITY_BOOST;
        }
        return switch (priority) {
            case HIGH -> HIGH_PRIORITY_BOOST;
            case MEDIUM -> MEDIUM_PRIORITY_BOOST;
            case LOW -> LOW_PRIORITY_BOOST;
        };
    }

    /**
     * True when {@code modified} is less than seven days before {@code now}.
     * Timestamps in the future count as recent.
     */
    public boolean isRecent(Instant modified, Instant now) {
        if (modified == null || now == null) {
            return false;
        }
        return Duration.between(modified, now).compareTo(RECENCY_WINDOW) < 0;
    }

    private boolean satisfiesItemLevelAnd(SearchQuery query, Set<Integer> matchedTerms) {
        if (andSemantics != AndSemantics.ITEM || query.operator() != SearchOperator.AND) {
            return true;
        }
        return IntStream.range(0, query.terms().size())
            .filter(index -> !query.terms().get(index).negated())
            .allMatch(matchedTerms::contains);
    }
}
