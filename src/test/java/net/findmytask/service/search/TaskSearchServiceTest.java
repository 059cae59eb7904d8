package net.findmytask.service.search;

import net.findmytask.config.SearchProperties;
import net.findmytask.domain.search.SearchResult;
import net.findmytask.model.Priority;
import net.findmytask.model.Task;
import net.findmytask.testutil.TaskTestData;
import net.findmytask.util.SearchQueryParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static net.findmytask.testutil.TaskTestData.NOW;
import static net.findmytask.testutil.TaskTestData.aTask;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TaskSearchServiceTest {

    private ExecutorService executor;
    private TaskSearchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        service = newService(1000, 100);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TaskSearchService newService(int parallelThreshold, int batchSize) {
        SearchProperties properties = new SearchProperties();
        properties.setParallelThreshold(parallelThreshold);
        properties.setBatchSize(batchSize);
        TaskScoringStrategy strategy = new TaskScoringStrategy(new FieldMatcher(), AndSemantics.PER_FIELD);
        return new TaskSearchService(strategy, executor, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    // --- Scenarios ---

    @Test
    void should_RankPrefixTitleMatchFirst_When_OtherMatchIsInNotes() {
        Task milk = aTask().id("milk").title("Buy milk").notes("").build();
        Task house = aTask().id("house").title("Clean house").notes("need to buy groceries").build();

        List<SearchResult> results = service.search(List.of(house, milk), "buy");

        assertThat(results).extracting(SearchResult::itemId).containsExactly("milk", "house");
        assertThat(results.get(0).relevanceScore()).isEqualTo(15.0);
        assertThat(results.get(1).relevanceScore()).isEqualTo(1.0);
    }

    @Test
    void should_ReturnOnlyLiteralPhraseMatch_When_QueryIsQuoted() {
        Task literal = aTask().id("literal").title("Notes").notes("use the exact phrase here").build();
        Task scattered = aTask().id("scattered").title("Notes").notes("exact wording, not a phrase").build();

        List<SearchResult> results = service.search(List.of(scattered, literal), "\"exact phrase\"");

        assertThat(results).extracting(SearchResult::itemId).containsExactly("literal");
    }

    @Test
    void should_ExcludeTask_When_NegatedTermInItsOnlyMatchingField() {
        Task clean = aTask().id("a").title("Quarterly report").notes("").build();
        Task draft = aTask().id("b").title("Quarterly report draft").build();

        List<SearchResult> results = service.search(List.of(clean, draft), "report NOT draft");

        assertThat(results).extracting(SearchResult::itemId).containsExactly("a");
    }

    @Test
    void should_RankHighPriorityFirst_When_TitlesIdentical() {
        Task low = aTask().id("low").title("Renew passport").priority(Priority.LOW).build();
        Task high = aTask().id("high").title("Renew passport").priority(Priority.HIGH).build();

        List<SearchResult> results = service.search(List.of(low, high), "passport");

        assertThat(results).extracting(SearchResult::itemId).containsExactly("high", "low");
        assertThat(results.get(0).relevanceScore()).isCloseTo(13.0, within(1e-9));
        assertThat(results.get(1).relevanceScore()).isCloseTo(9.0, within(1e-9));
    }

    // --- Sample fixture ---

    @Test
    void should_FindTitleMatch_When_SearchingSampleTasks() {
        List<SearchResult> results = service.search(TaskTestData.sampleTasks(), "bug");

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.itemId()).isEqualTo("auth-bug");
            assertThat(result.hasMatch("title")).isTrue();
            assertThat(result.highlightsFor("title")).first()
                .satisfies(highlight -> assertThat(highlight.matchedText()).isEqualTo("bug"));
        });
    }

    @Test
    void should_SearchProjectContextAndTags_When_TermsLiveThere() {
        assertThat(service.search(TaskTestData.sampleTasks(), "@computer")).hasSize(3);
        assertThat(service.search(TaskTestData.sampleTasks(), "urgent"))
            .singleElement()
            .satisfies(result -> assertThat(result.hasMatch("tags")).isTrue());
        assertThat(service.search(TaskTestData.sampleTasks(), "timeline"))
            .extracting(SearchResult::itemId)
            .containsExactly("call-john");
    }

    @Test
    void should_MatchEitherTerm_When_OperatorIsOr() {
        List<SearchResult> results = service.search(TaskTestData.sampleTasks(), "bug OR groceries");

        assertThat(results).extracting(SearchResult::itemId)
            .containsExactlyInAnyOrder("auth-bug", "groceries");
    }

    @Test
    void should_IgnoreCase_When_QueryCaseDiffers() {
        List<Task> tasks = TaskTestData.sampleTasks();

        assertThat(service.search(tasks, "BUG")).isEqualTo(service.search(tasks, "bug"));
    }

    @Test
    void should_SortDescending_When_ManyTasksMatch() {
        List<SearchResult> results = service.search(TaskTestData.sampleTasks(), "project");

        assertThat(results).isNotEmpty();
        assertThat(results).extracting(SearchResult::relevanceScore)
            .isSortedAccordingTo((left, right) -> Double.compare(right, left));
        assertThat(results).allSatisfy(result -> assertThat(result.highlights()).isNotEmpty());
    }

    // --- Edge cases ---

    @Test
    void should_ReturnEmpty_When_NoTasksOrEmptyQuery() {
        assertThat(service.search(List.of(), "anything")).isEmpty();
        assertThat(service.search(List.of(), SearchQueryParser.parse(""))).isEmpty();
        assertThat(service.search(TaskTestData.sampleTasks(), "")).isEmpty();
        assertThat(service.search(TaskTestData.sampleTasks(), "   AND  ")).isEmpty();
        assertThat(service.search(TaskTestData.sampleTasks(), "xyzabc123")).isEmpty();
    }

    @Test
    void should_PreserveInputOrder_When_ScoresTie() {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(aTask().id("t" + i).title("Same title").build());
        }

        List<SearchResult> results = service.search(tasks, "title");

        assertThat(results).extracting(SearchResult::itemId)
            .containsExactly("t0", "t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8", "t9");
    }

    @Test
    void should_MatchSpecialAndUnicodeCharacters() {
        Task special = aTask().id("special").title("Fix bug #123 (urgent!)").notes("Special characters: @#$%^&*()").build();
        Task unicode = aTask().id("unicode").title("Review pull request 你好").notes("Unicode: こんにちは 🎉").build();

        assertThat(service.search(List.of(special, unicode), "#123")).extracting(SearchResult::itemId).containsExactly("special");
        assertThat(service.search(List.of(special, unicode), "你好")).extracting(SearchResult::itemId).containsExactly("unicode");
    }

    // --- Parallel and cancellable paths ---

    @Test
    void should_MatchSequentialRanking_When_ScoringInParallel() {
        List<Task> tasks = generatedTasks(1500);
        TaskSearchService sequential = newService(Integer.MAX_VALUE, 100);
        TaskSearchService parallel = newService(1, 64);

        List<SearchResult> expected = sequential.search(tasks, "task 50");
        List<SearchResult> actual = parallel.search(tasks, "task 50");

        assertThat(actual).isNotEmpty();
        assertThat(actual).extracting(SearchResult::itemId)
            .containsExactlyElementsOf(expected.stream().map(SearchResult::itemId).toList());
        assertThat(actual).extracting(SearchResult::relevanceScore)
            .containsExactlyElementsOf(expected.stream().map(SearchResult::relevanceScore).toList());
    }

    @Test
    void should_ReturnCompletedBatches_When_CancelledMidway() {
        List<Task> tasks = generatedTasks(300);
        TaskSearchService batched = newService(Integer.MAX_VALUE, 100);
        AtomicInteger checks = new AtomicInteger();

        List<SearchResult> results = batched.search(tasks, SearchQueryParser.parse("task"),
            () -> checks.incrementAndGet() > 2);

        assertThat(checks.get()).isEqualTo(3);
        assertThat(results).hasSize(200);
        assertThat(results).extracting(SearchResult::itemId).doesNotContain("task-250");
    }

    @Test
    void should_ScoreEverything_When_NeverCancelled() {
        List<Task> tasks = generatedTasks(250);
        TaskSearchService batched = newService(Integer.MAX_VALUE, 100);

        assertThat(batched.search(tasks, SearchQueryParser.parse("task"), () -> false)).hasSize(250);
    }

    private static List<Task> generatedTasks(int count) {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tasks.add(aTask()
                .id("task-" + i)
                .title("Task " + i)
                .notes("This is task number " + i + " with some content")
                .project("Project " + (i % 10))
                .flagged(i % 7 == 0)
                .priority(Priority.values()[i % 3])
                .build());
        }
        return tasks;
    }
}
