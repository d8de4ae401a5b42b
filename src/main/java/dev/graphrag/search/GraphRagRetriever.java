package dev.graphrag.search;

import dev.graphrag.document.Document;
import dev.graphrag.entity.Entity;
import dev.graphrag.entity.EntityExtractor;
import dev.graphrag.graph.GraphNode;
import dev.graphrag.graph.GraphStore;
import dev.graphrag.graph.TraversalResult;
import dev.graphrag.graph.TraverseOptions;
import dev.graphrag.vector.VectorStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hybrid retrieval orchestrator combining vector similarity search with knowledge-graph
 * traversal.
 *
 * <p>Hybrid pipeline: vector search for {@code 2k} candidates, concurrently with entity extraction
 * followed by one breadth-first traversal per distinct entity -> fusion ({@link FusionEngine}) ->
 * reranking ({@link Reranker}) -> score metadata and optional graph context ({@link
 * ContextAugmenter}) -> {@code minScore} floor -> truncation to {@code k}.
 *
 * <p>Failure policy: a vector store failure aborts the call with {@link
 * BackendUnavailableException}. Entity extraction and traversal failures are logged, recorded as
 * degraded modalities in the statistics, and the call continues with whatever succeeded; in
 * {@link SearchMode#GRAPH} mode they are fatal because no other source remains.
 *
 * <p>The retriever holds no per-call state: settings are resolved into a fresh {@link
 * RetrievalSettings} for every call, and statistics are returned with the results. {@link
 * #getStatistics()} additionally exposes the statistics of the most recent call. Concurrent calls
 * are safe.
 */
public class GraphRagRetriever {

  private static final Logger log = LoggerFactory.getLogger(GraphRagRetriever.class);

  public static final Duration DEFAULT_SEARCH_TIMEOUT = Duration.ofSeconds(30);

  private final VectorStore vectorStore;
  private final GraphStore graphStore;
  private final @Nullable EntityExtractor entityExtractor;
  private final RetrievalSettings defaults;
  private final ExecutorService executor;
  private final Duration searchTimeout;
  private final Clock clock;
  private final AtomicReference<SearchStatistics> lastStatistics =
      new AtomicReference<>(SearchStatistics.empty());

  public GraphRagRetriever(
      VectorStore vectorStore,
      GraphStore graphStore,
      @Nullable EntityExtractor entityExtractor,
      RetrievalSettings defaults,
      ExecutorService executor) {
    this(
        vectorStore,
        graphStore,
        entityExtractor,
        defaults,
        executor,
        DEFAULT_SEARCH_TIMEOUT,
        Clock.systemUTC());
  }

  /**
   * Creates a retriever.
   *
   * @param vectorStore the vector search backend (required)
   * @param graphStore the knowledge graph (required)
   * @param entityExtractor finds traversal seeds in the query; null disables graph retrieval
   * @param defaults settings used where a call does not override them
   * @param executor runs the vector branch, entity extraction and traversals; tasks of a call
   *     that times out or is interrupted are cancelled with interruption
   * @param searchTimeout deadline for a whole call (must be positive)
   * @param clock time source for statistics
   * @throws InvalidRetrieverConfigException if a required collaborator is missing or the timeout
   *     is not positive
   */
  public GraphRagRetriever(
      VectorStore vectorStore,
      GraphStore graphStore,
      @Nullable EntityExtractor entityExtractor,
      RetrievalSettings defaults,
      ExecutorService executor,
      Duration searchTimeout,
      Clock clock) {
    this.vectorStore = required(vectorStore, "vectorStore");
    this.graphStore = required(graphStore, "graphStore");
    this.defaults = required(defaults, "defaults");
    this.executor = required(executor, "executor");
    this.clock = required(clock, "clock");
    this.searchTimeout = required(searchTimeout, "searchTimeout");
    if (searchTimeout.isZero() || searchTimeout.isNegative()) {
      throw new InvalidRetrieverConfigException(
          "searchTimeout must be positive, got: " + searchTimeout);
    }
    this.entityExtractor = entityExtractor;
  }

  /** Searches with the retriever defaults. */
  public RetrievalResult search(String query) {
    return search(query, null);
  }

  /**
   * Runs one search.
   *
   * @param query the query text; empty is allowed
   * @param options per-call overrides, or null to use the defaults
   * @return at most {@code k} documents with the statistics of this call
   * @throws InvalidRetrieverConfigException if an override is out of range
   * @throws BackendUnavailableException if the vector store fails (or, in graph mode, the graph
   *     path fails)
   * @throws SearchCancelledException if the thread is interrupted or the timeout elapses
   */
  public RetrievalResult search(String query, @Nullable SearchOptions options) {
    String text = query == null ? "" : query;
    RetrievalSettings settings = options == null ? defaults : options.applyTo(defaults);

    Instant start = clock.instant();
    Deadline deadline = Deadline.after(searchTimeout);
    SearchStatistics.Recorder stats = new SearchStatistics.Recorder();
    try {
      List<Document> documents =
          switch (settings.mode()) {
            case HYBRID -> hybridSearch(text, settings, stats, deadline);
            case VECTOR -> vectorOnlySearch(text, settings, stats, deadline);
            case GRAPH -> graphOnlySearch(text, settings, stats, deadline);
          };
      SearchStatistics statistics = record(stats, start);
      log.debug(
          "{} search returned {} documents in {} ms (vector={}, graph={}, fused={})",
          settings.mode(),
          documents.size(),
          statistics.totalTime().toMillis(),
          statistics.vectorResultsCount(),
          statistics.graphResultsCount(),
          statistics.fusedResultsCount());
      return new RetrievalResult(documents, statistics);
    } catch (RuntimeException e) {
      record(stats, start);
      throw e;
    }
  }

  /** Statistics of the most recent call on this retriever, from any thread. */
  public SearchStatistics getStatistics() {
    return lastStatistics.get();
  }

  public RetrievalSettings getDefaults() {
    return defaults;
  }

  private List<Document> hybridSearch(
      String query,
      RetrievalSettings settings,
      SearchStatistics.Recorder stats,
      Deadline deadline) {
    Tasks tasks = new Tasks();

    // Fork: vector search and (extraction -> traversal) run independently
    CompletableFuture<VectorOutcome> vectorBranch =
        startVectorSearch(query, settings.candidatePoolSize(), tasks);
    CompletableFuture<GraphOutcome> graphBranch = startGraphSearch(query, settings, tasks);

    // Join: vector first, so a fatal vector failure cancels the graph branch straight away
    VectorOutcome vector = awaitVector(vectorBranch, deadline, tasks);
    recordVector(stats, vector);

    GraphOutcome graph;
    try {
      graph = await(graphBranch, deadline, tasks);
    } catch (ExecutionException e) {
      log.warn("Graph retrieval failed, continuing with vector results only", e.getCause());
      graph = GraphOutcome.failedTraversal();
    }
    recordGraph(stats, graph);
    if (graph.extractionError() != null) {
      stats.degradedModalities.add(Modality.ENTITY_EXTRACTION);
    }
    if (graph.traversalsFailed() > 0) {
      stats.degradedModalities.add(Modality.GRAPH_TRAVERSAL);
    }

    Instant fusionStart = clock.instant();
    List<FusedResult> fused =
        FusionEngine.fuse(vector.documents(), graph.traversed().nodes(), settings);
    stats.fusedResultsCount = fused.size();
    stats.fusionTime = since(fusionStart);

    Instant rerankStart = clock.instant();
    List<FusedResult> ranked = Reranker.rerank(fused, query, settings);
    stats.rerankTime = since(rerankStart);

    Instant augmentStart = clock.instant();
    List<Document> documents =
        settings.enableContextAugmentation()
            ? ContextAugmenter.augment(ranked, graph.traversed())
            : ContextAugmenter.withScores(ranked);
    stats.augmentationTime = since(augmentStart);

    return filterAndTruncate(documents, settings);
  }

  private List<Document> vectorOnlySearch(
      String query,
      RetrievalSettings settings,
      SearchStatistics.Recorder stats,
      Deadline deadline) {
    Tasks tasks = new Tasks();
    VectorOutcome vector =
        awaitVector(startVectorSearch(query, settings.k(), tasks), deadline, tasks);
    recordVector(stats, vector);
    return filterAndTruncate(vector.documents(), settings);
  }

  private List<Document> graphOnlySearch(
      String query,
      RetrievalSettings settings,
      SearchStatistics.Recorder stats,
      Deadline deadline) {
    Tasks tasks = new Tasks();
    GraphOutcome graph;
    try {
      graph = await(startGraphSearch(query, settings, tasks), deadline, tasks);
    } catch (ExecutionException e) {
      throw new BackendUnavailableException("Graph retrieval failed", e.getCause());
    }
    recordGraph(stats, graph);

    if (graph.extractionError() != null) {
      throw new BackendUnavailableException(
          "Entity extraction failed: " + graph.extractionError().getMessage(),
          graph.extractionError());
    }
    if (graph.traversalsAttempted() > 0
        && graph.traversalsFailed() == graph.traversalsAttempted()) {
      throw new BackendUnavailableException(
          "Graph traversal failed for all %d entities".formatted(graph.traversalsAttempted()));
    }
    if (graph.traversalsFailed() > 0) {
      stats.degradedModalities.add(Modality.GRAPH_TRAVERSAL);
    }

    List<Document> documents = new ArrayList<>(graph.traversed().nodes().size());
    for (GraphNode node : graph.traversed().nodes()) {
      documents.add(node.toDocument());
    }
    return filterAndTruncate(documents, settings);
  }

  private CompletableFuture<VectorOutcome> startVectorSearch(String query, int k, Tasks tasks) {
    return submit(
        () -> {
          Instant start = clock.instant();
          List<Document> documents = vectorStore.similaritySearch(query, k);
          return new VectorOutcome(
              documents == null ? List.of() : List.copyOf(documents), since(start));
        },
        tasks);
  }

  private CompletableFuture<GraphOutcome> startGraphSearch(
      String query, RetrievalSettings settings, Tasks tasks) {
    CompletableFuture<Extraction> extraction = submit(() -> extractEntities(query), tasks);
    return tasks.track(extraction.thenCompose(result -> traverseAll(result, settings, tasks)));
  }

  /**
   * Runs {@code work} on the retrieval executor. The returned future completes with its outcome;
   * {@link Tasks#cancelAll()} interrupts the worker thread if the task is still running.
   */
  private <T> CompletableFuture<T> submit(Supplier<T> work, Tasks tasks) {
    CompletableFuture<T> outcome = new CompletableFuture<>();
    Future<?> running;
    try {
      running =
          executor.submit(
              () -> {
                try {
                  outcome.complete(work.get());
                } catch (Throwable e) {
                  outcome.completeExceptionally(e);
                }
              });
    } catch (RejectedExecutionException e) {
      outcome.completeExceptionally(e);
      return tasks.track(outcome);
    }
    return tasks.track(outcome, running);
  }

  private Extraction extractEntities(String query) {
    Instant start = clock.instant();
    if (entityExtractor == null) {
      return new Extraction(List.of(), null, Duration.ZERO);
    }
    try {
      List<Entity> entities = entityExtractor.extract(query);
      return new Extraction(entities == null ? List.of() : entities, null, since(start));
    } catch (RuntimeException e) {
      log.warn("Entity extraction failed, continuing without graph seeds: {}", e.getMessage());
      return new Extraction(List.of(), e, since(start));
    }
  }

  /**
   * Starts one traversal per distinct entity id and unions the results in entity order. A failing
   * traversal is logged and skipped.
   */
  private CompletableFuture<GraphOutcome> traverseAll(
      Extraction extraction, RetrievalSettings settings, Tasks tasks) {
    Set<String> seeds = new LinkedHashSet<>();
    for (Entity entity : extraction.entities()) {
      if (entity != null && entity.id() != null && !entity.id().isBlank()) {
        seeds.add(entity.id());
      }
    }
    if (seeds.isEmpty()) {
      return CompletableFuture.completedFuture(
          new GraphOutcome(extraction, TraversedGraph.empty(), 0, 0, Duration.ZERO));
    }

    TraverseOptions options =
        TraverseOptions.breadthFirst(settings.maxTraverseDepth(), settings.candidatePoolSize());
    Instant start = clock.instant();

    List<CompletableFuture<TraversalAttempt>> attempts = new ArrayList<>(seeds.size());
    for (String seed : seeds) {
      attempts.add(submit(() -> traverse(seed, options), tasks));
    }

    return CompletableFuture.allOf(attempts.toArray(CompletableFuture[]::new))
        .thenApply(
            ignored -> {
              List<TraversalResult> succeeded = new ArrayList<>();
              int failed = 0;
              for (CompletableFuture<TraversalAttempt> attempt : attempts) {
                TraversalAttempt outcome = attempt.join();
                if (outcome.result() != null) {
                  succeeded.add(outcome.result());
                } else {
                  failed++;
                }
              }
              return new GraphOutcome(
                  extraction,
                  TraversedGraph.union(succeeded),
                  seeds.size(),
                  failed,
                  since(start));
            });
  }

  private TraversalAttempt traverse(String seed, TraverseOptions options) {
    try {
      return new TraversalAttempt(seed, graphStore.traverse(seed, options));
    } catch (RuntimeException e) {
      log.warn("Graph traversal from {} failed, skipping entity: {}", seed, e.getMessage());
      return new TraversalAttempt(seed, null);
    }
  }

  private VectorOutcome awaitVector(
      CompletableFuture<VectorOutcome> vectorBranch, Deadline deadline, Tasks tasks) {
    try {
      return await(vectorBranch, deadline, tasks);
    } catch (ExecutionException e) {
      tasks.cancelAll();
      Throwable cause = e.getCause();
      throw new BackendUnavailableException(
          "Vector search failed: " + (cause == null ? e.getMessage() : cause.getMessage()),
          cause == null ? e : cause);
    }
  }

  /**
   * Waits for {@code future} until the deadline. Interruption, timeout and cancellation cancel
   * every task of the call and surface as {@link SearchCancelledException}.
   */
  private <T> T await(CompletableFuture<T> future, Deadline deadline, Tasks tasks)
      throws ExecutionException {
    try {
      return future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      tasks.cancelAll();
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Search interrupted", e);
    } catch (TimeoutException e) {
      tasks.cancelAll();
      throw new SearchCancelledException("Search exceeded timeout of " + searchTimeout, e);
    } catch (CancellationException e) {
      tasks.cancelAll();
      throw new SearchCancelledException("Search cancelled", e);
    }
  }

  private static List<Document> filterAndTruncate(
      List<Document> documents, RetrievalSettings settings) {
    // Documents without a fused score (single-modality paths) always pass the floor
    return documents.stream()
        .filter(
            doc -> {
              var score = doc.fusedScore();
              return score.isEmpty() || score.getAsDouble() >= settings.minScore();
            })
        .limit(settings.k())
        .toList();
  }

  private void recordVector(SearchStatistics.Recorder stats, VectorOutcome vector) {
    stats.vectorResultsCount = vector.documents().size();
    stats.vectorSearchTime = vector.elapsed();
    log.debug(
        "Vector search: {} documents in {} ms",
        vector.documents().size(),
        vector.elapsed().toMillis());
  }

  private void recordGraph(SearchStatistics.Recorder stats, GraphOutcome graph) {
    stats.entitiesExtracted = graph.extraction().entities().size();
    stats.entityExtractionTime = graph.extraction().elapsed();
    stats.graphResultsCount = graph.traversed().nodes().size();
    stats.nodesTraversed = graph.traversed().visits();
    stats.graphSearchTime = graph.elapsed();
    log.debug(
        "Graph search: {} entities, {} distinct nodes ({} visited) in {} ms",
        stats.entitiesExtracted,
        stats.graphResultsCount,
        stats.nodesTraversed,
        graph.elapsed().toMillis());
  }

  private SearchStatistics record(SearchStatistics.Recorder stats, Instant start) {
    SearchStatistics statistics = stats.build(since(start));
    lastStatistics.set(statistics);
    return statistics;
  }

  private Duration since(Instant start) {
    Duration elapsed = Duration.between(start, clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }

  private static <T> T required(@Nullable T value, String name) {
    if (value == null) {
      throw new InvalidRetrieverConfigException(name + " must not be null");
    }
    return value;
  }

  private record VectorOutcome(List<Document> documents, Duration elapsed) {}

  private record Extraction(
      List<Entity> entities, @Nullable RuntimeException error, Duration elapsed) {}

  private record TraversalAttempt(String seed, @Nullable TraversalResult result) {}

  private record GraphOutcome(
      Extraction extraction,
      TraversedGraph traversed,
      int traversalsAttempted,
      int traversalsFailed,
      Duration elapsed) {

    static GraphOutcome failedTraversal() {
      return new GraphOutcome(
          new Extraction(List.of(), null, Duration.ZERO),
          TraversedGraph.empty(),
          1,
          1,
          Duration.ZERO);
    }

    @Nullable RuntimeException extractionError() {
      return extraction.error();
    }
  }

  /** Absolute deadline on the monotonic clock. */
  private record Deadline(long nanos) {

    static Deadline after(Duration timeout) {
      return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    long remainingNanos() {
      return Math.max(0L, nanos - System.nanoTime());
    }
  }

  /**
   * Work started by one call. Cancelling interrupts the executor tasks still running and cancels
   * their completion stages; anything tracked afterwards is cancelled on arrival.
   */
  private static final class Tasks {
    private final Queue<Future<?>> running = new ConcurrentLinkedQueue<>();
    private final Queue<CompletableFuture<?>> stages = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    <T> CompletableFuture<T> track(CompletableFuture<T> stage) {
      stages.add(stage);
      if (cancelled) {
        stage.cancel(false);
      }
      return stage;
    }

    <T> CompletableFuture<T> track(CompletableFuture<T> stage, Future<?> task) {
      running.add(task);
      if (cancelled) {
        task.cancel(true);
      }
      return track(stage);
    }

    void cancelAll() {
      cancelled = true;
      // CompletableFuture.cancel never interrupts, so the executor tasks are cancelled directly
      running.forEach(task -> task.cancel(true));
      stages.forEach(stage -> stage.cancel(false));
    }
  }
}
