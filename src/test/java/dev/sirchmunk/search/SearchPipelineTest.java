package dev.sirchmunk.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.sirchmunk.cluster.ClusterBuilder;
import dev.sirchmunk.cluster.ClusterStore;
import dev.sirchmunk.cluster.KnowledgeCluster;
import dev.sirchmunk.cluster.ReuseDecision;
import dev.sirchmunk.cluster.SourceVerifier;
import dev.sirchmunk.evidence.DocumentReader;
import dev.sirchmunk.evidence.EvidenceSampler;
import dev.sirchmunk.evidence.EvidenceUnit;
import dev.sirchmunk.evidence.SamplingProperties;
import dev.sirchmunk.fixture.InMemoryTextSearchTool;
import dev.sirchmunk.grep.SearchToolProperties;
import dev.sirchmunk.grep.TextSearchDispatcher;
import dev.sirchmunk.llm.LlmGateway;
import dev.sirchmunk.retrieval.FileScanner;
import dev.sirchmunk.retrieval.FilenameMatcher;
import dev.sirchmunk.retrieval.HybridRetriever;
import dev.sirchmunk.retrieval.KeywordPlanner;
import dev.sirchmunk.retrieval.RetrievalProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Runs FAST searches through the real retrieval and sampling pipeline. Only the external search
 * tool, the LLM and the store are replaced.
 */
@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class SearchPipelineTest {

  @TempDir Path corpus;

  @Mock private LlmGateway llmGateway;
  @Mock private ClusterStore clusterStore;

  private ExecutorService toolExecutor;
  private ExecutorService searchExecutor;
  private SearchOrchestrator orchestrator;

  private Path fileA;
  private Path fileB;
  private Path fileC;

  @BeforeEach
  void setUp() throws IOException {
    fileA = Files.writeString(corpus.resolve("a.md"), "Tokenizers split text into pieces.\n");
    fileB =
        Files.writeString(
            corpus.resolve("b.md"),
            "# Transformers\n\nThe attention mechanism weighs every token against the others.\n");
    fileC =
        Files.writeString(corpus.resolve("c.md"), "Optimizers update parameters with gradients.\n");

    Clock clock = Clock.systemUTC();
    SearchToolProperties toolProperties = new SearchToolProperties();
    RetrievalProperties retrievalProperties = new RetrievalProperties();
    retrievalProperties.setLlmKeywordPlanning(false);
    SamplingProperties samplingProperties = new SamplingProperties();
    toolExecutor = Executors.newFixedThreadPool(2);
    searchExecutor = Executors.newSingleThreadExecutor();

    FileScanner fileScanner = new FileScanner(toolProperties);
    HybridRetriever retriever =
        new HybridRetriever(
            fileScanner,
            new KeywordPlanner(llmGateway),
            new TextSearchDispatcher(new InMemoryTextSearchTool(), toolExecutor, toolProperties),
            retrievalProperties);
    EvidenceSampler sampler =
        new EvidenceSampler(
            samplingProperties, new DocumentReader(samplingProperties), llmGateway);
    ClusterBuilder clusterBuilder = new ClusterBuilder(llmGateway, new SourceVerifier(clock));

    orchestrator =
        new SearchOrchestrator(
            fileScanner,
            new FilenameMatcher(),
            retriever,
            sampler,
            clusterBuilder,
            clusterStore,
            new ClusterSummaryFormatter(new SearchProperties()),
            new SearchProgressTracker(clock),
            new SearchProperties(),
            retrievalProperties,
            samplingProperties,
            searchExecutor,
            clock);
  }

  @AfterEach
  void tearDown() {
    toolExecutor.shutdownNow();
    searchExecutor.shutdownNow();
  }

  @Test
  void fastSearchRanksTheOnlyFileMentioningTheTopicFirst() {
    when(clusterStore.findReusable(anyString())).thenReturn(ReuseDecision.none());
    when(clusterStore.insert(any(KnowledgeCluster.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    SearchResult result =
        orchestrator.search(
            new SearchQuery("How does attention work?", List.of(corpus), SearchMode.FAST));

    assertThat(result.status()).isEqualTo(SearchResult.Status.COMPLETED);
    assertThat(result.failure()).isNull();
    assertThat(result.files()).isNotEmpty();
    assertThat(result.files().get(0).path().getFileName()).isEqualTo(fileB.getFileName());
    assertThat(result.files())
        .extracting(hit -> hit.path().getFileName())
        .doesNotContain(fileA.getFileName(), fileC.getFileName());
    assertThat(result.evidence())
        .isNotEmpty()
        .anySatisfy(
            unit -> {
              assertThat(unit.sourcePath()).endsWith("b.md");
              assertThat(unit.text()).contains("attention mechanism");
            });
    assertThat(result.clusterId()).isNotNull();
    verifyNoInteractions(llmGateway);
  }

  @Test
  void evidenceSpansStayInsideTheirDocument() throws IOException {
    when(clusterStore.findReusable(anyString())).thenReturn(ReuseDecision.none());
    when(clusterStore.insert(any(KnowledgeCluster.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    String document = Files.readString(fileB);

    SearchResult result =
        orchestrator.search(
            new SearchQuery("attention mechanism", List.of(corpus), SearchMode.FAST));

    assertThat(result.evidence()).isNotEmpty();
    for (EvidenceUnit unit : result.evidence()) {
      assertThat(unit.start()).isGreaterThanOrEqualTo(0).isLessThan(unit.end());
      assertThat(unit.end()).isLessThanOrEqualTo(document.length());
      assertThat(unit.text()).isEqualTo(document.substring(unit.start(), unit.end()));
    }
  }

  @Test
  void filenameOnlyFindsTestUtilitiesWithoutSearchingContent() throws IOException {
    Path utils = Files.writeString(corpus.resolve("test_utils.py"), "def helper(): pass\n");
    Path main = Files.writeString(corpus.resolve("main.py"), "print('test')\n");

    SearchResult result =
        orchestrator.search(new SearchQuery("test", List.of(corpus), SearchMode.FILENAME_ONLY));

    assertThat(result.files())
        .extracting(hit -> hit.path().getFileName())
        .contains(utils.getFileName())
        .doesNotContain(main.getFileName());
    verifyNoInteractions(llmGateway, clusterStore);
  }
}
