package dev.sirchmunk.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.llm.LlmGateway;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

class EvidenceSamplerPropertyTest {

  private final SamplingProperties properties = new SamplingProperties();
  private final EvidenceSampler sampler =
      new EvidenceSampler(properties, new DocumentReader(properties), mock(LlmGateway.class));

  @Provide
  Arbitrary<String> documents() {
    Arbitrary<String> words =
        Arbitraries.of("retry", "backoff", "policy", "the", "report", "rooms", "attempt", "a");
    Arbitrary<String> separators = Arbitraries.of(" ", " ", " ", ". ", "\n", "\n\n", "! ");
    return Arbitraries.lazy(
        () ->
            words
                .list()
                .ofMinSize(0)
                .ofMaxSize(600)
                .flatMap(
                    list ->
                        separators
                            .list()
                            .ofSize(list.size())
                            .map(
                                seps -> {
                                  StringBuilder text = new StringBuilder();
                                  for (int i = 0; i < list.size(); i++) {
                                    text.append(list.get(i)).append(seps.get(i));
                                  }
                                  return text.toString();
                                })));
  }

  @Property(tries = 200)
  void evidenceAlwaysPointsIntoTheDocument(
      @ForAll("documents") String document,
      @ForAll @IntRange(min = 0, max = 30) int maxProbes,
      @ForAll @IntRange(min = 1, max = 4) int topK) {
    List<EvidenceUnit> units =
        sampler.sample(
            "retry backoff policy",
            List.of(),
            "/corpus/doc.md",
            document,
            new SamplingBudget(maxProbes, 20_000, topK, false),
            QueryContext.unbounded());

    assertThat(units).hasSizeLessThanOrEqualTo(topK);
    if (maxProbes == 0) {
      assertThat(units).isEmpty();
    }
    for (EvidenceUnit unit : units) {
      assertThat(unit.start()).isGreaterThanOrEqualTo(0);
      assertThat(unit.end()).isGreaterThan(unit.start()).isLessThanOrEqualTo(document.length());
      assertThat(unit.text()).isEqualTo(document.substring(unit.start(), unit.end()));
      assertThat(unit.score()).isBetween(0.0, 1.0);
      assertThat(unit.end() - unit.start()).isLessThanOrEqualTo(properties.getRoiWindow());
    }
    for (int i = 0; i < units.size(); i++) {
      for (int j = i + 1; j < units.size(); j++) {
        assertThat(units.get(i).overlaps(units.get(j))).isFalse();
      }
    }
  }
}
