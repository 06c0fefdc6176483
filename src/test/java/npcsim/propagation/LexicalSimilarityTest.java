package npcsim.propagation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LexicalSimilarityTest {
  private final LexicalSimilarity similarity = new LexicalSimilarity();

  @Test
  void identicalTextScoresOne() {
    assertEquals(1.0, similarity.similarity("The vault door was left ajar", "The vault door was left ajar"));
  }

  @Test
  void identicalSecretClassifiesAsUnchangedAndEmptyTextScoresZero() {
    String secret = "The blacksmith is a spy";

    double same = similarity.similarity(secret, secret);

    assertEquals(1.0, same);
    assertEquals(MutationClass.UNCHANGED, PropagationSettings.defaults().classify(same));
    assertEquals(0.0, similarity.similarity("", secret));
  }

  @Test
  void caseAndStopWordsAreIgnored() {
    assertEquals(1.0, similarity.similarity("VAULT DOOR left AJAR!", "The vault door was left ajar"));
  }

  @Test
  void disjointTextScoresZero() {
    assertEquals(0.0, similarity.similarity("Fresh bread at the market", "The vault door was left ajar"));
  }

  @Test
  void partialOverlapIsJaccardOfContentWords() {
    // {vault, door, open} vs {vault, door, left, ajar}: 2 shared of 5
    assertEquals(0.4, similarity.similarity("The vault door is open", "The vault door was left ajar"), 1e-9);
  }

  @Test
  void textsMadeOnlyOfStopWordsCompareVerbatim() {
    assertEquals(1.0, similarity.similarity("It is", "it is"));
    assertEquals(0.0, similarity.similarity("It is", "it was"));
  }

  @Test
  void tokensKeepFirstAppearanceOrder() {
    assertEquals(List.of("guard", "captain", "seen", "bribing"),
        List.copyOf(LexicalSimilarity.tokens("Guard captain seen bribing the guard")));
  }
}
