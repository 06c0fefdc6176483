package npcsim.llm;

import npcsim.agents.DialogueResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateGeneratorTest {
  static GenerationRequest request(String topic, List<String> traits, String mood) {
    return new GenerationRequest("npc:theron", "Theron", "Theron, the Bard", "Bard (Minstrel)", traits, 1.4, mood,
        "Suna", "Suna, the Herbalist", "Herbalist (Healer)", "serene", topic, topic, 0.1,
        List.of(), List.of(), List.of(), false);
  }

  @Test
  void outputIsValidDialogueAboutTheThread() throws Exception {
    TemplateGenerator generator = new TemplateGenerator(42);

    DialogueResult result = DialogueResult.fromJson(
        generator.generate(request("Vault door left ajar last night.", List.of("theatrical"), "playful"), null));

    assertTrue(result.utterance.contains("vault door left ajar last night"));
    assertTrue(result.rumorDelta >= 0.05 && result.rumorDelta <= 0.35);
    assertEquals(TemplateGenerator.sentimentFor(result.rumorDelta), result.sentiment);
    assertEquals("Told Suna that vault door left ajar last night.", result.newMemory);
    assertEquals("", result.newDevelopment);
  }

  @Test
  void sameSeedGivesTheSameLines() throws Exception {
    GenerationRequest request = request("Smoke near the marsh", List.of("calm"), "serene");
    TemplateGenerator first = new TemplateGenerator(7);
    TemplateGenerator second = new TemplateGenerator(7);

    for (int i = 0; i < 5; i++) {
      assertEquals(first.generate(request, null), second.generate(request, null));
    }
  }

  @Test
  void voiceFollowsTheFirstKnownTrait() {
    assertEquals("grumpy", TemplateGenerator.voiceOf(List.of("guarded", "Grumpy", "calm")));
    assertEquals("calm", TemplateGenerator.voiceOf(List.of("inventive")));
  }

  @Test
  void sentimentRisesWithTheDelta() {
    assertEquals("worried", TemplateGenerator.sentimentFor(0.1));
    assertEquals("tense", TemplateGenerator.sentimentFor(0.2));
    assertEquals("urgent", TemplateGenerator.sentimentFor(0.3));
  }
}
