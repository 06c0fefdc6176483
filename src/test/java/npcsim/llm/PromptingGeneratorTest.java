package npcsim.llm;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptingGeneratorTest {

  private static class RecordingClient implements LLMClient {
    final List<String> prompts = new ArrayList<>();
    String reply = "{\"utterance\":\"Hush.\",\"rumor_delta\":0.1}";

    @Override
    public String generateJson(String systemPrompt, String prompt, LLMRequestOptions options) throws Exception {
      prompts.add(prompt);
      if (reply == null) throw new IOException("connection refused");
      return reply;
    }

    @Override
    public String name() {
      return "recording";
    }
  }

  @Test
  void promptCarriesSpeakerListenerAndMemories() throws Exception {
    RecordingClient client = new RecordingClient();
    GenerationRequest request = new GenerationRequest("npc:mara", "Mara", "Mara, the Shopkeeper", "Shopkeeper",
        List.of("grumpy"), 0.7, "irritable", "Rylan", "Rylan, the Guard", "Guard", "paranoid",
        "Vault door left ajar", "Vault door left ajar", 0.6, List.of("Mara to Rylan: hmph"),
        List.of("Mara noted the vault just now: \"The vault door was open.\""), List.of(), false);

    String raw = new PromptingGenerator(client, new PromptBuilder()).generate(request, null);

    assertEquals(client.reply, raw);
    String prompt = client.prompts.get(0);
    assertTrue(prompt.contains("Mara is talking with Rylan"));
    assertTrue(prompt.contains("Rumor tension: high ("));
    assertTrue(prompt.contains("WHAT MARA REMEMBERS:\n- Mara noted the vault just now"));
    assertTrue(prompt.contains("WHAT RYLAN HAS HEARD:\n(none)"));
    assertFalse(prompt.contains("Return compact JSON only"));

    new PromptingGenerator(client, null).generate(request.strictCopy(), null);
    assertTrue(client.prompts.get(1).contains("Return compact JSON only"));
  }

  @Test
  void providerFailuresAreInvalidResponses() {
    RecordingClient client = new RecordingClient();
    client.reply = null;
    PromptingGenerator generator = new PromptingGenerator(client, new PromptBuilder());

    assertThrows(InvalidGenerationResponseException.class,
        () -> generator.generate(TemplateGeneratorTest.request("vault", List.of(), "calm"), null));

    client.reply = "  ";
    assertThrows(InvalidGenerationResponseException.class,
        () -> generator.generate(TemplateGeneratorTest.request("vault", List.of(), "calm"), null));
  }

  @Test
  void fencedRepliesAreUnwrapped() {
    assertEquals("{\"a\":1}", JsonPayloads.extract("```json\n{\"a\":1}\n```"));
    assertEquals("{\"a\":1}", JsonPayloads.extract("Sure thing! {\"a\":1} Hope that helps."));
    assertEquals("", JsonPayloads.extract(null));
  }

  @Test
  void tensionLabelsFollowHeat() {
    assertEquals("low", PromptBuilder.tensionLabel(0.1));
    assertEquals("rising", PromptBuilder.tensionLabel(0.3));
    assertEquals("high", PromptBuilder.tensionLabel(0.5));
    assertEquals("boiling", PromptBuilder.tensionLabel(0.9));
  }
}
