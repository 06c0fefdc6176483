package npcsim.web;

import npcsim.core.DialogueTurn;
import npcsim.core.TurnEvent;
import npcsim.core.WorldSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnFeedTest {
  private static TurnEvent event(int turn) {
    DialogueTurn dialogue = new DialogueTurn(turn, "npc:mara", "Mara, the Grumpy Shopkeeper", "Quartermaster",
        "irritable", "npc:rylan", "Rylan, the Anxious Guard", "Night Watch Captain", "paranoid",
        "Hmph.", "", "neutral", 0.1, List.of(), 0L);
    WorldSnapshot world = new WorldSnapshot(0.1, 0.2, 1.0, "Vault door left ajar.", "Vault door left ajar.",
        List.of(), List.of());
    return new TurnEvent(dialogue, world);
  }

  @Test
  void pollingFromAnIndexReturnsOnlyNewerTurns() {
    TurnFeed feed = new TurnFeed(10);
    feed.onTurn(event(1));
    feed.onTurn(event(2));
    feed.onTurn(event(3));

    TurnFeed.FeedSnapshot snap = feed.snapshotFrom(1);

    assertEquals(List.of(2, 3), snap.events.stream().map(e -> e.turn().turn()).toList());
    assertEquals(3, snap.nextIndex);
  }

  @Test
  void overflowDropsOldestButKeepsIndices() {
    TurnFeed feed = new TurnFeed(2);
    for (int i = 1; i <= 4; i++) {
      feed.onTurn(event(i));
    }

    TurnFeed.FeedSnapshot snap = feed.snapshotFrom(0);

    assertEquals(List.of(3, 4), snap.events.stream().map(e -> e.turn().turn()).toList());
    assertEquals(4, snap.nextIndex);
  }

  @Test
  void clearDoesNotRewindClients() {
    TurnFeed feed = new TurnFeed(10);
    feed.onTurn(event(1));
    feed.onTurn(event(2));

    feed.clear();
    assertTrue(feed.snapshotFrom(2).events.isEmpty());
    assertEquals(2, feed.snapshotFrom(0).nextIndex);

    feed.onTurn(event(1));
    TurnFeed.FeedSnapshot snap = feed.snapshotFrom(2);
    assertEquals(1, snap.events.size());
    assertEquals(3, snap.nextIndex);
  }
}
