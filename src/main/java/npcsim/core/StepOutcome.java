package npcsim.core;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepOutcome {
  public enum Status {
    COMPLETED,
    FAILED,
    BUSY
  }

  public final Status status;
  public final DialogueTurn turn;
  public final WorldSnapshot world;
  public final String reason;

  private StepOutcome(Status status, DialogueTurn turn, WorldSnapshot world, String reason) {
    this.status = status;
    this.turn = turn;
    this.world = world;
    this.reason = reason;
  }

  public static StepOutcome completed(DialogueTurn turn, WorldSnapshot world) {
    return new StepOutcome(Status.COMPLETED, turn, world, null);
  }

  public static StepOutcome failed(String reason) {
    return new StepOutcome(Status.FAILED, null, null, reason);
  }

  public static StepOutcome busy(String reason) {
    return new StepOutcome(Status.BUSY, null, null, reason);
  }

  public boolean completed() {
    return status == Status.COMPLETED;
  }
}
