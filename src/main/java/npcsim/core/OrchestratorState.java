package npcsim.core;

public enum OrchestratorState {
  IDLE,
  RUNNING_SINGLE_STEP,
  RUNNING_LOOP,
  STOPPED
}
