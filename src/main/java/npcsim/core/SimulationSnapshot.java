package npcsim.core;

import npcsim.memory.GraphStats;

import java.util.List;

public record SimulationSnapshot(OrchestratorState state, int turn, String seedEvent, WorldSnapshot world,
                                 List<DialogueTurn> history, List<AgentView> agents, GraphStats graph) {}
