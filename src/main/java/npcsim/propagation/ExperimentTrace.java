package npcsim.propagation;

public record ExperimentTrace(int turn, String agentId, String agentName, String listenerId, String listenerName,
                              PersonalityType personalityType, String content, double similarity,
                              MutationClass mutation, String drift, long timestampMs) {}
