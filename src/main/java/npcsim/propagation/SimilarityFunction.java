package npcsim.propagation;

/** Scores how close a retold line is to the original secret, from 0 (unrelated) to 1 (identical). */
public interface SimilarityFunction {
  double similarity(String candidate, String original);
}
