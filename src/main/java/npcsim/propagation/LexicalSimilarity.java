package npcsim.propagation;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jaccard overlap of lower-cased word sets, ignoring stop words. Deterministic and cheap; word
 * order and synonyms are invisible to it.
 */
public class LexicalSimilarity implements SimilarityFunction {
  private static final Pattern WORD = Pattern.compile("[a-z0-9]+(?:'[a-z]+)?");
  private static final Set<String> STOP_WORDS = Set.of(
      "the", "a", "an", "is", "are", "was", "were", "be", "been",
      "have", "has", "had", "do", "does", "did", "will", "would",
      "could", "should", "may", "might", "must", "shall", "can",
      "to", "of", "in", "for", "on", "with", "at", "by", "from",
      "that", "this", "these", "those", "it", "its", "as", "or",
      "and", "but", "if", "so", "than", "too", "very", "just");

  @Override
  public double similarity(String candidate, String original) {
    Set<String> a = tokens(candidate);
    Set<String> b = tokens(original);
    if (a.isEmpty() && b.isEmpty()) {
      return normalize(candidate).equals(normalize(original)) ? 1.0 : 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  /** Content words of {@code text} in order of appearance. */
  public static Set<String> tokens(String text) {
    Set<String> out = new LinkedHashSet<>();
    if (text == null) return out;
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String word = matcher.group();
      if (!STOP_WORDS.contains(word)) out.add(word);
    }
    return out;
  }

  private static String normalize(String text) {
    return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
  }
}
