package ca.gc.cra.envbind.application.walk;

import ca.gc.cra.envbind.domain.env.EnvironmentSnapshot;
import ca.gc.cra.envbind.domain.failure.MalformedSequenceIndexException;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Counts the elements of an indexed list from the keys of a snapshot.
 *
 * <p>A key {@code BASE_3_HOST} or {@code BASE_3} contributes index 3. Keys whose segment after
 * {@code BASE_} does not start with a digit belong to other fields and are ignored. The indices
 * must form {@code 0..count-1}.</p>
 *
 * <p>Indices are plain decimal without leading zeros: {@code BASE_01_HOST} is rejected rather than
 * read as element 1, so {@code BASE_1_HOST} and {@code BASE_01_HOST} can never both set one
 * element.</p>
 *
 * @since 0.1.0
 */
public final class SequenceIndexScanner {

  /**
   * Counts the distinct indices found under a base key.
   *
   * @param base upper-cased list key
   * @param snapshot environment view
   * @return number of elements, {@code 0} when no indexed key exists
   * @throws MalformedSequenceIndexException when an index segment is malformed or indices have gaps
   */
  public int count(String base, EnvironmentSnapshot snapshot) throws MalformedSequenceIndexException {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(snapshot, "snapshot");
    String head = base + "_";
    SortedSet<Integer> indices = new TreeSet<>();
    for (String key : snapshot.keys()) {
      if (!key.startsWith(head)) {
        continue;
      }
      String rest = key.substring(head.length());
      if (rest.isEmpty() || !isDigit(rest.charAt(0))) {
        continue;
      }
      int end = 0;
      while (end < rest.length() && isDigit(rest.charAt(end))) {
        end++;
      }
      if (end < rest.length() && rest.charAt(end) != '_') {
        throw new MalformedSequenceIndexException(base, "malformed index in key " + key);
      }
      String digits = rest.substring(0, end);
      if (digits.length() > 1 && digits.charAt(0) == '0') {
        throw new MalformedSequenceIndexException(base, "leading zero in index of key " + key);
      }
      try {
        indices.add(Integer.parseInt(digits));
      } catch (NumberFormatException ex) {
        throw new MalformedSequenceIndexException(base, "index out of range in key " + key);
      }
    }
    if (indices.isEmpty()) {
      return 0;
    }
    int count = indices.size();
    if (indices.last() != count - 1) {
      throw new MalformedSequenceIndexException(base,
          "indices under " + base + " must be contiguous from 0: found " + count
              + " distinct indices, highest " + indices.last());
    }
    return count;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
