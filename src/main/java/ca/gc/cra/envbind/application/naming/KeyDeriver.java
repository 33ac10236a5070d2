package ca.gc.cra.envbind.application.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Computes the canonical and alias lookup keys of a field.
 * <p><strong>Role:</strong> First step of every field visit in the structure walker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split camel-case names into {@code _}-joined words when requested.</li>
 *   <li>Prefer a declared alias as the name segment and expose it as a fallback key.</li>
 *   <li>Void the alias inside indexed list elements so elements never share a key.</li>
 * </ul>
 * <p>The alias is void for every element of an indexed list, element {@code 0} included: an
 * {@code @EnvVar("SERVER_NAME")} field inside {@code servers} reads only {@code APP_SERVERS_0_NAME},
 * {@code APP_SERVERS_1_NAME} and so on, never a bare {@code SERVER_NAME}. The list field's own
 * alias still applies to the list base key.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class KeyDeriver {
  private static final Pattern WORDS = Pattern.compile("([^A-Z]+|[A-Z]+[^A-Z]+|[A-Z]+)");
  private static final Pattern ACRONYM = Pattern.compile("([A-Z]+)([A-Z][^A-Z]+)");

  /**
   * Derives the keys for a field.
   *
   * @param prefix current prefix, possibly empty
   * @param fieldName declared field name
   * @param splitWords whether camel-case words are separated with {@code _}
   * @param alias declared alias, possibly empty
   * @param insideSequence whether the field belongs to an indexed list element
   * @return canonical key and optional alias key
   */
  public DerivedKey derive(
      String prefix, String fieldName, boolean splitWords, String alias, boolean insideSequence) {
    String cleanAlias = alias == null ? "" : alias.trim();
    boolean useAlias = !cleanAlias.isEmpty() && !insideSequence;
    String segment;
    if (useAlias) {
      segment = cleanAlias;
    } else if (splitWords) {
      segment = String.join("_", splitWords(fieldName));
    } else {
      segment = fieldName;
    }
    String key = join(prefix, segment);
    String aliasKey = useAlias ? cleanAlias.toUpperCase(Locale.ROOT) : "";
    return new DerivedKey(key, aliasKey);
  }

  /**
   * Joins a prefix and a segment with {@code _} and upper-cases the result.
   *
   * @param prefix prefix, possibly empty
   * @param segment name segment
   * @return upper-cased key
   */
  public String join(String prefix, String segment) {
    String raw = prefix == null || prefix.isEmpty() ? segment : prefix + "_" + segment;
    return raw.toUpperCase(Locale.ROOT);
  }

  /**
   * Splits a camel-case name into words, keeping acronyms together.
   *
   * @param name field name
   * @return words in order; the name itself when nothing matches
   */
  static List<String> splitWords(String name) {
    List<String> words = new ArrayList<>();
    Matcher matcher = WORDS.matcher(name);
    while (matcher.find()) {
      String word = matcher.group();
      Matcher acronym = ACRONYM.matcher(word);
      if (acronym.matches()) {
        words.add(acronym.group(1));
        words.add(acronym.group(2));
      } else {
        words.add(word);
      }
    }
    if (words.isEmpty()) {
      words.add(name);
    }
    return words;
  }
}
