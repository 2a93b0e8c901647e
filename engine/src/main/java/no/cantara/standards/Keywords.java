package no.cantara.standards;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical keyword extraction shared by the graph index and the similarity scorer.
 */
public final class Keywords {

    private Keywords() {}

    private static final Pattern WORD = Pattern.compile("[a-z]+");
    private static final int MIN_LENGTH = 4;
    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with",
            "by", "is", "are", "was", "were", "has", "have", "had", "that", "this", "these",
            "those", "from", "into", "such", "their", "them", "they", "its", "which", "where",
            "when", "will", "shall", "must", "should", "been", "being", "also", "each", "other");

    /**
     * Lower-case alphabetic words of at least four characters, stop words removed,
     * in first-occurrence order.
     */
    public static Set<String> extract(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return keywords;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() >= MIN_LENGTH && !STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }
}
