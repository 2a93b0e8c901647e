package no.cantara.standards;

import no.cantara.standards.model.Accreditor;
import no.cantara.standards.model.EvidenceMapping;
import no.cantara.standards.model.MappingStatistics;
import no.cantara.standards.model.MatchType;
import no.cantara.standards.model.Standard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scores free-text evidence against the indicator sets of standards.
 *
 * <p>Confidence is the fraction of a standard's indicators that occur in the evidence as
 * case-insensitive substrings, each indicator counted once. The mapper holds no state
 * between calls: the same input always gives the same output.
 */
public class EvidenceMapper {

    static final int MAX_SPAN_LENGTH = 240;
    private static final int SPAN_LEAD = 80;

    private final int maxRationaleSpans;
    private final double meetsThreshold;

    public EvidenceMapper(EngineSettings settings) {
        this.maxRationaleSpans = settings.maxRationaleSpans();
        this.meetsThreshold = settings.meetsThreshold();
    }

    /**
     * Maps {@code evidence} against one accreditor, or the whole corpus when
     * {@code accreditor} is null. Results are sorted by descending confidence; ties keep
     * corpus order. Standards with nothing to score against are skipped.
     */
    public List<EvidenceMapping> map(StandardsGraph graph, String evidence, String accreditor) {
        String text = evidence != null ? evidence : "";
        List<Standard> standards = new ArrayList<>();
        if (accreditor == null) {
            for (String code : graph.accreditors()) {
                graph.getAccreditor(code).map(Accreditor::standards).ifPresent(standards::addAll);
            }
        } else {
            standards.addAll(graph.getAccreditorStandards(accreditor));
        }

        List<EvidenceMapping> mappings = new ArrayList<>();
        for (Standard standard : standards) {
            List<String> indicators = graph.indicatorsOf(standard.id());
            if (indicators.isEmpty()) {
                indicators = List.copyOf(Keywords.extract(standard.title()));
            }
            if (indicators.isEmpty()) {
                continue;
            }
            mappings.add(score(standard, indicators, text));
        }
        mappings.sort(Comparator.comparingDouble(EvidenceMapping::confidence).reversed());
        return List.copyOf(mappings);
    }

    /**
     * Maps several documents, keyed by document id, in the caller's order.
     */
    public Map<String, List<EvidenceMapping>> mapBatch(StandardsGraph graph, Map<String, String> documents, String accreditor) {
        Map<String, List<EvidenceMapping>> results = new LinkedHashMap<>();
        documents.forEach((docId, text) -> results.put(docId, map(graph, text, accreditor)));
        return results;
    }

    EvidenceMapping score(Standard standard, List<String> indicators, String evidence) {
        String haystack = evidence.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        if (!haystack.isBlank()) {
            for (String indicator : indicators) {
                if (haystack.contains(indicator.toLowerCase(Locale.ROOT))) {
                    matched.add(indicator);
                }
            }
        }

        double confidence = Math.min(1.0, (double) matched.size() / indicators.size());
        boolean meets = confidence > meetsThreshold;
        MatchType type = meets ? MatchType.STRONG : confidence > 0.0 ? MatchType.PARTIAL : MatchType.NONE;

        return new EvidenceMapping(
                standard.id(),
                standard.accreditor(),
                standard.title(),
                confidence,
                meets,
                type,
                matched,
                indicators.size(),
                extractRationaleSpans(evidence, matched, maxRationaleSpans),
                String.format(Locale.ROOT, "Matched %d of %d indicators for %s: %s (%s).",
                        matched.size(), indicators.size(), standard.id(), standard.title(), type.label())
        );
    }

    /**
     * Picks the evidence sentences holding the most matched indicators, best first.
     *
     * <p>Indicators are located in the full text before it is split, and a sentence break
     * falling inside an indicator occurrence (as in {@code Ph.D.}) does not end the sentence.
     */
    static List<String> extractRationaleSpans(String evidence, List<String> matched, int maxSpans) {
        if (matched.isEmpty() || maxSpans == 0) return List.of();

        List<List<Integer>> occurrences = new ArrayList<>();
        boolean[] inIndicator = new boolean[evidence.length()];
        for (String indicator : matched) {
            List<Integer> starts = new ArrayList<>();
            for (int at = indexOfIgnoreCase(evidence, indicator, 0); at >= 0;
                 at = indexOfIgnoreCase(evidence, indicator, at + 1)) {
                starts.add(at);
                Arrays.fill(inIndicator, at, at + indicator.length(), true);
            }
            occurrences.add(starts);
        }

        record Candidate(String sentence, int hits, int firstHit) {}
        List<Candidate> candidates = new ArrayList<>();
        int sentenceStart = 0;
        for (int i = 0; i <= evidence.length(); i++) {
            if (i < evidence.length() && (inIndicator[i] || !isSentenceBreak(evidence.charAt(i)))) continue;

            int from = sentenceStart;
            int to = i;
            sentenceStart = i + 1;
            while (from < to && Character.isWhitespace(evidence.charAt(from))) from++;
            while (to > from && Character.isWhitespace(evidence.charAt(to - 1))) to--;
            if (from == to) continue;

            int hits = 0;
            int firstHit = Integer.MAX_VALUE;
            for (int k = 0; k < matched.size(); k++) {
                int length = matched.get(k).length();
                for (int at : occurrences.get(k)) {
                    if (at >= from && at + length <= to) {
                        hits++;
                        firstHit = Math.min(firstHit, at - from);
                        break;
                    }
                }
            }
            if (hits > 0) {
                candidates.add(new Candidate(evidence.substring(from, to), hits, firstHit));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::hits).reversed());

        return candidates.stream()
                .limit(maxSpans)
                .map(c -> cap(c.sentence(), c.firstHit()))
                .toList();
    }

    private static boolean isSentenceBreak(char c) {
        return c == '.' || c == '!' || c == '?' || c == '\n';
    }

    private static int indexOfIgnoreCase(String text, String needle, int from) {
        for (int i = from; i <= text.length() - needle.length(); i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) return i;
        }
        return -1;
    }

    private static String cap(String sentence, int firstHit) {
        if (sentence.length() <= MAX_SPAN_LENGTH) return sentence;
        int start = Math.max(0, Math.min(firstHit - SPAN_LEAD, sentence.length() - MAX_SPAN_LENGTH));
        String window = sentence.substring(start, start + MAX_SPAN_LENGTH).strip();
        return (start > 0 ? "..." : "") + window + "...";
    }

    public static MappingStatistics summarize(List<EvidenceMapping> mappings) {
        if (mappings.isEmpty()) {
            return new MappingStatistics(0, 0.0, 0, Map.of(), Map.of());
        }
        Map<String, Integer> byAccreditor = new TreeMap<>();
        Map<MatchType, Integer> byType = new EnumMap<>(MatchType.class);
        double sum = 0.0;
        int meeting = 0;
        for (EvidenceMapping m : mappings) {
            sum += m.confidence();
            if (m.meetsStandard()) meeting++;
            byAccreditor.merge(m.accreditor(), 1, Integer::sum);
            byType.merge(m.matchType(), 1, Integer::sum);
        }
        return new MappingStatistics(mappings.size(), sum / mappings.size(), meeting, byAccreditor, byType);
    }
}
