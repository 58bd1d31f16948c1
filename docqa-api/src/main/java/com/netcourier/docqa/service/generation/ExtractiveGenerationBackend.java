package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import com.netcourier.docqa.service.retrieval.ContextChunk;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic last resort of the chain: answers with the context sentences sharing the most words
 * with the question. Never calls out and never fails.
 */
public class ExtractiveGenerationBackend implements GenerationBackend {

    public static final String NAME = "extractive";

    static final String PREFIX = "Based on the relevant information I found:";

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern NON_WORD = Pattern.compile("\\W+");
    private static final Set<String> STOP_WORDS = Set.of("a", "an", "and", "are", "as", "at", "be", "by", "do",
            "does", "for", "from", "how", "in", "is", "it", "of", "on", "or", "the", "to", "was", "what", "when",
            "where", "which", "who", "why", "with");

    private final int maxSentences;
    private final int wordsPerFragment;

    public ExtractiveGenerationBackend(int maxSentences, int wordsPerFragment) {
        this.maxSentences = maxSentences;
        this.wordsPerFragment = wordsPerFragment;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(GenerationRequest request) {
        if (request.context().isEmpty()) {
            return PromptBuilder.NO_INFORMATION;
        }
        Set<String> questionTerms = terms(request.question());
        List<Candidate> candidates = new ArrayList<>();
        for (ContextChunk chunk : request.context().chunks()) {
            for (String sentence : SENTENCE_END.split(chunk.text())) {
                String normalised = sentence.strip().replaceAll("\\s+", " ");
                if (!normalised.isEmpty()) {
                    candidates.add(new Candidate(candidates.size(), normalised, overlap(questionTerms, normalised)));
                }
            }
        }
        List<Candidate> chosen = candidates.stream()
                .sorted(Comparator.comparingInt(Candidate::score).reversed().thenComparingInt(Candidate::position))
                .limit(maxSentences)
                .sorted(Comparator.comparingInt(Candidate::position))
                .toList();
        if (chosen.isEmpty()) {
            return PromptBuilder.NO_INFORMATION;
        }
        return PREFIX + " " + chosen.stream().map(Candidate::sentence).collect(Collectors.joining(" "));
    }

    /**
     * Word groups whose concatenation equals {@link #generate(GenerationRequest)}.
     */
    @Override
    public Flux<String> stream(GenerationRequest request) {
        return Flux.defer(() -> {
            String[] words = generate(request).split(" ");
            List<String> fragments = new ArrayList<>();
            for (int i = 0; i < words.length; i += wordsPerFragment) {
                String fragment = String.join(" ", Arrays.copyOfRange(words, i, Math.min(i + wordsPerFragment, words.length)));
                fragments.add(i + wordsPerFragment < words.length ? fragment + " " : fragment);
            }
            return Flux.fromIterable(fragments);
        });
    }

    @Override
    public BackendDescriptor describe() {
        return new BackendDescriptor(NAME, "extractive", "context-sentences", true);
    }

    private static int overlap(Set<String> questionTerms, String sentence) {
        int score = 0;
        for (String term : terms(sentence)) {
            if (questionTerms.contains(term)) {
                score++;
            }
        }
        return score;
    }

    private static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isBlank() && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    private record Candidate(int position, String sentence, int score) {}
}
