package com.openforge.docrouter.memory;

import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.repository.EpisodicRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set (Jaccard) similarity over the filename and subject of recent
 * episodes. Default lookup when Milvus is not enabled; needs no index.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docrouter.milvus.enabled", havingValue = "false", matchIfMissing = true)
public class LexicalSimilarityLookup implements SimilarityLookup {

    private final EpisodicRecordRepository episodes;
    private final ExperienceProperties     properties;

    @Override
    public List<SimilarExperience> findSimilar(String queryText, int topK) {
        Set<String> query = tokens(queryText);
        if (query.isEmpty()) return List.of();

        return episodes.findAllByOrderByOccurredAtDesc(PageRequest.of(0, properties.lexicalWindow())).stream()
                .map(record -> new SimilarExperience(record, jaccard(query, tokens(record.queryText()))))
                .filter(hit -> hit.similarity() > 0.0)
                .sorted(Comparator.comparingDouble(SimilarExperience::similarity).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public void index(EpisodicRecord record) {
        // rows are read straight from episodic_records
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) return Set.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        if (intersection.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
