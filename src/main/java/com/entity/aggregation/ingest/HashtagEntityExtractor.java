package com.entity.aggregation.ingest;

import com.entity.aggregation.core.model.EntityCategory;
import com.entity.aggregation.core.model.SourceModality;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local extractor that needs no model: every hashtag on a post, whether listed with the post
 * or written in its caption, becomes a concept with a fixed confidence.
 */
public class HashtagEntityExtractor implements EntityExtractionProvider {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_]+)");

    private final double confidence;

    public HashtagEntityExtractor() {
        this(DEFAULT_CONFIDENCE);
    }

    public HashtagEntityExtractor(double confidence) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        this.confidence = confidence;
    }

    @Override
    public List<ExtractedEntity> extract(ContentAnalysis analysis) {
        // Keyed on lowercase so #Coffee and #coffee on the same post count once
        Set<String> seen = new LinkedHashSet<>();
        List<ExtractedEntity> extracted = new ArrayList<>();
        for (String tag : analysis.hashtags()) {
            add(tag.startsWith("#") ? tag.substring(1) : tag, analysis, seen, extracted);
        }
        Matcher matcher = HASHTAG.matcher(analysis.caption());
        while (matcher.find()) {
            add(matcher.group(1), analysis, seen, extracted);
        }
        return extracted;
    }

    private void add(String tag, ContentAnalysis analysis, Set<String> seen, List<ExtractedEntity> out) {
        if (tag.isBlank() || !seen.add(tag.toLowerCase(Locale.ROOT))) {
            return;
        }
        String context = analysis.caption().isBlank() ? "#" + tag : analysis.caption();
        out.add(new ExtractedEntity(tag, EntityCategory.CONCEPT, confidence, SourceModality.HASHTAG, context));
    }

    @Override
    public String getProviderName() {
        return "hashtag";
    }

    public double getConfidence() {
        return confidence;
    }
}
