package com.spendchat.ledger.categorization;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Multi-label expense categorizer. Evidence is accumulated from override rules, the keyword
 * mapping table and (when available) entity recognition; the zero-shot model is consulted only
 * when none of those produced a label. The result is never empty.
 */
@Service
public class ExpenseCategorizer {

    private static final Logger log = LoggerFactory.getLogger(ExpenseCategorizer.class);
    private static final Comparator<Category> BY_LABEL = Comparator.comparing(Category::label);

    private final KeywordMappingTable mappingTable;
    private final ZeroShotClassifier zeroShotClassifier;
    private final EntityRecognizer entityRecognizer;

    public ExpenseCategorizer(ZeroShotClassifier zeroShotClassifier, EntityRecognizer entityRecognizer) {
        this.mappingTable = KeywordMappingTable.standard();
        this.zeroShotClassifier = zeroShotClassifier;
        this.entityRecognizer = entityRecognizer;
    }

    /**
     * @return categories sorted by label, never empty
     */
    public List<Category> classify(String text) {
        String raw = text == null ? "" : text.trim();
        String normalized = raw.toLowerCase(Locale.ROOT);
        EnumSet<Category> labels = EnumSet.noneOf(Category.class);

        labels.addAll(CategoryOverrideRules.apply(normalized));
        labels.addAll(mappingTable.match(normalized));

        if (!raw.isEmpty()) {
            labels.addAll(matchRecognizedEntities(raw));
            if (labels.isEmpty()) {
                modelFallback(raw).ifPresent(labels::add);
            }
        }

        if (labels.isEmpty()) {
            labels.add(Category.OTHERS);
        }
        List<Category> result = labels.stream().sorted(BY_LABEL).toList();
        log.info("Categorized expense text ({} chars) as {}", raw.length(), result);
        return result;
    }

    private Set<Category> matchRecognizedEntities(String text) {
        EnumSet<Category> matched = EnumSet.noneOf(Category.class);
        if (!entityRecognizer.isAvailable()) {
            return matched;
        }
        try {
            for (EntityRecognizer.RecognizedEntity entity : entityRecognizer.recognize(text)) {
                if (entity == null || entity.spanText() == null) {
                    continue;
                }
                Set<Category> hits = mappingTable.match(entity.spanText().toLowerCase(Locale.ROOT));
                if (!hits.isEmpty()) {
                    log.debug("Entity '{}' triggers {}", entity.spanText(), hits);
                    matched.addAll(hits);
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Entity recognition skipped: {}", ex.getMessage());
        }
        return matched;
    }

    private Optional<Category> modelFallback(String text) {
        if (!zeroShotClassifier.isAvailable()) {
            return Optional.empty();
        }
        try {
            Optional<String> top = zeroShotClassifier.classify(text, Category.labels()).topLabel();
            Optional<Category> category = top.flatMap(Category::fromLabel);
            if (top.isPresent() && category.isEmpty()) {
                log.warn("Zero-shot model returned label outside the category set: '{}'", top.get());
            }
            category.ifPresent(value -> log.info("Zero-shot fallback returned '{}'", value.label()));
            return category;
        } catch (RuntimeException ex) {
            log.warn("Zero-shot fallback skipped: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
