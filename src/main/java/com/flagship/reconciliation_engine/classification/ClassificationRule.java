package com.flagship.reconciliation_engine.classification;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One entry of a {@link RuleSet}: the tags that select a category explicitly
 * and the text patterns that infer it.
 *
 * The category's own key is always accepted as a tag.
 */
@Getter
public final class ClassificationRule<K extends Enum<K> & CategoryKey> {

    private final K category;
    private final Set<String> tags;
    private final List<Pattern> patterns;

    private ClassificationRule(K category, Set<String> tags, List<Pattern> patterns) {
        this.category = Objects.requireNonNull(category);
        this.tags = Collections.unmodifiableSet(tags);
        this.patterns = Collections.unmodifiableList(patterns);
    }

    public static <K extends Enum<K> & CategoryKey> Builder<K> forCategory(K category) {
        return new Builder<>(category);
    }

    public boolean matchesTag(String tag) {
        return tag != null && tags.contains(normalizeTag(tag));
    }

    public boolean matchesText(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    static String normalizeTag(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder<K extends Enum<K> & CategoryKey> {
        private final K category;
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<Pattern> patterns = new ArrayList<>();

        private Builder(K category) {
            this.category = category;
            this.tags.add(category.key());
        }

        public Builder<K> tags(String... aliases) {
            for (String alias : aliases) {
                tags.add(normalizeTag(alias));
            }
            return this;
        }

        public Builder<K> pattern(String regex) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            return this;
        }

        public ClassificationRule<K> build() {
            return new ClassificationRule<>(category, tags, patterns);
        }
    }
}
