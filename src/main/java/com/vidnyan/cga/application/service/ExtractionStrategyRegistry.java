package com.vidnyan.cga.application.service;

import com.vidnyan.cga.application.port.out.ExtractionStrategy;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.model.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of extraction strategies by language.
 * Structural strategies are primaries; regex strategies are fallbacks.
 * Built once at startup and passed explicitly to the extractor.
 */
public final class ExtractionStrategyRegistry {

    private final Map<Language, ExtractionStrategy> primaries;
    private final Map<Language, ExtractionStrategy> fallbacks;

    private ExtractionStrategyRegistry(Map<Language, ExtractionStrategy> primaries,
                                       Map<Language, ExtractionStrategy> fallbacks) {
        this.primaries = Map.copyOf(primaries);
        this.fallbacks = Map.copyOf(fallbacks);
    }

    public Optional<ExtractionStrategy> primary(Language language) {
        return Optional.ofNullable(primaries.get(language));
    }

    public Optional<ExtractionStrategy> fallback(Language language) {
        return Optional.ofNullable(fallbacks.get(language));
    }

    public boolean supports(Language language) {
        return primaries.containsKey(language) || fallbacks.containsKey(language);
    }

    public Set<Language> languages() {
        EnumSet<Language> all = EnumSet.noneOf(Language.class);
        all.addAll(primaries.keySet());
        all.addAll(fallbacks.keySet());
        return Collections.unmodifiableSet(all);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Language, ExtractionStrategy> primaries = new EnumMap<>(Language.class);
        private final Map<Language, ExtractionStrategy> fallbacks = new EnumMap<>(Language.class);

        public Builder register(ExtractionStrategy strategy) {
            Map<Language, ExtractionStrategy> target =
                    strategy.method() == ExtractionMethod.STRUCTURAL ? primaries : fallbacks;
            if (target.putIfAbsent(strategy.language(), strategy) != null) {
                throw new IllegalStateException("Duplicate " + strategy.method() + " strategy for "
                        + strategy.language());
            }
            return this;
        }

        public ExtractionStrategyRegistry build() {
            return new ExtractionStrategyRegistry(primaries, fallbacks);
        }
    }
}
