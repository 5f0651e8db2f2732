package com.vidnyan.cga.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.cga.adapter.out.parser.regex.TypeScriptRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.registry.DefaultEntryPointRegistry;
import com.vidnyan.cga.adapter.out.sensitivity.PatternSensitivityClassifier;
import com.vidnyan.cga.application.port.out.EntryPointRegistry;
import com.vidnyan.cga.application.port.out.ExtractionStrategy;
import com.vidnyan.cga.application.service.ExtractionStrategyRegistry;
import com.vidnyan.cga.domain.graph.SensitivityClassifier;
import com.vidnyan.cga.domain.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for CGA components.
 * Wires the extraction strategies and the default pattern-based adapters.
 */
@Slf4j
@Configuration
public class CgaConfiguration {

    /**
     * ObjectMapper for the persisted graph and CLI output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public TypeScriptRegexExtractionStrategy typeScriptExtractionStrategy() {
        return new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT);
    }

    @Bean
    public TypeScriptRegexExtractionStrategy javaScriptExtractionStrategy() {
        return new TypeScriptRegexExtractionStrategy(Language.JAVASCRIPT);
    }

    /**
     * Registry of every strategy bean. Also logs them on startup.
     */
    @Bean
    public ExtractionStrategyRegistry extractionStrategyRegistry(List<ExtractionStrategy> strategies) {
        ExtractionStrategyRegistry.Builder builder = ExtractionStrategyRegistry.builder();
        strategies.forEach(builder::register);
        log.info("Registered {} extraction strategies:", strategies.size());
        strategies.forEach(s -> log.info("  - {} ({})", s.language().tag(), s.method().name().toLowerCase()));
        return builder.build();
    }

    @Bean
    public EntryPointRegistry entryPointRegistry() {
        return new DefaultEntryPointRegistry();
    }

    @Bean
    public SensitivityClassifier sensitivityClassifier() {
        return new PatternSensitivityClassifier();
    }
}
