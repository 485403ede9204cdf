package com.bank.lending.config;

import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibraryLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class PatternLibraryConfig {

    @Bean
    public PatternLibrary patternLibrary(ResourceLoader resourceLoader,
                                         ObjectMapper objectMapper,
                                         ClassificationConfig classificationConfig) {
        PatternLibraryLoader loader = new PatternLibraryLoader(objectMapper, classificationConfig.getMatching());
        return loader.load(resourceLoader.getResource(classificationConfig.getPatternLibraryLocation()));
    }
}
