package com.eyelevel.bordereaux.config;

import com.eyelevel.bordereaux.service.validation.RuleSetLoader;
import com.eyelevel.bordereaux.service.validation.rule.RuleSet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the rule set once at startup. A broken document stops the application from starting.
 */
@Configuration
public class ValidationRuleConfig {

    @Bean
    public RuleSet ruleSet(RuleSetLoader ruleSetLoader, ResourceLoader resourceLoader,
                           BordereauxProcessingConfig processingConfig) {
        return ruleSetLoader.load(resourceLoader.getResource(processingConfig.getValidation().getRulesLocation()));
    }
}
