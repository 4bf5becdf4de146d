package com.dubbi.brandtrail.classify;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BrandingClassifierConfig {

    @Bean
    @ConditionalOnMissingBean(BrandingClassifier.class)
    public BrandingClassifier brandingClassifier() {
        return new DisabledBrandingClassifier();
    }
}
