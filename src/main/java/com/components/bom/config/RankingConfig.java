package com.components.bom.config;

import com.components.bom.service.core.PackageMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RankingConfig {

    /**
     * Package matcher built from the configured alias groups.
     *
     * @param props ranking properties
     * @return the shared matcher
     */
    @Bean
    public PackageMatcher packageMatcher(final RankingProperties props) {
        log.info("Package alias groups: {}", props.getPackageAliases());
        return new PackageMatcher(props.getPackageAliases());
    }
}
