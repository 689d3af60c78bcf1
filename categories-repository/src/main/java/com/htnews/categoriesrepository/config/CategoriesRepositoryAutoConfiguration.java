package com.htnews.categoriesrepository.config;

import com.htnews.categoriesrepository.client.CategoriesClient;
import com.htnews.categoriesrepository.repository.CategoriesRepository;
import com.htnews.categoriesrepository.repository.CategoriesRepositoryImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Exposes a {@link CategoriesRepository} on top of the application's {@link CategoriesClient}.
 * Disable with {@code ht.categories.repository.enabled=false}.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "ht.categories.repository", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CategoriesRepositoryAutoConfiguration {

    @Bean
    @ConditionalOnBean(CategoriesClient.class)
    @ConditionalOnMissingBean(CategoriesRepository.class)
    public CategoriesRepository categoriesRepository(CategoriesClient categoriesClient) {
        log.info("Creating CategoriesRepository backed by {}", categoriesClient.getClass().getSimpleName());
        return new CategoriesRepositoryImpl(categoriesClient);
    }
}
