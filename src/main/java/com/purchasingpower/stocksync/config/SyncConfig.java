package com.purchasingpower.stocksync.config;

import com.purchasingpower.stocksync.event.EntityChangeBus;
import com.purchasingpower.stocksync.event.impl.SynchronousEntityChangeBus;
import com.purchasingpower.stocksync.mapping.EntityMappingRegistry;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root of the synchronisation layer: the mapping registry, the type table,
 * the view model factory and the change bus every repository and list shares.
 */
@Slf4j
@Configuration
public class SyncConfig {

    @Bean
    public TypeMapper typeMapper() {
        return TypeMapper.defaults();
    }

    @Bean
    public EntityMappingRegistry entityMappingRegistry() {
        EntityMappingRegistry registry = StoreMappings.registry();
        log.info("Registered {} entity mapping(s)", registry.getMappings().size());
        return registry;
    }

    @Bean
    public ViewModelFactory viewModelFactory(EntityMappingRegistry registry, TypeMapper typeMapper) {
        return new ViewModelFactory(registry, typeMapper);
    }

    @Bean
    public EntityChangeBus entityChangeBus() {
        return new SynchronousEntityChangeBus();
    }
}
