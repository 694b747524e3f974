package com.baskettecase.dpmcp.config;

import com.baskettecase.dpmcp.catalog.ContractFileSource;
import com.baskettecase.dpmcp.catalog.DefaultDefinitionSource;
import com.baskettecase.dpmcp.catalog.DefinitionSource;
import com.baskettecase.dpmcp.catalog.RegistryFileSource;
import com.baskettecase.dpmcp.catalog.ViewBootstrapper;
import com.baskettecase.dpmcp.gateway.PrincipalContextProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.ArrayList;
import java.util.List;

/**
 * Gateway wiring: definition source chain and principal context lookup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    /**
     * Definition sources in priority order: contract, registry, built-in defaults.
     */
    @Bean
    public ViewBootstrapper viewBootstrapper(GatewayProperties properties, ResourceLoader resourceLoader) {
        List<DefinitionSource> sources = new ArrayList<>();
        if (hasText(properties.getContractPath())) {
            sources.add(new ContractFileSource(resolve(resourceLoader, properties.getContractPath())));
        }
        if (hasText(properties.getRegistryPath())) {
            sources.add(new RegistryFileSource(resolve(resourceLoader, properties.getRegistryPath())));
        }
        sources.add(new DefaultDefinitionSource());
        log.info("🔧 Definition sources: {}", sources.stream().map(DefinitionSource::name).toList());
        return new ViewBootstrapper(sources);
    }

    @Bean
    @ConditionalOnMissingBean
    public PrincipalContextProvider principalContextProvider() {
        return PrincipalContextProvider.NONE;
    }

    static Resource resolve(ResourceLoader resourceLoader, String location) {
        if (location.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX) || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        return new FileSystemResource(location);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
