package biz.kryukov.dev.svcregistry.spring;

import biz.kryukov.dev.svcregistry.DiscoveryConfig;
import biz.kryukov.dev.svcregistry.Protocol;
import biz.kryukov.dev.svcregistry.ServiceDiscovery;
import biz.kryukov.dev.svcregistry.checks.HttpServiceChecker;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for svcregistry: creates a ServiceDiscovery bean from application.yml properties.
 */
@AutoConfiguration
@ConditionalOnClass(ServiceDiscovery.class)
@EnableConfigurationProperties(SvcRegistryProperties.class)
public class SvcRegistryAutoConfiguration {

    /**
     * Creates a {@link ServiceDiscovery} bean configured from application properties.
     *
     * @param properties    svcregistry configuration properties
     * @param meterRegistry Micrometer meter registry, if the application has one
     * @return configured ServiceDiscovery instance
     */
    @Bean
    @ConditionalOnMissingBean
    public ServiceDiscovery serviceDiscovery(SvcRegistryProperties properties,
                                             ObjectProvider<MeterRegistry> meterRegistry) {
        ServiceDiscovery.Builder builder = ServiceDiscovery.builder(meterRegistry.getIfAvailable());
        builder.config(toConfig(properties));

        if (properties.getTimeout() != null) {
            builder.timeout(properties.getTimeout());
        }
        if (!properties.getHttpHeaders().isEmpty()) {
            builder.httpChecker(HttpServiceChecker.builder()
                    .headers(properties.getHttpHeaders())
                    .build());
        }
        properties.getDataStores().forEach(builder::dataStore);

        properties.getServices().forEach((name, serviceProps) -> {
            Protocol protocol = serviceProps.getProtocol() != null
                    ? Protocol.fromLabel(serviceProps.getProtocol()) : null;
            builder.service(name, protocol, s -> configureService(s, serviceProps));
        });

        return builder.build();
    }

    /** Creates a lifecycle bean that starts and stops health monitoring with the context. */
    @Bean
    @ConditionalOnMissingBean
    public SvcRegistryLifecycle svcRegistryLifecycle(ServiceDiscovery serviceDiscovery) {
        return new SvcRegistryLifecycle(serviceDiscovery);
    }

    /** Creates a Spring Boot Actuator HealthIndicator for service health. */
    @Bean
    @ConditionalOnMissingBean
    public ServiceRegistryHealthIndicator serviceRegistryHealthIndicator(
            ServiceDiscovery serviceDiscovery) {
        return new ServiceRegistryHealthIndicator(serviceDiscovery);
    }

    /** Creates an Actuator endpoint exposing service health at {@code /actuator/services}. */
    @Bean
    @ConditionalOnMissingBean
    public ServicesEndpoint servicesEndpoint(ServiceDiscovery serviceDiscovery) {
        return new ServicesEndpoint(serviceDiscovery);
    }

    private static DiscoveryConfig toConfig(SvcRegistryProperties properties) {
        DiscoveryConfig.Builder config = DiscoveryConfig.builder();
        if (properties.getInterval() != null) {
            config.interval(properties.getInterval());
        }
        if (properties.getCircuitBreakerThreshold() != null) {
            config.circuitBreakerThreshold(properties.getCircuitBreakerThreshold());
        }
        if (properties.getCircuitBreakerMultiplier() != null) {
            config.circuitBreakerMultiplier(properties.getCircuitBreakerMultiplier());
        }
        return config.build();
    }

    private void configureService(ServiceDiscovery.ServiceBuilder s,
                                  SvcRegistryProperties.ServiceProperties props) {
        // Connection
        if (props.getUrl() != null) {
            s.url(props.getUrl());
        }
        if (props.getHost() != null) {
            s.host(props.getHost());
        }
        if (props.getPort() != null) {
            s.port(props.getPort());
        }

        // Policy
        if (props.getHealthPath() != null) {
            s.healthPath(props.getHealthPath());
        }
        if (props.getTimeout() != null) {
            s.timeout(props.getTimeout());
        }
        if (props.getRequired() != null) {
            s.required(props.getRequired());
        }

        // Redis
        if (props.getRedisPassword() != null) {
            s.redisPassword(props.getRedisPassword());
        }
    }
}
