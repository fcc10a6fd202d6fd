package org.rostilos.buildcrow.core.config;

import org.rostilos.buildcrow.core.security.SshKeyProvisioner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Auto-configuration for the repository core module.
 */
@AutoConfiguration
@ComponentScan(basePackages = "org.rostilos.buildcrow.core.service")
@EntityScan(basePackages = "org.rostilos.buildcrow.core.model")
@EnableJpaRepositories(basePackages = "org.rostilos.buildcrow.core.persistence.repository")
@EnableConfigurationProperties(RepoProperties.class)
public class RepoCoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SshKeyProvisioner sshKeyProvisioner(RepoProperties properties) {
        return new SshKeyProvisioner(properties.getKeySize());
    }
}
