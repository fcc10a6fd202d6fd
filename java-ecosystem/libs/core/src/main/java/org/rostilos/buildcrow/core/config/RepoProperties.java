package org.rostilos.buildcrow.core.config;

import jakarta.validation.constraints.Min;
import org.rostilos.buildcrow.core.security.SshKeyProvisioner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for repository registration.
 */
@Validated
@ConfigurationProperties(prefix = "buildcrow.repo")
public class RepoProperties {

    /**
     * RSA modulus size, in bits, of generated repository keys.
     */
    @Min(SshKeyProvisioner.MIN_KEY_SIZE)
    private int keySize = SshKeyProvisioner.DEFAULT_KEY_SIZE;

    /**
     * Build timeout, in seconds, assigned to newly registered repositories.
     */
    @Min(0)
    private long defaultTimeout = 3600;

    public int getKeySize() {
        return keySize;
    }

    public void setKeySize(int keySize) {
        this.keySize = keySize;
    }

    public long getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(long defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }
}
