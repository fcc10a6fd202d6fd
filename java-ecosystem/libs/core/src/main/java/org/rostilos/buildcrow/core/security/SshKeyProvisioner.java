package org.rostilos.buildcrow.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.InvalidParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;

/**
 * Generates the per-repository RSA key pair that authorizes build agents against the repository.
 * <p>
 * Each call creates its own generator and random source, so concurrent callers share no state
 * and no key is ever reused between repositories.
 */
public class SshKeyProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SshKeyProvisioner.class);

    public static final String KEY_ALGORITHM = "RSA";
    public static final int DEFAULT_KEY_SIZE = 2048;
    public static final int MIN_KEY_SIZE = 2048;

    private final int keySize;

    public SshKeyProvisioner() {
        this(DEFAULT_KEY_SIZE);
    }

    public SshKeyProvisioner(int keySize) {
        if (keySize < MIN_KEY_SIZE) {
            throw new IllegalArgumentException(
                    "RSA key size must be at least " + MIN_KEY_SIZE + " bits, got " + keySize);
        }
        this.keySize = keySize;
    }

    public int getKeySize() {
        return keySize;
    }

    /**
     * Generate a fresh key pair.
     *
     * @return the OpenSSH public key and the PEM private key
     * @throws KeyGenerationException if the random source or the RSA provider fails
     */
    public SshKeyPair provision() {
        KeyPair keyPair;
        try {
            KeyPairGenerator generator = newKeyPairGenerator();
            generator.initialize(keySize, new SecureRandom());
            keyPair = generator.generateKeyPair();
        } catch (GeneralSecurityException | ProviderException | InvalidParameterException e) {
            log.error("RSA key generation failed ({} bits): {}", keySize, e.getMessage());
            throw new KeyGenerationException("Failed to generate " + keySize + "-bit RSA key pair", e);
        }

        if (!(keyPair.getPrivate() instanceof RSAPrivateCrtKey privateKey)) {
            throw new KeyGenerationException("RSA provider returned a key without CRT parameters");
        }

        String publicKey = SshKeyEncoder.encodePublicKey(privateKey.getModulus(), privateKey.getPublicExponent());
        String privateKeyPem = SshKeyEncoder.encodePrivateKey(privateKey);
        log.debug("Generated {}-bit RSA key pair", keySize);
        return new SshKeyPair(publicKey, privateKeyPem);
    }

    protected KeyPairGenerator newKeyPairGenerator() throws GeneralSecurityException {
        return KeyPairGenerator.getInstance(KEY_ALGORITHM);
    }
}
