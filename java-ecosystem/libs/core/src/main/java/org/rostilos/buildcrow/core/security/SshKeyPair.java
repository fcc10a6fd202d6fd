package org.rostilos.buildcrow.core.security;

/**
 * Textual key pair injected into build environments as {@code .ssh/id_rsa.pub} and {@code .ssh/id_rsa}.
 *
 * @param publicKey  OpenSSH authorized-key line
 * @param privateKey PKCS#1 PEM block
 */
public record SshKeyPair(String publicKey, String privateKey) {

    @Override
    public String toString() {
        return "SshKeyPair[publicKey=" + publicKey.strip() + ", privateKey=<redacted>]";
    }
}
