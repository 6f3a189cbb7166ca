package com.kreasipositif.wpsprocessor.submission;

/**
 * Secrets and paths for one bank channel. Which fields matter depends on the protocol.
 *
 * @param knownHostsPath SFTP known_hosts file; when absent host keys are not verified
 */
public record ConnectionCredentials(
        String apiKey,
        String username,
        String password,
        String privateKeyPath,
        String knownHostsPath,
        String uploadPath,
        String downloadPath) {

    public static ConnectionCredentials none() {
        return new ConnectionCredentials(null, null, null, null, null, null, null);
    }

    public boolean hasApiKey() {
        return hasText(apiKey);
    }

    public boolean hasUsername() {
        return hasText(username);
    }

    public boolean hasPassword() {
        return hasText(password);
    }

    public boolean hasPrivateKey() {
        return hasText(privateKeyPath);
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "ConnectionCredentials[apiKey=%s, username=%s, password=%s, privateKeyPath=%s, uploadPath=%s, downloadPath=%s]"
                .formatted(mask(apiKey), username, mask(password), privateKeyPath, uploadPath, downloadPath);
    }

    private static String mask(String secret) {
        return hasText(secret) ? "****" : null;
    }
}
