package com.nchat.connectors.vault;

import com.nchat.connectors.model.ConnectorCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of encrypted credentials keyed by integration id.
 *
 * <p>Only ciphertext is held; every {@link #retrieve(String)} decrypts a fresh
 * copy. {@link #exportBlob(String)} hands the opaque blob to an external store.
 */
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final String keyMaterial;
    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    /**
     * @param keyMaterial at least 32 bytes of random key material
     */
    public CredentialVault(String keyMaterial) {
        if (keyMaterial == null || keyMaterial.isBlank()) {
            throw new IllegalArgumentException("keyMaterial must not be null or blank");
        }
        this.keyMaterial = keyMaterial;
    }

    public void store(String integrationId, ConnectorCredentials credentials) throws CredentialEncryptionException {
        blobs.put(integrationId, CredentialCipher.encrypt(credentials, keyMaterial));
        log.debug("Stored credentials for integration '{}'", integrationId);
    }

    public Optional<ConnectorCredentials> retrieve(String integrationId) throws CredentialEncryptionException {
        String blob = blobs.get(integrationId);
        return blob == null ? Optional.empty() : Optional.of(CredentialCipher.decrypt(blob, keyMaterial));
    }

    /** The encrypted blob for {@code integrationId}, for handing to an external store. */
    public Optional<String> exportBlob(String integrationId) {
        return Optional.ofNullable(blobs.get(integrationId));
    }

    /**
     * Accepts a blob produced elsewhere with the same key. It is decrypted once
     * to make sure it authenticates before it is kept.
     */
    public void importBlob(String integrationId, String blob) throws CredentialEncryptionException {
        CredentialCipher.decrypt(blob, keyMaterial);
        blobs.put(integrationId, blob);
    }

    public boolean remove(String integrationId) {
        boolean removed = blobs.remove(integrationId) != null;
        if (removed) log.debug("Removed credentials for integration '{}'", integrationId);
        return removed;
    }

    public boolean has(String integrationId) {
        return blobs.containsKey(integrationId);
    }

    public List<String> listIds() {
        return List.copyOf(blobs.keySet());
    }

    public void clear() {
        blobs.clear();
    }
}
