package com.pulseflow.pulseflow_backend.chain;

import com.pulseflow.pulseflow_backend.config.ChainProperties;
import com.pulseflow.pulseflow_backend.exception.ChainAdapterException;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import com.pulseflow.pulseflow_backend.repository.WorkflowRepository;
import lombok.RequiredArgsConstructor;
import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.utils.Numeric;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.UUID;

/**
 * Loads and stores the per-workflow signing key.
 *
 * Stored form is hex of {@code salt(16) | iv(16) | tag(16) | ciphertext}, AES-256-GCM under a
 * scrypt-derived key (N=16384, r=8, p=1). The plaintext is the 0x-prefixed private key. Keys are decrypted
 * on demand and never cached.
 */
@Service
@RequiredArgsConstructor
public class WalletKeyService {

    private static final int SALT_LEN = 16;
    private static final int IV_LEN = 16;
    private static final int TAG_LEN = 16;
    private static final int KEY_LEN = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final WorkflowRepository workflowRepository;
    private final ChainProperties chainProperties;

    public Credentials credentials(String workflowId) {
        Workflow workflow = workflowRepository.findById(UUID.fromString(workflowId))
                .orElseThrow(() -> new ChainAdapterException("Workflow " + workflowId + " not found"));
        return Credentials.create(decrypt(workflow.getWalletEncKey()));
    }

    public String walletAddress(String workflowId) {
        return workflowRepository.findById(UUID.fromString(workflowId))
                .map(Workflow::getWalletAddress)
                .orElseThrow(() -> new ChainAdapterException("Workflow " + workflowId + " not found"));
    }

    String encrypt(String privateKey) {
        byte[] salt = new byte[SALT_LEN];
        byte[] iv = new byte[IV_LEN];
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LEN * 8, iv));
            // JCE appends the tag to the ciphertext; the stored layout keeps it in front
            byte[] sealed = cipher.doFinal(privateKey.getBytes(StandardCharsets.UTF_8));
            int cipherLen = sealed.length - TAG_LEN;
            byte[] out = new byte[SALT_LEN + IV_LEN + TAG_LEN + cipherLen];
            System.arraycopy(salt, 0, out, 0, SALT_LEN);
            System.arraycopy(iv, 0, out, SALT_LEN, IV_LEN);
            System.arraycopy(sealed, cipherLen, out, SALT_LEN + IV_LEN, TAG_LEN);
            System.arraycopy(sealed, 0, out, SALT_LEN + IV_LEN + TAG_LEN, cipherLen);
            return Numeric.toHexStringNoPrefix(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Wallet key encryption failed", e);
        }
    }

    String decrypt(String encryptedHex) {
        byte[] blob = Numeric.hexStringToByteArray(encryptedHex);
        if (blob.length <= SALT_LEN + IV_LEN + TAG_LEN) {
            throw new ChainAdapterException("Stored wallet key is malformed");
        }
        byte[] salt = Arrays.copyOfRange(blob, 0, SALT_LEN);
        byte[] iv = Arrays.copyOfRange(blob, SALT_LEN, SALT_LEN + IV_LEN);
        byte[] tag = Arrays.copyOfRange(blob, SALT_LEN + IV_LEN, SALT_LEN + IV_LEN + TAG_LEN);
        byte[] cipherText = Arrays.copyOfRange(blob, SALT_LEN + IV_LEN + TAG_LEN, blob.length);

        byte[] sealed = new byte[cipherText.length + TAG_LEN];
        System.arraycopy(cipherText, 0, sealed, 0, cipherText.length);
        System.arraycopy(tag, 0, sealed, cipherText.length, TAG_LEN);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LEN * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            // Never include the blob or the password in the message
            throw new ChainAdapterException("Could not decrypt wallet key", e);
        }
    }

    private SecretKeySpec deriveKey(byte[] salt) {
        String password = chainProperties.walletEncryptionPassword();
        if (password == null || password.isBlank()) {
            throw new ChainAdapterException("Wallet encryption password is not configured");
        }
        byte[] key = SCrypt.generate(password.getBytes(StandardCharsets.UTF_8), salt, 16384, 8, 1, KEY_LEN);
        return new SecretKeySpec(key, "AES");
    }
}
