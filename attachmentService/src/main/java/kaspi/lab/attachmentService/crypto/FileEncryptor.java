package kaspi.lab.attachmentService.crypto;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.exception.IntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

// file: nonce | ciphertext+tag; chunk: index(LE) | nonce | ciphertext+tag, index is the GCM AAD
@Slf4j
@Component
public class FileEncryptor {

    public static final int KEY_SIZE_BYTES = 32;
    public static final int NONCE_SIZE_BYTES = 12;
    public static final int TAG_SIZE_BYTES = 16;
    public static final int CHUNK_INDEX_SIZE_BYTES = 4;

    private static final String DATA_CIPHER = "AES/GCM/NoPadding";
    private static final String WRAP_CIPHER = "AESWrap";

    private final SecretKey masterKey;
    private final List<SecretKey> unwrapKeys;
    private final SecureRandom secureRandom = new SecureRandom();

    public FileEncryptor(AppAttachmentProperties props) {
        AppAttachmentProperties.Encryption encryption = props.getEncryption();
        if (AppAttachmentProperties.Encryption.DEFAULT_MASTER_KEY.equals(encryption.getMasterKey())) {
            log.warn("Using default attachment master key! Set app.attachments.encryption.master-key for production");
        }
        this.masterKey = deriveKey(encryption.getMasterKey());

        List<SecretKey> keys = new ArrayList<>();
        keys.add(masterKey);
        for (String previous : encryption.getPreviousMasterKeys()) {
            if (previous != null && !previous.isBlank()) {
                keys.add(deriveKey(previous));
            }
        }
        this.unwrapKeys = List.copyOf(keys);
    }

    // 32 байта из произвольной строки-секрета
    private static SecretKey deriveKey(String secret) {
        return new SecretKeySpec(sha256(secret.getBytes(StandardCharsets.UTF_8)), "AES");
    }

    public byte[] generateFileKey() {
        byte[] key = new byte[KEY_SIZE_BYTES];
        secureRandom.nextBytes(key);
        return key;
    }

    public String wrapKey(byte[] fileKey) {
        requireFileKey(fileKey);
        try {
            Cipher cipher = Cipher.getInstance(WRAP_CIPHER);
            cipher.init(Cipher.WRAP_MODE, masterKey);
            return Base64.getEncoder().encodeToString(cipher.wrap(new SecretKeySpec(fileKey, "AES")));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to wrap file key", e);
        }
    }

    // сначала текущий мастер-ключ, потом выведенные из оборота
    public byte[] unwrapKey(String wrappedKey) {
        byte[] wrapped;
        try {
            wrapped = Base64.getDecoder().decode(wrappedKey);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Wrapped file key is not valid Base64", e);
        }

        GeneralSecurityException lastFailure = null;
        for (SecretKey key : unwrapKeys) {
            try {
                Cipher cipher = Cipher.getInstance(WRAP_CIPHER);
                cipher.init(Cipher.UNWRAP_MODE, key);
                Key unwrapped = cipher.unwrap(wrapped, "AES", Cipher.SECRET_KEY);
                return unwrapped.getEncoded();
            } catch (GeneralSecurityException e) {
                lastFailure = e;
            }
        }
        throw new IntegrityException("Failed to unwrap file key with any configured master key", lastFailure);
    }

    public byte[] encryptFile(byte[] data, byte[] fileKey) {
        byte[] nonce = newNonce();
        byte[] sealed = seal(data, fileKey, nonce, null);
        return ByteBuffer.allocate(NONCE_SIZE_BYTES + sealed.length)
                .put(nonce)
                .put(sealed)
                .array();
    }

    public byte[] decryptFile(byte[] encrypted, byte[] fileKey) {
        if (encrypted == null || encrypted.length < NONCE_SIZE_BYTES + TAG_SIZE_BYTES) {
            throw new IntegrityException("Encrypted file is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(encrypted);
        byte[] nonce = new byte[NONCE_SIZE_BYTES];
        buffer.get(nonce);
        byte[] sealed = new byte[buffer.remaining()];
        buffer.get(sealed);
        return open(sealed, fileKey, nonce, null);
    }

    public byte[] encryptChunk(byte[] data, byte[] fileKey, int chunkIndex) {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative: " + chunkIndex);
        }
        byte[] header = indexHeader(chunkIndex);
        byte[] nonce = newNonce();
        byte[] sealed = seal(data, fileKey, nonce, header);
        return ByteBuffer.allocate(CHUNK_INDEX_SIZE_BYTES + NONCE_SIZE_BYTES + sealed.length)
                .put(header)
                .put(nonce)
                .put(sealed)
                .array();
    }

    public DecryptedChunk decryptChunk(byte[] encryptedChunk, byte[] fileKey) {
        if (encryptedChunk == null
                || encryptedChunk.length < CHUNK_INDEX_SIZE_BYTES + NONCE_SIZE_BYTES + TAG_SIZE_BYTES) {
            throw new IntegrityException("Encrypted chunk is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(encryptedChunk);
        byte[] header = new byte[CHUNK_INDEX_SIZE_BYTES];
        buffer.get(header);
        byte[] nonce = new byte[NONCE_SIZE_BYTES];
        buffer.get(nonce);
        byte[] sealed = new byte[buffer.remaining()];
        buffer.get(sealed);

        int index = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN).getInt();
        return new DecryptedChunk(index, open(sealed, fileKey, nonce, header));
    }

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(sha256(data));
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static byte[] indexHeader(int chunkIndex) {
        return ByteBuffer.allocate(CHUNK_INDEX_SIZE_BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(chunkIndex).array();
    }

    private byte[] newNonce() {
        byte[] nonce = new byte[NONCE_SIZE_BYTES];
        secureRandom.nextBytes(nonce);
        return nonce;
    }

    private byte[] seal(byte[] plaintext, byte[] fileKey, byte[] nonce, byte[] aad) {
        requireFileKey(fileKey);
        try {
            Cipher cipher = Cipher.getInstance(DATA_CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(fileKey, "AES"),
                    new GCMParameterSpec(TAG_SIZE_BYTES * 8, nonce));
            if (aad != null) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize AES/GCM cipher for encryption", e);
        }
    }

    private byte[] open(byte[] sealed, byte[] fileKey, byte[] nonce, byte[] aad) {
        requireFileKey(fileKey);
        try {
            Cipher cipher = Cipher.getInstance(DATA_CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(fileKey, "AES"),
                    new GCMParameterSpec(TAG_SIZE_BYTES * 8, nonce));
            if (aad != null) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication tag mismatch: data was tampered with or the key is wrong", e);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Failed to decrypt data", e);
        }
    }

    private static void requireFileKey(byte[] fileKey) {
        if (fileKey == null || fileKey.length != KEY_SIZE_BYTES) {
            throw new IllegalArgumentException("File key must be " + KEY_SIZE_BYTES + " bytes");
        }
    }

    public record DecryptedChunk(int index, byte[] data) {}
}
