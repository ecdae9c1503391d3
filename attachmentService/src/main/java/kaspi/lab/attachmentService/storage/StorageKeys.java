package kaspi.lab.attachmentService.storage;

import kaspi.lab.attachmentService.exception.PathTraversalException;

import java.util.UUID;

public final class StorageKeys {

    public static final String ROOT_PREFIX = "attachments";

    private StorageKeys() {}

    /** {@code attachments/{id[0:2]}/{id[2:4]}/{id}/{filename}} */
    public static String forAttachment(UUID id, String sanitizedFilename) {
        String idStr = id.toString();
        String shard = idStr.substring(0, 2) + "/" + idStr.substring(2, 4);
        return ROOT_PREFIX + "/" + shard + "/" + idStr + "/" + sanitizedFilename;
    }

    /** {@code {storageKey}.chunk_{index:06d}} */
    public static String forChunk(String storageKey, int index) {
        return String.format("%s.chunk_%06d", storageKey, index);
    }

    /**
     * Rejects keys that could resolve outside a storage root. Nothing is normalized: a key with a
     * {@code ..} segment is refused even when it would land back inside the root.
     */
    public static String requireSafe(String key) {
        if (key == null || key.isBlank()
                || key.startsWith("/")
                || key.indexOf('\\') >= 0
                || key.indexOf('\0') >= 0
                || key.matches("^[A-Za-z]:.*")) {
            throw new PathTraversalException(String.valueOf(key));
        }
        for (String segment : key.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new PathTraversalException(key);
            }
        }
        return key;
    }
}
