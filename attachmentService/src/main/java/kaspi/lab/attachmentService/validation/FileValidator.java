package kaspi.lab.attachmentService.validation;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates uploads by content-type allowlist, per-category size limit and magic bytes. Declared
 * types and file extensions are never trusted on their own.
 */
@Slf4j
@Component
public class FileValidator {

    public static final String DEFAULT_FILENAME = "unnamed_file";
    public static final int MAX_FILENAME_BYTES = 255;

    private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^\\w\\s\\-.]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[\\s_]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double MB = 1024d * 1024d;

    private final Set<String> allowedContentTypes;
    private final Map<ContentCategory, Long> sizeLimits = new EnumMap<>(ContentCategory.class);

    public FileValidator(AppAttachmentProperties props) {
        Set<String> allowed = new LinkedHashSet<>();
        for (String type : props.getAllowedContentTypes()) {
            String normalized = type.trim().toLowerCase(Locale.ROOT);
            if (ContentCategory.of(normalized).isPresent()) {
                allowed.add(normalized);
            } else {
                log.warn("Ignoring allowed content type {} without a known category", type);
            }
        }
        this.allowedContentTypes = Set.copyOf(allowed);

        AppAttachmentProperties.SizeLimits limits = props.getSizeLimits();
        sizeLimits.put(ContentCategory.IMAGE, limits.getImage());
        sizeLimits.put(ContentCategory.VIDEO, limits.getVideo());
        sizeLimits.put(ContentCategory.AUDIO, limits.getAudio());
        sizeLimits.put(ContentCategory.DOCUMENT, limits.getDocument());
    }

    public boolean validateContentType(String contentType) {
        return contentType != null && allowedContentTypes.contains(contentType);
    }

    /**
     * Checks the leading bytes against the signatures known for {@code claimedContentType}. A type
     * without a signature entry never validates.
     */
    public boolean validateMagicBytes(byte[] data, String claimedContentType) {
        var signatures = MagicSignatures.forContentType(claimedContentType);
        if (signatures.isEmpty()) {
            log.warn("No magic signature defined for {}", claimedContentType);
            return false;
        }
        if (data != null && signatures.get().stream().anyMatch(s -> s.matches(data))) {
            return true;
        }
        log.warn("Magic byte mismatch: claimed {}, header bytes: {}", claimedContentType, headerHex(data));
        return false;
    }

    public ValidationResult validateFileSize(long size, String contentType) {
        var category = ContentCategory.of(contentType);
        if (category.isEmpty()) {
            return ValidationResult.rejected("Unknown content type: " + contentType);
        }
        long limit = sizeLimits.get(category.get());
        if (size > limit) {
            return ValidationResult.rejected(String.format(Locale.ROOT,
                    "File size %.1fMB exceeds %s limit of %.0fMB",
                    size / MB, category.get().value(), limit / MB));
        }
        return ValidationResult.ok();
    }

    /**
     * Makes a client-supplied name safe to store: directories stripped, unusual characters
     * replaced, separator runs collapsed, leading dots removed, at most 255 UTF-8 bytes with the
     * extension kept.
     */
    public String sanitizeFilename(String filename) {
        if (filename == null) {
            return DEFAULT_FILENAME;
        }
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }

        name = DISALLOWED_CHARS.matcher(name).replaceAll("_");
        name = SEPARATOR_RUNS.matcher(name).replaceAll("_");

        int firstVisible = 0;
        while (firstVisible < name.length() && name.charAt(firstVisible) == '.') {
            firstVisible++;
        }
        name = name.substring(firstVisible);

        if (utf8Length(name) > MAX_FILENAME_BYTES) {
            name = truncatePreservingExtension(name);
        }
        return name.isEmpty() ? DEFAULT_FILENAME : name;
    }

    /** Allowlist, then size, then magic bytes, then filename; stops at the first failure. */
    public UploadValidation validateUpload(byte[] data, String claimedContentType, String filename) {
        if (!validateContentType(claimedContentType)) {
            return UploadValidation.rejected(ErrorCode.CONTENT_TYPE_NOT_ALLOWED,
                    "Content type not allowed: " + claimedContentType);
        }

        ValidationResult size = validateFileSize(data.length, claimedContentType);
        if (!size.valid()) {
            return UploadValidation.rejected(ErrorCode.FILE_SIZE_EXCEEDED, size.reason());
        }

        if (!validateMagicBytes(data, claimedContentType)) {
            return UploadValidation.rejected(ErrorCode.MAGIC_BYTES_MISMATCH,
                    "File content does not match claimed content type");
        }

        return UploadValidation.accepted(sanitizeFilename(filename));
    }

    private static String truncatePreservingExtension(String name) {
        int dot = name.lastIndexOf('.');
        String ext = dot > 0 ? name.substring(dot) : "";
        String base = dot > 0 ? name.substring(0, dot) : name;
        if (utf8Length(ext) >= MAX_FILENAME_BYTES) {
            return truncateToBytes(name, MAX_FILENAME_BYTES);
        }
        return truncateToBytes(base, MAX_FILENAME_BYTES - utf8Length(ext)) + ext;
    }

    // Режем по кодовым точкам, чтобы не разорвать многобайтовый символ
    private static String truncateToBytes(String s, int maxBytes) {
        StringBuilder out = new StringBuilder();
        int used = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            int len = utf8Length(ch);
            if (used + len > maxBytes) {
                break;
            }
            out.append(ch);
            used += len;
            i += Character.charCount(cp);
        }
        return out.toString();
    }

    private static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String headerHex(byte[] data) {
        if (data == null) {
            return "";
        }
        int n = Math.min(16, data.length);
        return HexFormat.of().formatHex(data, 0, n);
    }
}
