package kaspi.lab.attachmentService.validation;

import java.util.Map;
import java.util.Optional;

public enum ContentCategory {
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT;

    private static final Map<String, ContentCategory> BY_CONTENT_TYPE = Map.ofEntries(
            Map.entry("image/jpeg", IMAGE),
            Map.entry("image/png", IMAGE),
            Map.entry("image/webp", IMAGE),
            Map.entry("image/gif", IMAGE),
            Map.entry("video/mp4", VIDEO),
            Map.entry("video/webm", VIDEO),
            Map.entry("video/quicktime", VIDEO),
            Map.entry("audio/mpeg", AUDIO),
            Map.entry("audio/wav", AUDIO),
            Map.entry("audio/ogg", AUDIO),
            Map.entry("application/pdf", DOCUMENT));

    public static Optional<ContentCategory> of(String contentType) {
        return Optional.ofNullable(contentType).map(BY_CONTENT_TYPE::get);
    }

    public String value() {
        return name().toLowerCase();
    }
}
