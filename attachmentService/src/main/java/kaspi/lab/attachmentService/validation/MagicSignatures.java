package kaspi.lab.attachmentService.validation;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Known file-format signatures per content type. A type matches when any one of its alternatives
 * matches, and an alternative matches when all of its markers are found at their offsets.
 */
final class MagicSignatures {

    record Marker(int offset, byte[] bytes) {

        boolean matches(byte[] data) {
            if (data.length < offset + bytes.length) {
                return false;
            }
            return Arrays.equals(data, offset, offset + bytes.length, bytes, 0, bytes.length);
        }
    }

    record Signature(List<Marker> markers) {

        boolean matches(byte[] data) {
            return markers.stream().allMatch(m -> m.matches(data));
        }
    }

    private static final Map<String, List<Signature>> SIGNATURES = Map.ofEntries(
            // Images
            Map.entry("image/jpeg", List.of(sig(at(0, 0xFF, 0xD8, 0xFF)))),
            Map.entry("image/png", List.of(sig(at(0, 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)))),
            Map.entry("image/webp", List.of(sig(at(0, "RIFF"), at(8, "WEBP")))),
            Map.entry("image/gif", List.of(sig(at(0, "GIF87a")), sig(at(0, "GIF89a")))),
            // Video: ftyp box starts at offset 4
            Map.entry("video/mp4", List.of(sig(at(4, "ftyp")))),
            Map.entry("video/webm", List.of(sig(at(0, 0x1A, 0x45, 0xDF, 0xA3)))),
            Map.entry("video/quicktime", List.of(sig(at(4, "ftyp")))),
            // Audio
            Map.entry("audio/mpeg", List.of(
                    sig(at(0, 0xFF, 0xFB)), sig(at(0, 0xFF, 0xF3)), sig(at(0, 0xFF, 0xF2)), sig(at(0, "ID3")))),
            Map.entry("audio/wav", List.of(sig(at(0, "RIFF"), at(8, "WAVE")))),
            Map.entry("audio/ogg", List.of(sig(at(0, "OggS")))),
            // Documents
            Map.entry("application/pdf", List.of(sig(at(0, "%PDF")))));

    private MagicSignatures() {}

    static Optional<List<Signature>> forContentType(String contentType) {
        return Optional.ofNullable(contentType).map(SIGNATURES::get);
    }

    private static Signature sig(Marker... markers) {
        return new Signature(List.of(markers));
    }

    private static Marker at(int offset, String ascii) {
        return new Marker(offset, ascii.getBytes(US_ASCII));
    }

    private static Marker at(int offset, int... unsignedBytes) {
        byte[] bytes = new byte[unsignedBytes.length];
        for (int i = 0; i < unsignedBytes.length; i++) {
            bytes[i] = (byte) unsignedBytes[i];
        }
        return new Marker(offset, bytes);
    }
}
