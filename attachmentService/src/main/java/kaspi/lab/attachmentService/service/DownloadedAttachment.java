package kaspi.lab.attachmentService.service;

/** Verified plaintext of a ready attachment together with what the response headers need. */
public record DownloadedAttachment(String filename, String contentType, byte[] data) {

    public long size() {
        return data.length;
    }
}
