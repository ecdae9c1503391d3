package kaspi.lab.attachmentService.exception;

public class ChunkIndexOutOfRangeException extends InvalidStateException {

    public ChunkIndexOutOfRangeException(int index, int totalChunks) {
        super(ErrorCode.CHUNK_INDEX_OUT_OF_RANGE,
                "Chunk index " + index + " exceeds total chunks " + totalChunks);
    }
}
