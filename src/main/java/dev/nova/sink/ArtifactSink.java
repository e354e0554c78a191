package dev.nova.sink;

/**
 * Durable storage for text artifacts produced by plan steps.
 */
public interface ArtifactSink {

    /**
     * Write a text blob.
     *
     * @param path    relative path of the artifact
     * @param content text content, stored as UTF-8
     * @return receipt with the artifact URI and size in bytes
     * @throws SinkUnavailableException if the write failed
     */
    ArtifactReceipt writeText(String path, String content);

    /** Display name used by connectivity checks. */
    String getName();
}
