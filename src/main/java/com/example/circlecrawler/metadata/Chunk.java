package com.example.circlecrawler.metadata;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unit of content handed to the scanning pipeline: sanitized log bytes tagged with the
 * source that produced them. {@code data} is copied on the way in and out, and equality
 * compares its contents.
 */
public record Chunk(
        SourceType sourceType,
        String sourceName,
        long sourceId,
        long jobId,
        byte[] data,
        CircleCiMetadata metadata,
        boolean verify
) {
    public Chunk {
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Chunk)) {
            return false;
        }
        Chunk that = (Chunk) other;
        return sourceId == that.sourceId
                && jobId == that.jobId
                && verify == that.verify
                && sourceType == that.sourceType
                && Objects.equals(sourceName, that.sourceName)
                && Arrays.equals(data, that.data)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sourceType, sourceName, sourceId, jobId, metadata, verify);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Chunk[sourceType=" + sourceType + ", sourceName=" + sourceName + ", sourceId=" + sourceId
                + ", jobId=" + jobId + ", data=" + data.length + " bytes, metadata=" + metadata
                + ", verify=" + verify + "]";
    }
}
