package com.vidnyan.codegraph.adapter.out.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;
import com.vidnyan.codegraph.exception.SnapshotException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Binary snapshot encoding: Jackson CBOR, then GZIP.
 */
@Component
public class SnapshotCodec {

    private final CBORMapper mapper = CBORMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    public byte[] serialize(SnapshotPayload payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream gzip = new GZIPOutputStream(buffer)) {
            mapper.writeValue(gzip, payload);
        } catch (IOException e) {
            throw new SnapshotException("Failed to encode snapshot", e);
        }
        return buffer.toByteArray();
    }

    /**
     * @throws SnapshotException when the bytes are not a gzip'd CBOR payload
     */
    public SnapshotPayload deserialize(byte[] data) {
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            SnapshotPayload payload = mapper.readValue(gzip, SnapshotPayload.class);
            if (payload == null || payload.meta() == null) {
                throw new SnapshotException("Snapshot payload has no header");
            }
            return payload;
        } catch (IOException e) {
            throw new SnapshotException("Failed to decode snapshot: " + e.getMessage(), e);
        }
    }
}
