package com.vidnyan.codegraph.adapter.out.snapshot;

import com.vidnyan.codegraph.exception.SnapshotException;
import lombok.RequiredArgsConstructor;

import javax.crypto.Mac;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 over the compressed snapshot bytes.
 */
@RequiredArgsConstructor
public class SnapshotSigner {

    private final SigningKeyProvider keyProvider;

    /**
     * @return lowercase hex digest
     */
    public String sign(byte[] data) {
        try {
            Mac mac = Mac.getInstance(SigningKeyProvider.ALGORITHM);
            mac.init(keyProvider.getKey());
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (GeneralSecurityException e) {
            throw new SnapshotException("Cannot sign snapshot", e);
        }
    }

    /**
     * Constant-time comparison of the recomputed digest with {@code expectedHex}.
     */
    public boolean verify(byte[] data, String expectedHex) {
        if (expectedHex == null || expectedHex.isBlank()) {
            return false;
        }
        byte[] actual = sign(data).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHex.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }
}
