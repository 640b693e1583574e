package com.questrail.alpaca.registry;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Deterministic device unique ids.
 *
 * <p>A device without a configured {@code unique_id} gets a name-based SHA-1
 * UUID (version 5, RFC 4122) over {@code "{type}-{number}"} in the OID
 * namespace, so the same configuration yields the same id on every start.</p>
 */
public final class UniqueIds {

    /** RFC 4122 namespace for ISO OIDs. */
    public static final UUID NAMESPACE_OID = UUID.fromString("6ba7b812-9dad-11d1-80b4-00c04fd430c8");

    private UniqueIds() {}

    public static String forDevice(String type, int number) {
        return nameBasedSha1(NAMESPACE_OID, type + "-" + number).toString();
    }

    static UUID nameBasedSha1(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-1.
            throw new IllegalStateException("SHA-1 not available", e);
        }
        ByteBuffer ns = ByteBuffer.allocate(16)
                .putLong(namespace.getMostSignificantBits())
                .putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        sha1.update(name.getBytes(StandardCharsets.UTF_8));
        byte[] hash = sha1.digest();

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);

        ByteBuffer bb = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bb.getLong(), bb.getLong());
    }
}
