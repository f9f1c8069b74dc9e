package br.edu.ifba.shared;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public final class UuidUtils {

    /**
     * Namespace of master entity ids (the RFC 4122 URL namespace).
     */
    public static final UUID MASTER_ENTITY_NAMESPACE = UUID.fromString("6ba7b811-9dad-11d1-80b4-00c04fd430c8");

    private UuidUtils() {
    }

    /**
     * Generates a deterministic UUID v5 (name-based) from an input string.
     * Same input always produces the same UUID.
     *
     * @param input The input string to generate UUID from
     * @return Deterministic UUID
     */
    public static UUID deterministicV5(String input) {
        return deterministicV5(MASTER_ENTITY_NAMESPACE, input);
    }

    /**
     * Generates a deterministic UUID v5 within a namespace.
     */
    public static UUID deterministicV5(UUID namespace, String input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(asBytes(namespace));
            md.update(input.getBytes(StandardCharsets.UTF_8));
            byte[] hash = md.digest();
            
            // Use first 16 bytes of hash for UUID
            ByteBuffer buf = ByteBuffer.wrap(hash);
            long msb = buf.getLong();
            long lsb = buf.getLong();
            
            // Set version (5) and variant bits
            msb = (msb & 0xFFFFFFFFFFFF0FFFL) | 0x0000000000005000L;
            lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
            
            return new UUID(msb, lsb);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    /**
     * Master entity id for a set of member record ids. Order of the input does
     * not matter. Ids are sorted and each one is prefixed with its length before
     * hashing, so no two member sets share a hash input.
     */
    public static UUID masterEntityId(Collection<String> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("memberIds cannot be null or empty");
        }
        List<String> sorted = new ArrayList<>(memberIds);
        Collections.sort(sorted);
        StringBuilder name = new StringBuilder();
        for (String id : sorted) {
            name.append(id.length()).append(':').append(id);
        }
        return deterministicV5(name.toString());
    }

    /**
     * Converts UUID to byte array.
     */
    private static byte[] asBytes(UUID uuid) {
        ByteBuffer bb = ByteBuffer.wrap(new byte[16]);
        bb.putLong(uuid.getMostSignificantBits());
        bb.putLong(uuid.getLeastSignificantBits());
        return bb.array();
    }
}
