package net.lexiconnect.parser;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Derives identifiers for elements that arrive without one. The same sequence of key
 * parts always yields the same ID, so re-parsing a file reproduces its IDs.
 * <p>
 * IDs are name-based (version 5) UUIDs over the parts joined with '|'. A '|' or a backslash
 * inside a part is escaped with a backslash, so distinct part lists never share a key.
 */
public class StableIdGenerator {

    private static final UUID NAMESPACE = UUID.fromString("11111111-1111-1111-1111-111111111111");

    private StableIdGenerator() {}

    /**
     * @param parts - the ordered key parts; null parts count as empty strings
     * @return a UUID string, 36 characters long
     */
    public static String generate(String... parts) {
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) name.append('|');
            if (parts[i] != null) appendEscaped(name, parts[i]);
        }
        return nameUUID(NAMESPACE, name.toString()).toString();
    }

    private static void appendEscaped(StringBuilder name, String part) {
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == '|' || c == '\\')
                name.append('\\');
            name.append(c);
        }
    }

    /**
     * Returns at most the first {@code length} characters of the trimmed content, for use as
     * a disambiguating key part.
     */
    public static String fragment(String content, int length) {
        if (content == null) return "";
        String trimmed = content.trim();
        return trimmed.length() <= length ? trimmed : trimmed.substring(0, length);
    }

    private static UUID nameUUID(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to provide SHA-1
            throw new IllegalStateException(e);
        }
        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50;  // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;  // IETF variant
        ByteBuffer bb = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bb.getLong(), bb.getLong());
    }
}
