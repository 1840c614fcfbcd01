// file: src/main/java/io/symtree/core/StructuralHasher.java
package io.symtree.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Structural fingerprint of a symbol, computed bottom-up like a Merkle hash.
 * <p>
 * Encoding hashed with SHA-256:
 *   kindTag (int32 len + UTF-8) || name (int32 len + UTF-8) || childCount (int32)
 *   || childId_1 (int64) || ... || childId_n (int64)
 * <p>
 * The id is the first 8 bytes of the digest, big-endian.
 * Length prefixes keep (kind, name) pairs unambiguous; child ids are hashed in
 * stored order, so permuting children changes the id.
 */
final class StructuralHasher {

    private StructuralHasher() {}

    static long fingerprint(Symbol symbol) {
        return collect(symbol, null, newDigest());
    }

    /**
     * Fingerprints of every node of {@code root}, keyed by node identity.
     * Each subtree is hashed exactly once.
     */
    static Map<Symbol, Long> fingerprintAll(Symbol root) {
        var out = new IdentityHashMap<Symbol, Long>();
        collect(root, out, newDigest());
        return out;
    }

    // ---------------- helpers ----------------

    private static long collect(Symbol node, Map<Symbol, Long> out, MessageDigest md) {
        long[] ids = new long[node.children().size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = collect(node.children().get(i), out, md);
        }
        long id = combine(md, node, ids);
        if (out != null) out.put(node, id);
        return id;
    }

    private static long combine(MessageDigest md, Symbol symbol, long[] childIds) {
        md.reset();
        updateString(md, symbol.getClass().getName());
        updateString(md, symbol.name());
        md.update(intBE(childIds.length));
        for (long id : childIds) {
            md.update(longBE(id));
        }
        byte[] h = md.digest();
        return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
    }

    private static void updateString(MessageDigest md, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        md.update(intBE(bytes.length));
        md.update(bytes);
    }

    private static byte[] intBE(int v) {
        return ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(v).array();
    }

    private static byte[] longBE(long v) {
        return ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(v).array();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
