package at.totenbilder.search.common.support;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Locale;
import java.util.UUID;

/**
 * Canonical image keys.
 *
 * <p>The canonical key is {@code {prefix}{filename}} and is the join key across the object store,
 * the metadata table and the vector index. The metadata table may hold either spelling.</p>
 */
public final class ImageKeys {

    private ImageKeys() {
    }

    /**
     * Prepends the storage prefix unless the filename already carries it.
     */
    public static String canonical(String prefix, String filename) {
        if (filename == null) {
            return null;
        }
        String safePrefix = prefix == null ? "" : prefix;
        if (safePrefix.isEmpty() || filename.startsWith(safePrefix)) {
            return filename;
        }
        return safePrefix + filename;
    }

    /**
     * Filename without the storage prefix
     */
    public static String bare(String prefix, String key) {
        if (key == null || prefix == null || prefix.isEmpty()) {
            return key;
        }
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    /**
     * Deterministic point id derived from the canonical key (name based UUID).
     */
    public static String pointId(String canonicalKey) {
        return UUID.nameUUIDFromBytes(canonicalKey.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * True for object keys that are indexable images: not the prefix marker itself and
     * ending with one of the extensions (case-insensitive).
     */
    public static boolean isIndexableImage(String prefix, String key, Collection<String> extensions) {
        if (key == null || key.isEmpty() || key.equals(prefix) || key.endsWith("/")) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
