package ai.disko.csi.naming;

/**
 * Canonicalizes arbitrary strings into storage volume names: lowercase {@code [a-z0-9-]},
 * no leading, trailing or doubled hyphens, at most {@link #MAX_LENGTH} characters.
 */
public final class VolumeNameSanitizer {
    public static final int MAX_LENGTH = 128;

    private static final char SEPARATOR = '-';

    private VolumeNameSanitizer() {
    }

    public static String sanitize(String raw) throws EmptyVolumeNameException {
        var stripped = raw.strip();

        // simple (per code point) lowercasing; every disallowed code point, '_' and '.' included,
        // becomes a separator and runs collapse to one
        var sb = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); ) {
            int cp = stripped.codePointAt(i);
            i += Character.charCount(cp);

            int lower = Character.toLowerCase(cp);
            if (isNameChar(lower)) {
                sb.append((char) lower);
            } else if (!sb.isEmpty() && sb.charAt(sb.length() - 1) != SEPARATOR) {
                sb.append(SEPARATOR);
            }
        }
        trimTrailingSeparators(sb);

        if (sb.isEmpty()) {
            throw new EmptyVolumeNameException(raw);
        }

        if (sb.length() > MAX_LENGTH) {
            sb.setLength(MAX_LENGTH);
            trimTrailingSeparators(sb);
        }

        return sb.toString();
    }

    public static boolean isValid(String name) {
        if (name.isEmpty() || name.length() > MAX_LENGTH) {
            return false;
        }
        if (name.charAt(0) == SEPARATOR || name.charAt(name.length() - 1) == SEPARATOR) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isNameChar(c) && c != SEPARATOR) {
                return false;
            }
            if (c == SEPARATOR && name.charAt(i - 1) == SEPARATOR) {
                return false;
            }
        }
        return true;
    }

    // hyphens are not name chars here, they pass through the separator collapse
    private static boolean isNameChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static void trimTrailingSeparators(StringBuilder sb) {
        while (!sb.isEmpty() && sb.charAt(sb.length() - 1) == SEPARATOR) {
            sb.setLength(sb.length() - 1);
        }
    }
}
