package ai.disko.csi.model;

import jakarta.annotation.Nullable;

public record ClaimRef(
    String namespace,
    String name
) {
    @Nullable
    public static ClaimRef of(@Nullable String namespace, @Nullable String name) {
        if (isBlank(namespace) || isBlank(name)) {
            return null;
        }
        return new ClaimRef(namespace, name);
    }

    private static boolean isBlank(@Nullable String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
