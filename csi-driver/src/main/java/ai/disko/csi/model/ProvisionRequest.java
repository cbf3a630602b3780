package ai.disko.csi.model;

import jakarta.annotation.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Naming-relevant part of a {@code CreateVolume} request.
 *
 * <p>{@code fallbackName} is the provisioner-generated name ({@code pvc-<uid>}) and is always present.
 * Claim identity is either attached by the external provisioner (extra-create-metadata) or absent.
 */
public record ProvisionRequest(
    String fallbackName,
    @Nullable String claimNamespace,
    @Nullable String claimName,
    @Nullable String namePrefix,
    @Nullable String nameSuffix
) {
    public static final String PVC_NAMESPACE_KEY = "csi.storage.k8s.io/pvc/namespace";
    public static final String PVC_NAME_KEY = "csi.storage.k8s.io/pvc/name";
    public static final String NAME_PREFIX_KEY = "volumeNamePrefix";
    public static final String NAME_SUFFIX_KEY = "volumeNameSuffix";

    public ProvisionRequest {
        Objects.requireNonNull(fallbackName, "fallbackName");
    }

    public static ProvisionRequest of(String fallbackName) {
        return new ProvisionRequest(fallbackName, null, null, null, null);
    }

    public static ProvisionRequest fromParameters(String name, @Nullable Map<String, String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return of(name);
        }
        return new ProvisionRequest(
            name,
            parameters.get(PVC_NAMESPACE_KEY),
            parameters.get(PVC_NAME_KEY),
            parameters.get(NAME_PREFIX_KEY),
            parameters.get(NAME_SUFFIX_KEY));
    }

    /**
     * @return claim identity, or {@code null} if either half is blank
     */
    @Nullable
    public ClaimRef claim() {
        return ClaimRef.of(claimNamespace, claimName);
    }
}
