package ai.disko.csi.naming;

import ai.disko.csi.model.ProvisionRequest;

import java.util.Optional;

/**
 * Where claim metadata for a new volume comes from.
 */
public interface VolumeNameSource {
    VolumeNameSource NONE = request -> Optional.empty();

    /**
     * @return raw, not yet sanitized, claim-derived name; empty if the request has no usable claim metadata
     */
    Optional<String> candidate(ProvisionRequest request);
}
