package ai.disko.csi.naming;

import ai.disko.csi.model.ProvisionRequest;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

@Singleton
public class VolumeNameResolver {
    private static final Logger LOG = LogManager.getLogger(VolumeNameResolver.class);

    private final VolumeNameSource nameSource;

    public VolumeNameResolver(VolumeNameSource nameSource) {
        this.nameSource = nameSource;
    }

    /**
     * Picks the final name of a new volume.
     *
     * <p>A claim-derived candidate, if the configured source yields one, is sanitized and returned.
     * Otherwise the fallback name is returned as is, it is generated upstream and already valid.
     *
     * @throws EmptyVolumeNameException if the claim-derived candidate sanitizes to an empty name
     */
    public String resolve(ProvisionRequest request) throws EmptyVolumeNameException {
        var candidate = nameSource.candidate(request).orElse(null);
        if (candidate == null || candidate.isBlank()) {
            return request.fallbackName();
        }

        LOG.debug("Sanitizing volume name candidate '{}' for {}", candidate, request.fallbackName());
        return VolumeNameSanitizer.sanitize(candidate);
    }
}
