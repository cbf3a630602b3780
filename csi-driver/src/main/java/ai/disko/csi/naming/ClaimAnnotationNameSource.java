package ai.disko.csi.naming;

import ai.disko.csi.model.ProvisionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Builds {@code pvc-<namespace>-<base>} where {@code base} is an operator-supplied annotation on the claim
 * bound to the volume.
 */
public class ClaimAnnotationNameSource implements VolumeNameSource {
    private static final Logger LOG = LogManager.getLogger(ClaimAnnotationNameSource.class);

    private final ClaimLookup claimLookup;
    private final String annotationKey;

    public ClaimAnnotationNameSource(ClaimLookup claimLookup, String annotationKey) {
        this.claimLookup = claimLookup;
        this.annotationKey = annotationKey;
    }

    @Override
    public Optional<String> candidate(ProvisionRequest request) {
        var claim = claimLookup.claimBinding(request.fallbackName()).orElse(null);
        if (claim == null) {
            LOG.debug("Volume {} is not bound to a claim", request.fallbackName());
            return Optional.empty();
        }

        var base = claimLookup.claimAnnotation(claim, annotationKey)
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .orElse(null);
        if (base == null) {
            LOG.debug("Claim {} has no {} annotation", claim, annotationKey);
            return Optional.empty();
        }

        return Optional.of("pvc-" + claim.namespace() + "-" + base);
    }
}
