package ai.disko.csi.kuber;

import ai.disko.csi.model.ClaimRef;
import ai.disko.csi.naming.ClaimLookup;
import ai.disko.csi.util.KuberUtils;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Resolves PV -> PVC bindings and PVC annotations through the Kubernetes API.
 *
 * <p>Every API failure is logged and reported as a missing value, so an unreachable API server
 * looks the same as an unbound volume to callers.
 */
@Singleton
public class KuberClaimLookup implements ClaimLookup {
    private static final Logger LOG = LogManager.getLogger(KuberClaimLookup.class);

    private final KuberClientFactory kuberClientFactory;

    public KuberClaimLookup(KuberClientFactory kuberClientFactory) {
        this.kuberClientFactory = kuberClientFactory;
    }

    @Override
    public Optional<ClaimRef> claimBinding(String volumeName) {
        if (volumeName == null || volumeName.isBlank()) {
            LOG.debug("Persistent volume name is blank, nothing to look up");
            return Optional.empty();
        }

        final PersistentVolume volume;
        try (var client = kuberClientFactory.build()) {
            volume = client.persistentVolumes().withName(volumeName).get();
        } catch (KubernetesClientException e) {
            logLookupFailure("persistent volume " + volumeName, e);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot read persistent volume '{}', falling back to the provisioner name. {}",
                volumeName, e.getMessage());
            return Optional.empty();
        }

        if (volume == null) {
            LOG.debug("Persistent volume {} not found", volumeName);
            return Optional.empty();
        }
        if (volume.getSpec() == null || volume.getSpec().getClaimRef() == null) {
            LOG.debug("Persistent volume {} has no claim ref", volumeName);
            return Optional.empty();
        }

        ObjectReference ref = volume.getSpec().getClaimRef();
        return Optional.ofNullable(ClaimRef.of(ref.getNamespace(), ref.getName()));
    }

    @Override
    public Optional<String> claimAnnotation(ClaimRef claim, String annotationKey) {
        if (ClaimRef.of(claim.namespace(), claim.name()) == null) {
            LOG.debug("Claim ref {} is incomplete, nothing to look up", claim);
            return Optional.empty();
        }

        final PersistentVolumeClaim pvc;
        try (var client = kuberClientFactory.build()) {
            pvc = client.persistentVolumeClaims()
                .inNamespace(claim.namespace())
                .withName(claim.name())
                .get();
        } catch (KubernetesClientException e) {
            logLookupFailure("persistent volume claim " + claim, e);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot read persistent volume claim '{}', falling back to the provisioner name. {}",
                claim, e.getMessage());
            return Optional.empty();
        }

        if (pvc == null) {
            LOG.debug("Persistent volume claim {} not found", claim);
            return Optional.empty();
        }

        var annotations = pvc.getMetadata() == null ? null : pvc.getMetadata().getAnnotations();
        if (annotations == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(annotations.get(annotationKey));
    }

    private static void logLookupFailure(String what, KubernetesClientException e) {
        if (KuberUtils.isResourceNotFound(e)) {
            LOG.debug("Cannot find {}: {}", what, e.getMessage());
            return;
        }
        LOG.warn("Cannot read {}, falling back to the provisioner name. {}", what, KuberUtils.describe(e));
    }
}
