package ai.disko.csi.test;

import io.fabric8.kubernetes.api.model.PersistentVolume;
import io.fabric8.kubernetes.api.model.PersistentVolumeBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.annotation.Nullable;

import java.util.Map;

public final class Utils {
    private Utils() {
    }

    public static PersistentVolume createBoundVolume(KubernetesClient client, String volumeName,
                                                     @Nullable String claimNamespace, @Nullable String claimName)
    {
        var builder = new PersistentVolumeBuilder()
            .withNewMetadata()
                .withName(volumeName)
            .endMetadata();
        if (claimNamespace != null || claimName != null) {
            builder.withNewSpec()
                .withNewClaimRef()
                    .withNamespace(claimNamespace)
                    .withName(claimName)
                .endClaimRef()
            .endSpec();
        } else {
            builder.withNewSpec().endSpec();
        }
        return client.persistentVolumes().resource(builder.build()).create();
    }

    public static PersistentVolumeClaim createClaim(KubernetesClient client, String namespace, String name,
                                                    Map<String, String> annotations)
    {
        var claim = new PersistentVolumeClaimBuilder()
            .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withAnnotations(annotations)
            .endMetadata()
            .build();
        return client.persistentVolumeClaims().inNamespace(namespace).resource(claim).create();
    }
}
