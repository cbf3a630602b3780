package ai.disko.csi.kuber;

import io.fabric8.kubernetes.client.KubernetesClient;

public interface KuberClientFactory {
    KubernetesClient build();
}
