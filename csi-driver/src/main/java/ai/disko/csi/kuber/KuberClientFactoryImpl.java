package ai.disko.csi.kuber;

import ai.disko.csi.configs.ServiceConfig;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Builds clients from the kubeconfig or in-cluster service account, optionally pinned to
 * {@code csi.kuber.master-url}. Lookups are best-effort, so the client never retries.
 */
@Requires(property = "csi.mock-kuber.enabled", notEquals = "true")
@Singleton
public class KuberClientFactoryImpl implements KuberClientFactory {

    private final ServiceConfig.KuberConfig config;

    public KuberClientFactoryImpl(ServiceConfig.KuberConfig config) {
        this.config = config;
    }

    @Override
    public KubernetesClient build() {
        return new KubernetesClientBuilder()
            .withConfig(clientConfig())
            .build();
    }

    public Config clientConfig() {
        var builder = new ConfigBuilder(Config.autoConfigure(null))
            .withRequestTimeout((int) config.getRequestTimeout().toMillis())
            .withConnectionTimeout((int) config.getConnectionTimeout().toMillis())
            .withRequestRetryBackoffLimit(0);
        if (config.getMasterUrl() != null) {
            builder.withMasterUrl(config.getMasterUrl());
        }
        return builder.build();
    }
}
