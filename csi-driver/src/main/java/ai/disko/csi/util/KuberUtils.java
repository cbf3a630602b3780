package ai.disko.csi.util;

import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;

public final class KuberUtils {

    private KuberUtils() {
    }

    public static boolean isResourceNotFound(KubernetesClientException ex) {
        return ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    public static String describe(KubernetesClientException ex) {
        return ex.getCode() > 0 ? "HTTP " + ex.getCode() + ": " + ex.getMessage() : ex.getMessage();
    }
}
