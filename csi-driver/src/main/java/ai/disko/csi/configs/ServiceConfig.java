package ai.disko.csi.configs;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("csi")
public class ServiceConfig {
    private String driverName = "csi.disko.ai";

    public String volumeNameAnnotationKey() {
        return driverName + "/volumeName";
    }

    public enum NameSource {
        Parameters,
        Annotation,
        Disabled,
    }

    @Getter
    @Setter
    @ConfigurationProperties("volume-name")
    public static final class VolumeNameConfig {
        private NameSource source = NameSource.Parameters;
    }

    @Getter
    @Setter
    @ConfigurationProperties("kuber")
    public static final class KuberConfig {
        @Nullable
        private String masterUrl;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration connectionTimeout = Duration.ofSeconds(5);
    }
}
