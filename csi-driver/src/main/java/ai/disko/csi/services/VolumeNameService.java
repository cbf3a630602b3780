package ai.disko.csi.services;

import ai.disko.csi.model.ProvisionRequest;
import ai.disko.csi.naming.EmptyVolumeNameException;
import ai.disko.csi.naming.VolumeNameResolver;
import ai.disko.csi.naming.VolumeNameSanitizer;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Naming step of {@code CreateVolume}: turns the request name and parameters into the name
 * the volume is created with.
 */
@Singleton
public class VolumeNameService {
    private static final Logger LOG = LogManager.getLogger(VolumeNameService.class);

    private final VolumeNameResolver resolver;

    public VolumeNameService(VolumeNameResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param requestName provisioner-generated name from {@code CreateVolumeRequest.name}
     * @param parameters  {@code CreateVolumeRequest.parameters}, may be null
     * @throws StatusRuntimeException with {@code INVALID_ARGUMENT} if the name is not set or
     *                                the claim-derived name sanitizes to nothing
     */
    public String provisionedName(@Nullable String requestName, @Nullable Map<String, String> parameters) {
        if (requestName == null || requestName.isBlank()) {
            throw Status.INVALID_ARGUMENT.withDescription("Volume name not set").asRuntimeException();
        }

        var request = ProvisionRequest.fromParameters(requestName, parameters);
        final String name;
        try {
            name = resolver.resolve(request);
        } catch (EmptyVolumeNameException e) {
            LOG.error("Cannot create volume {}: {}", requestName, e.getMessage());
            throw Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException();
        }

        if (name.equals(requestName)) {
            LOG.info("Volume {} keeps the provisioner name", requestName);
            if (!VolumeNameSanitizer.isValid(name)) {
                LOG.warn("Provisioner name {} is not a valid storage volume name", name);
            }
        } else {
            LOG.info("Volume {} will be created as {}", requestName, name);
        }
        return name;
    }
}
