package ai.disko.csi.naming;

import ai.disko.csi.model.ProvisionRequest;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds {@code <prefix>ns-<namespace>--pvc-<claim><suffix>} from claim identity attached to the request
 * by the external provisioner.
 */
public class RequestParametersNameSource implements VolumeNameSource {

    @Override
    public Optional<String> candidate(ProvisionRequest request) {
        var claim = request.claim();
        if (claim == null) {
            return Optional.empty();
        }

        return Optional.of(Objects.requireNonNullElse(request.namePrefix(), "")
            + "ns-" + claim.namespace()
            + "--pvc-" + claim.name()
            + Objects.requireNonNullElse(request.nameSuffix(), ""));
    }
}
