package ai.disko.csi.test;

import ai.disko.csi.naming.RequestParametersNameSource;
import ai.disko.csi.naming.VolumeNameResolver;
import ai.disko.csi.services.VolumeNameService;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;
import java.util.Optional;

import static ai.disko.csi.model.ProvisionRequest.PVC_NAMESPACE_KEY;
import static ai.disko.csi.model.ProvisionRequest.PVC_NAME_KEY;

public class VolumeNameServiceTest {

    private final VolumeNameService service =
        new VolumeNameService(new VolumeNameResolver(new RequestParametersNameSource()));

    @Test
    public void claimDerivedName() {
        var name = service.provisionedName("pvc-abc123", Map.of(
            PVC_NAMESPACE_KEY, "team-a",
            PVC_NAME_KEY, "data-01"));
        Assert.assertEquals("ns-team-a-pvc-data-01", name);
    }

    @Test
    public void fallbackName() {
        Assert.assertEquals("pvc-abc123", service.provisionedName("pvc-abc123", null));
    }

    @Test
    public void nameNotSet() {
        var e = Assert.assertThrows(StatusRuntimeException.class, () -> service.provisionedName("  ", Map.of()));
        Assert.assertEquals(Status.INVALID_ARGUMENT.getCode(), e.getStatus().getCode());

        e = Assert.assertThrows(StatusRuntimeException.class, () -> service.provisionedName(null, Map.of()));
        Assert.assertEquals(Status.INVALID_ARGUMENT.getCode(), e.getStatus().getCode());
    }

    @Test
    public void emptySanitizedName() {
        var service = new VolumeNameService(new VolumeNameResolver(request -> Optional.of("!!!")));

        var e = Assert.assertThrows(StatusRuntimeException.class, () -> service.provisionedName("pvc-1", null));
        Assert.assertEquals(Status.INVALID_ARGUMENT.getCode(), e.getStatus().getCode());
        Assert.assertTrue(e.getStatus().getDescription(), e.getStatus().getDescription().contains("'!!!'"));
    }
}
