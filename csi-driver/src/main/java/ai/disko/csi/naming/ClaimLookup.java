package ai.disko.csi.naming;

import ai.disko.csi.model.ClaimRef;

import java.util.Optional;

/**
 * Read-only, best-effort access to claim bindings. Implementations never throw on lookup failures,
 * they report the value as missing.
 */
public interface ClaimLookup {
    Optional<ClaimRef> claimBinding(String volumeName);

    Optional<String> claimAnnotation(ClaimRef claim, String annotationKey);
}
