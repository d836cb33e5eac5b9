package org.buildlens.bsp.protocol;

import java.util.Objects;

/**
 * Identifies a build target by URI. Compares by value.
 *
 * @param uri The target URI.
 */
public record BuildTargetIdentifier(String uri) {

    public BuildTargetIdentifier {
        Objects.requireNonNull(uri, "uri cannot be null");
    }
}
