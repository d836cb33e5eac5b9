package org.buildlens.bsp.protocol;

import java.util.Objects;

/**
 * Identifies a text document by URI. Compares by value.
 *
 * @param uri The document URI.
 */
public record TextDocumentIdentifier(String uri) {

    public TextDocumentIdentifier {
        Objects.requireNonNull(uri, "uri cannot be null");
    }
}
