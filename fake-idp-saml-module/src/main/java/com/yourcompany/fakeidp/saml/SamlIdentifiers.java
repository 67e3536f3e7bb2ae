package com.yourcompany.fakeidp.saml;

import java.util.UUID;

/**
 * The two reference identifiers of one response. The response ID doubles as the {@code SessionIndex};
 * the assertion ID is what the signature {@code Reference} points at.
 *
 * @param responseId  ID of the {@code samlp:Response} root
 * @param assertionId ID of the {@code saml:Assertion}
 */
public record SamlIdentifiers(String responseId, String assertionId) {

    /**
     * Generates two fresh identifiers. Both start with an underscore because {@code xs:ID} must not start with a digit.
     */
    public static SamlIdentifiers generate() {
        return new SamlIdentifiers(generateUniqueId(), generateUniqueId());
    }

    public String referenceUri() {
        return "#" + assertionId;
    }

    private static String generateUniqueId() {
        return "_" + UUID.randomUUID();
    }
}
