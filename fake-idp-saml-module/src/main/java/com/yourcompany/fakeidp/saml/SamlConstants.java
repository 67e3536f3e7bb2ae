package com.yourcompany.fakeidp.saml;

/**
 * Namespace URIs, prefixes and fixed protocol values written into every response.
 */
public final class SamlConstants {

    public static final String PROTOCOL_NS = "urn:oasis:names:tc:SAML:2.0:protocol";
    public static final String ASSERTION_NS = "urn:oasis:names:tc:SAML:2.0:assertion";
    public static final String DSIG_NS = "http://www.w3.org/2000/09/xmldsig#";
    public static final String XENC_NS = "http://www.w3.org/2001/04/xmlenc#";

    public static final String PROTOCOL_PREFIX = "samlp";
    public static final String ASSERTION_PREFIX = "saml";
    public static final String DSIG_PREFIX = "ds";

    public static final String SAML_VERSION = "2.0";
    public static final String CONSENT_UNSPECIFIED = "urn:oasis:names:tc:SAML:2.0:consent:unspecified";
    public static final String STATUS_SUCCESS = "urn:oasis:names:tc:SAML:2.0:status:Success";
    public static final String ENTITY_FORMAT = "urn:oasis:names:tc:SAML:2.0:nameid-format:entity";
    public static final String EMAIL_ADDRESS_FORMAT = "urn:oasis:names:tc:SAML:1.1:nameid-format:emailAddress";
    public static final String BEARER_METHOD = "urn:oasis:names:tc:SAML:2.0:cm:bearer";
    public static final String AUTHN_CONTEXT_CLASS = "urn:federation:authentication:windows";

    /** The only canonicalization schema supported, used for both the reference transform and SignedInfo. */
    public static final String EXCLUSIVE_C14N = "http://www.w3.org/2001/10/xml-exc-c14n#";
    public static final String ENVELOPED_SIGNATURE = "http://www.w3.org/2000/09/xmldsig#enveloped-signature";

    private SamlConstants() {
        // Constants holder
    }
}
