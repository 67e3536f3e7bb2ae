package com.yourcompany.fakeidp.saml;

/**
 * Exception raised when a SAML response cannot be assembled, digested, signed or encrypted.
 * The class is checked so that callers of the fake Identity Provider handle a failed build
 * explicitly instead of posting a half-built response to the Service Provider.
 */
public class SamlProcessingException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with a descriptive message.
     *
     * @param message human readable error description
     */
    public SamlProcessingException(String message) {
        super(message);
    }

    /**
     * Creates a new instance with a descriptive message and root cause.
     *
     * @param message human readable error description
     * @param cause   underlying cause that triggered the failure
     */
    public SamlProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
