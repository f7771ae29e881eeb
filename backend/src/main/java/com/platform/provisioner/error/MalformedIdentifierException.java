package com.platform.provisioner.error;

/**
 * Thrown when a resource identifier does not decode into the expected key parts.
 * Never retried.
 */
public class MalformedIdentifierException extends ProvisionerException {
    
    private final String identifier;
    private final String expectedLayout;
    
    public MalformedIdentifierException(String identifier, String expectedLayout) {
        super(ErrorCode.MALFORMED_IDENTIFIER,
            String.format("unexpected format for ID (%s), expected %s", identifier, expectedLayout));
        this.identifier = identifier;
        this.expectedLayout = expectedLayout;
    }
    
    public String getIdentifier() {
        return identifier;
    }
    
    public String getExpectedLayout() {
        return expectedLayout;
    }
}
