package com.platform.provisioner.resource.endpoint;

/**
 * Which cluster instances a custom endpoint routes to.
 */
public enum EndpointType {
    READER,
    WRITER,
    ANY
}
