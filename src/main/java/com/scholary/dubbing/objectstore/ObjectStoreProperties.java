package com.scholary.dubbing.objectstore;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. The client is only created when
 * {@code enabled} is true; without it, only local video references are accepted.
 */
@ConfigurationProperties(prefix = "objectstore")
public record ObjectStoreProperties(
    boolean enabled,
    String endpoint,
    String accessKey,
    String secretKey,
    String region,
    boolean pathStyleAccess) {}
