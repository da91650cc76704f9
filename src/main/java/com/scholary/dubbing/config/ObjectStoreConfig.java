package com.scholary.dubbing.config;

import com.scholary.dubbing.objectstore.ObjectStoreClient;
import com.scholary.dubbing.objectstore.ObjectStoreProperties;
import com.scholary.dubbing.objectstore.S3ObjectStoreClient;
import com.scholary.dubbing.source.ObjectStoreVideoSource;
import com.scholary.dubbing.source.VideoSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code objectstore.enabled=true}; otherwise {@code s3://} video references
 * are rejected as unsupported.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
@ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public VideoSource objectStoreVideoSource(ObjectStoreClient objectStoreClient) {
    return new ObjectStoreVideoSource(objectStoreClient);
  }
}
