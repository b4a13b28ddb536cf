package com.myorg.choirsplit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the REST surface keeps uploaded scores and everything a run writes.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String basePath = "output";
}
