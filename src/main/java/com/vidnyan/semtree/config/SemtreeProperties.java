package com.vidnyan.semtree.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for tree construction.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "semtree.build")
public class SemtreeProperties {

    /**
     * Worker threads used to build files in parallel.
     * Default: number of available processors
     */
    private int concurrency = Runtime.getRuntime().availableProcessors();

    /**
     * Emit the untransformed CST instead of the semantic tree.
     */
    private boolean rawMode = false;

    /**
     * Largest source file that is built, in bytes. Larger files are reported as errors.
     */
    private long maxFileSize = 8L * 1024 * 1024;
}
