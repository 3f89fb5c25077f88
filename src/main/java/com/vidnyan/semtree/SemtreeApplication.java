package com.vidnyan.semtree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Semtree - semantic tree construction engine.
 *
 * Rewrites parser CSTs into uniform, XPath-queryable trees.
 */
@SpringBootApplication
public class SemtreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemtreeApplication.class, args);
    }
}
