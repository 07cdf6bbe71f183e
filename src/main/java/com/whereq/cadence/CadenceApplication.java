package com.whereq.cadence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Cadence.
 * This service turns content into rendered artifacts, spreads them over future publish
 * slots and drives each through upload, scheduling and publishing on a remote target.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class CadenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadenceApplication.class, args);
    }
}
