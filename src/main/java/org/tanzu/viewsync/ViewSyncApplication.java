package org.tanzu.viewsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PDF view synchronization service entry point.
 */
@SpringBootApplication
public class ViewSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ViewSyncApplication.class, args);
    }
}
