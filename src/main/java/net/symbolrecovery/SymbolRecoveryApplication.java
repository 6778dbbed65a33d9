/**
 * Main application class for Symbol Recovery
 *
 * Features:
 * - Boots the recovery pipeline, damage assessor and decode backend as Spring singletons
 * - Binds {@code symbol-recovery.*} configuration
 * - Runs without a web server; callers embed the services or drive them from tests
 */

package net.symbolrecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SymbolRecoveryApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SymbolRecoveryApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        // Image transforms need AWT but never a display
        System.setProperty("java.awt.headless", "true");
        application.run(args);
    }
}
