/**
 * Main application class for the UPC scanner
 *
 * Features:
 * - Boots the barcode recovery pipeline as a Spring context
 * - Binds scanner configuration properties
 * - Entry point for Spring Boot application
 */

package net.upcscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UpcScannerApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(UpcScannerApplication.class, args);
    }
}
