/**
 * Main application class for FindMyTask search
 *
 * Features:
 * - Boots the search engine, recent-search history and default in-memory task store
 * - Runs without a web server; host applications call {@code TaskSearchUseCase} directly
 */

package net.findmytask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FindMyTaskApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(FindMyTaskApplication.class, args);
    }
}
