package ch.battleship.navalcombat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the naval combat engine.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for deferred AI turns</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class NavalCombatApplication {

    public static void main(String[] args) {
        SpringApplication.run(NavalCombatApplication.class, args);
    }

}
