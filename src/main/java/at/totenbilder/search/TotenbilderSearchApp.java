package at.totenbilder.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Totenbilder image search back end
 */
@SpringBootApplication
public class TotenbilderSearchApp {

    public static void main(String[] args) {
        SpringApplication.run(TotenbilderSearchApp.class, args);
    }
}
