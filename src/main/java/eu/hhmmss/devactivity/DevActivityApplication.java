package eu.hhmmss.devactivity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DevActivityApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevActivityApplication.class, args);
    }
}
