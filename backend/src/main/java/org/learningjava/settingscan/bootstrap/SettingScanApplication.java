package org.learningjava.settingscan.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.settingscan")
public class SettingScanApplication {
    public static void main(String[] args) {
        SpringApplication.run(SettingScanApplication.class, args);
    }
}
