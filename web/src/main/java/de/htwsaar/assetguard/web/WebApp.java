package de.htwsaar.assetguard.web;

import de.htwsaar.assetguard.common.auth.SecurityConfig;
import de.htwsaar.assetguard.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class, SecurityConfig.class})
public class WebApp {
    public static void main(String[] args) {
        SpringApplication.run(WebApp.class, args);
    }
}
