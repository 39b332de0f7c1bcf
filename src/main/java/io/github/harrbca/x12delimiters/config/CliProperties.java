package io.github.harrbca.x12delimiters.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Console session settings. {@code charset} is used for both reading commands and printing results,
 * independent of the platform default.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.cli")
public class CliProperties {

    private boolean enabled = true;
    private String prompt = "x12-delimiters> ";
    private boolean showWelcomeMessage = true;
    private Charset charset = StandardCharsets.UTF_8;
}
