package io.github.flexsource.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the command-line preview, bound from the {@code preview} section of
 * {@code application.yml}.
 *
 * <pre>
 * preview:
 *   rows: 10
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "preview")
@Data
public class PreviewConfig {

    /**
     * Number of rows shown when {@code --rows} is not given.
     */
    private int rows = 10;
}
