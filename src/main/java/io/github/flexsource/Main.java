package io.github.flexsource;

import io.github.flexsource.config.PreviewConfig;
import io.github.flexsource.core.DataSource;
import io.github.flexsource.core.RecordExporter;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.Table;
import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.util.ErrorHandler;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Loads a data source from its YAML definition and either previews its first rows or exports all
 * of its records as JSON lines.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --config <file>} or {@code -c <file>}: data source YAML file (required).</li>
 * <li>{@code --rows <n>} or {@code -n <n>}: number of rows to preview. If omitted,
 * {@code preview.rows} in {@code application.yml} is used.</li>
 * <li>{@code --mapped} or {@code -m}: use the mapped view instead of the sanitized dataset.</li>
 * <li>{@code --output <file>} or {@code -o <file>}: export every record to the file as JSON lines
 * instead of previewing.</li>
 * </ul>
 *
 * @see PreviewConfig
 * @see DataSource
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(PreviewConfig.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PreviewConfig previewConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String config = null;
        String output = null;
        Integer rows = null;
        boolean mapped = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    config = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--rows":
                case "-n":
                    String value = (i + 1 < args.length ? args[++i] : null);
                    try {
                        rows = value == null ? null : Integer.valueOf(value);
                    } catch (NumberFormatException e) {
                        ErrorHandler.errorAndExit("Invalid number of rows: " + value, e);
                        return;
                    }
                    break;
                case "--mapped":
                case "-m":
                    mapped = true;
                    break;
                case "--output":
                case "-o":
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (config == null || config.isEmpty()) {
            ErrorHandler.errorAndExit("Data source configuration is required (--config <file>).");
            return;
        }
        int previewRows = rows == null ? previewConfig.getRows() : rows;
        log.info("Config: {}, Mapped: {}, Output: {}, Rows: {}", config, mapped, output,
                previewRows);

        // Execute
        try {
            DataSource dataSource = DataSource.fromYaml(Paths.get(config));
            if (output != null) {
                Path target = Paths.get(output);
                Stream<Map<String, Object>> records =
                        mapped ? dataSource.toMappedRecords() : dataSource.toRecords();
                long count = new RecordExporter().export(records, target);
                log.info("Export completed. {} records written to [{}]", count, target);
            } else {
                TabularDataset dataset =
                        mapped ? dataSource.toMappedDataFrame() : dataSource.toDataFrame();
                print(dataset.head(previewRows), System.out);
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (config={}): {}", config, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    static void print(Table table, PrintStream out) {
        List<String> header = new ArrayList<>();
        header.add(table.getIndexName() == null ? "" : table.getIndexName());
        header.addAll(table.getColumnNames());
        out.println(String.join("\t", header));
        for (DataRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            cells.add(String.valueOf(row.getIndex()));
            row.getValues().forEach(value -> cells.add(String.valueOf(value)));
            out.println(String.join("\t", cells));
        }
    }
}
