package de.mattis.arraybench;

import de.mattis.arraybench.bench.BenchCli;
import de.mattis.arraybench.bench.BenchDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Einstiegspunkt der Spring-Boot-Anwendung.
 *
 * Diese Klasse startet den Spring Application Context (ohne Webserver),
 * bindet die Defaults aus {@code application.properties} an {@link BenchDefaults}
 * und übergibt die Kommandozeile an {@link BenchCli}.
 *
 * Diese Klasse enthält keine Benchmark-Logik.
 * Sie ist ausschließlich für das Bootstrapping und den Exit-Code zuständig.
 */
@SpringBootApplication
@EnableConfigurationProperties(BenchDefaults.class)
public class ArrayBenchApplication implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_CONFIGURATION_ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(ArrayBenchApplication.class);

    private final BenchDefaults defaults;
    private int exitCode;

    public ArrayBenchApplication(BenchDefaults defaults) {
        this.defaults = defaults;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ArrayBenchApplication.class, args)));
    }

    @Override
    public void run(String... args) throws Exception {
        try {
            exitCode = new BenchCli(defaults).run(args);
        } catch (IllegalArgumentException e) {
            // Konfigurationsfehler: sofort beenden, keine Teilergebnisse
            log.error("Fatal configuration error: {}", e.getMessage());
            exitCode = EXIT_CONFIGURATION_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
