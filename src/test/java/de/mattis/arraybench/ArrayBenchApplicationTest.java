package de.mattis.arraybench;

import de.mattis.arraybench.bench.BenchDefaults;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(args = "--help")
class ArrayBenchApplicationTest {

    @Autowired
    private BenchDefaults defaults;

    @Autowired
    private ArrayBenchApplication application;

    @Test
    void shouldBindDefaultsFromApplicationProperties() {
        assertEquals("10000,100000,1000000", defaults.sizes());
        assertEquals(3, defaults.repetitions());
        assertEquals("42", defaults.seeds());
        assertEquals("results.csv", defaults.outfile());
        assertEquals(List.of("java_long_array"), defaults.implementations());
        assertTrue(defaults.scenarios().isEmpty());
        assertEquals(11, defaults.scenarioList().size());
    }

    @Test
    void shouldExitCleanlyAfterPrintingUsage() {
        assertEquals(0, application.getExitCode());
    }
}
