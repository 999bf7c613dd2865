package com.example.grouping;

import com.example.grouping.error.UnknownGroupFunctionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the report command against the JSON fixtures in {@code src/test/resources/fixtures}.
 */
class GroupingReportMainTest {

    @Test
    @DisplayName("Should print the grouped tree report")
    void shouldPrintTreeReport() throws Exception {
        String output = GroupingReportMain.run(fixture("employees.json"), fixture("grouping-config.json"), "tree");

        assertThat(output).isEqualTo("""
                Total (5)
                  employees: 5
                  Engineering (3)
                    median(salary): 120000
                    Senior (2)
                      average salary: 125,000.0
                    Junior (1)
                      average salary: 80,000.0
                    sum(salary): $330,000
                  Sales (2)
                    median(salary): 95000
                    Senior (1)
                      average salary: 95,000.0
                    Junior (1)
                      average salary: 60,000.0
                    sum(salary): $155,000
                """);
    }

    @Test
    @DisplayName("Should print the pivot grid after filtering")
    void shouldPrintPivotReport() throws Exception {
        String output = GroupingReportMain.run(fixture("employees.json"), fixture("pivot-config.json"), "PIVOT");

        assertThat(output.lines().findFirst().orElseThrow())
                .contains("Senior / payroll", "Senior / headcount", "Junior / payroll");
        assertThat(output).contains("Total payroll: $355,000", "Total headcount: 4");
        assertThat(output.lines().filter(line -> line.startsWith("Engineering")).findFirst().orElseThrow())
                .contains("$120,000", "$80,000");
    }

    @Test
    @DisplayName("Should reject an unknown mode")
    void shouldRejectUnknownMode() {
        assertThatThrownBy(() -> GroupingReportMain.run(fixture("employees.json"), fixture("grouping-config.json"),
                "chart"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chart");
    }

    @Test
    @DisplayName("Should surface configuration errors from the engine")
    void shouldSurfaceConfigurationErrors(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("config.json");
        Files.writeString(config, """
                {"columns": [{"id": "department", "grouping": {"level": 1,
                    "function": {"method": "custom", "customId": "byCostCenter"}}}]}
                """);

        assertThatThrownBy(() -> GroupingReportMain.run(fixture("employees.json"), config, "tree"))
                .isInstanceOf(UnknownGroupFunctionException.class)
                .hasMessageContaining("byCostCenter");
    }

    private static Path fixture(String name) throws URISyntaxException, IOException {
        var url = GroupingReportMainTest.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IOException("Missing test fixture " + name);
        }
        return Path.of(url.toURI());
    }
}
