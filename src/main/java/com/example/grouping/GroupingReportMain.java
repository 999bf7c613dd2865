package com.example.grouping;

import com.example.grouping.error.GroupingValidationException;
import com.example.grouping.json.GroupingConfigReader;
import com.example.grouping.json.RecordJsonParser;
import com.example.grouping.model.DataRecord;
import com.example.grouping.pivot.PivotConfig;
import com.example.grouping.pivot.PivotTable;
import com.example.grouping.report.GroupTreeReport;
import com.example.grouping.resolver.GroupingConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Prints a grouped report or a pivot table for a JSON record file.
 *
 * <p>Usage:
 * <pre>
 * java -cp ... com.example.grouping.GroupingReportMain \
 *     --records=sales.json \
 *     --config=grouping.json \
 *     [--mode=tree|pivot]
 * </pre>
 *
 * <p>The records file holds {@code {"data": [...]}} or a bare array. In
 * {@code tree} mode (default) the config is a grouping configuration
 * ({@code {"columns": [...]}}); in {@code pivot} mode it is a pivot configuration.
 */
public class GroupingReportMain {

    public static void main(String[] args) {
        String records = parseStringArg(args, "records", null);
        String config = parseStringArg(args, "config", null);
        String mode = parseStringArg(args, "mode", "tree");

        if (records == null || config == null) {
            System.err.println("Error: --records and --config parameters are required");
            System.err.println("Usage: java ... GroupingReportMain --records=<file> --config=<file> [--mode=tree|pivot]");
            System.exit(1);
        }

        try {
            System.out.print(run(Path.of(records), Path.of(config), mode));
        } catch (GroupingValidationException e) {
            System.err.println("Invalid configuration [" + e.getCode() + "]: " + e.getMessage());
            System.exit(2);
        } catch (IOException | RuntimeException e) {
            System.err.println("Error producing report: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    static String run(Path recordsFile, Path configFile, String mode) throws IOException {
        List<DataRecord> records;
        try (InputStream in = Files.newInputStream(recordsFile)) {
            records = new RecordJsonParser().readAll(in);
        }

        GroupingConfigReader reader = new GroupingConfigReader();
        GroupingEngine engine = new GroupingEngine();
        GroupTreeReport report = new GroupTreeReport();

        return switch (mode.toLowerCase(Locale.ROOT)) {
            case "tree" -> {
                GroupingConfig grouping = reader.readGroupingConfig(configFile);
                yield report.render(engine.process(records, grouping));
            }
            case "pivot" -> {
                PivotConfig pivot = reader.readPivotConfig(configFile);
                PivotTable table = engine.pivot(records, pivot);
                yield report.render(table, pivot.measures());
            }
            default -> throw new IllegalArgumentException("Unknown mode: " + mode + ". Valid values: tree, pivot");
        };
    }

    private static String parseStringArg(String[] args, String name, String defaultValue) {
        String prefix = "--" + name + "=";
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                return arg.substring(prefix.length());
            }
        }
        return defaultValue;
    }
}
