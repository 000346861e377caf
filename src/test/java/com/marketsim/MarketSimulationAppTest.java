package com.marketsim;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MarketSimulationAppTest {

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return MarketSimulationApp.run(args, new PrintStream(out), new PrintStream(err));
    }

    private Path writeData() throws IOException {
        var data = Files.createDirectories(workDir.resolve("data"));
        Files.writeString(data.resolve("geo_mapping.csv"), """
            postal_code,market,latitude,longitude,str_tam
            10001,NYC,40.7506,-73.9972,120
            10002,NYC,40.7157,-73.9863,80
            """);
        Files.writeString(data.resolve("cleaners.csv"), """
            contractor_id,latitude,longitude,postal_code,bidding_active,assignment_active,cleaner_score,service_radius,team_size,active_connections
            C-1,40.7500,-73.9950,10001,true,true,0.9,10,2,1
            C-2,40.7200,-73.9900,10002,true,true,0.6,6,1,0
            """);
        return data;
    }

    @Test
    void parseArgAcceptsBothForms() {
        String[] args = {"--type", "location", "--market-id=abc"};
        assertEquals("location", MarketSimulationApp.parseArg(args, "--type", null));
        assertEquals("abc", MarketSimulationApp.parseArg(args, "--market-id", null));
        assertEquals("dflt", MarketSimulationApp.parseArg(args, "--missing", "dflt"));
    }

    @Test
    void postalCodeRunWritesResults() throws IOException {
        var data = writeData();
        var outputBase = workDir.resolve("out");

        int code = run("--type", "postal_code", "--data-dir", data.toString(), "--market-id", "NYC",
            "--search-iterations", "40", "--random-seed=5", "--output-base", outputBase.toString());

        assertEquals(MarketSimulationApp.EXIT_OK, code, err.toString());
        try (var dirs = Files.list(outputBase)) {
            var dir = dirs.findFirst().orElseThrow();
            assertTrue(dir.getFileName().toString().startsWith("postal_code_"));
            assertTrue(Files.exists(dir.resolve("summary_stats.json")));
        }
        assertTrue(out.toString().contains("connection rate"));
    }

    @Test
    void locationRunNeedsCenterAndRadius() throws IOException {
        var data = writeData();
        int code = run("--type", "location", "--data-dir", data.toString(), "--market-id", "mid");
        assertEquals(MarketSimulationApp.EXIT_USAGE, code);
        assertTrue(err.toString().contains("--center-lat"));
    }

    @Test
    void unknownTypeIsUsageError() {
        assertEquals(MarketSimulationApp.EXIT_USAGE, run("--type", "zip", "--data-dir", "x", "--market-id", "y"));
    }

    @Test
    void emptyCleanerFileFailsTheRun() throws IOException {
        var data = writeData();
        Files.writeString(data.resolve("cleaners.csv"), "contractor_id,latitude,longitude\n");
        int code = run("--type", "location", "--data-dir", data.toString(), "--market-id", "mid",
            "--center-lat", "40.75", "--center-lon", "-73.99", "--market-radius", "5",
            "--output-base", workDir.resolve("out").toString());
        assertEquals(MarketSimulationApp.EXIT_FAILED, code);
        assertTrue(err.toString().contains("No cleaners"), err.toString());
    }

    @Test
    void cleanersFromAnotherMarketDoNotSupplyThisOne() throws IOException {
        var data = writeData();
        Files.writeString(data.resolve("geo_mapping.csv"), """
            postal_code,market,latitude,longitude,str_tam
            10001,NYC,40.7506,-73.9972,120
            90012,LA,34.0614,-118.2385,90
            """);
        Files.writeString(data.resolve("cleaners.csv"), """
            contractor_id,latitude,longitude,postal_code,bidding_active,service_radius
            LA-1,34.0600,-118.2400,90012,true,10
            LA-2,34.0500,-118.2500,90012,true,10
            """);

        int code = run("--type", "postal_code", "--data-dir", data.toString(), "--market-id", "NYC",
            "--output-base", workDir.resolve("out").toString());

        assertEquals(MarketSimulationApp.EXIT_FAILED, code);
        assertTrue(err.toString().contains("No cleaners"), err.toString());
        assertFalse(Files.exists(workDir.resolve("out")));
    }
}
