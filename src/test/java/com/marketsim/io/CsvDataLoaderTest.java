package com.marketsim.io;

import com.marketsim.error.ValidationException;
import com.marketsim.geo.GeoPoint;
import com.marketsim.model.LocationMarket;
import com.marketsim.model.Provider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvDataLoaderTest {

    @TempDir
    Path dataDir;

    private void write(String file, String content) throws IOException {
        Files.writeString(dataDir.resolve(file), content);
    }

    @Test
    void loadsMarketCellsWithOptionalArea() throws IOException {
        write("geo_mapping.csv", """
            postal_code,market,latitude,longitude,str_tam,area
            10001,NYC,40.7506,-73.9972,120,
            10002,NYC,40.7157,-73.9863,80,2.5
            94103,SF,37.7725,-122.4147,60,
            """);

        var market = new CsvDataLoader(dataDir).loadPostalCodeMarket("NYC");

        assertEquals("NYC", market.marketId());
        assertEquals(2, market.cells().size());
        assertNull(market.cells().get(0).areaKm2());
        assertEquals(2.5, market.cells().get(1).areaKm2());
        assertEquals(200, market.totalDemandWeight().getAsDouble(), 1e-9);
    }

    @Test
    void unknownMarketIsRejected() throws IOException {
        write("geo_mapping.csv", """
            postal_code,market,latitude,longitude,str_tam
            10001,NYC,40.7506,-73.9972,120
            """);
        var e = assertThrows(ValidationException.class,
            () -> new CsvDataLoader(dataDir).loadPostalCodeMarket("LA"));
        assertTrue(e.getMessage().contains("LA"));
        assertTrue(e.getMessage().contains("NYC"));
    }

    @Test
    void loadsCleanersWithLenientBooleansAndDefaults() throws IOException {
        write("cleaners.csv", """
            contractor_id,latitude,longitude,postal_code,bidding_active,assignment_active,cleaner_score,service_radius,team_size,active_connections
            C-1,40.75,-73.99,10001,True,False,0.9,12.5,3,4
            C-2,40.76,-73.98,10001,0,,,,,
            C-3,40.70,-73.95,,yes,1,0.2,5,1,0
            """);

        var providers = new CsvDataLoader(dataDir).loadProviders();
        assertEquals(3, providers.size());

        var first = providers.get(0);
        assertTrue(first.biddingActive());
        assertFalse(first.assignmentActive());
        assertEquals(0.9, first.score());
        assertEquals(12.5, first.serviceRadiusKm());
        assertEquals(3, first.teamSize());
        assertEquals(4, first.activeConnections());

        var second = providers.get(1);
        assertFalse(second.biddingActive());
        assertFalse(second.assignmentActive(), "assignment follows bidding when absent");
        assertEquals(0.5, second.score());
        assertEquals(10.0, second.serviceRadiusKm());

        assertNull(providers.get(2).postalCode());
        assertTrue(providers.get(2).biddingActive());
    }

    @Test
    void legacyActiveColumnDrivesBidding() throws IOException {
        write("cleaners.csv", """
            contractor_id,postal_code,latitude,longitude,active,cleaner_score,service_radius,active_connections,active_connection_ratio,team_size
            C-1,10001,40.75,-73.99,False,0.8,10,1,0.1,1
            """);
        var provider = new CsvDataLoader(dataDir).loadProviders().get(0);
        assertFalse(provider.biddingActive());
    }

    @Test
    void badValueNamesFileAndLine() throws IOException {
        write("cleaners.csv", """
            contractor_id,latitude,longitude,cleaner_score
            C-1,40.75,-73.99,0.5
            C-2,40.75,-73.99,1.7
            """);
        var e = assertThrows(ValidationException.class, () -> new CsvDataLoader(dataDir).loadProviders());
        assertTrue(e.getMessage().startsWith("cleaners.csv line 3"), e.getMessage());
    }

    @Test
    void nonNumericValueIsReported() throws IOException {
        write("geo_mapping.csv", """
            postal_code,market,latitude,longitude,str_tam
            10001,NYC,north,-73.9972,120
            """);
        var e = assertThrows(ValidationException.class, () -> new CsvDataLoader(dataDir).loadPostalCells());
        assertTrue(e.getMessage().contains("geo_mapping.csv line 2"), e.getMessage());
        assertTrue(e.getMessage().contains("latitude"), e.getMessage());
    }

    @Test
    void missingFileIsAValidationError() {
        assertThrows(ValidationException.class, () -> new CsvDataLoader(dataDir).loadProviders());
    }

    @Test
    void providersAreScopedToTheMarket() throws IOException {
        write("geo_mapping.csv", """
            postal_code,market,latitude,longitude,str_tam
            10001,NYC,40.7506,-73.9972,120
            90012,LA,34.0614,-118.2385,90
            """);
        write("cleaners.csv", """
            contractor_id,latitude,longitude,postal_code
            NY-1,40.7500,-73.9950,10001
            LA-1,34.0600,-118.2400,90012
            NY-2,40.7510,-73.9960,
            """);
        var loader = new CsvDataLoader(dataDir);

        var nyc = loader.loadProviders(loader.loadPostalCodeMarket("NYC"));
        assertEquals(List.of("NY-1", "NY-2"), nyc.stream().map(Provider::id).toList());

        var downtownLa = new LocationMarket("dtla", GeoPoint.of(34.05, -118.25), 5);
        assertEquals(List.of("LA-1"), loader.loadProviders(downtownLa).stream().map(Provider::id).toList());
    }
}
