package com.marketsim.model;

import com.marketsim.error.ValidationException;
import com.marketsim.geo.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderTest {

    @Test
    void builder_appliesDefaults() {
        var provider = Provider.builder("C-1").location(40.75, -73.99).build();
        assertEquals(10.0, provider.serviceRadiusKm());
        assertTrue(provider.biddingActive());
        assertEquals(0.5, provider.score());
        assertEquals(1, provider.teamSize());
        assertEquals(0, provider.activeConnections());
    }

    @Test
    void reaches_usesOwnServiceRadius() {
        var provider = Provider.builder("C-1").location(40.75, -73.99).serviceRadiusKm(1.0).build();
        assertTrue(provider.reaches(GeoPoint.of(40.755, -73.99)));
        assertFalse(provider.reaches(GeoPoint.of(40.80, -73.99)));
    }

    @Test
    void rejectsInvalidFields() {
        var base = Provider.builder("C-1").location(40.75, -73.99);
        assertThrows(ValidationException.class, () -> base.serviceRadiusKm(0).build());
        assertThrows(ValidationException.class,
            () -> Provider.builder("C-1").location(40.75, -73.99).score(1.2).build());
        assertThrows(ValidationException.class,
            () -> Provider.builder("C-1").location(40.75, -73.99).teamSize(0).build());
        assertThrows(ValidationException.class,
            () -> Provider.builder("C-1").location(40.75, -73.99).activeConnections(-1).build());
        assertThrows(ValidationException.class, () -> Provider.builder(" ").location(40.75, -73.99).build());
        assertThrows(ValidationException.class, () -> Provider.builder("C-1").build());
    }
}
