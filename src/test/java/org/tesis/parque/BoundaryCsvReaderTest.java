package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.LineString;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryCsvReaderTest {

    @Test
    @DisplayName("Reads the 20 ha fixture with its highway line")
    void readsFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/sites/twenty-hectare.csv")) {
            assertNotNull(in);
            SiteInput site = BoundaryCsvReader.read(in, "twenty-hectare.csv");
            assertEquals(200_000, site.getBoundary().area(), 1e-6);
            LineString road = site.getReference().orElseThrow();
            assertEquals(2, road.getNumPoints());
            assertEquals(-20, road.getCoordinateN(0).y, 1e-9);
        }
    }

    @Test
    @DisplayName("Vertices are ordered by point index, not by line order")
    void ordersByIndex() throws IOException {
        String csv = "entity_type,entity_id,ring,point_idx,x,y\n"
                + "BOUNDARY,s,0,2,10,10\n"
                + "BOUNDARY,s,0,0,0,0\n"
                + "BOUNDARY,s,0,3,0,10\n"
                + "BOUNDARY,s,0,1,10,0\n";
        SiteInput site = BoundaryCsvReader.read(new StringReader(csv), "inline");
        assertEquals(100, site.getBoundary().area(), 1e-9);
        assertTrue(site.getReference().isEmpty());
    }

    @Test
    @DisplayName("Bad rows and missing columns are reported")
    void rejectsBadInput() {
        String badNumber = "entity_type,entity_id,ring,point_idx,x,y\nBOUNDARY,s,0,0,abc,0\n";
        assertThrows(IllegalArgumentException.class, () -> BoundaryCsvReader.read(new StringReader(badNumber), "bad"));
        String noX = "entity_type,entity_id,ring,point_idx,y\nBOUNDARY,s,0,0,0\n";
        assertThrows(IllegalArgumentException.class, () -> BoundaryCsvReader.read(new StringReader(noX), "bad"));
        String hole = "entity_type,entity_id,ring,point_idx,x,y\nBOUNDARY,s,1,0,0,0\n";
        assertThrows(IllegalArgumentException.class, () -> BoundaryCsvReader.read(new StringReader(hole), "bad"));
        assertThrows(IOException.class, () -> BoundaryCsvReader.read(new StringReader(""), "empty"));
    }
}
