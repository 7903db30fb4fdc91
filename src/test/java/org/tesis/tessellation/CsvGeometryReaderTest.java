package org.tesis.tessellation;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.tesis.tessellation.TestGeometries.GF;

public class CsvGeometryReaderTest {

    private static final String CSV =
            "entity_type,entity_id,ring,point_idx,x,y,kvart\n"
            + "region,r1,0,0,0,0,\n"
            + "region,r1,0,1,10,0,\n"
            + "region,r1,0,2,10,10,\n"
            + "region,r1,0,3,0,10,\n"
            + "region,r1,1,0,4,4,\n"
            + "region,r1,1,1,6,4,\n"
            + "region,r1,1,2,6,6,\n"
            + "region,r1,1,3,4,6,\n"
            + "\n"
            + "SPLIT,s1,0,2,5,10,a\n"
            + "SPLIT,s1,0,0,0,0,a\n"
            + "SPLIT,s1,0,1,5,0,a\n"
            + "SPLIT,s1,0,3,0,10,a\n"
            + "REMOVE_AFTER,x,0,0,0,0,\n"
            + "REMOVE_AFTER,x,0,1,1,0,\n"
            + "REMOVE_AFTER,x,0,2,1,1,\n";

    private static List<VertexRow> rows() throws Exception {
        return CsvGeometryReader.readCsv(new BufferedReader(new StringReader(CSV)), "test");
    }

    @Test
    public void testReadRows() throws Exception {
        List<VertexRow> rows = rows();
        assertEquals(15, rows.size());
        assertEquals("REGION", rows.get(0).entityType);
        assertTrue(rows.get(0).attributes.isEmpty());
        assertEquals("a", rows.get(8).attributes.get("kvart"));
    }

    @Test
    public void testBuildInput() throws Exception {
        GeometryInput in = GeomUtils.buildInput(rows(), GF);
        assertEquals(96, in.region.getArea(), 1e-9); // con hueco
        assertEquals(1, in.splits.size());
        SplitPolygon s = in.splits.get(0);
        assertEquals("s1", s.id);
        assertEquals("a", s.attributes.get("kvart"));
        assertEquals(50, s.poly.getArea(), 1e-9); // vértices reordenados por point_idx
        assertNull(in.removeBefore);
        assertEquals(0.5, in.removeAfter.getArea(), 1e-9);
    }

    @Test
    public void testMissingRegion() throws Exception {
        String csv = "entity_type,entity_id,ring,point_idx,x,y\nSPLIT,s,0,0,0,0\nSPLIT,s,0,1,1,0\nSPLIT,s,0,2,1,1\n";
        List<VertexRow> rows = CsvGeometryReader.readCsv(new BufferedReader(new StringReader(csv)), "test");
        assertThrows(IllegalStateException.class, () -> GeomUtils.buildInput(rows, GF));
    }

    @Test
    public void testMissingColumn() {
        String csv = "entity_type,entity_id,x,y\nREGION,r,0,0\n";
        assertThrows(IllegalArgumentException.class,
                () -> CsvGeometryReader.readCsv(new BufferedReader(new StringReader(csv)), "test"));
    }
}
