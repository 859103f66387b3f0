package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.model.DimensionFilter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DimensionPairParserTest {

    @Test
    void parsesPipeSeparatedValueIds() {
        List<DimensionFilter> filters = DimensionPairParser.parse(List.of("3:10|11", "4:20"));
        assertEquals(2, filters.size());
        assertEquals(3L, filters.get(0).dimensionId());
        assertEquals(List.of(10L, 11L), filters.get(0).valueIds());
        assertEquals(List.of(20L), filters.get(1).valueIds());
        assertFalse(filters.get(0).isKeyForm());
    }

    @Test
    void repeatedDimensionIsMerged() {
        List<DimensionFilter> filters = DimensionPairParser.parse(List.of("3:10", "3:12"));
        assertEquals(1, filters.size());
        assertEquals(List.of(10L, 12L), filters.get(0).valueIds());
    }

    @Test
    void emptyInputMeansNoFilters() {
        assertTrue(DimensionPairParser.parse(null).isEmpty());
        assertTrue(DimensionPairParser.parse(List.of()).isEmpty());
    }

    @Test
    void rejectsMalformedPairs() {
        assertThrows(InvalidRequestException.class, () -> DimensionPairParser.parse(List.of("region:us")));
        assertThrows(InvalidRequestException.class, () -> DimensionPairParser.parse(List.of("3")));
        assertThrows(InvalidRequestException.class, () -> DimensionPairParser.parse(List.of("3:")));
        assertThrows(InvalidRequestException.class, () -> DimensionPairParser.parse(List.of("3:x|1")));
    }
}
