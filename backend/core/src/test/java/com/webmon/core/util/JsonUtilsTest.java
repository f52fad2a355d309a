package com.webmon.core.util;

import com.fasterxml.jackson.databind.MappingIterator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonUtilsTest {
    @Test
    void csvRowsKeepQuotedCommasAndSkipEmptyLines() throws Exception {
        String csv = "host,interval,pattern\n\nfoo.com,5,\"a,b\"\nbar.io,10\n";
        List<String[]> rows = new ArrayList<>();
        try (MappingIterator<String[]> iterator = JsonUtils.csvRowReader().readValues(csv)) {
            while (iterator.hasNextValue()) {
                rows.add(iterator.nextValue());
            }
        }

        assertEquals(3, rows.size());
        assertArrayEquals(new String[]{"foo.com", "5", "a,b"}, rows.get(1));
        assertArrayEquals(new String[]{"bar.io", "10"}, rows.get(2));
    }

    @Test
    void mapperIgnoresUnknownProperties() throws Exception {
        Sample sample = JsonUtils.objectMapper().readValue("{\"name\":\"x\",\"extra\":1}", Sample.class);
        assertEquals("x", sample.name());
    }

    record Sample(String name) {
    }
}
