package com.streetsweeping.engine.service;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DelimitedRecordReaderTest {

    private static List<List<String>> read(char delimiter, String text) throws Exception {
        return new DelimitedRecordReader(delimiter).readAll(new StringReader(text));
    }

    @Test
    void splitsRecordsAndFields() throws Exception {
        List<List<String>> records = read(',', "a,b,c\n1,2,3\r\n4,,6\n");

        assertEquals(List.of(
            List.of("a", "b", "c"),
            List.of("1", "2", "3"),
            List.of("4", "", "6")), records);
    }

    @Test
    void keepsDelimitersAndLineBreaksInsideQuotes() throws Exception {
        List<List<String>> records = read(',', "id,name\n1,\"Grove St, Hayes St\"\n2,\"two\nlines\"\n");

        assertEquals(List.of("1", "Grove St, Hayes St"), records.get(1));
        assertEquals(List.of("2", "two\nlines"), records.get(2));
    }

    @Test
    void unescapesDoubledQuotes() throws Exception {
        List<List<String>> records = read(',', "\"say \"\"hi\"\"\",x\n");

        assertEquals(List.of("say \"hi\"", "x"), records.get(0));
    }

    @Test
    void keepsDelimitersInsideBracketsAndBraces() throws Exception {
        List<List<String>> records = read(',', "1,{'coordinates': [[-122.1, 37.1], [-122.2, 37.2]]},end\n");

        assertEquals(3, records.get(0).size());
        assertEquals("{'coordinates': [[-122.1, 37.1], [-122.2, 37.2]]}", records.get(0).get(1));
    }

    @Test
    void unclosedBracketEndsAtLineBreak() throws Exception {
        List<List<String>> records = read(',', "1,[[-122.1, 37.1\n2,[[-122.2, 37.2]]\n");

        assertEquals(List.of(
            List.of("1", "[[-122.1, 37.1"),
            List.of("2", "[[-122.2, 37.2]]")), records);
    }

    @Test
    void supportsOtherDelimitersAndSkipsBlankLines() throws Exception {
        List<List<String>> records = read(';', "a;b\n\n1;2");

        assertEquals(List.of(List.of("a", "b"), List.of("1", "2")), records);
    }
}
