package com.streetsweeping.engine.service;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits delimited text into records and fields.
 *
 * Rules:
 * - fields may be wrapped in double quotes; {@code ""} inside quotes is a literal quote
 * - a delimiter inside quotes, or nested inside {@code {...}} / {@code [...]}, is part of the field
 * - a line break inside quotes is part of the field; outside quotes it ends the record,
 *   even inside an unclosed bracket or brace, so a truncated value spoils one record only
 * - {@code \r\n} and {@code \n} are both accepted as record terminators
 *
 * Blank lines are skipped. Field values are returned without surrounding quotes but
 * otherwise untrimmed.
 */
public class DelimitedRecordReader {

    private final char delimiter;

    public DelimitedRecordReader(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Unsupported delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    public List<List<String>> readAll(Reader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldStarted = false;
        int depth = 0;

        int c = reader.read();
        while (c != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == '"') {
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                        c = reader.read();
                        continue;
                    }
                    inQuotes = false;
                    c = next;
                    continue;
                }
                field.append(ch);
            } else if (ch == '"' && depth == 0) {
                inQuotes = true;
                fieldStarted = true;
            } else if (ch == '{' || ch == '[') {
                depth++;
                field.append(ch);
                fieldStarted = true;
            } else if ((ch == '}' || ch == ']') && depth > 0) {
                depth--;
                field.append(ch);
            } else if (ch == delimiter && depth == 0) {
                current.add(field.toString());
                field.setLength(0);
                fieldStarted = true;
            } else if (ch == '\n' || ch == '\r') {
                if (fieldStarted || field.length() > 0) {
                    current.add(field.toString());
                    records.add(current);
                }
                current = new ArrayList<>();
                field.setLength(0);
                fieldStarted = false;
                depth = 0;
            } else {
                field.append(ch);
                fieldStarted = true;
            }
            c = reader.read();
        }

        if (fieldStarted || field.length() > 0) {
            current.add(field.toString());
            records.add(current);
        }
        return records;
    }
}
