package com.example.grouping.json;

import com.example.grouping.model.DataRecord;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams records out of a JSON document with Jackson's streaming API.
 *
 * <p>Accepts either a bare array or an object holding the array in a named
 * field ({@code "data"} by default). Records are read one at a time as the
 * returned stream is consumed.
 *
 * <pre>{@code
 * {
 *   "data": [
 *     {"region": "North", "amount": 10},
 *     {"region": "South", "amount": 5}
 *   ]
 * }
 * }</pre>
 */
public class RecordJsonParser {

    public static final String DEFAULT_ARRAY_FIELD = "data";

    private final ObjectMapper objectMapper;
    private final String arrayFieldName;

    public RecordJsonParser() {
        this(JsonSupport.objectMapper(), DEFAULT_ARRAY_FIELD);
    }

    /**
     * @param objectMapper   mapper used for each record
     * @param arrayFieldName name of the field holding the record array
     */
    public RecordJsonParser(ObjectMapper objectMapper, String arrayFieldName) {
        this.objectMapper = objectMapper;
        this.arrayFieldName = arrayFieldName;
    }

    /**
     * Returns a lazy stream of records. Closing the stream closes the parser;
     * the caller still owns the input stream.
     *
     * @throws IOException if the document cannot be read up to the array
     */
    public Stream<DataRecord> parseRecords(InputStream inputStream) throws IOException {
        JsonParser parser = objectMapper.getFactory().createParser(inputStream);

        if (!navigateToArray(parser)) {
            parser.close();
            return Stream.empty();
        }

        Spliterator<DataRecord> spliterator = new RecordSpliterator(parser, objectMapper);
        return StreamSupport.stream(spliterator, false)
                .onClose(() -> close(parser));
    }

    /**
     * Reads every record into memory.
     */
    public List<DataRecord> readAll(InputStream inputStream) throws IOException {
        try (Stream<DataRecord> records = parseRecords(inputStream)) {
            return records.collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private boolean navigateToArray(JsonParser parser) throws IOException {
        JsonToken first = parser.nextToken();
        if (first == JsonToken.START_ARRAY) {
            return true;
        }
        if (first != JsonToken.START_OBJECT) {
            return false;
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.currentName();
            JsonToken value = parser.nextToken();
            if (arrayFieldName.equals(name) && value == JsonToken.START_ARRAY) {
                return true;
            }
            parser.skipChildren();
        }
        return false;
    }

    private static void close(JsonParser parser) {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close JSON parser", e);
        }
    }

    /**
     * Reads one array element per advance.
     */
    private static class RecordSpliterator extends Spliterators.AbstractSpliterator<DataRecord> {

        private final JsonParser parser;
        private final ObjectMapper objectMapper;
        private boolean finished = false;

        RecordSpliterator(JsonParser parser, ObjectMapper objectMapper) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.parser = parser;
            this.objectMapper = objectMapper;
        }

        @Override
        public boolean tryAdvance(Consumer<? super DataRecord> action) {
            if (finished) {
                return false;
            }

            try {
                JsonToken token = parser.nextToken();

                if (token == null || token == JsonToken.END_ARRAY) {
                    finished = true;
                    return false;
                }

                action.accept(objectMapper.readValue(parser, DataRecord.class));
                return true;
            } catch (IOException e) {
                finished = true;
                throw new UncheckedIOException("Failed to parse record", e);
            }
        }
    }
}
