package edu.stanford.futuredata.tsquery.utilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.ByteString;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;

public class Utilities {
    private static final Logger logger = LoggerFactory.getLogger(Utilities.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static Pair<String, Integer> parseConnectString(String connectString) {
        int split = connectString.lastIndexOf(':');
        if (split <= 0 || split == connectString.length() - 1) {
            throw new IllegalArgumentException("Malformed connect string: " + connectString);
        }
        String host = connectString.substring(0, split);
        Integer port = Integer.parseInt(connectString.substring(split + 1));
        return new Pair<>(host, port);
    }

    public static ByteString objectToByteString(Serializable obj) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bos)) {
            out.writeObject(obj);
            out.flush();
        } catch (IOException e) {
            logger.error("Serialization Failed {} {}", obj, e.getMessage());
            throw new UncheckedIOException(e);
        }
        return ByteString.copyFrom(bos.toByteArray());
    }

    /** Decodes a payload written by objectToByteString; malformed input is a protocol error. */
    public static <T> T byteStringToObject(ByteString b, Class<T> type) throws QueryException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(b.toByteArray()))) {
            Object obj = in.readObject();
            if (!type.isInstance(obj)) {
                throw QueryException.malformedRequest("expected " + type.getSimpleName() + " but got "
                        + (obj == null ? "null" : obj.getClass().getSimpleName()));
            }
            return type.cast(obj);
        } catch (IOException | ClassNotFoundException e) {
            logger.error("Deserialization Failed {}", e.getMessage());
            throw QueryException.malformedRequest(e.getMessage());
        }
    }

    public static String toJSON(Object obj) {
        try {
            return mapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encoding failed: " + e.getMessage(), e);
        }
    }

    public static <T> T fromJSON(String json, TypeReference<T> type) throws IOException {
        return mapper.readValue(json, type);
    }

    public static <T> T fromJSON(byte[] json, TypeReference<T> type) throws IOException {
        return mapper.readValue(json, type);
    }
}
