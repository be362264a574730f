package io.hisondata.transport;

import io.hisondata.codec.ValueCodec;
import io.hisondata.core.HisonData;
import io.hisondata.core.HisonDataConfiguration;
import io.hisondata.core.InvalidArgumentTypeException;
import io.hisondata.storage.DataTable;
import io.hisondata.wrapper.DataWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads tables and wrappers back from the JSON their {@code getSerialized()} produces.
 * <p>
 * A wrapper payload is a JSON object. Object and array members become tables, every other
 * member is stored as a string. The {@value #WRAPPER_MARKER} member some servers add to
 * flag a wrapper response is skipped.
 * <p>
 * JSON has a single number type, so integers too large for a {@code long} are read as
 * {@link BigDecimal} and share the {@code number} kind with every other JSON number.
 * <pre>
 * TransportJson transport = new TransportJson();
 * DataWrapper response = transport.readWrapper(body);
 * DataTable users = response.getTable("users");
 * </pre>
 */
public final class TransportJson {
    private static final Logger LOG = LoggerFactory.getLogger(TransportJson.class);

    public static final String WRAPPER_MARKER = "DATAWRAPPER";

    private final HisonDataConfiguration configuration;
    private final ValueCodec codec;

    public TransportJson() {
        this(HisonData.configuration());
    }

    public TransportJson(HisonDataConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
        this.codec = configuration.valueCodec();
    }

    /**
     * Parse a JSON array of records, or a single record, into a table.
     *
     * @throws InvalidArgumentTypeException if the document is neither an array nor an object
     * @throws io.hisondata.core.ValueEncodingException if the document is malformed
     */
    public DataTable readTable(String json) {
        return toTable(read(json));
    }

    /**
     * Parse a JSON object into a wrapper.
     *
     * @throws InvalidArgumentTypeException if the document is not a JSON object
     */
    public DataWrapper readWrapper(String json) {
        Object parsed = read(json);
        if (!(parsed instanceof Map<?, ?> members)) {
            throw new InvalidArgumentTypeException("a wrapper payload must be a JSON object");
        }
        DataWrapper wrapper = new DataWrapper(codec);
        int tables = 0;
        for (Map.Entry<?, ?> member : members.entrySet()) {
            String key = String.valueOf(member.getKey());
            if (WRAPPER_MARKER.equals(key)) {
                continue;
            }
            Object value = member.getValue();
            if (value instanceof Map || value instanceof List) {
                wrapper.putTable(key, toTable(value));
                tables++;
            } else {
                wrapper.putString(key, value);
            }
        }
        LOG.debug("Decoded wrapper with {} keys ({} tables)", wrapper.size(), tables);
        return wrapper;
    }

    public String write(DataTable table) {
        if (table == null) {
            throw new InvalidArgumentTypeException("a table is required");
        }
        return table.getSerialized();
    }

    public String write(DataWrapper wrapper) {
        if (wrapper == null) {
            throw new InvalidArgumentTypeException("a wrapper is required");
        }
        return wrapper.getSerialized();
    }

    private Object read(String json) {
        return jsonNumbers(codec.readValue(json));
    }

    private static Object jsonNumbers(Object parsed) {
        if (parsed instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (parsed instanceof List<?> list) {
            List<Object> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(jsonNumbers(element));
            }
            return values;
        }
        if (parsed instanceof Map<?, ?> map) {
            Map<Object, Object> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                members.put(entry.getKey(), jsonNumbers(entry.getValue()));
            }
            return members;
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private DataTable toTable(Object parsed) {
        if (parsed instanceof List<?> rows) {
            return new DataTable(rows, configuration);
        }
        if (parsed instanceof Map<?, ?> row) {
            return new DataTable((Map<String, ?>) row, configuration);
        }
        throw new InvalidArgumentTypeException("a table payload must be a JSON array or object, got: "
                + (parsed == null ? "null" : parsed.getClass().getSimpleName()));
    }
}
