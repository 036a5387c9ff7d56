package io.github.cyfko.partialresponse.jackson;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.filter.FilteringGeneratorDelegate;
import com.fasterxml.jackson.core.filter.TokenFilter;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.partialresponse.core.model.FieldsResolution;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;

/**
 * Serializes values with Jackson, keeping only the selected fields.
 *
 * <p>
 * Filtering happens while streaming: the value is serialized by the configured {@link ObjectMapper} through a
 * {@link FilteringGeneratorDelegate} holding a {@link SelectionTokenFilter}, so excluded subtrees are skipped
 * without building an intermediate tree. Every serializer, module and feature of the mapper applies as usual.
 * </p>
 *
 * <pre>{@code
 * PartialJsonWriter writer = new PartialJsonWriter(objectMapper);
 * FieldsResolution fields = partialResponse.resolve(request.getParameter("fields"));
 * String json = writer.writeValueAsString(body, fields);
 * }</pre>
 *
 * <p>Thread-safe as long as the underlying mapper is not reconfigured.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PartialJsonWriter {

    private final ObjectMapper mapper;

    public PartialJsonWriter() {
        this(new ObjectMapper());
    }

    public PartialJsonWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String writeValueAsString(Object value, Selection selection, boolean ignoreCase) throws JsonProcessingException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = mapper.createGenerator(out)) {
            writeValue(generator, value, selection, ignoreCase);
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw JsonMappingException.fromUnexpectedIOE(e);
        }
        return out.toString();
    }

    /**
     * @param value  the value to serialize
     * @param fields the resolved fields of the request
     * @return the JSON text, complete unless the resolution is filtering
     * @throws IllegalStateException   if the request was rejected
     * @throws JsonProcessingException if serialization fails
     */
    public String writeValueAsString(Object value, FieldsResolution fields) throws JsonProcessingException {
        Objects.requireNonNull(fields, "fields");
        if (fields.isRejected()) {
            throw new IllegalStateException("Rejected request must not be serialized");
        }
        return writeValueAsString(value, fields.selection().orElse(Selection.empty()), fields.ignoreCase());
    }

    /**
     * Writes to a character stream. The writer is closed according to the mapper's
     * {@link JsonGenerator.Feature#AUTO_CLOSE_TARGET} setting.
     */
    public void writeValue(Writer writer, Object value, Selection selection, boolean ignoreCase) throws IOException {
        try (JsonGenerator generator = mapper.createGenerator(writer)) {
            writeValue(generator, value, selection, ignoreCase);
        }
    }

    /**
     * Writes UTF-8 JSON to a byte stream. The stream is closed according to the mapper's
     * {@link JsonGenerator.Feature#AUTO_CLOSE_TARGET} setting.
     */
    public void writeValue(OutputStream out, Object value, Selection selection, boolean ignoreCase) throws IOException {
        try (JsonGenerator generator = mapper.createGenerator(out, JsonEncoding.UTF8)) {
            writeValue(generator, value, selection, ignoreCase);
        }
    }

    /**
     * Writes through a caller-owned generator, which is flushed but not closed.
     *
     * @param generator  the target generator
     * @param value      the value to serialize
     * @param selection  the selection to apply; the empty selection writes everything
     * @param ignoreCase whether names are compared case-insensitively
     * @throws IOException if serialization or the underlying output fails
     */
    public void writeValue(JsonGenerator generator, Object value, Selection selection, boolean ignoreCase) throws IOException {
        Objects.requireNonNull(generator, "generator");
        TokenFilter filter = SelectionTokenFilter.of(selection, ignoreCase);
        if (filter == TokenFilter.INCLUDE_ALL) {
            mapper.writeValue(generator, value);
            return;
        }

        FilteringGeneratorDelegate filtering = new FilteringGeneratorDelegate(
                generator, filter, TokenFilter.Inclusion.INCLUDE_ALL_AND_PATH, true);
        mapper.writeValue(filtering, value);
        filtering.flush();
    }
}
