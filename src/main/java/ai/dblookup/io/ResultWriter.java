package ai.dblookup.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.dblookup.model.Lookup;
import ai.dblookup.model.TableSchema;

/**
 * Renders lookup outcomes as JSON tool responses.
 */
public final class ResultWriter {

    public static final String STATUS_FOUND = "found";
    public static final String STATUS_NOT_FOUND = "not_found";

    private final ObjectMapper jsonMapper;

    public ResultWriter() {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public void write(Lookup<?> lookup, Writer out) throws IOException {
        Objects.requireNonNull(lookup, "lookup");
        Objects.requireNonNull(out, "out");
        jsonMapper.writeValue(out, toResponse(lookup));
    }

    /**
     * An absent line lookup carries no message of its own.
     */
    public void write(Optional<?> result, String notFoundMessage, Writer out) throws IOException {
        Objects.requireNonNull(result, "result");
        write(result.<Lookup<?>>map(Lookup::found).orElseGet(() -> Lookup.notFound(notFoundMessage)), out);
    }

    public void writeDatabases(Path root, List<DatabaseEntry> databases, Writer out) throws IOException {
        jsonMapper.writeValue(out, new DatabaseIndex(root.toString(), databases));
    }

    public String toJson(Lookup<?> lookup) throws IOException {
        return jsonMapper.writeValueAsString(toResponse(lookup));
    }

    private static Response toResponse(Lookup<?> lookup) {
        if (lookup instanceof Lookup.Found<?> found) {
            return new Response(STATUS_FOUND, found.value(), null);
        }
        return new Response(STATUS_NOT_FOUND, null, ((Lookup.NotFound<?>) lookup).message());
    }

    // --- response records ---

    public record Response(
            String status,
            Object result,
            String message
    ) {
    }

    public record DatabaseIndex(
            String root,
            List<DatabaseEntry> databases
    ) {
    }

    public record DatabaseEntry(
            String id,
            String path,
            Set<TableSchema> tables,
            boolean sourceArchive
    ) {
    }
}
