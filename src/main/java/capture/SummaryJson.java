package capture;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON text of manifest and sidecar summaries. Object properties are written in sorted order so
 * the same summary always renders the same text. Writing the text anywhere is the caller's job.
 */
public final class SummaryJson
{
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private SummaryJson()
    {
        throw new UnsupportedOperationException("This is a utility class");
    }

    public static String toJson(Object summary)
    {
        try
        {
            return MAPPER.writeValueAsString(summary);
        }
        catch (JsonProcessingException e)
        {
            throw new UncheckedIOException("summary not serializable " + summary.getClass().getSimpleName(), e);
        }
    }

    public static JsonNode readTree(String json)
    {
        try
        {
            return MAPPER.readTree(json);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("summary JSON not readable", e);
        }
    }
}
