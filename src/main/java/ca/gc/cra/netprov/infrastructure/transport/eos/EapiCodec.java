package ca.gc.cra.netprov.infrastructure.transport.eos;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes eAPI {@code runCmds} requests and parses replies into {@link Map}/{@link List} graphs using the
 * Jackson streaming API.
 *
 * @since 0.1.0
 */
final class EapiCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Builds a JSON-RPC 2.0 {@code runCmds} request.
   *
   * @param id request id echoed by the device
   * @param commands CLI commands executed in order
   * @param format {@code json} or {@code text}
   * @return request body
   */
  String runCmds(String id, List<String> commands, String format) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField("jsonrpc", "2.0");
      generator.writeStringField("method", "runCmds");
      generator.writeObjectFieldStart("params");
      generator.writeNumberField("version", 1);
      generator.writeArrayFieldStart("cmds");
      for (String command : commands) {
        generator.writeString(command);
      }
      generator.writeEndArray();
      generator.writeStringField("format", format);
      generator.writeEndObject();
      generator.writeStringField("id", id);
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to encode eAPI request", ex);
    }
    return out.toString();
  }

  /**
   * Parses a JSON document into maps, lists and scalars.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON document");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String field = parser.getCurrentName();
      map.put(field, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
