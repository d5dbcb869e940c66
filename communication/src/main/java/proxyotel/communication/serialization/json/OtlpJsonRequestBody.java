package proxyotel.communication.serialization.json;

import com.squareup.moshi.JsonWriter;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.Buffer;
import okio.BufferedSink;

/**
 * {@code ExportTraceServiceRequest} in the OTLP/JSON encoding.
 *
 * <p>Spans are grouped by resource, then by instrumentation scope. Trace and span ids are
 * lowercase hex, enums are written as their integer values and 64 bit integers as decimal
 * strings.
 */
public final class OtlpJsonRequestBody extends RequestBody {

  public static class SerializationException extends RuntimeException {
    public SerializationException(Throwable cause) {
      super("Failed serializing OTLP/JSON trace export request", cause);
    }
  }

  static final MediaType JSON = MediaType.get("application/json");

  private final Buffer body;

  private OtlpJsonRequestBody(Buffer body) {
    this.body = body;
  }

  /**
   * Serializes the spans up front, so the body can be written more than once when a call is
   * retried by the client.
   */
  public static OtlpJsonRequestBody of(Collection<SpanData> spans) {
    Buffer body = new Buffer();
    try (JsonWriter writer = JsonWriter.of(body)) {
      writeRequest(writer, spans);
    } catch (IOException e) {
      throw new SerializationException(e);
    }
    return new OtlpJsonRequestBody(body);
  }

  @Override
  public MediaType contentType() {
    return JSON;
  }

  @Override
  public long contentLength() {
    return body.size();
  }

  @Override
  public void writeTo(BufferedSink sink) throws IOException {
    sink.write(body.snapshot());
  }

  /** Serialized payload, for diagnostics. */
  public String utf8() {
    return body.clone().readUtf8();
  }

  private static void writeRequest(JsonWriter writer, Collection<SpanData> spans)
      throws IOException {
    Map<Resource, Map<InstrumentationScopeInfo, List<SpanData>>> grouped = new LinkedHashMap<>();
    for (SpanData span : spans) {
      grouped
          .computeIfAbsent(span.getResource(), r -> new LinkedHashMap<>())
          .computeIfAbsent(span.getInstrumentationScopeInfo(), s -> new ArrayList<>())
          .add(span);
    }

    writer.beginObject();
    writer.name("resourceSpans");
    writer.beginArray();
    for (Map.Entry<Resource, Map<InstrumentationScopeInfo, List<SpanData>>> resourceSpans :
        grouped.entrySet()) {
      Resource resource = resourceSpans.getKey();
      writer.beginObject();
      writer.name("resource");
      writer.beginObject();
      writeAttributes(writer, resource.getAttributes());
      writer.endObject();
      if (resource.getSchemaUrl() != null) {
        writer.name("schemaUrl").value(resource.getSchemaUrl());
      }
      writer.name("scopeSpans");
      writer.beginArray();
      for (Map.Entry<InstrumentationScopeInfo, List<SpanData>> scopeSpans :
          resourceSpans.getValue().entrySet()) {
        writeScopeSpans(writer, scopeSpans.getKey(), scopeSpans.getValue());
      }
      writer.endArray();
      writer.endObject();
    }
    writer.endArray();
    writer.endObject();
  }

  private static void writeScopeSpans(
      JsonWriter writer, InstrumentationScopeInfo scope, List<SpanData> spans) throws IOException {
    writer.beginObject();
    writer.name("scope");
    writer.beginObject();
    writer.name("name").value(scope.getName());
    if (scope.getVersion() != null) {
      writer.name("version").value(scope.getVersion());
    }
    writeAttributes(writer, scope.getAttributes());
    writer.endObject();
    if (scope.getSchemaUrl() != null) {
      writer.name("schemaUrl").value(scope.getSchemaUrl());
    }
    writer.name("spans");
    writer.beginArray();
    for (SpanData span : spans) {
      writeSpan(writer, span);
    }
    writer.endArray();
    writer.endObject();
  }

  private static void writeSpan(JsonWriter writer, SpanData span) throws IOException {
    writer.beginObject();
    writer.name("traceId").value(span.getTraceId());
    writer.name("spanId").value(span.getSpanId());
    String traceState = encodeTraceState(span.getSpanContext().getTraceState());
    if (!traceState.isEmpty()) {
      writer.name("traceState").value(traceState);
    }
    if (span.getParentSpanContext().isValid()) {
      writer.name("parentSpanId").value(span.getParentSpanId());
    }
    writer.name("flags").value(span.getSpanContext().getTraceFlags().asByte() & 0xff);
    writer.name("name").value(span.getName());
    writer.name("kind").value(spanKind(span.getKind()));
    writer.name("startTimeUnixNano").value(Long.toString(span.getStartEpochNanos()));
    writer.name("endTimeUnixNano").value(Long.toString(span.getEndEpochNanos()));
    writeAttributes(writer, span.getAttributes());
    writeDropped(
        writer,
        "droppedAttributesCount",
        span.getTotalAttributeCount() - span.getAttributes().size());

    writer.name("events");
    writer.beginArray();
    for (EventData event : span.getEvents()) {
      writer.beginObject();
      writer.name("timeUnixNano").value(Long.toString(event.getEpochNanos()));
      writer.name("name").value(event.getName());
      writeAttributes(writer, event.getAttributes());
      writeDropped(
          writer,
          "droppedAttributesCount",
          event.getTotalAttributeCount() - event.getAttributes().size());
      writer.endObject();
    }
    writer.endArray();
    writeDropped(
        writer, "droppedEventsCount", span.getTotalRecordedEvents() - span.getEvents().size());

    writer.name("links");
    writer.beginArray();
    for (LinkData link : span.getLinks()) {
      SpanContext linked = link.getSpanContext();
      writer.beginObject();
      writer.name("traceId").value(linked.getTraceId());
      writer.name("spanId").value(linked.getSpanId());
      String linkedState = encodeTraceState(linked.getTraceState());
      if (!linkedState.isEmpty()) {
        writer.name("traceState").value(linkedState);
      }
      writeAttributes(writer, link.getAttributes());
      writer.endObject();
    }
    writer.endArray();
    writeDropped(
        writer, "droppedLinksCount", span.getTotalRecordedLinks() - span.getLinks().size());

    StatusData status = span.getStatus();
    writer.name("status");
    writer.beginObject();
    if (!status.getDescription().isEmpty()) {
      writer.name("message").value(status.getDescription());
    }
    writer.name("code").value(statusCode(status));
    writer.endObject();
    writer.endObject();
  }

  private static void writeDropped(JsonWriter writer, String name, int dropped)
      throws IOException {
    if (dropped > 0) {
      writer.name(name).value(dropped);
    }
  }

  private static void writeAttributes(JsonWriter writer, Attributes attributes)
      throws IOException {
    writer.name("attributes");
    writer.beginArray();
    for (Map.Entry<AttributeKey<?>, Object> attribute : attributes.asMap().entrySet()) {
      writer.beginObject();
      writer.name("key").value(attribute.getKey().getKey());
      writer.name("value");
      writeAnyValue(writer, attribute.getKey(), attribute.getValue());
      writer.endObject();
    }
    writer.endArray();
  }

  private static void writeAnyValue(JsonWriter writer, AttributeKey<?> key, Object value)
      throws IOException {
    switch (key.getType()) {
      case STRING:
        writeScalar(writer, "stringValue", value);
        break;
      case BOOLEAN:
        writeScalar(writer, "boolValue", value);
        break;
      case LONG:
        writeScalar(writer, "intValue", value);
        break;
      case DOUBLE:
        writeScalar(writer, "doubleValue", value);
        break;
      case STRING_ARRAY:
        writeArray(writer, "stringValue", (List<?>) value);
        break;
      case BOOLEAN_ARRAY:
        writeArray(writer, "boolValue", (List<?>) value);
        break;
      case LONG_ARRAY:
        writeArray(writer, "intValue", (List<?>) value);
        break;
      case DOUBLE_ARRAY:
        writeArray(writer, "doubleValue", (List<?>) value);
        break;
      default:
        writeScalar(writer, "stringValue", String.valueOf(value));
    }
  }

  private static void writeArray(JsonWriter writer, String field, List<?> values)
      throws IOException {
    writer.beginObject();
    writer.name("arrayValue");
    writer.beginObject();
    writer.name("values");
    writer.beginArray();
    for (Object value : values) {
      writeScalar(writer, field, value);
    }
    writer.endArray();
    writer.endObject();
    writer.endObject();
  }

  private static void writeScalar(JsonWriter writer, String field, Object value)
      throws IOException {
    writer.beginObject();
    writer.name(field);
    if (value instanceof Boolean) {
      writer.value((Boolean) value);
    } else if (value instanceof Long) {
      writer.value(Long.toString((Long) value));
    } else if (value instanceof Double) {
      writer.value((Double) value);
    } else {
      writer.value(String.valueOf(value));
    }
    writer.endObject();
  }

  static int spanKind(SpanKind kind) {
    switch (kind) {
      case INTERNAL:
        return 1;
      case SERVER:
        return 2;
      case CLIENT:
        return 3;
      case PRODUCER:
        return 4;
      case CONSUMER:
        return 5;
      default:
        return 0;
    }
  }

  static int statusCode(StatusData status) {
    switch (status.getStatusCode()) {
      case OK:
        return 1;
      case ERROR:
        return 2;
      default:
        return 0;
    }
  }

  static String encodeTraceState(TraceState traceState) {
    if (traceState.isEmpty()) {
      return "";
    }
    StringBuilder encoded = new StringBuilder();
    traceState.forEach(
        (key, value) -> {
          if (encoded.length() > 0) {
            encoded.append(',');
          }
          encoded.append(key).append('=').append(value);
        });
    return encoded.toString();
  }
}
