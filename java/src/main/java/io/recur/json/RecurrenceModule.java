package io.recur.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.recur.model.DayDelta;
import io.recur.model.Duration;
import io.recur.model.MonthDelta;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepDelta;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson module for the persisted form of dates and repetitions.
 *
 * <p>Sum types are written externally tagged, a single-field object named after the variant:
 *
 * <pre>{@code
 * {"delta": {"Month": {"OnWeek": {"nth": 1, "weekid": 1, "day": "Tuesday"}}},
 *  "end": {"Date": {"year": 2021, "month": 6, "day": 30}}}
 * }</pre>
 *
 * <p>Unit variants are bare strings ({@code "Never"}, {@code "Monday"}) and single-value
 * variants hold the value directly ({@code {"Count": 5}}, {@code {"Week": 2}}). Every delta is
 * written in its tagged {@link RepDelta} form, also when serialized on its own.
 */
public final class RecurrenceModule extends SimpleModule {
  private static final long serialVersionUID = 1L;

  private static final Map<Duration.Kind, String> DURATION_TAGS =
      Map.of(
          Duration.Kind.DAY, "Day",
          Duration.Kind.WEEK, "Week",
          Duration.Kind.MONTH, "Month",
          Duration.Kind.YEAR, "Year");

  /** Creates the module with all serializers and deserializers registered. */
  public RecurrenceModule() {
    super("RecurrenceModule");

    addSerializer(SimpleDate.class, new SimpleDateSerializer());
    addSerializer(Weekday.class, new WeekdaySerializer());
    addSerializer(Duration.class, new DurationSerializer());
    addSerializer(RepDelta.class, new RepDeltaSerializer());
    addSerializer(RepEnd.class, new RepEndSerializer());
    addSerializer(Repetition.class, new RepetitionSerializer());

    addDeserializer(SimpleDate.class, new NodeDeserializer<>(RecurrenceModule::readDate));
    addDeserializer(Weekday.class, new NodeDeserializer<>(RecurrenceModule::readWeekday));
    addDeserializer(Duration.class, new NodeDeserializer<>(RecurrenceModule::readDuration));
    addDeserializer(RepDelta.class, deltaDeserializer(RepDelta.class));
    addDeserializer(MonthDelta.class, deltaDeserializer(MonthDelta.class));
    addDeserializer(DayDelta.class, deltaDeserializer(DayDelta.class));
    addDeserializer(WeekDelta.class, deltaDeserializer(WeekDelta.class));
    addDeserializer(MonthDeltaDate.class, deltaDeserializer(MonthDeltaDate.class));
    addDeserializer(MonthDeltaWeek.class, deltaDeserializer(MonthDeltaWeek.class));
    addDeserializer(YearDelta.class, deltaDeserializer(YearDelta.class));
    addDeserializer(RepEnd.class, new NodeDeserializer<>(RecurrenceModule::readEnd));
    addDeserializer(Repetition.class, new NodeDeserializer<>(RecurrenceModule::readRepetition));
  }

  /**
   * Creates an object mapper with this module registered.
   *
   * @return a new object mapper
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper().registerModule(new RecurrenceModule());
  }

  // Writers

  private static void writeDate(SimpleDate date, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("year", date.year());
    gen.writeNumberField("month", date.month());
    gen.writeNumberField("day", date.day());
    gen.writeEndObject();
  }

  private static void writeDelta(RepDelta delta, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    if (delta instanceof DayDelta d) {
      gen.writeObjectFieldStart("Day");
      gen.writeNumberField("nth", d.nth());
      gen.writeEndObject();
    } else if (delta instanceof WeekDelta w) {
      gen.writeObjectFieldStart("Week");
      gen.writeNumberField("nth", w.nth());
      gen.writeArrayFieldStart("on");
      for (Weekday day : w.on()) {
        gen.writeString(day.toString());
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } else if (delta instanceof MonthDeltaDate md) {
      gen.writeObjectFieldStart("Month");
      gen.writeObjectFieldStart("OnDate");
      gen.writeNumberField("nth", md.nth());
      gen.writeArrayFieldStart("days");
      for (int day : md.days()) {
        gen.writeNumber(day);
      }
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeEndObject();
    } else if (delta instanceof MonthDeltaWeek mw) {
      gen.writeObjectFieldStart("Month");
      gen.writeObjectFieldStart("OnWeek");
      gen.writeNumberField("nth", mw.nth());
      gen.writeNumberField("weekid", mw.weekid());
      gen.writeStringField("day", mw.day().toString());
      gen.writeEndObject();
      gen.writeEndObject();
    } else if (delta instanceof YearDelta y) {
      gen.writeObjectFieldStart("Year");
      gen.writeNumberField("nth", y.nth());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeEnd(RepEnd end, JsonGenerator gen) throws IOException {
    switch (end.kind()) {
      case NEVER -> gen.writeString("Never");
      case DATE -> {
        gen.writeStartObject();
        gen.writeFieldName("Date");
        writeDate(end.date(), gen);
        gen.writeEndObject();
      }
      case COUNT -> {
        gen.writeStartObject();
        gen.writeNumberField("Count", end.count());
        gen.writeEndObject();
      }
    }
  }

  // Readers

  private static SimpleDate readDate(JsonNode node, JsonParser p) throws JsonMappingException {
    requireObject(node, "date", p);
    long year = readLong(node, "year", p);
    long month = readLong(node, "month", p);
    long day = readLong(node, "day", p);
    if (month < 1 || month > 12 || day < 1 || day > 31) {
      throw JsonMappingException.from(p, "invalid date: " + node);
    }
    try {
      return new SimpleDate(year, (int) month, (int) day);
    } catch (IllegalArgumentException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }

  private static Weekday readWeekday(JsonNode node, JsonParser p) throws JsonMappingException {
    if (node == null || !node.isTextual()) {
      throw JsonMappingException.from(p, "expected weekday name but got " + node);
    }
    return Weekday.fromDisplayName(node.asText())
        .orElseThrow(() -> JsonMappingException.from(p, "unknown weekday: " + node.asText()));
  }

  private static Duration readDuration(JsonNode node, JsonParser p) throws JsonMappingException {
    Map.Entry<String, JsonNode> variant = singleField(node, "duration", p);
    long amount = asLong(variant.getValue(), p);
    for (Map.Entry<Duration.Kind, String> tag : DURATION_TAGS.entrySet()) {
      if (tag.getValue().equals(variant.getKey())) {
        return build(p, () -> new Duration(tag.getKey(), amount));
      }
    }
    throw JsonMappingException.from(p, "unknown duration variant: " + variant.getKey());
  }

  private static RepDelta readDelta(JsonNode node, JsonParser p) throws JsonMappingException {
    Map.Entry<String, JsonNode> variant = singleField(node, "delta", p);
    JsonNode body = variant.getValue();
    switch (variant.getKey()) {
      case "Day" -> {
        long nth = readLong(body, "nth", p);
        return build(p, () -> new DayDelta(nth));
      }
      case "Week" -> {
        long nth = readLong(body, "nth", p);
        List<Weekday> on = new ArrayList<>();
        for (JsonNode day : readArray(body, "on", p)) {
          on.add(readWeekday(day, p));
        }
        return build(p, () -> new WeekDelta(nth, on));
      }
      case "Month" -> {
        return readMonthDelta(body, p);
      }
      case "Year" -> {
        long nth = readLong(body, "nth", p);
        return build(p, () -> new YearDelta(nth));
      }
      default -> throw JsonMappingException.from(p, "unknown delta variant: " + variant.getKey());
    }
  }

  private static MonthDelta readMonthDelta(JsonNode node, JsonParser p)
      throws JsonMappingException {
    Map.Entry<String, JsonNode> variant = singleField(node, "month delta", p);
    JsonNode body = variant.getValue();
    long nth = readLong(body, "nth", p);
    switch (variant.getKey()) {
      case "OnDate" -> {
        List<Integer> days = new ArrayList<>();
        for (JsonNode day : readArray(body, "days", p)) {
          long value = asLong(day, p);
          if (value < 1 || value > 31) {
            throw JsonMappingException.from(p, "day of month out of range: " + value);
          }
          days.add((int) value);
        }
        return build(p, () -> new MonthDeltaDate(nth, days));
      }
      case "OnWeek" -> {
        long weekid = readLong(body, "weekid", p);
        Weekday day = readWeekday(body.get("day"), p);
        if (weekid < 0 || weekid > MonthDeltaWeek.MAX_WEEKID) {
          throw JsonMappingException.from(p, "weekid out of range: " + weekid);
        }
        return build(p, () -> new MonthDeltaWeek(nth, (int) weekid, day));
      }
      default ->
          throw JsonMappingException.from(p, "unknown month delta variant: " + variant.getKey());
    }
  }

  private static RepEnd readEnd(JsonNode node, JsonParser p) throws JsonMappingException {
    if (node != null && node.isTextual()) {
      if ("Never".equals(node.asText())) {
        return RepEnd.never();
      }
      throw JsonMappingException.from(p, "unknown end variant: " + node.asText());
    }

    Map.Entry<String, JsonNode> variant = singleField(node, "end", p);
    switch (variant.getKey()) {
      case "Date" -> {
        SimpleDate date = readDate(variant.getValue(), p);
        return RepEnd.until(date);
      }
      case "Count" -> {
        long count = asLong(variant.getValue(), p);
        return build(p, () -> RepEnd.times(count));
      }
      default -> throw JsonMappingException.from(p, "unknown end variant: " + variant.getKey());
    }
  }

  private static Repetition readRepetition(JsonNode node, JsonParser p)
      throws JsonMappingException {
    requireObject(node, "repetition", p);
    RepDelta delta = readDelta(node.get("delta"), p);
    RepEnd end = readEnd(node.get("end"), p);
    return new Repetition(delta, end);
  }

  // Node helpers

  private static void requireObject(JsonNode node, String what, JsonParser p)
      throws JsonMappingException {
    if (node == null || !node.isObject()) {
      throw JsonMappingException.from(p, "expected " + what + " object but got " + node);
    }
  }

  private static Map.Entry<String, JsonNode> singleField(JsonNode node, String what, JsonParser p)
      throws JsonMappingException {
    requireObject(node, what, p);
    if (node.size() != 1) {
      throw JsonMappingException.from(
          p, "expected exactly one variant for " + what + " but got " + node);
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    return fields.next();
  }

  private static long readLong(JsonNode node, String field, JsonParser p)
      throws JsonMappingException {
    requireObject(node, "'" + field + "' holder", p);
    return asLong(node.get(field), p);
  }

  private static long asLong(JsonNode value, JsonParser p) throws JsonMappingException {
    if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
      throw JsonMappingException.from(p, "expected integer but got " + value);
    }
    return value.asLong();
  }

  private static JsonNode readArray(JsonNode node, String field, JsonParser p)
      throws JsonMappingException {
    JsonNode array = node.get(field);
    if (array == null || !array.isArray()) {
      throw JsonMappingException.from(p, "expected array '" + field + "' but got " + array);
    }
    return array;
  }

  private static <T> T build(JsonParser p, ValueFactory<T> factory) throws JsonMappingException {
    try {
      return factory.create();
    } catch (IllegalArgumentException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }

  private static <T extends RepDelta> NodeDeserializer<T> deltaDeserializer(Class<T> type) {
    return new NodeDeserializer<>(
        (node, p) -> {
          RepDelta delta = readDelta(node, p);
          if (!type.isInstance(delta)) {
            String found = delta.getClass().getSimpleName();
            throw JsonMappingException.from(
                p, "expected " + type.getSimpleName() + " but got " + found);
          }
          return type.cast(delta);
        });
  }

  @FunctionalInterface
  private interface ValueFactory<T> {
    T create();
  }

  @FunctionalInterface
  private interface NodeReader<T> {
    T read(JsonNode node, JsonParser p) throws JsonMappingException;
  }

  // Serializers

  private static final class SimpleDateSerializer extends JsonSerializer<SimpleDate> {
    @Override
    public void serialize(SimpleDate value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      writeDate(value, gen);
    }
  }

  private static final class WeekdaySerializer extends JsonSerializer<Weekday> {
    @Override
    public void serialize(Weekday value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeString(value.toString());
    }
  }

  private static final class DurationSerializer extends JsonSerializer<Duration> {
    @Override
    public void serialize(Duration value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeStartObject();
      gen.writeNumberField(DURATION_TAGS.get(value.kind()), value.amount());
      gen.writeEndObject();
    }
  }

  private static final class RepDeltaSerializer extends JsonSerializer<RepDelta> {
    @Override
    public void serialize(RepDelta value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      writeDelta(value, gen);
    }
  }

  private static final class RepEndSerializer extends JsonSerializer<RepEnd> {
    @Override
    public void serialize(RepEnd value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      writeEnd(value, gen);
    }
  }

  private static final class RepetitionSerializer extends JsonSerializer<Repetition> {
    @Override
    public void serialize(Repetition value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeStartObject();
      gen.writeFieldName("delta");
      writeDelta(value.delta(), gen);
      gen.writeFieldName("end");
      writeEnd(value.end(), gen);
      gen.writeEndObject();
    }
  }

  /** Reads the whole value as a tree and converts it. */
  private static final class NodeDeserializer<T> extends JsonDeserializer<T> {
    private final NodeReader<T> reader;

    NodeDeserializer(NodeReader<T> reader) {
      this.reader = reader;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.getCodec().readTree(p);
      return reader.read(node, p);
    }
  }
}
