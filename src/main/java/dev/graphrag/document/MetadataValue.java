package dev.graphrag.document;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;

/**
 * Typed metadata value attached to documents and graph nodes.
 *
 * <p>Collaborators hand over loosely typed maps; {@link #of(Object)} narrows each value to one of
 * the four supported kinds so downstream code never inspects raw {@code Object}s.
 */
public sealed interface MetadataValue
    permits MetadataValue.Text, MetadataValue.Number, MetadataValue.Flag, MetadataValue.TextList {

  /** Renders the value for display in formatted context. */
  String asText();

  /** Returns the numeric value if this is a {@link Number}. */
  default OptionalDouble asNumber() {
    return OptionalDouble.empty();
  }

  /** Returns the string value if this is a {@link Text}. */
  default Optional<String> asString() {
    return Optional.empty();
  }

  record Text(String value) implements MetadataValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String asText() {
      return value;
    }

    @Override
    public Optional<String> asString() {
      return Optional.of(value);
    }
  }

  record Number(double value) implements MetadataValue {
    @Override
    public String asText() {
      if (value == Math.rint(value) && !Double.isInfinite(value)) {
        return Long.toString((long) value);
      }
      return Double.toString(value);
    }

    @Override
    public OptionalDouble asNumber() {
      return OptionalDouble.of(value);
    }
  }

  record Flag(boolean value) implements MetadataValue {
    @Override
    public String asText() {
      return Boolean.toString(value);
    }
  }

  record TextList(List<String> values) implements MetadataValue {
    public TextList {
      values = List.copyOf(values);
    }

    @Override
    public String asText() {
      return String.join(", ", values);
    }
  }

  static MetadataValue text(String value) {
    return new Text(value);
  }

  static MetadataValue number(double value) {
    return new Number(value);
  }

  static MetadataValue flag(boolean value) {
    return new Flag(value);
  }

  static MetadataValue textList(List<String> values) {
    return new TextList(values);
  }

  /**
   * Converts an untyped value into a {@link MetadataValue}. Numbers become {@link Number},
   * booleans become {@link Flag}, collections become {@link TextList} (elements rendered with
   * {@link String#valueOf(Object)}) and everything else becomes {@link Text}.
   *
   * @param raw the value to convert; {@code null} maps to an empty {@link Text}
   * @return the typed value
   */
  static MetadataValue of(@Nullable Object raw) {
    if (raw == null) {
      return new Text("");
    }
    if (raw instanceof MetadataValue value) {
      return value;
    }
    if (raw instanceof java.lang.Number n) {
      return new Number(n.doubleValue());
    }
    if (raw instanceof Boolean b) {
      return new Flag(b);
    }
    if (raw instanceof Collection<?> c) {
      return new TextList(c.stream().map(String::valueOf).toList());
    }
    return new Text(String.valueOf(raw));
  }
}
