package com.gentoro.annomics.tools;

import com.gentoro.annomics.exception.ValidationException;
import com.gentoro.annomics.utility.NumberUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;

/**
 * Validates a raw argument map against a {@link ToolDescriptor}: enforces required parameters,
 * applies defaults and coerces values to the declared {@link ParameterType}. Keys the descriptor
 * does not declare are dropped.
 */
public final class ArgumentCoercer {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(ArgumentCoercer.class);

  private ArgumentCoercer() {}

  public static Map<String, Object> coerce(ToolDescriptor descriptor, Map<String, Object> raw) {
    Map<String, Object> source = raw == null ? Map.of() : raw;
    Map<String, Object> result = new LinkedHashMap<>();

    for (ToolParameter p : descriptor.parameters()) {
      Object value = source.get(p.name());
      if (value == null) {
        if (p.required()) {
          throw new ValidationException("Missing required argument '" + p.name() + "'");
        }
        if (p.hasDefault()) {
          result.put(p.name(), p.defaultValue());
        }
        continue;
      }
      result.put(p.name(), coerceValue(p, value));
    }

    for (String key : source.keySet()) {
      if (descriptor.parameter(key).isEmpty()) {
        log.debug("Ignoring undeclared argument '{}' for tool {}", key, descriptor.name());
      }
    }
    return result;
  }

  static Object coerceValue(ToolParameter p, Object value) {
    switch (p.type()) {
      case STRING:
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
          return value.toString();
        }
        throw typeError(p, "a string");
      case BOOLEAN:
        if (value instanceof Boolean) return value;
        if (value instanceof String s) {
          String trimmed = s.trim();
          if ("true".equalsIgnoreCase(trimmed)) return Boolean.TRUE;
          if ("false".equalsIgnoreCase(trimmed)) return Boolean.FALSE;
        }
        throw typeError(p, "a boolean");
      case INTEGER:
        OptionalInt number = NumberUtility.toIntExact(value);
        if (number.isPresent()) return number.getAsInt();
        throw typeError(p, "an integer between " + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE);
      case STRING_ARRAY:
        return stringList(p, value);
      case STRING_OR_ARRAY:
        return value instanceof Collection<?> ? stringList(p, value) : coerceString(p, value);
      default:
        throw new IllegalStateException("Unhandled parameter type " + p.type());
    }
  }

  private static String coerceString(ToolParameter p, Object value) {
    if (value instanceof String s) return s;
    throw typeError(p, "a string or an array of strings");
  }

  private static List<String> stringList(ToolParameter p, Object value) {
    List<String> items = new ArrayList<>();
    if (value instanceof Collection<?> values) {
      for (Object item : values) {
        if (!(item instanceof String s)) {
          throw typeError(p, "an array of strings");
        }
        items.add(s);
      }
    } else if (value instanceof String s) {
      items.add(s);
    } else {
      throw typeError(p, "an array of strings");
    }
    return items;
  }

  private static ValidationException typeError(ToolParameter p, String expected) {
    return new ValidationException("Argument '" + p.name() + "' must be " + expected);
  }
}
