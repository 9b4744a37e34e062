package ca.gc.cra.relay.application.processor;

import ca.gc.cra.relay.application.port.SignalProcessor;
import ca.gc.cra.relay.domain.signal.AttributeMaps;
import ca.gc.cra.relay.domain.signal.Signal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Applies an ordered list of attribute edits to every signal.
 * <p>Actions run in declaration order against the signal's own attributes; resource attributes are untouched.
 * Signals whose attributes end up unchanged are passed through as the same instance.</p>
 *
 * @since 0.1.0
 */
public final class AttributesProcessor implements SignalProcessor {
  private final String id;
  private final List<Action> actions;

  /**
   * Creates a processor.
   *
   * @param id processor id, e.g. {@code attributes/env}
   * @param actions edits applied in order; must not be empty
   */
  public AttributesProcessor(String id, List<Action> actions) {
    this.id = Objects.requireNonNull(id, "id");
    this.actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
    if (this.actions.isEmpty()) {
      throw new IllegalArgumentException("processor " + id + " needs at least one action");
    }
  }

  @Override
  public String id() {
    return id;
  }

  public List<Action> actions() {
    return actions;
  }

  @Override
  public List<Signal> process(List<Signal> signals) {
    List<Signal> result = new ArrayList<>(signals.size());
    for (Signal signal : signals) {
      Map<String, Object> edited = apply(signal.attributes());
      result.add(edited == null ? signal : signal.withAttributes(edited));
    }
    return result;
  }

  private Map<String, Object> apply(Map<String, Object> attributes) {
    Map<String, Object> working = null;
    for (Action action : actions) {
      Map<String, Object> current = working == null ? attributes : working;
      boolean present = current.containsKey(action.key());
      Object value = action.resolve(current);
      boolean write = switch (action.type()) {
        case INSERT -> !present && value != null;
        case UPDATE -> present && value != null;
        case UPSERT -> value != null;
        case DELETE -> false;
      };
      boolean remove = action.type() == ActionType.DELETE && present;
      if (!write && !remove) {
        continue;
      }
      if (working == null) {
        working = new LinkedHashMap<>(attributes);
      }
      if (remove) {
        working.remove(action.key());
      } else {
        working.put(action.key(), value);
      }
    }
    return working;
  }

  /** Supported attribute edits. */
  public enum ActionType {
    /** Adds the key only when absent. */
    INSERT,
    /** Replaces the value only when the key exists. */
    UPDATE,
    /** Adds or replaces. */
    UPSERT,
    /** Removes the key. */
    DELETE;

    /**
     * Parses an action name.
     *
     * @param raw action name, case-insensitive
     * @return action type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ActionType fromString(String raw) {
      String normalized = Objects.requireNonNull(raw, "action").trim().toUpperCase(Locale.ROOT);
      try {
        return valueOf(normalized);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("unknown attribute action '" + raw + "' (expected insert, update, upsert or delete)", ex);
      }
    }
  }

  /**
   * One attribute edit.
   *
   * @param key attribute key
   * @param type edit type
   * @param value literal value for writes; {@code null} when {@code fromAttribute} is used or for deletes
   * @param fromAttribute key to copy the value from; {@code null} when a literal is used
   */
  public record Action(String key, ActionType type, Object value, String fromAttribute) {
    public Action {
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("attribute action key must not be blank");
      }
      Objects.requireNonNull(type, "type");
      if (type != ActionType.DELETE) {
        if (value == null && (fromAttribute == null || fromAttribute.isBlank())) {
          throw new IllegalArgumentException("attribute action on " + key + " needs value or from_attribute");
        }
        if (value != null) {
          value = AttributeMaps.normalize(key, value);
        }
      }
    }

    Object resolve(Map<String, Object> attributes) {
      if (type == ActionType.DELETE) {
        return null;
      }
      return value != null ? value : attributes.get(fromAttribute);
    }
  }
}
