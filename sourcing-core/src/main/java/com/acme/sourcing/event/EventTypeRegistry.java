package com.acme.sourcing.event;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit mapping from event type tag to payload class for one sealed event family.
 *
 * <p>Built once at startup. {@link Builder#build()} refuses to produce a registry that misses any
 * permitted subtype of the family, so a newly added event that nobody registered fails the
 * application at boot rather than on first replay.
 *
 * @param <E> the sealed event interface
 */
public final class EventTypeRegistry<E extends DomainEvent> {
  private static final Logger log = LoggerFactory.getLogger(EventTypeRegistry.class);

  private final Class<E> family;
  private final Map<String, Class<? extends E>> types;

  private EventTypeRegistry(Class<E> family, Map<String, Class<? extends E>> types) {
    this.family = family;
    this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
  }

  public static <E extends DomainEvent> Builder<E> builder(Class<E> family) {
    return new Builder<>(family);
  }

  public Optional<Class<? extends E>> resolve(String eventType) {
    return Optional.ofNullable(types.get(eventType));
  }

  public Class<E> family() {
    return family;
  }

  public Set<String> eventTypes() {
    return types.keySet();
  }

  public static final class Builder<E extends DomainEvent> {
    private final Class<E> family;
    private final Map<String, Class<? extends E>> types = new LinkedHashMap<>();

    private Builder(Class<E> family) {
      if (!family.isSealed()) {
        throw new IllegalArgumentException(
            "Event family must be a sealed type: " + family.getName());
      }
      this.family = family;
    }

    /** Registers a type under its simple class name. */
    public Builder<E> register(Class<? extends E> type) {
      return register(type.getSimpleName(), type);
    }

    /**
     * Registers a type under an explicit tag, e.g. a legacy name kept readable after a rename.
     *
     * @throws IllegalStateException if the tag is already taken
     */
    public Builder<E> register(String eventType, Class<? extends E> type) {
      if (!family.isAssignableFrom(type)) {
        throw new IllegalArgumentException(
            type.getName() + " is not a member of event family " + family.getSimpleName());
      }
      if (types.containsKey(eventType)) {
        throw new IllegalStateException("Event type already registered: " + eventType);
      }
      types.put(eventType, type);
      return this;
    }

    /**
     * @throws IllegalStateException if a permitted subtype of the family has no registration
     */
    public EventTypeRegistry<E> build() {
      Set<Class<?>> registered = new HashSet<>(types.values());
      Set<String> missing =
          Arrays.stream(family.getPermittedSubclasses())
              .filter(c -> !registered.contains(c))
              .map(Class::getSimpleName)
              .collect(Collectors.toCollection(TreeSet::new));
      if (!missing.isEmpty()) {
        String error =
            "Event family " + family.getSimpleName() + " has unregistered event types: " + missing;
        log.error(error);
        throw new IllegalStateException(error);
      }
      log.info("Registered {} event types for {}", types.size(), family.getSimpleName());
      return new EventTypeRegistry<>(family, types);
    }
  }
}
