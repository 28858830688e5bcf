package io.b2mash.tms.tendering.hook;

import java.util.Objects;

/**
 * A named interception point with a fixed phase and payload type. Instances are declared once as
 * constants in {@link TenderHooks}; identity is the hook ID.
 *
 * @param <P> payload type handed to handlers
 */
public final class HookPoint<P> {

  private final String id;
  private final HookPhase phase;
  private final Class<P> payloadType;

  private HookPoint(String id, HookPhase phase, Class<P> payloadType) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.phase = Objects.requireNonNull(phase, "phase must not be null");
    this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
  }

  public static <P> HookPoint<P> pre(String id, Class<P> payloadType) {
    return new HookPoint<>(id, HookPhase.PRE, payloadType);
  }

  public static <P> HookPoint<P> post(String id, Class<P> payloadType) {
    return new HookPoint<>(id, HookPhase.POST, payloadType);
  }

  public String id() {
    return id;
  }

  public HookPhase phase() {
    return phase;
  }

  public Class<P> payloadType() {
    return payloadType;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof HookPoint<?> other && id.equals(other.id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
