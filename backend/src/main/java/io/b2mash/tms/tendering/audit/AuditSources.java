package io.b2mash.tms.tendering.audit;

/** Actor types and sources recorded on audit rows. */
public final class AuditSources {

  /** Transition triggered by a service call. */
  public static final String INTERNAL = "INTERNAL";

  /** Transition triggered by a scheduled sweep. */
  public static final String SWEEP = "SWEEP";

  public static final String ACTOR_SYSTEM = "SYSTEM";
  public static final String ACTOR_CARRIER = "CARRIER";

  private AuditSources() {}
}
