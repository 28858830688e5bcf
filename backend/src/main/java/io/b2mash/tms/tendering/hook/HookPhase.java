package io.b2mash.tms.tendering.hook;

public enum HookPhase {
  /** Runs inside the transaction before the change; may rewrite the payload or veto. */
  PRE,

  /** Runs after commit; notification only. */
  POST
}
