package io.b2mash.tms.tendering.hook;

@FunctionalInterface
public interface PreHookHandler<P> {

  /**
   * Inspects the payload before the guarded change is written. Throwing counts as a veto whose
   * reason is the exception message.
   */
  HookDecision<P> handle(P payload);
}
