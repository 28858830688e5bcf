package io.b2mash.tms.tendering.hook;

/**
 * Result of a pre-hook handler: either continue with a (possibly rewritten) payload, or veto with
 * a reason.
 */
public record HookDecision<P>(boolean proceed, P payload, String reason) {

  public static <P> HookDecision<P> proceed(P payload) {
    return new HookDecision<>(true, payload, null);
  }

  public static <P> HookDecision<P> veto(String reason) {
    return new HookDecision<>(false, null, reason);
  }
}
