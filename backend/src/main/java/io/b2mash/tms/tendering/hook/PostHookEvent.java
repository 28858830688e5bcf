package io.b2mash.tms.tendering.hook;

/** Carries a post-hook payload to {@link PostHookDispatcher} so it can run after commit. */
public record PostHookEvent(HookPoint<?> point, Object payload) {}
