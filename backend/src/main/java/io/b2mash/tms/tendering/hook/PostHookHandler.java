package io.b2mash.tms.tendering.hook;

@FunctionalInterface
public interface PostHookHandler<P> {

  void handle(P payload);
}
