package io.b2mash.tms.tendering.hook;

/**
 * Bean that registers hook handlers when the {@link HookRegistry} is created. Contributors are
 * applied in {@link org.springframework.core.annotation.Order} order.
 */
public interface HookContributor {

  void contribute(HookRegistry registry);
}
