package io.b2mash.tms.tendering.hook;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs post hooks once the publishing transaction has committed. A rolled-back transaction drops
 * its post hooks. Outside a transaction the hooks run immediately.
 */
@Component
public class PostHookDispatcher {

  private final HookRegistry hookRegistry;

  public PostHookDispatcher(HookRegistry hookRegistry) {
    this.hookRegistry = hookRegistry;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPostHook(PostHookEvent event) {
    hookRegistry.dispatchPost(event.point(), event.payload());
  }
}
