package io.b2mash.tms.tendering.logistics;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryOrderDirectory implements OrderDirectory {

  private final Set<UUID> orders = ConcurrentHashMap.newKeySet();

  @Override
  public boolean exists(UUID orderId) {
    return orderId != null && orders.contains(orderId);
  }

  public void registerOrder(UUID orderId) {
    orders.add(orderId);
  }
}
