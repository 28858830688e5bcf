package io.b2mash.tms.tendering.logistics;

import java.util.UUID;

/** Existence check against the host's order store. */
public interface OrderDirectory {

  boolean exists(UUID orderId);
}
