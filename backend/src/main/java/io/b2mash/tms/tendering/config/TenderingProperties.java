package io.b2mash.tms.tendering.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tendering configuration bound from {@code tendering.*}. Sweep intervals are read directly by the
 * {@code @Scheduled} processors and are not part of this record.
 *
 * @param defaultCurrency currency stamped on pre-provisioned PENDING offers
 * @param maxCascadeTiers upper bound on the number of tier requests accepted in one cascade
 */
@ConfigurationProperties(prefix = "tendering")
public record TenderingProperties(
    @DefaultValue("USD") String defaultCurrency, @DefaultValue("10") int maxCascadeTiers) {}
