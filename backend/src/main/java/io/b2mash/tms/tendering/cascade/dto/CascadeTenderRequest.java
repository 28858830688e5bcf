package io.b2mash.tms.tendering.cascade.dto;

import io.b2mash.tms.tendering.tender.TenderMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

public record CascadeTenderRequest(
    @NotNull UUID brokerId,
    @NotNull UUID orderId,
    @NotNull TenderMode mode,
    @NotEmpty List<@Valid @NotNull TierRequest> tiers) {}
