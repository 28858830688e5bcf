package io.b2mash.tms.tendering.tender.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record SubmitOfferRequest(
    @NotNull @DecimalMin("0.00") BigDecimal priceAmount,
    @NotBlank @Size(min = 3, max = 3) String priceCurrency,
    @NotNull Instant validUntil,
    List<@NotBlank @Size(max = 500) String> conditions) {}
