package io.b2mash.tms.tendering.hook;

import io.b2mash.tms.tendering.cascade.dto.CascadeResult;
import io.b2mash.tms.tendering.cascade.dto.CascadeTenderRequest;
import io.b2mash.tms.tendering.tender.dto.AwardOutcome;
import io.b2mash.tms.tendering.tender.dto.AwardRequest;
import io.b2mash.tms.tendering.tender.dto.CreateTenderRequest;
import io.b2mash.tms.tendering.tender.dto.OfferDecision;
import io.b2mash.tms.tendering.tender.dto.OfferResponse;
import io.b2mash.tms.tendering.tender.dto.OfferSubmission;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;

/** Every hook point the tendering services expose. */
public final class TenderHooks {

  public static final HookPoint<CascadeTenderRequest> BEFORE_CASCADE_CREATE =
      HookPoint.pre("tender.before.cascade", CascadeTenderRequest.class);
  public static final HookPoint<CascadeResult> AFTER_CASCADE_CREATE =
      HookPoint.post("tender.after.cascade", CascadeResult.class);

  public static final HookPoint<CreateTenderRequest> BEFORE_TENDER_CREATE =
      HookPoint.pre("tender.before.create", CreateTenderRequest.class);
  public static final HookPoint<TenderResponse> AFTER_TENDER_CREATE =
      HookPoint.post("tender.after.create", TenderResponse.class);

  public static final HookPoint<AwardRequest> BEFORE_TENDER_AWARD =
      HookPoint.pre("tender.before.award", AwardRequest.class);
  public static final HookPoint<AwardOutcome> AFTER_TENDER_AWARD =
      HookPoint.post("tender.after.award", AwardOutcome.class);

  public static final HookPoint<OfferSubmission> BEFORE_OFFER_SUBMIT =
      HookPoint.pre("offer.before.submit", OfferSubmission.class);
  public static final HookPoint<OfferResponse> AFTER_OFFER_SUBMIT =
      HookPoint.post("offer.after.submit", OfferResponse.class);

  public static final HookPoint<OfferDecision> BEFORE_OFFER_ACCEPT =
      HookPoint.pre("offer.before.accept", OfferDecision.class);
  public static final HookPoint<OfferResponse> AFTER_OFFER_ACCEPT =
      HookPoint.post("offer.after.accept", OfferResponse.class);

  private TenderHooks() {}
}
