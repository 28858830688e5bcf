package io.b2mash.tms.tendering.tender;

/**
 * Source of human-readable tender numbers. A cascade draws one number and suffixes each tier with
 * {@code -T<tier>}.
 */
public interface TenderNumberGenerator {

  String nextNumber();
}
