package io.b2mash.tms.tendering.carrier;

public enum RelationStatus {
  ACTIVE,
  SUSPENDED,
  TERMINATED
}
