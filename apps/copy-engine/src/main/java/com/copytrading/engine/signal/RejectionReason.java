package com.copytrading.engine.signal;

import java.util.Objects;

public record RejectionReason(FilterStage stage, RejectionCode code, String detail) {
  public RejectionReason {
    Objects.requireNonNull(stage, "stage must not be null");
    Objects.requireNonNull(code, "code must not be null");
  }

  public static RejectionReason whale(RejectionCode code, String detail) {
    return new RejectionReason(FilterStage.WHALE, code, detail);
  }

  public static RejectionReason trade(RejectionCode code, String detail) {
    return new RejectionReason(FilterStage.TRADE, code, detail);
  }

  public static RejectionReason portfolio(RejectionCode code, String detail) {
    return new RejectionReason(FilterStage.PORTFOLIO, code, detail);
  }
}
