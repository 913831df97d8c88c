package com.wealthdesk.oms;

import com.wealthdesk.domain.enums.RejectionCode;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a submission. Rejections are values, not exceptions: a rejected
 * submission creates no order and leaves no trace in history.
 */
@Data
@Builder
public class OrderSubmissionResult {

    private boolean accepted;

    /** Set when accepted, including duplicates (the original order's id). */
    private String orderId;

    /** True when the idempotency key matched an earlier accepted submission. */
    private boolean duplicate;

    private RejectionCode rejectionCode;
    private String rejectionReason;

    @Builder.Default
    private Map<String, Object> details = Map.of();

    public static OrderSubmissionResult accepted(String orderId) {
        return OrderSubmissionResult.builder().accepted(true).orderId(orderId).build();
    }

    public static OrderSubmissionResult duplicateOf(String orderId) {
        return OrderSubmissionResult.builder()
                .accepted(true)
                .orderId(orderId)
                .duplicate(true)
                .build();
    }

    public static OrderSubmissionResult rejected(RejectionCode code, String reason) {
        return rejected(code, reason, Map.of());
    }

    public static OrderSubmissionResult rejected(RejectionCode code, String reason, Map<String, Object> details) {
        return OrderSubmissionResult.builder()
                .accepted(false)
                .rejectionCode(code)
                .rejectionReason(reason)
                .details(details)
                .build();
    }
}
