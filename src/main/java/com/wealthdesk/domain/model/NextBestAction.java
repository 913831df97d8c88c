package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.ActionPriority;
import com.wealthdesk.domain.enums.ActionType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** A recommendation surfaced to the advisor for one client. */
@Value
@Builder
public class NextBestAction {

    String id;
    String clientId;
    ActionType type;
    String title;
    String description;
    ActionPriority priority;
    LocalDateTime createdAt;
    Map<String, Object> metadata;
}
