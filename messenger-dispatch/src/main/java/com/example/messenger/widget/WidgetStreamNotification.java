package com.example.messenger.widget;

import com.example.messenger.dto.WidgetMessagePayload;
import java.io.Serializable;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unit published on the cross-node stream topic. Exactly one of {@code message} and
 * {@code assignment} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WidgetStreamNotification implements Serializable {

    private long conversationId;
    private WidgetMessagePayload message;
    private Map<String, Object> assignment;
}
