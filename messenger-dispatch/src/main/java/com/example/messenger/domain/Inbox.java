package com.example.messenger.domain;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Inbox {

    private long id;
    private String name;
    private String widgetToken;
    private Long branchId;
    private boolean active;

    private boolean autoReplyEnabled;
    private String autoReplyBody;

    @Builder.Default
    private List<String> allowedDomains = List.of();

    public boolean isGlobal() {
        return branchId == null;
    }
}
