package com.example.messenger.widget;

import lombok.Value;

@Value
public class WidgetRequestContext {

    String clientIp;
    String originHost;
}
