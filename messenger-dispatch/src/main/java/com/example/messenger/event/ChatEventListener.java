package com.example.messenger.event;

@FunctionalInterface
public interface ChatEventListener {

    void onEvent(ChatEvent event);
}
