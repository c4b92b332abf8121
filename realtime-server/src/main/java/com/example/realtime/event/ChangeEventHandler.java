package com.example.realtime.event;

@FunctionalInterface
public interface ChangeEventHandler {

    void handle(ChangeEvent event);
}
