package com.example.realtime.push;

import lombok.Value;

@Value
public class PushResult {

    public static final PushResult NO_TOKENS = new PushResult(0, 0, 0, 0);

    int accepted;
    int pruned;
    int retained;
    int batches;
}
