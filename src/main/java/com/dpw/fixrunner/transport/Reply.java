package com.dpw.fixrunner.transport;

import lombok.Value;

import java.util.Map;

@Value
public class Reply {
    String raw;
    Map<String, String> fields;
}
