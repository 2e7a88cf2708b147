package com.dpw.fixrunner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationKey {
    private String identifier;
    private String type;

    @Override
    public String toString() {
        return identifier + "/" + type;
    }
}
