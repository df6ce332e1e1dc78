package com.couchreplicator.model.internal;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;

@Getter
@AllArgsConstructor
@ToString
public class DatabaseSelection {

    // ordered, deduplicated
    private final Set<String> databases;

    private final List<String> skipped;
}
