package com.ionindexer.domain.block;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Classified higher-level operation handed over by the block classifier.
 * {@code data} is a loosely-typed payload whose keys depend on {@code btype}; nested objects are maps.
 */
@Getter
@Builder
public class Block {

    private final String btype;
    @Singular
    private final List<EventNode> eventNodes;
    private final boolean failed;
    private final long minLt;
    private final long maxLt;
    private final long minUtime;
    private final long maxUtime;
    @Singular("dataEntry")
    private final Map<String, Object> data;
}
