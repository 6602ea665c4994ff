package com.purchasingpower.coderag.indexing;

import lombok.Value;

/**
 * One repository file as fetched by the caller. {@code path} is repository-relative.
 */
@Value
public class SourceFile {
    String path;
    String content;
}
